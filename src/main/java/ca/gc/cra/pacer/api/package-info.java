/**
 * Command-line entry points for PACER.
 * <p><strong>Role:</strong> Parses {@code key=value} arguments and flags, merges them over YAML configuration,
 * and runs commands, mapping failures to {@link ca.gc.cra.pacer.api.ExitCode} values.</p>
 * <p><strong>Observability:</strong> {@code --verbose} raises logging to DEBUG; metrics exporter selection is
 * handled by {@code TelemetryConfigurator}.</p>
 */
package ca.gc.cra.pacer.api;
