package ca.gc.cra.pacer.api;

import ca.gc.cra.pacer.application.pipeline.AnalysisPipeline.RunSummary;
import ca.gc.cra.pacer.application.port.MetricsPort;
import ca.gc.cra.pacer.config.CompositionRoot;
import ca.gc.cra.pacer.config.CompositionRoot.Simulation;
import ca.gc.cra.pacer.config.ConfigMerger;
import ca.gc.cra.pacer.config.GovernorConfig;
import ca.gc.cra.pacer.config.SimulationConfig;
import ca.gc.cra.pacer.config.YamlConfigLoader;
import ca.gc.cra.pacer.domain.frame.ReleaseReason;
import ca.gc.cra.pacer.domain.metrics.PerformanceSnapshot;
import ca.gc.cra.pacer.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.pacer.logging.LoggingConfigurator;
import ca.gc.cra.pacer.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the governor against a synthetic camera and synthetic analyzers, then prints the final snapshot.
 *
 * @since PACER 0.1
 */
public final class SimulateCli {
  private static final Logger log = LoggerFactory.getLogger(SimulateCli.class);
  private static final String COMMAND = "simulate";
  private static final String SUMMARY_USAGE =
      "usage: simulate [config=PATH] [targetFrameRate=N] [targetBudgetMs=N] [maxMemoryMb=N] [capacity=1-1024] "
          + "[initialQuality=LOW|MEDIUM|HIGH|ULTRA] [analysisWorkers=1-32] [sourceFps=N] [durationMs=N] "
          + "[frames=N] [output=text|json] [metricsExporter=otlp|none] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      PACER synthetic load simulation

      Usage:
        simulate [key=value...] [--dry-run] [--verbose]

      Governor:
        targetFrameRate=N           Frame rate cap for the estimated rate (default 30)
        targetBudgetMs=N            Per-analysis budget in ms (default 33)
        maxMemoryMb=N               Resident memory ceiling in MiB (default 200)
        capacity=1-1024             Frame store capacity (default 5)
        initialQuality=LEVEL        LOW, MEDIUM, HIGH or ULTRA (default HIGH)
        adaptiveQuality=true|false  Adjust quality from measured latency (default true)
        resourceThrottling=true|false  Reject frames under memory or latency pressure (default true)
        performanceLogging=true|false  Periodic performance log lines (default true)
        analysisWorkers=1-32        Analyzer worker threads (default 4)
        monitorIntervalMs=N         Snapshot and warning period (default 5000)
        memorySampleIntervalMs=N    Memory refresh period (default 500)

      Synthetic load:
        sourceFps=N                 Synthetic camera frame rate (default 30)
        durationMs=N                Run length (default 10000 unless frames is set)
        frames=N                    Stop after N frames
        highPriorityEvery=N         Every N-th frame is HIGH priority (default 10)
        lowPriorityEvery=N          Every N-th other frame is LOW priority (default 3)
        analyzers=1-16              Analyzers per frame (default 3)
        analyzerLatencyMs=N         Analyzer latency at HIGH quality (default 8)
        analyzerJitterMs=N          Random latency added per analysis (default 4)
        seed=N                      Random seed (default 42)
        output=text|json            Snapshot format (default text)

      Other:
        logLevel=LEVEL              Root log level (TRACE, DEBUG, INFO, WARN, ERROR)
        config=PATH                 YAML file with common and simulate sections; CLI keys win
        metricsExporter=otlp|none   Metrics exporter (default none)
        otelEndpoint=URL            OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run, -n               Validate and print the plan without running
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private SimulateCli() {}

  /**
   * Runs the command.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for simulate");
    }

    Map<String, String> cli;
    TelemetrySettings telemetry;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
      telemetry = TelemetryConfigurator.resolve(cli);
      String logLevel = cli.remove("logLevel");
      if (logLevel != null) {
        LoggingConfigurator.setLevel(Logger.ROOT_LOGGER_NAME, logLevel);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      String configPath = cli.remove("config");
      Optional<Map<String, String>> yaml = configPath == null
          ? Optional.empty()
          : loadYaml(Path.of(configPath));
      effective = ConfigMerger.merge(yaml, cli, log::info);
    } catch (IOException ex) {
      log.error("Failed to read configuration file: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid configuration file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    GovernorConfig governorConfig;
    SimulationConfig simulationConfig;
    try {
      governorConfig = GovernorConfig.fromMap(effective);
      simulationConfig = SimulationConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid simulate configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if (input.dryRun()) {
      printDryRunPlan(governorConfig, simulationConfig, telemetry);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = TelemetryConfigurator.createMetrics(telemetry);
    try {
      CompositionRoot root = new CompositionRoot(governorConfig, metrics);
      Simulation simulation = root.simulation(simulationConfig);
      RunSummary summary = simulation.pipeline().run();
      PerformanceSnapshot snapshot = simulation.governor().snapshot();
      log.info(
          "Simulation finished: {} frames offered, {} analyzed, {} rejected, {} evicted",
          summary.framesOffered(),
          summary.framesAnalyzed(),
          simulation.releases().count(ReleaseReason.REJECTED),
          simulation.releases().count(ReleaseReason.EVICTED));
      printSnapshot(snapshot, simulationConfig.output());
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Simulation interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException ex) {
      log.error("Simulation configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in simulation", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in simulation", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeMetrics(metrics);
    }
  }

  private static Optional<Map<String, String>> loadYaml(Path path) throws IOException {
    Optional<Map<String, String>> yaml = YamlConfigLoader.load(path, COMMAND);
    if (yaml.isEmpty()) {
      log.warn("Configuration file {} not found; using CLI values and defaults", path);
    }
    return yaml;
  }

  private static void printSnapshot(PerformanceSnapshot snapshot, SimulationConfig.OutputFormat format) {
    if (format == SimulationConfig.OutputFormat.JSON) {
      CliPrinter.println(SnapshotRenderer.json(snapshot));
    } else {
      CliPrinter.printLines(SnapshotRenderer.text(snapshot));
    }
  }

  private static void printDryRunPlan(
      GovernorConfig governorConfig, SimulationConfig simulation, TelemetrySettings telemetry) {
    var governor = governorConfig.governor();
    var pipeline = governorConfig.pipeline();
    CliPrinter.printLines(
        "Simulate dry-run: no frames will be generated.",
        " Target fps        : " + governor.targetFrameRate(),
        " Budget            : " + Logs.millis(governor.targetBudget().toNanos()),
        " Memory ceiling    : " + Logs.mebibytes(governor.maxMemoryBytes()),
        " Store capacity    : " + governor.capacity(),
        " Initial quality   : " + governor.initialQuality(),
        " Adaptive quality  : " + governor.adaptiveQuality(),
        " Throttling        : " + governor.resourceThrottling(),
        " Workers           : " + pipeline.analysisWorkers(),
        " Monitor interval  : " + pipeline.monitorInterval().toMillis() + " ms",
        " Source fps        : " + simulation.sourceFps(),
        " Duration          : " + (simulation.duration().isZero()
            ? "<frames only>" : simulation.duration().toMillis() + " ms"),
        " Frames            : " + (simulation.frames() == 0 ? "<unbounded>" : simulation.frames()),
        " Analyzers         : " + simulation.analyzers() + " x "
            + simulation.analyzerLatency().toMillis() + " ms (+" + simulation.analyzerJitter().toMillis()
            + " ms jitter)",
        " Output            : " + simulation.output(),
        " Metrics exporter  : " + telemetry.exporter(),
        " Re-run without --dry-run to start the simulation.");
  }

  private static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
