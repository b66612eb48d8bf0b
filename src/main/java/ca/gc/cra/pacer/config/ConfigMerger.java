package ca.gc.cra.pacer.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges YAML and CLI configuration with precedence CLI over YAML.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides; may be {@code null}
   * @param warn invoked when a CLI key overrides a YAML key; may be {@code null}
   * @return immutable merged map
   */
  public static Map<String, String> merge(
      Optional<Map<String, String>> yaml, Map<String, String> cli, Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(yamlValues);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        if (entry.getKey() == null || entry.getValue() == null) {
          continue;
        }
        if (yamlValues.containsKey(entry.getKey()) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + entry.getKey());
        }
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }
}
