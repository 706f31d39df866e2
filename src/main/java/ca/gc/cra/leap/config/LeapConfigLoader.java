package ca.gc.cra.leap.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads bridge settings from a YAML document and flattens nested sections into dotted keys.
 *
 * <pre>
 * common:
 *   native:
 *     library: LeapShim
 * test:
 *   dispatch:
 *     failureExitCode: 70
 * </pre>
 *
 * Loading profile {@code test} yields {@code native.library=LeapShim} and {@code dispatch.failureExitCode=70}.
 */
public final class LeapConfigLoader {

  private LeapConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the {@code profile} section. Profile
   * values win.
   *
   * @param path location of the YAML file
   * @param profile profile section name, matched case-insensitively
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or not a mapping of mappings
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String section = profile.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Map<String, String> flat = new LinkedHashMap<>();
      for (String name : new String[] {"common", section}) {
        Object node = section(root, name);
        if (node != null) {
          flatten(asMap(node, name), "", flat);
        }
      }
      return Optional.of(Map.copyOf(flat));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, dotted), dotted, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + dotted);
      } else {
        target.put(dotted, value == null ? "" : value.toString());
      }
    });
  }
}
