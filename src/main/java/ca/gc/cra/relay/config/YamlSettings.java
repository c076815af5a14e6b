package ca.gc.cra.relay.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a RELAY settings document: a top-level mapping of profiles, one of which is {@code common}.
 *
 * <p>The selected profile is merged over {@code common} tree by tree, so a profile may override a single leaf such
 * as {@code pool.workers} and inherit its siblings. The merged tree is then rendered as dotted keys. Keys may also be
 * written already dotted ({@code pool.workers: 4}).</p>
 */
final class YamlSettings {
  private static final Logger log = LoggerFactory.getLogger(YamlSettings.class);
  private static final String COMMON_PROFILE = "common";

  private YamlSettings() {}

  static Optional<Map<String, String>> read(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(read(reader, profile, path.toString()));
    }
  }

  static Map<String, String> read(String yaml, String profile) {
    return read(new StringReader(Objects.requireNonNull(yaml, "yaml")), profile, "inline settings");
  }

  private static Map<String, String> read(Reader reader, String profile, String origin) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Malformed YAML in " + origin, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> profiles)) {
      throw new IllegalArgumentException(origin + ": top level must map profile names to settings");
    }

    String wanted = profile.trim().toLowerCase(Locale.ROOT);
    Map<String, Object> merged = new LinkedHashMap<>();
    Object selected = null;
    for (Map.Entry<?, ?> entry : profiles.entrySet()) {
      String name = String.valueOf(entry.getKey()).trim().toLowerCase(Locale.ROOT);
      if (name.equals(COMMON_PROFILE)) {
        overlay(merged, entry.getValue(), COMMON_PROFILE);
      } else if (name.equals(wanted)) {
        selected = entry.getValue();
      }
    }
    if (selected != null) {
      overlay(merged, selected, wanted);
    } else if (!wanted.equals(COMMON_PROFILE)) {
      log.debug("Profile '{}' not present in {}; using common settings only", wanted, origin);
    }

    Map<String, String> settings = new TreeMap<>();
    render(merged, "", settings);
    return Map.copyOf(settings);
  }

  @SuppressWarnings("unchecked")
  private static void overlay(Map<String, Object> target, Object section, String path) {
    if (section == null) {
      return;
    }
    if (!(section instanceof Map<?, ?> mapping)) {
      throw new IllegalArgumentException("Settings at '" + path + "' must be a mapping");
    }
    for (Map.Entry<?, ?> entry : mapping.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException("Settings at '" + path + "' contain a blank or non-text key");
      }
      Object value = entry.getValue();
      Object existing = target.get(key);
      if (value instanceof Map<?, ?> && existing instanceof Map<?, ?>) {
        overlay((Map<String, Object>) existing, value, path + "." + key);
      } else if (value instanceof Map<?, ?>) {
        Map<String, Object> branch = new LinkedHashMap<>();
        overlay(branch, value, path + "." + key);
        target.put(key, branch);
      } else {
        target.put(key, value);
      }
    }
  }

  private static void render(Map<String, Object> tree, String prefix, Map<String, String> settings) {
    tree.forEach((key, value) -> {
      String dotted = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?>) {
        @SuppressWarnings("unchecked")
        Map<String, Object> branch = (Map<String, Object>) value;
        render(branch, dotted, settings);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("Setting " + dotted + " is a list; only scalar values are supported");
      } else {
        settings.put(dotted, value == null ? "" : value.toString());
      }
    });
  }
}
