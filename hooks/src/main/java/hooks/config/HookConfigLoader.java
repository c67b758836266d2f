package hooks.config;

import hooks.manifest.UnrecognizedPhasePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads hook configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code release-hooks.properties} on the classpath</li>
 *   <li>{@code release-hooks.yml} on the classpath</li>
 * </ol>
 * If neither exists, {@link HookConfig#DEFAULTS} apply.
 *
 * <p>System properties override file-based values (e.g.
 * {@code -Dhooks.unrecognized.policy=REJECT}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code hooks.annotation.key} - annotation holding the phase list</li>
 *   <li>{@code hooks.unrecognized.policy} - IGNORE or REJECT</li>
 *   <li>{@code hooks.timeout.readiness} - per-hook timeout in seconds, 0 disables</li>
 *   <li>{@code hooks.poll.interval.ms} - readiness poll interval in milliseconds</li>
 *   <li>{@code hooks.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 */
public final class HookConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(HookConfigLoader.class);

    static final String PROPERTIES_RESOURCE = "release-hooks.properties";
    static final String YAML_RESOURCE = "release-hooks.yml";

    private HookConfigLoader() {}

    /**
     * Load from classpath, falling back to defaults.
     *
     * @return the loaded configuration
     * @throws HookConfigException if a file exists but cannot be parsed
     */
    public static HookConfig load() {
        InputStream props = getResource(PROPERTIES_RESOURCE);
        if (props != null) {
            try (props) {
                return loadProperties(props, PROPERTIES_RESOURCE);
            } catch (IOException e) {
                throw new HookConfigException("Failed to close " + PROPERTIES_RESOURCE, e);
            }
        }

        InputStream yaml = getResource(YAML_RESOURCE);
        if (yaml != null) {
            try (yaml) {
                return loadYaml(yaml, YAML_RESOURCE);
            } catch (IOException e) {
                throw new HookConfigException("Failed to close " + YAML_RESOURCE, e);
            }
        }

        log.debug("No {} or {} on classpath, using defaults", PROPERTIES_RESOURCE, YAML_RESOURCE);
        return parse(new Properties());
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to a .properties or .yml/.yaml file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws HookConfigException if the configuration is invalid
     */
    public static HookConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return HookConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static HookConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded hook config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new HookConfigException("Failed to load " + source, e);
        }
    }

    private static HookConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException | ClassCastException e) {
            throw new HookConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root != null) {
            flatten("", root, props);
        }
        log.info("Loaded hook config from {}", source);
        return parse(props);
    }

    private static void flatten(String prefix, Map<?, ?> map, Properties props) {
        for (var entry : map.entrySet()) {
            String name = String.valueOf(entry.getKey());
            String key = prefix.isEmpty() ? name : prefix + "." + name;
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<?, ?>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static HookConfig parse(Properties props) {
        HookConfig.Builder b = HookConfig.builder();

        getString(props, "hooks.annotation.key").ifPresent(b::annotationKey);

        getString(props, "hooks.unrecognized.policy").ifPresent(v -> {
            try {
                b.unrecognizedPhasePolicy(UnrecognizedPhasePolicy.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid unrecognized.policy: {}", v);
            }
        });

        getLong(props, "hooks.timeout.readiness").ifPresent(b::readinessTimeoutSeconds);

        getLong(props, "hooks.poll.interval.ms").ifPresent(v -> {
            if (v > 0) {
                b.pollIntervalMillis(v);
            } else {
                log.warn("Ignoring non-positive poll.interval.ms: {}", v);
            }
        });

        getString(props, "hooks.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null && !val.isBlank() ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
