package com.rmatrix.config;

import com.rmatrix.dnf.ClauseDeduplication;
import com.rmatrix.exception.ConfigurationException;
import com.rmatrix.output.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads rmatrix configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static RmatrixConfig load(String path) {
        log.info("Loading rmatrix configuration from: {}", path);

        Resource resource = ResourceResolver.resolve(path);
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in configuration: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    static RmatrixConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Settings can sit at root or under the 'rmatrix' key
        Map<String, Object> rmatrixConfig = root.containsKey("rmatrix")
                ? (Map<String, Object>) root.get("rmatrix")
                : root;

        String name = getString(rmatrixConfig, "name", "default-model");
        String version = getString(rmatrixConfig, "version", "1.0");

        DnfConfig dnf = parseDnfConfig((Map<String, Object>) rmatrixConfig.get("dnf"));
        BatchConfig batch = parseBatchConfig((Map<String, Object>) rmatrixConfig.get("batch"));
        MatrixConfig matrix = parseMatrixConfig((Map<String, Object>) rmatrixConfig.get("matrix"));

        RmatrixConfig config = new RmatrixConfig(name, version, dnf, batch, matrix);

        log.info("Loaded rmatrix configuration: {} v{}, deduplication: {}, format: {}, rules: {}",
                name, version, dnf.clauseDeduplication(), batch.format(),
                batch.rulesPath() != null ? batch.rulesPath() : "(none)");

        return config;
    }

    private static DnfConfig parseDnfConfig(Map<String, Object> map) {
        if (map == null) {
            return DnfConfig.defaults();
        }
        String mode = getString(map, "clause-deduplication", ClauseDeduplication.TEXTUAL.name());
        return new DnfConfig(parseEnum(ClauseDeduplication.class, mode, "dnf.clause-deduplication"));
    }

    private static BatchConfig parseBatchConfig(Map<String, Object> map) {
        if (map == null) {
            return BatchConfig.defaults();
        }
        String rules = getString(map, "rules", null);
        String output = getString(map, "output", BatchConfig.STANDARD_OUTPUT);
        String format = getString(map, "format", OutputFormat.EQUATIONS.name());
        boolean failFast = getBoolean(map, "fail-fast", true);

        log.debug("Parsed batch config: rules={}, output={}, format={}, failFast={}",
                rules, output, format, failFast);
        return new BatchConfig(rules, output, parseEnum(OutputFormat.class, format, "batch.format"), failFast);
    }

    private static MatrixConfig parseMatrixConfig(Map<String, Object> map) {
        if (map == null) {
            return MatrixConfig.defaults();
        }
        return new MatrixConfig(
                getBoolean(map, "normalize-protein-rows", true),
                getBoolean(map, "exchange-columns", true));
    }

    // Helper methods

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key) {
        try {
            return Enum.valueOf(type, value.toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown value '" + value + "' for " + key, e);
        }
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
