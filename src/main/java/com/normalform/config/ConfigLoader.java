package com.normalform.config;

import com.normalform.exception.ConfigurationException;
import com.normalform.minimizer.NormalForm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Loads normal form configuration from YAML files.
 * <p>
 * Example:
 * <pre>
 * normal-form:
 *   default-form: CNF
 *   max-terms: 16
 *   warn-terms: 12
 *   output-format: TEXT
 * </pre>
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
    public static NormalFormConfig load(String path) {
        log.info("Loading normal form configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration file not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static NormalFormConfig parse(InputStream inputStream) {
        Map<String, Object> root;
        try {
            Yaml yaml = new Yaml();
            root = yaml.load(inputStream);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Configuration file is not a YAML mapping", e);
        }

        if (root == null) {
            log.warn("Configuration file is empty, using defaults");
            return NormalFormConfig.defaults();
        }

        // Settings may sit at the root or under a 'normal-form' key
        Object section = root.containsKey("normal-form") ? root.get("normal-form") : root;
        if (section == null) {
            return NormalFormConfig.defaults();
        }
        if (!(section instanceof Map)) {
            throw new ConfigurationException("normal-form must be a YAML mapping, got '" + section + "'");
        }
        Map<String, Object> settings = (Map<String, Object>) section;

        NormalForm defaultForm = parseEnum(NormalForm.class,
                getString(settings, "default-form", NormalForm.CNF.name()), "default-form");
        int maxTerms = getInt(settings, "max-terms", NormalFormConfig.DEFAULT_MAX_TERMS);
        int warnTerms = getInt(settings, "warn-terms", Math.min(NormalFormConfig.DEFAULT_WARN_TERMS, maxTerms));
        OutputFormat outputFormat = parseEnum(OutputFormat.class,
                getString(settings, "output-format", OutputFormat.TEXT.name()), "output-format");

        NormalFormConfig config = new NormalFormConfig(defaultForm, maxTerms, warnTerms, outputFormat);
        log.info("Loaded normal form configuration: default form {}, max terms {}, warn terms {}, output {}",
                defaultForm, maxTerms, warnTerms, outputFormat);
        return config;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + key + " '" + value + "'", e);
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, got '" + value + "'", e);
        }
    }
}
