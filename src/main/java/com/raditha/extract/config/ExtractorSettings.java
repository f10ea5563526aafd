package com.raditha.extract.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.extract.model.Accessibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads extraction configuration from extractor.yml.
 *
 * Configuration priority: explicit file > extractor.yml on the classpath > defaults
 */
public class ExtractorSettings {

    private static final Logger logger = LoggerFactory.getLogger(ExtractorSettings.class);

    static final String CONFIG_KEY = "extract_method";
    static final String DEFAULT_RESOURCE = "/extractor.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ExtractorSettings() {
        /* this is only a utility class */
    }

    /**
     * Load configuration from extractor.yml on the classpath, falling back to defaults.
     */
    public static ExtractionConfig loadConfig() {
        try (InputStream in = ExtractorSettings.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                logger.debug("{} not found on classpath, using defaults", DEFAULT_RESOURCE);
                return ExtractionConfig.defaults();
            }
            return fromMap(YAML.readValue(in, Map.class));
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", DEFAULT_RESOURCE, e.getMessage());
            return ExtractionConfig.defaults();
        }
    }

    /**
     * Load configuration from a YAML file.
     *
     * @param yamlFile file with an extract_method section
     * @return Complete extraction configuration
     * @throws IOException if the file cannot be read or parsed
     */
    public static ExtractionConfig loadConfig(Path yamlFile) throws IOException {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            return fromMap(YAML.readValue(in, Map.class));
        }
    }

    /**
     * Build configuration from the parsed YAML document.
     */
    static ExtractionConfig fromMap(Map<?, ?> root) {
        Object section = root == null ? null : root.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return ExtractionConfig.defaults();
        }

        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;

        String preset = getString(config, "preset", null);
        ExtractionConfig base = "out_params".equals(preset) ? ExtractionConfig.outParams() : ExtractionConfig.defaults();

        MultiValueStrategy strategy = MultiValueStrategy.valueOf(
                getString(config, "return_strategy", base.multiValueStrategy().name()).toUpperCase());
        ExitNormalization normalization = ExitNormalization.valueOf(
                getString(config, "exit_normalization", base.exitNormalization().name()).toUpperCase());
        Accessibility accessibility = Accessibility.fromString(
                getString(config, "default_accessibility", base.defaultAccessibility().name()));

        Set<String> suspension = getStringSet(config, "suspension_methods", base.suspensionMethods());
        Set<String> generator = getStringSet(config, "generator_methods", base.generatorMethods());

        return new ExtractionConfig(
                strategy,
                normalization,
                accessibility,
                suspension,
                generator,
                getString(config, "default_method_name", base.defaultMethodName()),
                getBoolean(config, "generate_names", base.generateNames()),
                getInt(config, "max_parameters_warning", base.maxParametersWarning()));
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static Set<String> getStringSet(Map<String, Object> map, String key, Set<String> defaultValue) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            Set<String> names = new LinkedHashSet<>();
            list.forEach(item -> names.add(String.valueOf(item)));
            return names;
        }
        return defaultValue;
    }
}
