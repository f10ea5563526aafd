package com.raditha.extract.config;

import com.raditha.extract.model.Accessibility;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExtractorSettingsTest {

    @Test
    void testMissingSectionGivesDefaults() {
        assertEquals(ExtractionConfig.defaults(), ExtractorSettings.fromMap(Map.of("other", Map.of())));
        assertEquals(ExtractionConfig.defaults(), ExtractorSettings.fromMap(null));
    }

    @Test
    void testClasspathConfigMatchesDefaults() {
        assertEquals(ExtractionConfig.defaults(), ExtractorSettings.loadConfig());
    }

    @Test
    void testExplicitValuesOverrideDefaults() {
        Map<String, Object> section = Map.of(
                "return_strategy", "out_params",
                "exit_normalization", "return_in_place",
                "default_accessibility", "package",
                "generator_methods", List.of("yieldValue"),
                "default_method_name", "part",
                "generate_names", false,
                "max_parameters_warning", 2);

        ExtractionConfig config = ExtractorSettings.fromMap(Map.of(ExtractorSettings.CONFIG_KEY, section));

        assertEquals(MultiValueStrategy.OUT_PARAMS, config.multiValueStrategy());
        assertEquals(ExitNormalization.RETURN_IN_PLACE, config.exitNormalization());
        assertEquals(Accessibility.PACKAGE_PRIVATE, config.defaultAccessibility());
        assertEquals(Set.of("yieldValue"), config.generatorMethods());
        assertEquals(Set.of("await"), config.suspensionMethods());
        assertEquals("part", config.defaultMethodName());
        assertFalse(config.generateNames());
        assertEquals(2, config.maxParametersWarning());
    }

    @Test
    void testPresetFromFile() throws IOException, URISyntaxException {
        Path file = Path.of(Objects.requireNonNull(
                getClass().getResource("/extractor-out-params.yml")).toURI());

        ExtractionConfig config = ExtractorSettings.loadConfig(file);

        assertEquals(MultiValueStrategy.OUT_PARAMS, config.multiValueStrategy());
        assertEquals(ExitNormalization.RETURN_IN_PLACE, config.exitNormalization());
        assertEquals(Accessibility.PROTECTED, config.defaultAccessibility());
        assertTrue(config.isSuspensionMethod("join"));
        assertTrue(config.isGeneratorMethod("emit"));
        assertEquals("helper", config.defaultMethodName());
        assertEquals(3, config.maxParametersWarning());
    }

    @Test
    void testMethodCannotBeBothSuspensionAndGenerator() {
        Map<String, Object> section = Map.of(
                "suspension_methods", List.of("next"),
                "generator_methods", List.of("next"));

        Map<String, Object> root = Map.of(ExtractorSettings.CONFIG_KEY, section);
        assertThrows(IllegalArgumentException.class, () -> ExtractorSettings.fromMap(root));
    }

    @Test
    void testUnknownStrategyIsRejected() {
        Map<String, Object> root = Map.of(ExtractorSettings.CONFIG_KEY, Map.of("return_strategy", "tuple"));

        assertThrows(IllegalArgumentException.class, () -> ExtractorSettings.fromMap(root));
    }

    @Test
    void testWithersKeepOtherSettings() {
        ExtractionConfig config = ExtractionConfig.defaults()
                .withMultiValueStrategy(MultiValueStrategy.OUT_PARAMS)
                .withExitNormalization(ExitNormalization.RETURN_IN_PLACE);

        assertEquals(ExtractionConfig.outParams(), config);
    }
}
