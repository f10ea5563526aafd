package com.raditha.extract.config;

import com.raditha.extract.model.Accessibility;

import java.util.Set;

/**
 * Configuration for method extraction.
 *
 * @param multiValueStrategy   Aggregate record or holder parameters when several values flow back
 * @param exitNormalization    Rewriting policy for early exits
 * @param defaultAccessibility Access modifier used when a request does not name one
 * @param suspensionMethods    Method names treated as suspension points (await)
 * @param generatorMethods     Method names treated as generator points (emit)
 * @param defaultMethodName    Base name used when no meaningful name can be derived
 * @param generateNames        Derive method names from the selected code
 * @param maxParametersWarning Parameter count above which a warning is raised
 */
public record ExtractionConfig(
        MultiValueStrategy multiValueStrategy,
        ExitNormalization exitNormalization,
        Accessibility defaultAccessibility,
        Set<String> suspensionMethods,
        Set<String> generatorMethods,
        String defaultMethodName,
        boolean generateNames,
        int maxParametersWarning) {

    /**
     * Validate configuration.
     */
    public ExtractionConfig {
        if (multiValueStrategy == null) {
            throw new IllegalArgumentException("multiValueStrategy cannot be null");
        }
        if (exitNormalization == null) {
            throw new IllegalArgumentException("exitNormalization cannot be null");
        }
        if (defaultAccessibility == null) {
            defaultAccessibility = Accessibility.PRIVATE;
        }
        suspensionMethods = suspensionMethods == null ? Set.of() : Set.copyOf(suspensionMethods);
        generatorMethods = generatorMethods == null ? Set.of() : Set.copyOf(generatorMethods);
        if (defaultMethodName == null || defaultMethodName.isBlank()) {
            throw new IllegalArgumentException("defaultMethodName cannot be blank");
        }
        if (maxParametersWarning < 0) {
            throw new IllegalArgumentException("maxParametersWarning must be >= 0");
        }
        for (String name : suspensionMethods) {
            if (generatorMethods.contains(name)) {
                throw new IllegalArgumentException("'" + name + "' cannot be both a suspension and a generator method");
            }
        }
    }

    /**
     * Default preset: result records, labeled-block exits, private methods.
     */
    public static ExtractionConfig defaults() {
        return new ExtractionConfig(
                MultiValueStrategy.AGGREGATE,
                ExitNormalization.LABELED_BLOCK,
                Accessibility.PRIVATE,
                Set.of("await"),
                Set.of("emit"),
                "extracted",
                true,
                5);
    }

    /**
     * Holder preset: AtomicReference out-parameters with in-place returns.
     */
    public static ExtractionConfig outParams() {
        return new ExtractionConfig(
                MultiValueStrategy.OUT_PARAMS,
                ExitNormalization.RETURN_IN_PLACE,
                Accessibility.PRIVATE,
                Set.of("await"),
                Set.of("emit"),
                "extracted",
                true,
                5);
    }

    public ExtractionConfig withMultiValueStrategy(MultiValueStrategy strategy) {
        return new ExtractionConfig(strategy, exitNormalization, defaultAccessibility, suspensionMethods,
                generatorMethods, defaultMethodName, generateNames, maxParametersWarning);
    }

    public ExtractionConfig withExitNormalization(ExitNormalization normalization) {
        return new ExtractionConfig(multiValueStrategy, normalization, defaultAccessibility, suspensionMethods,
                generatorMethods, defaultMethodName, generateNames, maxParametersWarning);
    }

    public boolean isSuspensionMethod(String name) {
        return suspensionMethods.contains(name);
    }

    public boolean isGeneratorMethod(String name) {
        return generatorMethods.contains(name);
    }
}
