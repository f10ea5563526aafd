package com.raditha.extract.model;

import java.nio.file.Path;

/**
 * A request to extract the code covered by a range into a new method.
 *
 * @param filePath      File holding the selection
 * @param range         Selected range
 * @param explicitName  Method name to use, null to generate one
 * @param mode          Preview or apply
 * @param accessibility Access modifier, null for the configured default
 * @param makeStatic    Force static (true) or instance (false), null to infer
 */
public record ExtractionRequest(
        Path filePath,
        Range range,
        String explicitName,
        ExtractionMode mode,
        Accessibility accessibility,
        Boolean makeStatic) {

    public ExtractionRequest {
        if (filePath == null) {
            throw new IllegalArgumentException("filePath cannot be null");
        }
        if (range == null) {
            throw new IllegalArgumentException("range cannot be null");
        }
        if (mode == null) {
            mode = ExtractionMode.PREVIEW;
        }
    }

    public static ExtractionRequest preview(Path filePath, Range range) {
        return new ExtractionRequest(filePath, range, null, ExtractionMode.PREVIEW, null, null);
    }

    public static ExtractionRequest apply(Path filePath, Range range) {
        return new ExtractionRequest(filePath, range, null, ExtractionMode.APPLY, null, null);
    }

    public ExtractionRequest withName(String name) {
        return new ExtractionRequest(filePath, range, name, mode, accessibility, makeStatic);
    }

    public ExtractionRequest withAccessibility(Accessibility value) {
        return new ExtractionRequest(filePath, range, explicitName, mode, value, makeStatic);
    }

    public ExtractionRequest withMakeStatic(Boolean value) {
        return new ExtractionRequest(filePath, range, explicitName, mode, accessibility, value);
    }

    public ExtractionRequest withMode(ExtractionMode value) {
        return new ExtractionRequest(filePath, range, explicitName, value, accessibility, makeStatic);
    }
}
