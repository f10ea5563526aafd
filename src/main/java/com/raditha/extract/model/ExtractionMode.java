package com.raditha.extract.model;

/**
 * Whether an extraction only describes the change or also writes it.
 */
public enum ExtractionMode {
    PREVIEW,
    APPLY
}
