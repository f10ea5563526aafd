package com.raditha.extract.model;

/**
 * Raised by any extraction phase to abort the request with a specific error kind.
 */
public class ExtractionException extends RuntimeException {

    private final ErrorKind kind;
    private final String detail;

    public ExtractionException(ErrorKind kind, String detail) {
        super(kind + ": " + detail);
        this.kind = kind;
        this.detail = detail;
    }

    public ExtractionException(ErrorKind kind, String detail, Throwable cause) {
        super(kind + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDetail() {
        return detail;
    }
}
