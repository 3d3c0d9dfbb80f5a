package com.kmg.nexar.exception;

public class InvalidSourceRefException extends RuntimeException {
    private final String sourceRef;

    public InvalidSourceRefException(String sourceRef, String message) {
        super(message);
        this.sourceRef = sourceRef;
    }

    public String getSourceRef() {
        return sourceRef;
    }
}
