package com.kmg.nexar.exception;

import java.io.IOException;

/**
 * The source answered, but will not serve the content (missing file, 4xx response). Not retried.
 */
public class SourceUnavailableException extends IOException {
    public SourceUnavailableException(String message) {
        super(message);
    }
}
