package com.kmg.nexar.exception;

import java.io.IOException;

public class DiskExhaustedException extends IOException {
    public DiskExhaustedException(String message) {
        super(message);
    }

    public DiskExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
