package com.kmg.nexar.exception;

import java.io.IOException;

/**
 * A source read that may succeed when repeated (timeouts, 5xx, throttling, dropped connections).
 */
public class TransientTransferException extends IOException {
    public TransientTransferException(String message) {
        super(message);
    }

    public TransientTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
