package com.kmg.nexar.exception;

import java.io.IOException;

public class ChecksumMismatchException extends IOException {
    public ChecksumMismatchException(long offset, String expected, String actual) {
        super("Checksum mismatch at offset " + offset + ": expected " + expected + " but got " + actual);
    }
}
