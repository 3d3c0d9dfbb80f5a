package com.kmg.nexar.service.source;

import com.kmg.nexar.model.SourceDescriptor;

import java.io.IOException;
import java.net.URI;

/**
 * Byte provider behind a sourceRef. Implementations must be safe for concurrent use by several
 * transfer units.
 */
public interface ContentSource {

    /**
     * Syntactic check only, no I/O. Used at submit time.
     */
    boolean supports(URI uri);

    SourceDescriptor describe(URI uri) throws IOException;

    /**
     * Reads up to {@code length} bytes starting at {@code offset}. Returns fewer bytes at the end of
     * the content and an empty array past it.
     */
    byte[] read(URI uri, long offset, int length) throws IOException;
}
