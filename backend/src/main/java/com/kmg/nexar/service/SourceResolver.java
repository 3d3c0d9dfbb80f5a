package com.kmg.nexar.service;

import com.kmg.nexar.exception.InvalidSourceRefException;
import com.kmg.nexar.model.SourceDescriptor;
import com.kmg.nexar.service.source.ContentSource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;

/**
 * Maps the catalog's opaque sourceRef onto a {@link ContentSource}. The catalog has already
 * authorized the download; no entitlement checks happen here.
 */
@Service
public class SourceResolver {
    private final List<ContentSource> sources;

    public SourceResolver(List<ContentSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public URI parse(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            throw new InvalidSourceRefException(sourceRef, "sourceRef is required.");
        }
        URI uri;
        try {
            uri = new URI(sourceRef.trim());
        } catch (URISyntaxException e) {
            throw new InvalidSourceRefException(sourceRef, "Malformed sourceRef: " + e.getMessage());
        }
        if (!uri.isAbsolute()) {
            throw new InvalidSourceRefException(sourceRef, "sourceRef must be an absolute URI: " + sourceRef);
        }
        sourceFor(uri);
        return uri;
    }

    public SourceDescriptor describe(String sourceRef) throws IOException {
        URI uri = parse(sourceRef);
        return sourceFor(uri).describe(uri);
    }

    public byte[] read(URI uri, long offset, int length) throws IOException {
        return sourceFor(uri).read(uri, offset, length);
    }

    private ContentSource sourceFor(URI uri) {
        return sources.stream()
                .filter(source -> source.supports(uri))
                .findFirst()
                .orElseThrow(() -> new InvalidSourceRefException(uri.toString(), "Unsupported sourceRef: " + uri));
    }
}
