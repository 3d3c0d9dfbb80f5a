package com.kmg.nexar.model;

import java.net.URI;
import java.util.List;

/**
 * What a content source declares about the bytes behind a sourceRef.
 *
 * @param totalBytes     size in bytes, or {@link DownloadJob#UNKNOWN_SIZE}
 * @param sha256         hex SHA-256 of the whole file, or {@code null} when not declared
 * @param chunkSize      size of the ranges covered by {@code chunkChecksums}, 0 when none are declared
 * @param chunkChecksums hex SHA-256 per {@code chunkSize} range, in file order
 */
public record SourceDescriptor(
        URI uri,
        long totalBytes,
        String sha256,
        int chunkSize,
        List<String> chunkChecksums
) {
    public SourceDescriptor {
        chunkChecksums = chunkChecksums == null ? List.of() : List.copyOf(chunkChecksums);
    }

    public static SourceDescriptor of(URI uri, long totalBytes, String sha256) {
        return new SourceDescriptor(uri, totalBytes, sha256, 0, List.of());
    }

    public boolean hasChunkChecksums() {
        return chunkSize > 0 && !chunkChecksums.isEmpty();
    }

    public String chunkChecksumAt(long offset) {
        if (!hasChunkChecksums() || offset % chunkSize != 0) {
            return null;
        }
        long index = offset / chunkSize;
        return index < chunkChecksums.size() ? chunkChecksums.get((int) index) : null;
    }
}
