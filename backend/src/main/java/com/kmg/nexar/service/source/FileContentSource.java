package com.kmg.nexar.service.source;

import com.kmg.nexar.exception.SourceUnavailableException;
import com.kmg.nexar.model.SourceDescriptor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Serves {@code file:} URIs, typically content already mirrored to a local or network share.
 * A sibling {@code <name>.sha256} declares the whole-file digest; a sibling {@code <name>.chunks}
 * declares the chunk size on its first line followed by one digest per chunk.
 */
@Component
public class FileContentSource implements ContentSource {

    @Override
    public boolean supports(URI uri) {
        if (!"file".equalsIgnoreCase(uri.getScheme())) {
            return false;
        }
        if (uri.getRawAuthority() != null || uri.getRawQuery() != null || uri.getRawFragment() != null) {
            return false;
        }
        String path = uri.getPath();
        if (path == null || path.isBlank() || path.endsWith("/")) {
            return false;
        }
        try {
            Path.of(uri);
            return true;
        } catch (IllegalArgumentException | FileSystemNotFoundException e) {
            return false;
        }
    }

    @Override
    public SourceDescriptor describe(URI uri) throws IOException {
        Path path = Path.of(uri);
        if (!Files.isRegularFile(path)) {
            throw new SourceUnavailableException("Source file not found: " + path);
        }
        long size = Files.size(path);
        String sha256 = readSha256(sibling(path, ".sha256"));

        Path chunksFile = sibling(path, ".chunks");
        if (!Files.isRegularFile(chunksFile)) {
            return SourceDescriptor.of(uri, size, sha256);
        }
        List<String> lines = Files.readAllLines(chunksFile, StandardCharsets.UTF_8).stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
        if (lines.isEmpty()) {
            return SourceDescriptor.of(uri, size, sha256);
        }
        int chunkSize = Integer.parseInt(lines.get(0));
        List<String> digests = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            digests.add(line.toLowerCase(Locale.ROOT));
        }
        return new SourceDescriptor(uri, size, sha256, chunkSize, digests);
    }

    @Override
    public byte[] read(URI uri, long offset, int length) throws IOException {
        Path path = Path.of(uri);
        if (!Files.isRegularFile(path)) {
            throw new SourceUnavailableException("Source file not found: " + path);
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate(length);
            long position = offset;
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                position += read;
            }
            return Arrays.copyOf(buffer.array(), buffer.position());
        }
    }

    private Path sibling(Path path, String suffix) {
        return path.resolveSibling(path.getFileName().toString() + suffix);
    }

    private String readSha256(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return null;
        }
        String content = Files.readString(file, StandardCharsets.UTF_8).trim();
        if (content.isEmpty()) {
            return null;
        }
        return content.split("\\s+")[0].toLowerCase(Locale.ROOT);
    }
}
