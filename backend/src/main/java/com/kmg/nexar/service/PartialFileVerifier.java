package com.kmg.nexar.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Decides how much of a part file can be trusted by re-hashing its prefix against the SHA-256
 * committed to the ledger with the byte offset.
 */
@Component
public class PartialFileVerifier {
    private static final Logger log = LoggerFactory.getLogger(PartialFileVerifier.class);
    private static final int READ_BUFFER = 64 * 1024;

    public ResumePoint resume(Path partFile, long committedOffset, String committedSha256) throws IOException {
        if (committedOffset <= 0) {
            return new ResumePoint(0, newDigest());
        }
        if (committedSha256 == null || !Files.isRegularFile(partFile) || Files.size(partFile) < committedOffset) {
            log.warn("Part file {} cannot back offset {}; restarting from zero", partFile, committedOffset);
            return new ResumePoint(0, newDigest());
        }

        MessageDigest digest = newDigest();
        try (FileChannel channel = FileChannel.open(partFile, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate(READ_BUFFER);
            long position = 0;
            while (position < committedOffset) {
                buffer.clear();
                buffer.limit((int) Math.min(READ_BUFFER, committedOffset - position));
                int read = channel.read(buffer, position);
                if (read < 0) {
                    break;
                }
                buffer.flip();
                digest.update(buffer);
                position += read;
            }
        }

        String actual = hex(digest);
        if (!actual.equalsIgnoreCase(committedSha256)) {
            log.warn("Prefix checksum of {} does not match the ledger at offset {}; restarting from zero",
                    partFile, committedOffset);
            return new ResumePoint(0, newDigest());
        }
        return new ResumePoint(committedOffset, digest);
    }

    /**
     * Hex digest of everything fed to {@code digest} so far, leaving it usable for more updates.
     */
    public String hex(MessageDigest digest) {
        try {
            MessageDigest copy = (MessageDigest) digest.clone();
            return HexFormat.of().formatHex(copy.digest());
        } catch (CloneNotSupportedException e) {
            throw new IllegalStateException("SHA-256 digest is not cloneable", e);
        }
    }

    public static String sha256Hex(byte[] data) {
        return HexFormat.of().formatHex(newDigest().digest(data));
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public record ResumePoint(long offset, MessageDigest digest) {
    }
}
