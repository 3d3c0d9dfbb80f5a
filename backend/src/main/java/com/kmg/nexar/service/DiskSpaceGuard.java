package com.kmg.nexar.service;

import com.kmg.nexar.config.DownloadProperties;
import com.kmg.nexar.exception.DiskExhaustedException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

@Component
public class DiskSpaceGuard {
    private final long reserveBytes;

    @Autowired
    public DiskSpaceGuard(DownloadProperties properties) {
        this(properties.getDiskReserveBytes());
    }

    protected DiskSpaceGuard(long reserveBytes) {
        this.reserveBytes = reserveBytes;
    }

    public void ensureAvailable(Path dir, long bytes) throws DiskExhaustedException {
        long usable;
        try {
            usable = usableSpace(dir);
        } catch (IOException e) {
            // Some file stores cannot report free space; the write itself will fail if the disk is full.
            return;
        }
        if (usable - reserveBytes < bytes) {
            throw new DiskExhaustedException("Not enough disk space in " + dir + ": " + usable
                    + " bytes usable, " + (bytes + reserveBytes) + " required");
        }
    }

    protected long usableSpace(Path dir) throws IOException {
        return Files.getFileStore(dir).getUsableSpace();
    }

    public static boolean isNoSpace(IOException e) {
        if (e instanceof DiskExhaustedException) {
            return true;
        }
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        return normalized.contains("no space left") || normalized.contains("not enough space");
    }
}
