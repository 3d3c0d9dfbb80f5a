package com.kmg.nexar.service;

import com.kmg.nexar.exception.ChecksumMismatchException;
import com.kmg.nexar.exception.DiskExhaustedException;
import com.kmg.nexar.exception.InvalidSourceRefException;
import com.kmg.nexar.exception.SourceUnavailableException;
import com.kmg.nexar.exception.TransientTransferException;
import com.kmg.nexar.model.DownloadJob;
import com.kmg.nexar.model.FailureReason;
import com.kmg.nexar.model.SourceDescriptor;
import com.kmg.nexar.model.TransferOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Moves the bytes of one job from its source into {@code <download-dir>/<jobId>.part}, one chunk
 * at a time, and renames the part file once the content is complete and verified.
 */
public class TransferUnit implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(TransferUnit.class);
    private static final Object FINAL_NAME_LOCK = new Object();
    private static final int MAX_MOVE_ATTEMPTS = 3;

    private final DownloadJob job;
    private final TransferControl control;
    private final TransferListener listener;
    private final SourceResolver sourceResolver;
    private final BandwidthAllocator bandwidthAllocator;
    private final PartialFileVerifier verifier;
    private final DiskSpaceGuard diskSpaceGuard;
    private final RetryPolicy retryPolicy;
    private final int chunkSize;
    private final Path downloadDir;
    private final Duration pollInterval;

    public TransferUnit(
            DownloadJob job,
            TransferControl control,
            TransferListener listener,
            SourceResolver sourceResolver,
            BandwidthAllocator bandwidthAllocator,
            PartialFileVerifier verifier,
            DiskSpaceGuard diskSpaceGuard,
            RetryPolicy retryPolicy,
            int chunkSize,
            Path downloadDir,
            Duration pollInterval
    ) {
        this.job = job;
        this.control = control;
        this.listener = listener;
        this.sourceResolver = sourceResolver;
        this.bandwidthAllocator = bandwidthAllocator;
        this.verifier = verifier;
        this.diskSpaceGuard = diskSpaceGuard;
        this.retryPolicy = retryPolicy;
        this.chunkSize = chunkSize;
        this.downloadDir = downloadDir;
        this.pollInterval = pollInterval;
    }

    public static Path partFileOf(Path downloadDir, String jobId) {
        return downloadDir.resolve(jobId + ".part");
    }

    @Override
    public void run() {
        TransferOutcome outcome;
        try {
            outcome = transfer();
        } catch (StopRequestedException e) {
            outcome = TransferOutcome.stopped();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = control.stopRequested()
                    ? TransferOutcome.stopped()
                    : TransferOutcome.failed(FailureReason.IO_ERROR, "Transfer interrupted");
        } catch (ChecksumMismatchException e) {
            outcome = TransferOutcome.failed(FailureReason.CHECKSUM_MISMATCH, e.getMessage());
        } catch (SourceUnavailableException e) {
            outcome = TransferOutcome.failed(FailureReason.SOURCE_UNAVAILABLE, e.getMessage());
        } catch (InvalidSourceRefException e) {
            outcome = TransferOutcome.failed(FailureReason.SOURCE_UNAVAILABLE, e.getMessage());
        } catch (TransientTransferException e) {
            outcome = TransferOutcome.failed(FailureReason.TRANSFER_ERROR, e.getMessage());
        } catch (IOException e) {
            outcome = DiskSpaceGuard.isNoSpace(e)
                    ? TransferOutcome.failed(FailureReason.DISK_EXHAUSTED, e.getMessage())
                    : TransferOutcome.failed(FailureReason.IO_ERROR, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Transfer of {} failed unexpectedly: {}", job.id(), e.getMessage(), e);
            outcome = TransferOutcome.failed(FailureReason.IO_ERROR, e.getMessage());
        } finally {
            bandwidthAllocator.release(job.id());
        }

        if (outcome.kind() == TransferOutcome.Kind.FAILED) {
            log.warn("Transfer of {} failed: {}", job.id(), outcome.errorText());
        }
        listener.onFinished(control, outcome);
    }

    private TransferOutcome transfer() throws IOException, InterruptedException {
        SourceDescriptor descriptor = describeWithRetry();
        URI uri = descriptor.uri();
        long total = descriptor.totalBytes();
        int stride = descriptor.hasChunkChecksums() ? descriptor.chunkSize() : chunkSize;

        Files.createDirectories(downloadDir);
        Path partFile = partFileOf(downloadDir, job.id());
        boolean checksumMismatch = false;
        String finalSha256;

        try (FileChannel channel = FileChannel.open(partFile,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            PartialFileVerifier.ResumePoint resume = verifier.resume(partFile, job.downloadedBytes(), job.prefixSha256());
            long offset = resume.offset();
            MessageDigest digest = resume.digest();
            if (total >= 0 && offset > total) {
                log.warn("Source of {} shrank to {} bytes below committed offset {}; restarting", job.id(), total, offset);
                offset = 0;
                digest = PartialFileVerifier.newDigest();
            }
            channel.truncate(offset);

            if (!listener.onStarted(control, offset, total, verifier.hex(digest))) {
                return TransferOutcome.stopped();
            }
            log.info("Transfer of {} started at offset {} of {}", job.id(), offset, total);
            control.speedMeter().start();

            while (total < 0 || offset < total) {
                ensureNotStopped();
                int length = nextLength(offset, total, stride);
                diskSpaceGuard.ensureAvailable(downloadDir, length);
                if (!bandwidthAllocator.acquire(job.id(), job.priority(), length, control::stopRequested)) {
                    throw new StopRequestedException();
                }

                byte[] data = readWithRetry(uri, descriptor, offset, length, total);
                if (data.length == 0) {
                    total = offset;
                    break;
                }
                writeFully(channel, data, offset);
                channel.force(false);
                digest.update(data);
                offset += data.length;
                control.speedMeter().record(data.length);
                listener.onChunkCommitted(control, offset, total, verifier.hex(digest));
            }
            finalSha256 = verifier.hex(digest);
            if (descriptor.sha256() != null && !descriptor.sha256().equalsIgnoreCase(finalSha256)) {
                checksumMismatch = true;
            }
        }

        if (checksumMismatch) {
            Files.deleteIfExists(partFile);
            return TransferOutcome.failedDiscarding(FailureReason.CHECKSUM_MISMATCH,
                    "Downloaded content hashes to " + finalSha256 + ", expected " + descriptor.sha256());
        }

        Path target = moveToFinalName(partFile, downloadDir.resolve(deriveFileName(uri)));
        log.info("Transfer of {} completed: {}", job.id(), target);
        return TransferOutcome.completed(target.toString());
    }

    private Path moveToFinalName(Path partFile, Path preferred) throws IOException {
        // Units finishing in parallel may derive the same name.
        synchronized (FINAL_NAME_LOCK) {
            int attempt = 0;
            while (true) {
                attempt++;
                Path target = uniquePath(preferred);
                if (!listener.onFinalizing(control, target.toString())) {
                    ensureNotStopped();
                    throw new IOException("Final path of download " + job.id() + " could not be recorded");
                }
                try {
                    return Files.move(partFile, target);
                } catch (FileAlreadyExistsException e) {
                    if (attempt >= MAX_MOVE_ATTEMPTS) {
                        throw e;
                    }
                    log.warn("{} appeared while finishing {}; picking another name", target, job.id());
                }
            }
        }
    }

    private SourceDescriptor describeWithRetry() throws IOException, InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return sourceResolver.describe(job.sourceRef());
            } catch (SourceUnavailableException e) {
                throw e;
            } catch (IOException e) {
                backoffOrGiveUp(attempt, e, "Describing source");
            }
        }
    }

    private byte[] readWithRetry(URI uri, SourceDescriptor descriptor, long offset, int length, long total)
            throws IOException, InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            ensureNotStopped();
            try {
                byte[] data = sourceResolver.read(uri, offset, length);
                if (data.length == 0 && total >= 0 && offset < total) {
                    throw new TransientTransferException("Source ended early at offset " + offset + " of " + total);
                }
                String expected = descriptor.chunkChecksumAt(offset);
                if (expected != null && data.length > 0) {
                    String actual = PartialFileVerifier.sha256Hex(data);
                    if (!expected.equalsIgnoreCase(actual)) {
                        throw new ChecksumMismatchException(offset, expected, actual);
                    }
                }
                return data;
            } catch (SourceUnavailableException | DiskExhaustedException e) {
                throw e;
            } catch (IOException e) {
                backoffOrGiveUp(attempt, e, "Chunk at offset " + offset);
            }
        }
    }

    private void backoffOrGiveUp(int attempt, IOException error, String what) throws IOException, InterruptedException {
        if (attempt >= retryPolicy.maxAttempts()) {
            if (error instanceof ChecksumMismatchException) {
                throw error;
            }
            throw new TransientTransferException(what + " failed after " + attempt + " attempts: " + error.getMessage(), error);
        }
        Duration delay = retryPolicy.delayBefore(attempt);
        log.warn("{} of {} failed (attempt {}/{}), retrying in {} ms: {}",
                what, job.id(), attempt, retryPolicy.maxAttempts(), delay.toMillis(), error.getMessage());
        sleepUnlessStopped(delay);
    }

    private void sleepUnlessStopped(Duration delay) throws InterruptedException {
        long deadline = System.nanoTime() + delay.toNanos();
        long slice = Math.max(1, pollInterval.toNanos());
        while (true) {
            ensureNotStopped();
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return;
            }
            TimeUnit.NANOSECONDS.sleep(Math.min(slice, remaining));
        }
    }

    private void ensureNotStopped() {
        if (control.stopRequested()) {
            throw new StopRequestedException();
        }
    }

    private int nextLength(long offset, long total, int stride) {
        long untilBoundary = stride - (offset % stride);
        long length = total >= 0 ? Math.min(untilBoundary, total - offset) : untilBoundary;
        return (int) length;
    }

    private void writeFully(FileChannel channel, byte[] data, long offset) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        long position = offset;
        while (buffer.hasRemaining()) {
            position += channel.write(buffer, position);
        }
    }

    private String deriveFileName(URI uri) {
        String path = uri.getPath();
        String name = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        name = name.replaceAll("[\\\\/:*?\"<>|]", "_").trim();
        if (name.isBlank() || name.endsWith(".part")) {
            name = job.id() + (name.isBlank() ? ".bin" : "");
        }
        return name;
    }

    private Path uniquePath(Path path) {
        if (!Files.exists(path)) {
            return path;
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        String stamped = base + "_" + System.currentTimeMillis();
        Path candidate = path.getParent().resolve(stamped + ext);
        for (int n = 2; Files.exists(candidate); n++) {
            candidate = path.getParent().resolve(stamped + "_" + n + ext);
        }
        return candidate;
    }

    private static class StopRequestedException extends RuntimeException {
    }
}
