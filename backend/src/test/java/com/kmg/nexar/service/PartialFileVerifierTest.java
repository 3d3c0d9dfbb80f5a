package com.kmg.nexar.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PartialFileVerifierTest {

    @TempDir
    Path tempDir;

    private final PartialFileVerifier verifier = new PartialFileVerifier();

    @Test
    void trustsPrefixMatchingCommittedDigest() throws Exception {
        byte[] content = MemoryContentSource.sampleBytes(200_000);
        Path part = tempDir.resolve("job.part");
        Files.write(part, content);
        String committed = PartialFileVerifier.sha256Hex(Arrays.copyOf(content, 150_000));

        PartialFileVerifier.ResumePoint point = verifier.resume(part, 150_000, committed);

        assertEquals(150_000, point.offset());
        assertEquals(committed, verifier.hex(point.digest()));
    }

    @Test
    void restartsWhenPrefixWasTampered() throws Exception {
        byte[] content = MemoryContentSource.sampleBytes(1000);
        String committed = PartialFileVerifier.sha256Hex(Arrays.copyOf(content, 500));
        content[10] ^= 1;
        Path part = tempDir.resolve("job.part");
        Files.write(part, content);

        assertEquals(0, verifier.resume(part, 500, committed).offset());
    }

    @Test
    void restartsWhenFileIsMissingOrShort() throws Exception {
        byte[] content = MemoryContentSource.sampleBytes(100);
        Path part = tempDir.resolve("job.part");
        String committed = PartialFileVerifier.sha256Hex(content);

        assertEquals(0, verifier.resume(part, 100, committed).offset());
        Files.write(part, Arrays.copyOf(content, 50));
        assertEquals(0, verifier.resume(part, 100, committed).offset());
        assertEquals(0, verifier.resume(part, 50, null).offset());
    }

    @Test
    void hexLeavesDigestUsable() {
        MessageDigest digest = PartialFileVerifier.newDigest();
        digest.update(new byte[]{1, 2, 3});
        String first = verifier.hex(digest);
        digest.update(new byte[]{4});

        assertEquals(PartialFileVerifier.sha256Hex(new byte[]{1, 2, 3}), first);
        assertEquals(PartialFileVerifier.sha256Hex(new byte[]{1, 2, 3, 4}), verifier.hex(digest));
    }
}
