package com.convoviewer.viewer.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileFingerprintServiceTest {

    private final FileFingerprintService fingerprintService = new FileFingerprintService();

    @TempDir
    Path tempDir;

    @Test
    void testUnchangedFilesGiveEqualFingerprints() throws IOException {
        Path file = Files.writeString(tempDir.resolve("session.jsonl"), "{\"type\":\"user\"}\n");

        FileFingerprint first = fingerprintService.fingerprint(List.of(file));
        FileFingerprint second = fingerprintService.fingerprint(List.of(file));

        assertEquals(first, second);
        assertTrue(first.getStamps().get(0).isExists());
        assertEquals(Files.size(file), first.getStamps().get(0).getSizeBytes());
    }

    @Test
    void testModifiedFileChangesFingerprint() throws IOException {
        Path file = Files.writeString(tempDir.resolve("session.jsonl"), "{}\n");
        FileFingerprint before = fingerprintService.fingerprint(List.of(file));

        Files.writeString(file, "{}\n{}\n");
        Files.setLastModifiedTime(file, FileTime.fromMillis(Files.getLastModifiedTime(file).toMillis() + 5_000));

        assertNotEquals(before, fingerprintService.fingerprint(List.of(file)));
    }

    @Test
    void testMissingFileIsRecordedAsAbsent() throws IOException {
        Path missing = tempDir.resolve("missing.json");

        FileFingerprint absent = fingerprintService.fingerprint(List.of(missing));
        assertFalse(absent.getStamps().get(0).isExists());

        Files.writeString(missing, "{}");
        assertNotEquals(absent, fingerprintService.fingerprint(List.of(missing)));
    }
}
