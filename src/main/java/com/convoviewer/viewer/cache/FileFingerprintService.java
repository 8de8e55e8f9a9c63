package com.convoviewer.viewer.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class FileFingerprintService {

    /**
     * Stat the given files and capture modification time and size for each.
     * This is used to detect if a log changed since it was parsed, without reading its content.
     *
     * Missing or unreadable files are recorded as absent rather than failing, so a file
     * that disappears or reappears also changes the fingerprint.
     *
     * @param paths - Backing files, in a stable order
     * @return Fingerprint of all files
     */
    public FileFingerprint fingerprint(List<Path> paths) {
        List<FileFingerprint.FileStamp> stamps = new ArrayList<>(paths.size());
        for (Path path : paths) {
            stamps.add(stamp(path));
        }
        return new FileFingerprint(stamps);
    }

    private FileFingerprint.FileStamp stamp(Path path) {
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            // Directory sizes are filesystem-specific, only their mtime is meaningful
            long size = attrs.isDirectory() ? 0L : attrs.size();
            return new FileFingerprint.FileStamp(path.toString(), true, attrs.lastModifiedTime().toMillis(), size);
        } catch (NoSuchFileException e) {
            return new FileFingerprint.FileStamp(path.toString(), false, 0L, 0L);
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", path, e.getMessage());
            return new FileFingerprint.FileStamp(path.toString(), false, 0L, 0L);
        }
    }
}
