package com.bubblegrade.modules.storage;

import com.bubblegrade.config.ScanningProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class FileSystemScanImageStore implements ScanImageStore {

    private final ScanningProperties properties;

    @Override
    public String store(byte[] image) {
        String filename = UUID.randomUUID() + ".jpg";
        Path dir = Paths.get(properties.getImageStorageDir());
        try {
            Files.createDirectories(dir);
            Files.write(dir.resolve(filename), image);
            log.debug("Stored scan image {} ({} bytes)", filename, image.length);
            return filename;
        } catch (IOException e) {
            log.error("Failed to store scan image in {}: {}", dir, e.getMessage(), e);
            throw new UncheckedIOException("Scan image could not be stored", e);
        }
    }

    @Override
    public void delete(String imagePath) {
        Path file = Paths.get(properties.getImageStorageDir()).resolve(imagePath);
        try {
            if (Files.deleteIfExists(file)) {
                log.debug("Deleted scan image {}", imagePath);
            }
        } catch (IOException e) {
            log.warn("Failed to delete scan image {}: {}", file, e.getMessage());
        }
    }
}
