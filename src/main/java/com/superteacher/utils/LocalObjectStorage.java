package com.superteacher.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;

/**
 * Stores uploads as files under a local directory, one random name per
 * upload, keeping the original extension.
 */
public class LocalObjectStorage implements ObjectStorage {
    private static final Logger logger = LoggerFactory.getLogger(LocalObjectStorage.class);

    private final Path directory;

    public LocalObjectStorage(Path directory) {
        this.directory = directory;
    }

    @Override
    public URI store(String fileName, byte[] bytes) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(UUID.randomUUID() + extension(fileName));
        Files.write(target, bytes);
        logger.info("Stored upload {} ({} bytes) at {}", fileName, bytes.length, target);
        return target.toUri();
    }

    static String extension(String fileName) {
        if (fileName == null) {
            return ".img";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return ".img";
        }
        String ext = fileName.substring(dot).toLowerCase(Locale.ROOT);
        return ext.matches("\\.[a-z0-9]{1,5}") ? ext : ".img";
    }
}
