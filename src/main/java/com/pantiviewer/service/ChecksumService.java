package com.pantiviewer.service;

import com.pantiviewer.util.ProjectLogger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Optional;

/**
 * Computes the SHA-256 of a file's bytes, streaming it in fixed-size blocks.
 */
public class ChecksumService {

    private static final String ALGORITHM = "SHA-256";
    private static final int BLOCK_SIZE = 64 * 1024;

    /**
     * @param file The file to hash.
     * @return The lowercase hex digest, or empty if the file could not be read.
     */
    public Optional<String> checksum(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            byte[] buffer = new byte[BLOCK_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
            return Optional.of(toHex(digest.digest()));
        } catch (IOException e) {
            ProjectLogger.logRecurringError(file.getParent(), "ChecksumService", "Unreadable file, will retry on the next scan: " + file, e);
            return Optional.empty();
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    private static String toHex(byte[] hash) {
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
