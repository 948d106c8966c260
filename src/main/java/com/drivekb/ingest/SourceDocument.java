package com.drivekb.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * The reference manual as read from disk, with a content fingerprint used to detect changes
 * between builds.
 */
public record SourceDocument(String id, Path path, String content, String fingerprint) {

    public static SourceDocument read(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        String id = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        return new SourceDocument(id, path, new String(bytes, StandardCharsets.UTF_8), fingerprint(bytes));
    }

    static String fingerprint(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
