package vn.com.fecredit.fileportal.model.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * SHA-256 helpers. Hashes are exchanged as lowercase hex; S3 part checksums need base64.
 */
public final class ChecksumUtil {

    public static final String ALGORITHM = "SHA-256";

    private static final int BUFFER_SIZE = 64 * 1024;

    private ChecksumUtil() {
    }

    public static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    public static String sha256Hex(byte[] data) {
        return toHex(newDigest().digest(data));
    }

    /**
     * Streams the file through SHA-256 without loading it into memory.
     */
    public static String sha256Hex(Path file) throws IOException {
        MessageDigest digest = newDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return toHex(digest.digest());
    }

    public static String toHex(byte[] hash) {
        StringBuilder sb = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    /**
     * Converts a hex SHA-256 into the base64 form S3 expects in {@code x-amz-checksum-sha256}.
     */
    public static String hexToBase64(String hex) {
        return Base64.getEncoder().encodeToString(fromHex(hex));
    }

    public static byte[] fromHex(String hex) {
        if (hex.length() % 2 != 0) {
            throw new IllegalArgumentException("Hex string must have an even length");
        }
        byte[] bytes = new byte[hex.length() / 2];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) Integer.parseInt(hex.substring(i * 2, i * 2 + 2), 16);
        }
        return bytes;
    }

    /**
     * Case-insensitive comparison; {@code null} never matches.
     */
    public static boolean matches(String expectedHex, String actualHex) {
        return expectedHex != null && actualHex != null && expectedHex.equalsIgnoreCase(actualHex);
    }
}
