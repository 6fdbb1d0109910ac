package com.realestate.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Derives content-stable identifiers: the SHA-1 of the parts joined with {@code |}, as lowercase hex.
 * <p>
 * The same parts yield the same id in any run and any process. A fresh digest is used per call, so the
 * hasher holds no mutable state and needs no locking.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public final class IdentityHasher {
    private static final Logger logger = LoggerFactory.getLogger(IdentityHasher.class);

    private static final String ALGORITHM = "SHA-1";

    private IdentityHasher() {}

    /**
     * Hashes the given parts; a null part hashes like an empty string.
     * @param parts identity components, in a fixed order
     * @return 40 character lowercase hex digest
     */
    public static String hash(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) joined.append('|');
            if (parts[i] != null) joined.append(parts[i]);
        }
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return bytesToHex(digest.digest(joined.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            logger.error("Could not initialize {} MessageDigest", ALGORITHM, e);
            throw new IllegalStateException("Failed to initialize identity hashing", e);
        }
    }

    private static String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
