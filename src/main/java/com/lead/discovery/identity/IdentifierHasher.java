package com.lead.discovery.identity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;

/**
 * SHA-256 digests used as identity keys.
 */
public final class IdentifierHasher {

    private static final String ALGORITHM = "SHA-256";

    private IdentifierHasher() {
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of {@code value}.
     */
    public static String hash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }

    /**
     * Digest of an identifier-id set. Order of the input never matters.
     */
    public static String profileHash(Collection<String> identifierIds) {
        return hash(String.join("|", identifierIds.stream().sorted().toList()));
    }
}
