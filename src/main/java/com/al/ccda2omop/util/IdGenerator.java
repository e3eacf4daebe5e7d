package com.al.ccda2omop.util;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Deterministic identifier generation for OMOP rows.
 *
 * <p>
 * Each part is hashed as its UTF-8 bytes followed by a {@code 0x00}
 * separator. The first eight bytes of the SHA-256 digest are read as a
 * big-endian signed long and the absolute value is returned, so the same
 * ordered parts always produce the same id in any process.
 *
 * @author CCDA2OMOP Team
 * @since 1.0.0
 */
public final class IdGenerator {

    public static final String SOURCE_SYSTEM_CCDA = "CCDA";

    private static final byte SEPARATOR = 0x00;

    private IdGenerator() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    /**
     * Generate an id from the ordered parts. The first part is normally the
     * table namespace ("person", "visit", "condition", ...).
     */
    public static long generateId(String... parts) {
        MessageDigest digest = sha256();
        for (String part : parts) {
            digest.update((part == null ? "" : part).getBytes(StandardCharsets.UTF_8));
            digest.update(SEPARATOR);
        }
        long raw = ByteBuffer.wrap(digest.digest(), 0, Long.BYTES).getLong();
        // abs(Long.MIN_VALUE) overflows
        return raw == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(raw);
    }

    public static long personId(String patientId, String sourceSystem) {
        return generateId("person", patientId, sourceSystem);
    }

    public static long visitId(long personId, String encounterId) {
        return generateId("visit", String.valueOf(personId), encounterId);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
