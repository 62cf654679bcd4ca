// file: src/main/java/io/txtlite/core/DomainRecord.java
package io.txtlite.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Tenant namespace record.
 * <p>
 * The domain named {@link #PUBLIC} always exists implicitly, is always public
 * and has no password; it is never stored.
 */
public record DomainRecord(
        String name,
        String passwordHash,
        boolean isPublic,
        long createdMillis
) {
    public static final String PUBLIC = "public";

    public DomainRecord {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (!name.equals(normalizeName(name))) {
            throw new IllegalArgumentException("name must be normalized: '" + name + "'");
        }
    }

    /** Synthetic record describing the implicit public domain. */
    public static DomainRecord publicDomain() {
        return new DomainRecord(PUBLIC, null, true, 0L);
    }

    public DomainRecord withPasswordHash(String newHash) {
        return new DomainRecord(name, newHash, isPublic, createdMillis);
    }

    public DomainRecord withPublic(boolean flag) {
        return new DomainRecord(name, passwordHash, flag, createdMillis);
    }

    /** Domain names are case-insensitive: trimmed and lower-cased. Null maps to "". */
    public static String normalizeName(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isPublicName(String name) {
        return PUBLIC.equals(name);
    }
}
