// file: src/main/java/io/txtlite/core/DomainKey.java
package io.txtlite.core;

import java.util.Objects;

/**
 * Bearer key issued for a domain.
 * <p>
 * Only the SHA-256 hex digest of the raw token is kept; the raw token is
 * handed to the caller once, at issue time. Many keys may point at the same domain.
 */
public record DomainKey(
        String tokenHash,
        String domain,
        long issuedMillis,
        long lastUsedMillis
) {
    public DomainKey {
        Objects.requireNonNull(tokenHash, "tokenHash");
        Objects.requireNonNull(domain, "domain");
    }

    public DomainKey touchedAt(long nowMillis) {
        return new DomainKey(tokenHash, domain, issuedMillis, Math.max(lastUsedMillis, nowMillis));
    }
}
