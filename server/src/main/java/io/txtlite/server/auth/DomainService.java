// file: server/src/main/java/io/txtlite/server/auth/DomainService.java
package io.txtlite.server.auth;

import io.txtlite.core.ContentHash;
import io.txtlite.core.DomainKey;
import io.txtlite.core.DomainRecord;
import io.txtlite.core.error.AuthException;
import io.txtlite.core.error.ConflictException;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.core.error.ValidationException;
import io.txtlite.storage.TextStore;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Application service for domains and their bearer keys.
 *
 * Responsibilities:
 *  - Register domains with a one-way password hash (never the plaintext).
 *  - Issue opaque keys after a password check; only the key's SHA-256 is stored.
 *  - Resolve keys back to their domain and refresh lastUsed on every use.
 *  - Change password / public flag for a key holder.
 *  - Decide read access for a (domain, key) pair.
 *
 * Keys are never invalidated by issuing another one; a domain can hold any
 * number of live keys until they age out of the retention window.
 */
public class DomainService {
    private static final Logger log = Logger.getLogger(DomainService.class.getName());

    private static final int TOKEN_BYTES = 32;

    private final TextStore store;
    private final PasswordEncoder passwords;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public DomainService(TextStore store, PasswordEncoder passwords, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.passwords = Objects.requireNonNull(passwords, "passwords");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Create a new, non-public domain.
     *
     * @throws ConflictException   if the name is taken (the public domain always is)
     * @throws ValidationException if name or password is blank
     */
    public void register(String name, String password) {
        String domain = requireName(name);
        requirePassword(password);
        if (DomainRecord.isPublicName(domain)) {
            throw new ConflictException("domain already exists: " + domain);
        }
        var record = new DomainRecord(domain, passwords.encode(password), false, clock.millis());
        if (!store.insertDomain(record)) {
            throw new ConflictException("domain already exists: " + domain);
        }
        log.info("registered domain " + domain);
    }

    /**
     * Verify the password and mint a new bearer key for the domain.
     *
     * @return raw key; the caller is the only holder of this value
     * @throws NotFoundException   unknown domain
     * @throws AuthException       wrong password
     * @throws ValidationException the public domain does not use keys
     */
    public String issueKey(String name, String password) {
        String domain = requireName(name);
        if (DomainRecord.isPublicName(domain)) {
            throw new ValidationException("the public domain does not use keys");
        }
        DomainRecord record = store.domain(domain)
                .orElseThrow(() -> new NotFoundException("domain does not exist: " + domain));
        if (password == null || !passwords.matches(password, record.passwordHash())) {
            throw new AuthException("incorrect password for domain " + domain);
        }

        String token = newToken();
        long now = clock.millis();
        store.putKey(new DomainKey(ContentHash.sha256Hex(token), domain, now, now));
        log.fine(() -> "issued key for domain " + domain);
        return token;
    }

    /**
     * Sign in to a domain, registering it first when the name is free.
     *
     * @return raw key for the domain
     */
    public String signIn(String name, String password) {
        String domain = requireName(name);
        if (DomainRecord.isPublicName(domain)) {
            throw new ValidationException("cannot sign in to the public domain");
        }
        if (password == null || password.isBlank()) {
            throw new ValidationException("domain key cannot be empty");
        }
        if (store.domain(domain).isEmpty()) {
            try {
                register(domain, password);
            } catch (ConflictException raced) {
                // registered concurrently; the password check below decides
                log.fine(() -> "domain " + domain + " registered concurrently");
            }
        }
        return issueKey(domain, password);
    }

    /**
     * Map a raw key to its domain and refresh the key's lastUsed.
     *
     * @throws NotFoundException when the key is blank or unknown
     */
    public String resolveKey(String token) {
        if (token == null || token.isBlank()) {
            throw new NotFoundException("no key given");
        }
        String hash = ContentHash.sha256Hex(token.trim());
        DomainKey key = store.key(hash)
                .orElseThrow(() -> new NotFoundException("unknown key"));
        store.touchKey(hash, clock.millis());
        return key.domain();
    }

    /** True when the key resolves to exactly the given domain. Never throws for bad keys. */
    public boolean holdsKey(String name, String token) {
        String domain = DomainRecord.normalizeName(name);
        if (domain.isEmpty() || token == null || token.isBlank()) {
            return false;
        }
        try {
            return domain.equals(resolveKey(token));
        } catch (NotFoundException unknown) {
            return false;
        }
    }

    /**
     * Change password and/or public flag of a domain.
     *
     * @param newPassword blank keeps the current password
     * @return true when the password was replaced
     * @throws AuthException       key does not resolve to this domain
     * @throws ValidationException the public domain cannot be modified
     */
    public boolean updateSettings(String name, String token, String newPassword, boolean isPublic) {
        String domain = requireName(name);
        if (DomainRecord.isPublicName(domain)) {
            throw new ValidationException("cannot modify the public domain");
        }
        if (!holdsKey(domain, token)) {
            throw new AuthException("key does not grant access to domain " + domain);
        }
        DomainRecord record = store.domain(domain)
                .orElseThrow(() -> new NotFoundException("domain does not exist: " + domain));

        boolean changePassword = newPassword != null && !newPassword.isBlank();
        if (changePassword) {
            record = record.withPasswordHash(passwords.encode(newPassword));
        }
        store.updateDomain(record.withPublic(isPublic));
        log.info("updated settings of domain " + domain
                + " (public=" + isPublic + ", passwordChanged=" + changePassword + ")");
        return changePassword;
    }

    /** @throws NotFoundException for an unregistered, non-public name */
    public DomainInfo describe(String name) {
        String domain = requireName(name);
        DomainRecord record = lookup(domain)
                .orElseThrow(() -> new NotFoundException("domain does not exist: " + domain));
        return new DomainInfo(record.name(), record.isPublic(), record.createdMillis());
    }

    /** Registered domain or the implicit public one. */
    public Optional<DomainRecord> lookup(String name) {
        String domain = DomainRecord.normalizeName(name);
        if (domain.isEmpty()) {
            return Optional.empty();
        }
        if (DomainRecord.isPublicName(domain)) {
            return Optional.of(DomainRecord.publicDomain());
        }
        return store.domain(domain);
    }

    /**
     * Read access rule: the public domain, public-flagged domains and names
     * that are not registered are open; anything else needs a matching key.
     */
    public boolean canRead(String name, String token) {
        Optional<DomainRecord> record = lookup(name);
        if (record.isEmpty() || record.get().isPublic()) {
            return true;
        }
        return holdsKey(record.get().name(), token);
    }

    // ---------- helpers ----------

    private String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String requireName(String raw) {
        String name = DomainRecord.normalizeName(raw);
        if (name.isEmpty()) {
            throw new ValidationException("domain name must not be empty");
        }
        return name;
    }

    private static void requirePassword(String password) {
        if (password == null || password.isBlank()) {
            throw new ValidationException("password must not be empty");
        }
    }
}
