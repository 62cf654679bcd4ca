package io.txtlite.server.auth;

import io.txtlite.core.ContentHash;
import io.txtlite.core.error.AuthException;
import io.txtlite.core.error.ConflictException;
import io.txtlite.core.error.NotFoundException;
import io.txtlite.core.error.ValidationException;
import io.txtlite.server.MutableClock;
import io.txtlite.storage.SnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DomainServiceTest {

    @TempDir Path dataDir;
    private MutableClock clock;
    private SnapshotStore store;
    private DomainService domains;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        store = SnapshotStore.open(dataDir, 3, Duration.ofDays(30), clock);
        domains = new DomainService(store, new BCryptPasswordEncoder(4), clock);
    }

    @Test
    void registering_twice_is_a_conflict() {
        domains.register("acme", "pw");
        assertThrows(ConflictException.class, () -> domains.register("acme", "other"));
        assertThrows(ConflictException.class, () -> domains.register("  ACME ", "other"));
    }

    @Test
    void public_domain_always_exists() {
        assertThrows(ConflictException.class, () -> domains.register("public", "pw"));
        DomainInfo info = domains.describe("public");
        assertTrue(info.isPublic());
    }

    @Test
    void blank_inputs_are_rejected() {
        assertThrows(ValidationException.class, () -> domains.register("acme", " "));
        assertThrows(ValidationException.class, () -> domains.register("", "pw"));
    }

    @Test
    void password_is_stored_hashed() {
        domains.register("acme", "pw");
        String hash = store.domain("acme").orElseThrow().passwordHash();
        assertNotEquals("pw", hash);
        assertTrue(hash.startsWith("$2"));
    }

    @Test
    void issued_key_resolves_to_its_domain_and_only_its_hash_is_stored() {
        domains.register("acme", "pw");
        String key = domains.issueKey("acme", "pw");

        assertEquals("acme", domains.resolveKey(key));
        assertTrue(store.key(key).isEmpty());
        assertTrue(store.key(ContentHash.sha256Hex(key)).isPresent());
    }

    @Test
    void wrong_password_and_unknown_domain() {
        domains.register("acme", "pw");
        assertThrows(AuthException.class, () -> domains.issueKey("acme", "nope"));
        assertThrows(NotFoundException.class, () -> domains.issueKey("ghost", "pw"));
    }

    @Test
    void garbage_key_does_not_resolve() {
        assertThrows(NotFoundException.class, () -> domains.resolveKey("not-a-key"));
        assertThrows(NotFoundException.class, () -> domains.resolveKey(""));
        assertFalse(domains.holdsKey("acme", "not-a-key"));
    }

    @Test
    void reissuing_keeps_earlier_keys_valid() {
        domains.register("acme", "pw");
        String first = domains.issueKey("acme", "pw");
        String second = domains.issueKey("acme", "pw");

        assertNotEquals(first, second);
        assertEquals("acme", domains.resolveKey(first));
        assertEquals("acme", domains.resolveKey(second));
    }

    @Test
    void resolving_refreshes_last_used() {
        domains.register("acme", "pw");
        String key = domains.issueKey("acme", "pw");
        clock.advanceMillis(5_000);

        domains.resolveKey(key);

        assertEquals(clock.millis(), store.key(ContentHash.sha256Hex(key)).orElseThrow().lastUsedMillis());
    }

    @Test
    void sign_in_registers_free_names_and_checks_taken_ones() {
        String key = domains.signIn("Fresh", "pw");
        assertEquals("fresh", domains.resolveKey(key));

        assertThrows(AuthException.class, () -> domains.signIn("fresh", "wrong"));
        assertThrows(ValidationException.class, () -> domains.signIn("public", "pw"));
    }

    @Test
    void settings_change_needs_a_key_for_that_domain() {
        domains.register("acme", "pw");
        domains.register("other", "pw");
        String acmeKey = domains.issueKey("acme", "pw");
        String otherKey = domains.issueKey("other", "pw");

        assertThrows(AuthException.class, () -> domains.updateSettings("acme", otherKey, "", true));
        assertThrows(AuthException.class, () -> domains.updateSettings("acme", "bogus", "", true));

        assertFalse(domains.updateSettings("acme", acmeKey, "", true));
        assertTrue(domains.describe("acme").isPublic());

        assertTrue(domains.updateSettings("acme", acmeKey, "new-pw", false));
        assertFalse(domains.describe("acme").isPublic());
        assertThrows(AuthException.class, () -> domains.issueKey("acme", "pw"));
        assertNotNull(domains.issueKey("acme", "new-pw"));
    }

    @Test
    void public_domain_settings_are_immutable() {
        assertThrows(ValidationException.class, () -> domains.updateSettings("public", "k", "", false));
    }

    @Test
    void describe_unknown_domain() {
        assertThrows(NotFoundException.class, () -> domains.describe("ghost"));
    }

    @Test
    void read_access_rule() {
        domains.register("private", "pw");
        domains.register("open", "pw");
        String openKey = domains.issueKey("open", "pw");
        domains.updateSettings("open", openKey, "", true);
        String privateKey = domains.issueKey("private", "pw");

        assertTrue(domains.canRead("public", null));
        assertTrue(domains.canRead("open", null));
        assertTrue(domains.canRead("unregistered", null));
        assertFalse(domains.canRead("private", null));
        assertFalse(domains.canRead("private", openKey));
        assertTrue(domains.canRead("private", privateKey));
    }
}
