// file: server/src/main/java/io/txtlite/server/Main.java
package io.txtlite.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.txtlite.core.error.PersistenceException;
import io.txtlite.server.auth.DomainService;
import io.txtlite.server.compaction.Compactor;
import io.txtlite.server.docs.BlobService;
import io.txtlite.server.docs.DocumentService;
import io.txtlite.server.similarity.SimilarityIndexer;
import io.txtlite.server.sync.LiveSyncEndpoint;
import io.txtlite.server.sync.LiveSyncSession;
import io.txtlite.storage.FlushPolicy;
import io.txtlite.storage.SnapshotStore;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a txt-lite server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Open the store once; refuse to start when it cannot be opened.
 *  - Wire services, the live-sync endpoint and the HTTP layer around that one store.
 *  - Start the background compactor.
 *  - On shutdown: stop HTTP, stop the compactor, then flush one last time.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ServerConfig.fromArgs(args);
        if (cfg.showVersion()) {
            System.out.println("txt-lite " + version());
            return;
        }
        LoggingSetup.configure(cfg.debug());

        Clock clock = Clock.systemUTC();

        // ------ Storage layer ------
        SnapshotStore store;
        try {
            store = SnapshotStore.open(
                    Path.of(cfg.dataDir()),
                    cfg.snapshotsRetained(),
                    Duration.ofDays(cfg.keyRetentionDays()),
                    clock
            );
        } catch (PersistenceException e) {
            log.log(Level.SEVERE, "cannot open store in " + cfg.dataDir() + "; refusing to start", e);
            System.exit(1);
            return;
        }

        // ------ Services ------
        var domains = new DomainService(store, new BCryptPasswordEncoder(cfg.bcryptStrength()), clock);
        var documents = new DocumentService(store, clock);
        var blobs = new BlobService(store, clock);
        var indexer = new SimilarityIndexer(store);

        // ------ HTTP + live sync ------
        var json = new ObjectMapper();
        var liveSync = new LiveSyncEndpoint(json,
                () -> new LiveSyncSession(domains, documents, indexer, clock));
        var web = new WebServer(cfg.httpPort(), json, domains, documents, blobs, liveSync);

        // ------ Background compaction ------
        var policy = new FlushPolicy(
                Duration.ofSeconds(cfg.idleSeconds()),
                Duration.ofSeconds(cfg.minFlushSpacingSeconds())
        );
        var compactor = new Compactor(store, policy, Duration.ofSeconds(cfg.pollSeconds()), clock);

        compactor.start();
        web.start();
        log.info(String.format("txt-lite %s listening on http://localhost:%d (data in %s)",
                version(), cfg.httpPort(), Path.of(cfg.dataDir()).toAbsolutePath()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("shutting down");
            web.stop();
            compactor.stop();
            documents.close();
            try {
                String id = store.flush();
                log.info("final snapshot " + id + " written");
            } catch (PersistenceException e) {
                log.log(Level.SEVERE, "final flush failed; changes since the last snapshot are lost", e);
            }
        }, "shutdown"));
    }

    /** Implementation-Version from the jar manifest; "dev" when run from classes. */
    static String version() {
        String v = Main.class.getPackage().getImplementationVersion();
        return v == null ? "dev" : v;
    }
}
