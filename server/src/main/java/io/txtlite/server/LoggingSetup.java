// file: server/src/main/java/io/txtlite/server/LoggingSetup.java
package io.txtlite.server;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Loads /logging.properties into java.util.logging and applies --debug.
 */
final class LoggingSetup {
    // strong reference: LogManager only holds loggers weakly
    private static final Logger APP_LOGGER = Logger.getLogger("io.txtlite");

    private LoggingSetup() {
    }

    static void configure(boolean debug) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties, using JDK defaults: " + e.getMessage());
        }

        if (debug) {
            APP_LOGGER.setLevel(Level.FINE);
            for (Handler h : Logger.getLogger("").getHandlers()) {
                h.setLevel(Level.FINE);
            }
        }
    }
}
