// file: server/src/main/java/io/txtlite/server/ServerConfig.java
package io.txtlite.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - dataDir:                 directory holding snapshot files
 *  - httpPort:                HTTP + WebSocket port
 *  - debug:                   FINE logging for io.txtlite.*
 *  - keyRetentionDays:        keys unused for longer than this are evicted
 *  - pollSeconds:             compactor poll interval
 *  - idleSeconds:             quiet time required before a flush
 *  - minFlushSpacingSeconds:  minimum time between two flushes
 *  - snapshotsRetained:       snapshot files kept on disk
 *  - bcryptStrength:          log2 rounds for password hashing
 *  - showVersion:             print the version and exit
 */
public record ServerConfig(
        String dataDir,
        int httpPort,
        boolean debug,
        long keyRetentionDays,
        long pollSeconds,
        long idleSeconds,
        long minFlushSpacingSeconds,
        int snapshotsRetained,
        int bcryptStrength,
        boolean showVersion
) {

    public static ServerConfig defaults() {
        return new ServerConfig("./data", 8152, false, 30, 120, 3, 10, 3, 10, false);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --data-dir,  -d  <path>
     *   --port,      -p  <port>
     *   --debug
     *   --key-retention-days <days>
     *   --poll-seconds <seconds>
     *   --idle-seconds <seconds>
     *   --min-flush-spacing-seconds <seconds>
     *   --snapshots-retained <n>
     *   --bcrypt-strength <4..31>
     *   --version,   -v
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local use.
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig d = defaults();
        String dataDir = d.dataDir();
        int httpPort = d.httpPort();
        boolean debug = d.debug();
        long keyRetentionDays = d.keyRetentionDays();
        long pollSeconds = d.pollSeconds();
        long idleSeconds = d.idleSeconds();
        long minFlushSpacingSeconds = d.minFlushSpacingSeconds();
        int snapshotsRetained = d.snapshotsRetained();
        int bcryptStrength = d.bcryptStrength();
        boolean showVersion = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--version", "-v" -> showVersion = true;

                case "--debug" -> debug = true;

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = (int) parseNumber(args[i], args[++i], 1, 65535);
                }

                case "--key-retention-days" -> {
                    ensureValue(args, i);
                    keyRetentionDays = parseNumber(args[i], args[++i], 1, 36500);
                }

                case "--poll-seconds" -> {
                    ensureValue(args, i);
                    pollSeconds = parseNumber(args[i], args[++i], 1, Long.MAX_VALUE);
                }

                case "--idle-seconds" -> {
                    ensureValue(args, i);
                    idleSeconds = parseNumber(args[i], args[++i], 0, Long.MAX_VALUE);
                }

                case "--min-flush-spacing-seconds" -> {
                    ensureValue(args, i);
                    minFlushSpacingSeconds = parseNumber(args[i], args[++i], 0, Long.MAX_VALUE);
                }

                case "--snapshots-retained" -> {
                    ensureValue(args, i);
                    snapshotsRetained = (int) parseNumber(args[i], args[++i], 1, 1000);
                }

                case "--bcrypt-strength" -> {
                    ensureValue(args, i);
                    bcryptStrength = (int) parseNumber(args[i], args[++i], 4, 31);
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(
                dataDir,
                httpPort,
                debug,
                keyRetentionDays,
                pollSeconds,
                idleSeconds,
                minFlushSpacingSeconds,
                snapshotsRetained,
                bcryptStrength,
                showVersion
        );
    }

    private static long parseNumber(String flag, String raw, long min, long max) {
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min || v > max) {
                System.err.println("Value for " + flag + " out of range [" + min + ", " + max + "]: " + raw);
                System.exit(1);
            }
            return v;
        } catch (NumberFormatException e) {
            System.err.println("Invalid number for " + flag + ": " + raw);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: txt-lite-server [options]

            Options:
              --data-dir,  -d               Snapshot directory (default: ./data)
              --port,      -p               HTTP/WebSocket port (default: 8152)
              --debug                       Verbose (FINE) logging
              --key-retention-days          Evict keys unused for this long (default: 30)
              --poll-seconds                Compactor poll interval (default: 120)
              --idle-seconds                Quiet time before a flush (default: 3)
              --min-flush-spacing-seconds   Minimum time between flushes (default: 10)
              --snapshots-retained          Snapshot files kept on disk (default: 3)
              --bcrypt-strength             Password hashing cost, 4..31 (default: 10)
              --version,   -v               Print version and exit
              --help,      -h               Show this help message
            """);
        System.exit(0);
    }
}
