// file: bench/src/main/java/io/txtlite/bench/SimilarityBench.java
package io.txtlite.bench;

import io.txtlite.core.Document;
import io.txtlite.server.similarity.SimilarityIndexer;
import io.txtlite.storage.SnapshotStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Measures the cost of one session-close similarity update as the domain grows.
 *
 * Usage:
 *   java -cp bench.jar io.txtlite.bench.SimilarityBench \
 *     --sizes 100,1000,5000 \
 *     --doc-words 200 \
 *     --vocabulary 5000 \
 *     --zipf-skew 1.0 \
 *     --repeats 5
 *
 * Output:
 *   - Summary line per size to stderr.
 *   - CSV to stdout, one line per run:
 *       corpus_size,ms
 */
public final class SimilarityBench {

    private static final String DOMAIN = "bench";

    private SimilarityBench() {
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> cfg = parseArgs(args);

        List<Integer> sizes = parseSizes(cfg.getOrDefault("sizes", "100,1000,5000"));
        int docWords = Integer.parseInt(cfg.getOrDefault("doc-words", "200"));
        int vocabulary = Integer.parseInt(cfg.getOrDefault("vocabulary", "5000"));
        double skew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "1.0"));
        int repeats = Integer.parseInt(cfg.getOrDefault("repeats", "5"));

        System.out.println("corpus_size,ms");
        for (int size : sizes) {
            List<Double> runs = runSize(size, docWords, new ZipfianWordGenerator(vocabulary, skew, 42L), repeats);
            double best = runs.stream().mapToDouble(Double::doubleValue).min().orElse(Double.NaN);
            System.err.printf("corpus=%d words/doc=%d best=%.2fms%n", size, docWords, best);
            for (double ms : runs) {
                System.out.printf("%d,%.3f%n", size, ms);
            }
        }
    }

    /**
     * Fill a fresh store with {@code size} documents and time
     * {@code repeats} indexing runs of the first one.
     */
    static List<Double> runSize(int size, int docWords, ZipfianWordGenerator words, int repeats) throws IOException {
        Path dir = Files.createTempDirectory("txt-lite-bench");
        try {
            Clock clock = Clock.systemUTC();
            SnapshotStore store = SnapshotStore.open(dir, 1, Duration.ofDays(30), clock);
            for (int i = 0; i < size; i++) {
                String id = "doc-" + i;
                String content = words.nextText(docWords);
                long created = i;
                store.computeDocument(id, prev ->
                        new Document(id, DOMAIN, id, content, created, created, 0L, List.of()));
            }

            var indexer = new SimilarityIndexer(store);
            List<Double> out = new ArrayList<>(repeats);
            for (int r = 0; r < repeats; r++) {
                long start = System.nanoTime();
                indexer.index(DOMAIN, "doc-0");
                out.add((System.nanoTime() - start) / 1_000_000.0);
            }
            return out;
        } finally {
            deleteRecursively(dir);
        }
    }

    private static List<Integer> parseSizes(String raw) {
        List<Integer> sizes = new ArrayList<>();
        for (String part : raw.split(",")) {
            int n = Integer.parseInt(part.trim());
            if (n < 1) throw new IllegalArgumentException("sizes must be >= 1: " + n);
            sizes.add(n);
        }
        return sizes;
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    private static void deleteRecursively(Path dir) throws IOException {
        try (var paths = Files.walk(dir)) {
            for (Path p : paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
