// file: bench/src/main/java/io/txtlite/bench/ZipfianWordGenerator.java
package io.txtlite.bench;

import java.util.Random;

/**
 * Zipf-distributed words over a synthetic vocabulary "w0".."w{n-1}".
 *
 * Precomputes the harmonic weights once and samples with a binary search
 * over the CDF, so low-numbered words dominate like common words in prose.
 */
public final class ZipfianWordGenerator {

    private final int n;
    private final double[] cdf;
    private final Random rnd;

    public ZipfianWordGenerator(int vocabularySize, double skew, long seed) {
        if (vocabularySize <= 0) throw new IllegalArgumentException("vocabularySize must be > 0");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");

        this.n = vocabularySize;
        this.rnd = new Random(seed);

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += 1.0 / Math.pow(i + 1, skew);
        }
        this.cdf = new double[n];
        double running = 0.0;
        for (int i = 0; i < n; i++) {
            running += (1.0 / Math.pow(i + 1, skew)) / sum;
            cdf[i] = running;
        }
        cdf[n - 1] = 1.0;
    }

    /** Word rank in [0, n). */
    public int nextRank() {
        double u = rnd.nextDouble();
        int lo = 0;
        int hi = n - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (u <= cdf[mid]) {
                hi = mid;
            } else {
                lo = mid + 1;
            }
        }
        return lo;
    }

    public String nextWord() {
        return "w" + nextRank();
    }

    /** Space-separated text of the given length in words. */
    public String nextText(int words) {
        StringBuilder sb = new StringBuilder(words * 6);
        for (int i = 0; i < words; i++) {
            if (i > 0) sb.append(' ');
            sb.append(nextWord());
        }
        return sb.toString();
    }
}
