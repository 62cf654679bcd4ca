package io.txtlite.bench;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityBenchTest {

    @Test
    void small_run_produces_one_timing_per_repeat() throws Exception {
        List<Double> runs = SimilarityBench.runSize(20, 10, new ZipfianWordGenerator(30, 1.0, 1L), 3);

        assertEquals(3, runs.size());
        runs.forEach(ms -> assertTrue(ms >= 0.0));
    }
}
