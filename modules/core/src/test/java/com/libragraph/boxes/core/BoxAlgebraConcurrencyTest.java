package com.libragraph.boxes.core;

import com.libragraph.boxes.core.config.BoxesConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class BoxAlgebraConcurrencyTest {

    private static final int THREADS = 8;
    private static final int ROUNDS = 20;

    private final List<Box> samples = BoxSamples.generate(11, 12);
    private final BoxAlgebra reference = new BoxAlgebra(new BoxesConfig(256, 0, 1000));

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void standardAlgebraHoldsUnderContention() throws Exception {
        List<String> failures = race(BoxAlgebra.standard());

        assertThat(failures).isEmpty();
    }

    @Test
    void smallCacheEvictsWhileThreadsRace() throws Exception {
        BoxAlgebra small = new BoxAlgebra(new BoxesConfig(256, 4, 1000));

        List<String> failures = race(small);

        assertThat(failures).isEmpty();
        assertThat(small.cache().size()).isLessThanOrEqualTo(4);
        assertThat(small.cache().misses()).isGreaterThan(4);
        assertThat(small.cache().hits()).isPositive();
    }

    /**
     * Runs every operator over every sample pair from all threads and returns the pairs whose
     * results differ from an uncached single-threaded computation.
     */
    private List<String> race(BoxAlgebra algebra) throws Exception {
        List<Callable<List<String>>> tasks = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            int offset = t;
            tasks.add(() -> {
                List<String> failures = new ArrayList<>();
                for (int round = 0; round < ROUNDS; round++) {
                    for (int i = 0; i < samples.size(); i++) {
                        Box a = samples.get((i + offset) % samples.size());
                        Box b = samples.get((i + round) % samples.size());
                        check(algebra, a, b, failures);
                    }
                }
                return failures;
            });
        }

        List<Future<List<String>>> futures = executor.invokeAll(tasks);
        List<String> failures = new ArrayList<>();
        for (Future<List<String>> future : futures) {
            failures.addAll(future.get(60, TimeUnit.SECONDS));
        }
        return failures;
    }

    private void check(BoxAlgebra algebra, Box a, Box b, List<String> failures) {
        Box product = algebra.product(a, b);
        if (!product.equals(algebra.product(b, a))) {
            failures.add("product not commutative for " + a + ", " + b);
        }
        if (!product.equals(reference.product(a, b))) {
            failures.add("product differs for " + a + ", " + b);
        }
        if (!algebra.sum(a, b).equals(reference.sum(a, b))) {
            failures.add("sum differs for " + a + ", " + b);
        }
        if (!algebra.sum(a, algebra.negate(a)).isEmpty()) {
            failures.add("no annihilation for " + a);
        }
        if (!algebra.evaluate(product).equals(a.evaluate().multiply(b.evaluate()))) {
            failures.add("evaluate not multiplicative for " + a + ", " + b);
        }
    }
}
