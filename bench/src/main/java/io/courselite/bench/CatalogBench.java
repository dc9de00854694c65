// file: bench/src/main/java/io/courselite/bench/CatalogBench.java
package io.courselite.bench;

import io.courselite.core.AvlInvariants;
import io.courselite.core.Course;
import io.courselite.storage.AvlCourseStore;

import java.util.*;

/**
 * In-process microbenchmark for the AVL course store.
 *
 * Usage:
 *   java -cp bench.jar io.courselite.bench.CatalogBench \
 *     --keys 100000 \
 *     --lookups 1000000 \
 *     --zipf-skew 0.99 \
 *     --seed 42
 *
 * Workload:
 *   1) Generate 'keys' distinct course numbers (DEPT + 5 digits, at most 800000), shuffled.
 *   2) Insert all of them, timing the whole phase.
 *   3) Run 'lookups' finds drawn from a {@link CourseLookupMix}: Zipf popularity
 *      over the catalog, with one lookup in ten for a number that was never inserted.
 *
 * Output (stderr):
 *   - insert throughput, lookup throughput and p50/p95/p99 lookup latency,
 *   - final tree height vs. the AVL height bound, and rotation count.
 */
public final class CatalogBench {

    private static final String[] DEPARTMENTS = {"CSCI", "MATH", "PHYS", "CHEM", "BIOL", "ENGL", "HIST", "ECON"};
    private static final int NUMBERS_PER_DEPARTMENT = 100_000;

    /** Number of distinct course numbers {@link #generateNumbers} can produce. */
    static final int MAX_KEYS = DEPARTMENTS.length * NUMBERS_PER_DEPARTMENT;
    private static final double MISS_RATE = 0.1;

    public record Result(int keys, int height, double heightBound, long rotations,
                         double insertsPerSec, double lookupsPerSec,
                         long hits, long misses,
                         double p50Micros, double p95Micros, double p99Micros) {}

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int keys = Integer.parseInt(cfg.getOrDefault("keys", "100000"));
        int lookups = Integer.parseInt(cfg.getOrDefault("lookups", "1000000"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));

        Result r = run(keys, lookups, zipfSkew, seed);
        System.err.printf(
                "keys=%d inserts=%.0f ops/s lookups=%.0f ops/s hits=%d misses=%d p50=%.2fus p95=%.2fus p99=%.2fus%n",
                r.keys(), r.insertsPerSec(), r.lookupsPerSec(), r.hits(), r.misses(),
                r.p50Micros(), r.p95Micros(), r.p99Micros()
        );
        System.err.printf("height=%d bound=%.2f rotations=%d%n", r.height(), r.heightBound(), r.rotations());
    }

    static Map<String, String> parseArgs(String[] args) {
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

    public static Result run(int keys, int lookups, double zipfSkew, long seed) {
        if (keys <= 0 || keys > MAX_KEYS) throw new IllegalArgumentException("keys must be in [1, " + MAX_KEYS + "]");
        if (lookups < 0) throw new IllegalArgumentException("lookups must be >= 0");

        List<String> numbers = generateNumbers(keys, seed);
        var store = new AvlCourseStore();

        long iStart = System.nanoTime();
        for (String number : numbers) {
            store.insert(number, new Course(number, "Course " + number));
        }
        long insertNanos = Math.max(1L, System.nanoTime() - iStart);

        var mix = new CourseLookupMix(numbers, zipfSkew, MISS_RATE, seed + 1);

        long[] samples = new long[lookups];
        long hits = 0;
        long lStart = System.nanoTime();
        for (int i = 0; i < lookups; i++) {
            String key = mix.next();
            long s = System.nanoTime();
            boolean found = store.find(key).isPresent();
            samples[i] = System.nanoTime() - s;
            if (found) hits++;
        }
        long lookupNanos = Math.max(1L, System.nanoTime() - lStart);
        Arrays.sort(samples);

        return new Result(
                keys,
                store.height(),
                AvlInvariants.heightBound(keys),
                store.rotationCount(),
                keys / (insertNanos / 1e9),
                lookups / (lookupNanos / 1e9),
                hits,
                lookups - hits,
                percentile(samples, 0.50) / 1_000.0,
                percentile(samples, 0.95) / 1_000.0,
                percentile(samples, 0.99) / 1_000.0
        );
    }

    /**
     * Distinct course numbers such as "CSCI04217", in seeded random order.
     * Slots of the key space are drawn with a partial Fisher-Yates shuffle, so the
     * cost is linear even when 'keys' equals {@link #MAX_KEYS}.
     */
    static List<String> generateNumbers(int keys, long seed) {
        if (keys < 0 || keys > MAX_KEYS) {
            throw new IllegalArgumentException("keys must be in [0, " + MAX_KEYS + "]");
        }
        var rnd = new Random(seed);
        int[] slots = new int[MAX_KEYS];
        for (int i = 0; i < slots.length; i++) {
            slots[i] = i;
        }
        List<String> out = new ArrayList<>(keys);
        for (int i = 0; i < keys; i++) {
            int j = i + rnd.nextInt(slots.length - i);
            int slot = slots[j];
            slots[j] = slots[i];
            slots[i] = slot;
            out.add(String.format("%s%05d",
                    DEPARTMENTS[slot / NUMBERS_PER_DEPARTMENT], slot % NUMBERS_PER_DEPARTMENT));
        }
        return out;
    }

    private static double percentile(long[] sorted, double q) {
        if (sorted.length == 0) return Double.NaN;
        double idx = q * (sorted.length - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted[lo];
        double w = idx - lo;
        return sorted[lo] * (1 - w) + sorted[hi] * w;
    }
}
