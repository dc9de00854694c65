// file: bench/src/main/java/io/courselite/bench/CourseLookupMix.java
package io.courselite.bench;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Stream of course numbers to look up, shaped like advising traffic.
 *
 * Most lookups target catalog courses with Zipf-distributed popularity, so a
 * handful of gateway courses absorb most of the load. A fixed fraction asks for
 * numbers that are not in the catalog at all ("ZZZZ" is never a department).
 */
public final class CourseLookupMix {

    static final String MISSING_PREFIX = "ZZZZ";

    private final List<String> byPopularity;
    private final double[] cumulative;
    private final double missRate;
    private final Random rnd;

    /**
     * @param catalogNumbers course numbers in the catalog; their popularity order is
     *                       a seeded shuffle, independent of insertion order
     * @param skew           Zipf exponent, larger means more concentrated
     * @param missRate       fraction of lookups for absent numbers, in [0, 1]
     */
    public CourseLookupMix(List<String> catalogNumbers, double skew, double missRate, long seed) {
        Objects.requireNonNull(catalogNumbers, "catalogNumbers");
        if (catalogNumbers.isEmpty()) throw new IllegalArgumentException("catalog must not be empty");
        if (skew <= 0.0) throw new IllegalArgumentException("skew must be > 0");
        if (missRate < 0.0 || missRate > 1.0) throw new IllegalArgumentException("missRate must be in [0, 1]");

        this.rnd = new Random(seed);
        this.missRate = missRate;
        this.byPopularity = new ArrayList<>(catalogNumbers);
        Collections.shuffle(byPopularity, rnd);

        int n = byPopularity.size();
        this.cumulative = new double[n];
        double total = 0.0;
        for (int rank = 0; rank < n; rank++) {
            total += Math.pow(rank + 1, -skew);
            cumulative[rank] = total;
        }
    }

    /** Next course number to look up. */
    public String next() {
        if (rnd.nextDouble() < missRate) {
            return String.format("%s%05d", MISSING_PREFIX, rnd.nextInt(100_000));
        }
        return byPopularity.get(rankOf(rnd.nextDouble() * cumulative[cumulative.length - 1]));
    }

    /** Course number at the given popularity rank (0 is the most popular). */
    String atRank(int rank) {
        return byPopularity.get(rank);
    }

    private int rankOf(double target) {
        int idx = Arrays.binarySearch(cumulative, target);
        int rank = idx >= 0 ? idx : -idx - 1;
        return Math.min(rank, cumulative.length - 1);
    }
}
