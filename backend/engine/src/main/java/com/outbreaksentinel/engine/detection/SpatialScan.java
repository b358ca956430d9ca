package com.outbreaksentinel.engine.detection;

import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Kulldorff circular scan statistic under a Poisson model.
 *
 * <p>Candidate windows are centred on every region and grown by nearest neighbours while the window
 * holds at most {@code maxPopulationFraction} of the study population. For a window with {@code O}
 * observed and {@code E = C · pop(window) / pop(total)} expected cases the log likelihood ratio is
 * {@code O·ln(O/E) − (O − E)} when {@code O > E} and zero otherwise. Significance comes from
 * {@code permutations} Monte Carlo replicates in which the {@code C} cases are redistributed
 * multinomially by population; {@code p = rank / (permutations + 1)}.
 */
public final class SpatialScan {
    private SpatialScan() {
    }

    public record Cluster(
            List<String> regions,
            String center,
            double radiusKm,
            double observed,
            double expected,
            long population,
            double logLikelihoodRatio,
            double pValue
    ) {
        public boolean significant(double alpha) {
            return !regions.isEmpty() && logLikelihoodRatio > 0.0 && pValue < alpha;
        }
    }

    public static Cluster scan(List<SpatialCell> cells, int permutations, double maxPopulationFraction, long seed) {
        if (cells.size() < 2) {
            throw new IllegalArgumentException("the scan needs at least two located regions");
        }
        long[] population = cells.stream().mapToLong(cell -> cell.region().population()).toArray();
        long totalPopulation = Arrays.stream(population).sum();
        if (totalPopulation <= 0) {
            throw new IllegalArgumentException("the scan needs a positive study population");
        }
        double[] cases = cells.stream().mapToDouble(SpatialCell::cases).toArray();
        double totalCases = Arrays.stream(cases).sum();

        List<Circle> circles = candidateCircles(cells, population, maxPopulationFraction * totalPopulation);
        if (circles.isEmpty() || totalCases <= 0.0) {
            return new Cluster(List.of(), null, 0.0, 0.0, 0.0, 0L, 0.0, 1.0);
        }

        Best observed = best(circles, cases, totalCases, totalPopulation);
        int totalCount = (int) Math.round(totalCases);
        RandomGenerator random = new Well19937c(seed);
        int atLeastAsExtreme = 0;
        for (int replicate = 0; replicate < permutations; replicate++) {
            double[] simulated = redistribute(totalCount, population, totalPopulation, random);
            if (best(circles, simulated, totalCount, totalPopulation).llr() >= observed.llr()) {
                atLeastAsExtreme++;
            }
        }
        double pValue = (atLeastAsExtreme + 1.0) / (permutations + 1.0);

        Circle circle = observed.circle();
        int size = observed.size();
        List<String> regions = IntStream.range(0, size)
                .mapToObj(i -> cells.get(circle.order()[i]).region().region())
                .toList();
        double windowCases = 0.0;
        for (int i = 0; i < size; i++) {
            windowCases += cases[circle.order()[i]];
        }
        long windowPopulation = circle.cumulativePopulation()[size - 1];
        return new Cluster(
                regions,
                cells.get(circle.center()).region().region(),
                circle.radiusKm()[size - 1],
                windowCases,
                totalCases * windowPopulation / totalPopulation,
                windowPopulation,
                observed.llr(),
                pValue
        );
    }

    static double logLikelihoodRatio(double observed, double expected) {
        if (observed <= expected || expected <= 0.0) {
            return 0.0;
        }
        return observed * Math.log(observed / expected) - (observed - expected);
    }

    private static List<Circle> candidateCircles(List<SpatialCell> cells, long[] population, double cap) {
        List<Circle> circles = new ArrayList<>();
        for (int center = 0; center < cells.size(); center++) {
            int c = center;
            int[] order = IntStream.range(0, cells.size()).boxed()
                    .sorted(Comparator.<Integer>comparingDouble(i -> cells.get(c).region().distanceKm(cells.get(i).region()))
                            .thenComparing(i -> i))
                    .mapToInt(Integer::intValue)
                    .toArray();
            long[] cumulative = new long[order.length];
            double[] radius = new double[order.length];
            int size = 0;
            long running = 0;
            for (int member : order) {
                if (running + population[member] > cap) {
                    break;
                }
                running += population[member];
                cumulative[size] = running;
                radius[size] = cells.get(center).region().distanceKm(cells.get(member).region());
                size++;
            }
            if (size > 0) {
                circles.add(new Circle(center, order, cumulative, radius, size));
            }
        }
        return circles;
    }

    private static Best best(List<Circle> circles, double[] cases, double totalCases, long totalPopulation) {
        Circle bestCircle = circles.get(0);
        int bestSize = 1;
        double bestLlr = -1.0;
        for (Circle circle : circles) {
            double observed = 0.0;
            for (int size = 1; size <= circle.maxSize(); size++) {
                observed += cases[circle.order()[size - 1]];
                double expected = totalCases * circle.cumulativePopulation()[size - 1] / totalPopulation;
                double llr = logLikelihoodRatio(observed, expected);
                if (llr > bestLlr) {
                    bestLlr = llr;
                    bestCircle = circle;
                    bestSize = size;
                }
            }
        }
        return new Best(bestCircle, bestSize, bestLlr);
    }

    private static double[] redistribute(int totalCases, long[] population, long totalPopulation, RandomGenerator random) {
        double[] simulated = new double[population.length];
        int remainingCases = totalCases;
        long remainingPopulation = totalPopulation;
        for (int i = 0; i < population.length && remainingCases > 0 && remainingPopulation > 0; i++) {
            double share = (double) population[i] / remainingPopulation;
            int drawn = share >= 1.0
                    ? remainingCases
                    : new BinomialDistribution(random, remainingCases, share).sample();
            simulated[i] = drawn;
            remainingCases -= drawn;
            remainingPopulation -= population[i];
        }
        return simulated;
    }

    /**
     * Nested windows around one centre: the first {@code size} entries of {@code order} for every
     * {@code size} up to {@code maxSize}.
     */
    private record Circle(int center, int[] order, long[] cumulativePopulation, double[] radiusKm, int maxSize) {
    }

    private record Best(Circle circle, int size, double llr) {
    }
}
