package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.RetirementProperties;
import com.gillianbc.retirement.model.MonteCarloPercentile;
import com.gillianbc.retirement.model.MonteCarloResult;
import com.gillianbc.retirement.model.SimulationInputs;
import com.gillianbc.retirement.model.SimulationResult;
import com.gillianbc.retirement.numeric.GaussianSampler;
import com.gillianbc.retirement.numeric.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Repeats the projection with randomly drawn annual capital growth and summarises the spread
 * of total assets per year.
 */
@Slf4j
@Service
public class MonteCarloService {

    private final ProjectionService projectionService;
    private final RetirementProperties properties;

    public MonteCarloService(ProjectionService projectionService, RetirementProperties properties) {
        this.projectionService = Objects.requireNonNull(projectionService, "projectionService must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public MonteCarloResult runMonteCarlo(SimulationInputs inputs) {
        return runMonteCarlo(inputs, properties.getMonteCarlo().getIterations());
    }

    public MonteCarloResult runMonteCarlo(SimulationInputs inputs, int iterations) {
        Long configured = properties.getMonteCarlo().getSeed();
        return runMonteCarlo(inputs, iterations, configured != null ? configured : new Random().nextLong());
    }

    /**
     * Runs {@code iterations} stochastic projections. Every run gets its own seed drawn from
     * {@code seed} before any run starts, so the outcome is the same whether runs execute
     * sequentially or in parallel.
     *
     * @throws IllegalArgumentException if {@code iterations} is not positive
     */
    public MonteCarloResult runMonteCarlo(SimulationInputs inputs, int iterations, long seed) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be > 0");
        }

        Random master = new Random(seed);
        long[] runSeeds = new long[iterations];
        for (int i = 0; i < iterations; i++) {
            runSeeds[i] = master.nextLong();
        }

        boolean parallel = properties.getMonteCarlo().isParallel();
        log.info("Starting Monte Carlo: {} runs, seed {}, parallel {}", iterations, seed, parallel);

        IntStream indices = IntStream.range(0, iterations);
        if (parallel) {
            indices = indices.parallel();
        }
        List<List<SimulationResult>> runs = indices
                .mapToObj(i -> projectionService.runSimulation(inputs, new GaussianSampler(runSeeds[i])))
                .filter(run -> !run.isEmpty())
                .collect(Collectors.toList());

        if (runs.isEmpty()) {
            log.info("Monte Carlo produced no projections; inputs were rejected");
            return new MonteCarloResult(Collections.emptyList(), 0.0, BigDecimal.ZERO.setScale(2), 0, seed);
        }

        List<MonteCarloPercentile> percentiles = percentiles(runs);

        BigDecimal threshold = properties.getMonteCarlo().getSuccessThreshold();
        List<BigDecimal> finals = new ArrayList<>(runs.size());
        int successes = 0;
        for (List<SimulationResult> run : runs) {
            BigDecimal last = run.get(run.size() - 1).getTotalAssets();
            finals.add(last);
            if (last.compareTo(threshold) > 0) {
                successes++;
            }
        }
        Collections.sort(finals);
        double successRate = (double) successes / runs.size();
        BigDecimal median = Money.round(pick(finals, 0.50));

        log.info("Monte Carlo finished: success rate {}, median end-of-plan assets {}", successRate, median);
        return new MonteCarloResult(percentiles, successRate, median, runs.size(), seed);
    }

    /** Per-year percentile bands; the shortest run sets the number of years. */
    private static List<MonteCarloPercentile> percentiles(List<List<SimulationResult>> runs) {
        int years = runs.stream().mapToInt(List::size).min().orElse(0);
        List<MonteCarloPercentile> bands = new ArrayList<>(years);
        for (int y = 0; y < years; y++) {
            List<BigDecimal> values = new ArrayList<>(runs.size());
            for (List<SimulationResult> run : runs) {
                values.add(run.get(y).getTotalAssets());
            }
            Collections.sort(values);
            SimulationResult reference = runs.get(0).get(y);
            bands.add(new MonteCarloPercentile(reference.getYear(), reference.getAge(),
                    Money.round(pick(values, 0.05)),
                    Money.round(pick(values, 0.25)),
                    Money.round(pick(values, 0.50)),
                    Money.round(pick(values, 0.75)),
                    Money.round(pick(values, 0.95))));
        }
        return bands;
    }

    /** Nearest-rank pick: index floor(p x n), clamped to the last element. */
    static BigDecimal pick(List<BigDecimal> sorted, double p) {
        int index = Math.min(sorted.size() - 1, (int) Math.floor(p * sorted.size()));
        return sorted.get(index);
    }
}
