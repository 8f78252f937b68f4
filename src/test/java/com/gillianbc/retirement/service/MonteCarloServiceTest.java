package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.RetirementProperties;
import com.gillianbc.retirement.model.MonteCarloPercentile;
import com.gillianbc.retirement.model.MonteCarloResult;
import com.gillianbc.retirement.model.ReturnAssumptions;
import com.gillianbc.retirement.model.SimulationInputs;
import com.gillianbc.retirement.model.SimulationResult;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.gillianbc.retirement.service.EngineFixtures.account;
import static com.gillianbc.retirement.service.EngineFixtures.money;
import static com.gillianbc.retirement.service.EngineFixtures.retiree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class MonteCarloServiceTest {

    private static final long SEED = 20250101L;

    private final EngineFixtures engine = new EngineFixtures();

    private static SimulationInputs retirement(String spend, double volatility) {
        return SimulationInputs.builder()
                .person(retiree(65, 90).rrsp(account("600000")).tfsa(account("100000")).build())
                .postRetirementSpend(money(spend))
                .returnRates(ReturnAssumptions.builder()
                        .capitalGrowth(money("0.05"))
                        .volatility(volatility)
                        .build())
                .startYear(2025)
                .build();
    }

    @Test
    @DisplayName("With zero volatility every percentile band equals the deterministic projection")
    void zeroVolatilityCollapses() {
        SimulationInputs inputs = retirement("40000", 0.0);
        List<SimulationResult> deterministic = engine.projectionService.runSimulation(inputs);

        MonteCarloResult result = engine.monteCarloService.runMonteCarlo(inputs, 20, SEED);

        assertEquals(deterministic.size(), result.getPercentiles().size());
        for (int i = 0; i < deterministic.size(); i++) {
            MonteCarloPercentile band = result.getPercentiles().get(i);
            BigDecimal expected = deterministic.get(i).getTotalAssets();
            assertEquals(deterministic.get(i).getAge(), band.getAge());
            assertEquals(expected, band.getP5());
            assertEquals(expected, band.getP50());
            assertEquals(expected, band.getP95());
        }
        assertEquals(deterministic.get(deterministic.size() - 1).getTotalAssets(), result.getMedianEndOfPlanAssets());
        assertEquals(20, result.getIterations());
        assertEquals(SEED, result.getSeed());
    }

    @Test
    @DisplayName("Success rate never rises as retirement spending rises")
    void successFallsWithSpending() {
        double previous = 1.0;
        for (String spend : new String[]{"20000", "45000", "70000", "1000000"}) {
            MonteCarloResult result = engine.monteCarloService.runMonteCarlo(retirement(spend, 0.15), 60, SEED);
            log.info("spend {} success {}", spend, result.getSuccessRate());
            assertTrue(result.getSuccessRate() <= previous, "spend " + spend);
            previous = result.getSuccessRate();
        }
        assertEquals(0.0, previous);
    }

    @Test
    @DisplayName("Bands are ordered and a fixed seed reproduces the result, in parallel too")
    void seededAndOrdered() {
        SimulationInputs inputs = retirement("45000", 0.12);
        MonteCarloResult first = engine.monteCarloService.runMonteCarlo(inputs, 50, SEED);
        MonteCarloResult again = engine.monteCarloService.runMonteCarlo(inputs, 50, SEED);

        RetirementProperties parallelProperties = new RetirementProperties();
        parallelProperties.getMonteCarlo().setParallel(true);
        MonteCarloResult parallel = new EngineFixtures(parallelProperties).monteCarloService.runMonteCarlo(inputs, 50, SEED);

        assertEquals(first, again);
        assertEquals(first, parallel);
        for (MonteCarloPercentile band : first.getPercentiles()) {
            assertTrue(band.getP5().compareTo(band.getP25()) <= 0);
            assertTrue(band.getP25().compareTo(band.getP50()) <= 0);
            assertTrue(band.getP50().compareTo(band.getP75()) <= 0);
            assertTrue(band.getP75().compareTo(band.getP95()) <= 0);
        }
        assertTrue(first.getSuccessRate() >= 0.0 && first.getSuccessRate() <= 1.0);
    }

    @Test
    @DisplayName("Rejected inputs give an empty result; a non-positive run count is an error")
    void emptyAndInvalid() {
        SimulationInputs invalid = SimulationInputs.builder().person(retiree(70, 60).build()).build();
        MonteCarloResult result = engine.monteCarloService.runMonteCarlo(invalid, 10, SEED);
        assertTrue(result.isEmpty());
        assertEquals(0, result.getIterations());
        assertEquals(0.0, result.getSuccessRate());

        assertThrows(IllegalArgumentException.class,
                () -> engine.monteCarloService.runMonteCarlo(retirement("1000", 0.1), 0, SEED));
    }

    @Test
    @DisplayName("Percentile index is floor(p x n), clamped to the last element")
    void nearestRank() {
        List<BigDecimal> sorted = List.of(money("1"), money("2"), money("3"), money("4"), money("5"),
                money("6"), money("7"), money("8"), money("9"), money("10"));
        assertEquals(money("1"), MonteCarloService.pick(sorted, 0.05));
        assertEquals(money("3"), MonteCarloService.pick(sorted, 0.25));
        assertEquals(money("6"), MonteCarloService.pick(sorted, 0.50));
        assertEquals(money("10"), MonteCarloService.pick(sorted, 0.95));
        assertEquals(money("7"), MonteCarloService.pick(List.of(money("7")), 0.95));
    }
}
