package com.gillianbc.retirement.service;

import com.gillianbc.retirement.model.SplitDirection;
import com.gillianbc.retirement.numeric.Money;
import com.gillianbc.retirement.numeric.TernarySearch;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Pension income splitting between two spouses for a single year.
 * <p>
 * Up to half of a transferor's eligible pension income can be reported by the other spouse.
 * The transfer amount is found by ternary search on the couple's combined tax, which in
 * practice is unimodal in the transfer amount once OAS recovery tax is included.
 */
@Slf4j
@Service
public class IncomeSplitOptimizer {

    static final int ELIGIBLE_AGE = 65;
    static final BigDecimal MAX_TRANSFER_SHARE = new BigDecimal("0.5");
    static final int SEARCH_ITERATIONS = 15;

    private final IncomeTaxCalculator taxCalculator;

    public IncomeSplitOptimizer(IncomeTaxCalculator taxCalculator) {
        this.taxCalculator = Objects.requireNonNull(taxCalculator, "taxCalculator must not be null");
    }

    /**
     * Searches both transfer directions and keeps the one with the larger saving. Returns a
     * zero split (with the standalone taxes) when neither direction beats the baseline.
     */
    public SplitResult computeOptimalSplit(SplitCandidate first, SplitCandidate second, String jurisdiction, BigDecimal inflationFactor) {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        Objects.requireNonNull(inflationFactor, "inflationFactor must not be null");

        BigDecimal firstBaseline = taxAfterTransfer(first, BigDecimal.ZERO, jurisdiction, inflationFactor);
        BigDecimal secondBaseline = taxAfterTransfer(second, BigDecimal.ZERO, jurisdiction, inflationFactor);
        BigDecimal baseline = firstBaseline.add(secondBaseline);

        TernarySearch.Minimum firstToSecond = search(first, second, jurisdiction, inflationFactor);
        TernarySearch.Minimum secondToFirst = search(second, first, jurisdiction, inflationFactor);

        BigDecimal savingFirstToSecond = firstToSecond == null ? BigDecimal.ZERO : baseline.subtract(firstToSecond.getValue());
        BigDecimal savingSecondToFirst = secondToFirst == null ? BigDecimal.ZERO : baseline.subtract(secondToFirst.getValue());

        if (savingFirstToSecond.signum() <= 0 && savingSecondToFirst.signum() <= 0) {
            return SplitResult.none(firstBaseline, secondBaseline);
        }

        SplitResult result;
        if (savingFirstToSecond.compareTo(savingSecondToFirst) >= 0) {
            BigDecimal x = firstToSecond.getX();
            result = new SplitResult(x, SplitDirection.FIRST_TO_SECOND, savingFirstToSecond,
                    taxAfterTransfer(first, x.negate(), jurisdiction, inflationFactor),
                    taxAfterTransfer(second, x, jurisdiction, inflationFactor));
        } else {
            BigDecimal x = secondToFirst.getX();
            result = new SplitResult(x, SplitDirection.SECOND_TO_FIRST, savingSecondToFirst,
                    taxAfterTransfer(first, x, jurisdiction, inflationFactor),
                    taxAfterTransfer(second, x.negate(), jurisdiction, inflationFactor));
        }
        log.debug("Pension split {} of {} saves {}", result.getDirection(), result.getAmount(), result.getSavings());
        return result;
    }

    /** Returns null when the transferor cannot split. */
    private TernarySearch.Minimum search(SplitCandidate from, SplitCandidate to, String jurisdiction, BigDecimal inflationFactor) {
        if (from.getAge() < ELIGIBLE_AGE || from.getEligiblePensionIncome().signum() <= 0) {
            return null;
        }
        BigDecimal maxTransfer = from.getEligiblePensionIncome().multiply(MAX_TRANSFER_SHARE, Money.MATH_CONTEXT);
        UnaryOperator<BigDecimal> combinedTax = x -> taxAfterTransfer(from, x.negate(), jurisdiction, inflationFactor)
                .add(taxAfterTransfer(to, x, jurisdiction, inflationFactor));
        return TernarySearch.minimize(combinedTax, BigDecimal.ZERO, maxTransfer, SEARCH_ITERATIONS);
    }

    private BigDecimal taxAfterTransfer(SplitCandidate candidate, BigDecimal delta, String jurisdiction, BigDecimal inflationFactor) {
        return taxCalculator.computeTotalTax(
                candidate.getTaxableIncome().add(delta),
                jurisdiction,
                inflationFactor,
                candidate.getAge(),
                Money.floorAtZero(candidate.getEligiblePensionIncome().add(delta)),
                candidate.getGrossedUpDividends(),
                candidate.getOasIncome());
    }

    /** One spouse's position before any split. */
    @Value
    @Builder
    public static class SplitCandidate {
        int age;
        @NonNull BigDecimal taxableIncome;
        @NonNull @Builder.Default BigDecimal eligiblePensionIncome = BigDecimal.ZERO;
        @NonNull @Builder.Default BigDecimal oasIncome = BigDecimal.ZERO;
        @NonNull @Builder.Default BigDecimal grossedUpDividends = BigDecimal.ZERO;
    }

    /** Chosen transfer and each spouse's tax (including OAS recovery) after it. */
    @Value
    public static class SplitResult {
        BigDecimal amount;
        SplitDirection direction;
        BigDecimal savings;
        BigDecimal firstNewTax;
        BigDecimal secondNewTax;

        public static SplitResult none(BigDecimal firstTax, BigDecimal secondTax) {
            return new SplitResult(BigDecimal.ZERO, SplitDirection.NONE, BigDecimal.ZERO, firstTax, secondTax);
        }

        public boolean isSplit() {
            return direction != SplitDirection.NONE;
        }
    }
}
