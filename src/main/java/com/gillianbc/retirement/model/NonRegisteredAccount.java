package com.gillianbc.retirement.model;

import com.gillianbc.retirement.numeric.Money;
import lombok.Getter;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Open (taxable) account. Tracks the adjusted cost base so that each sale can be split into
 * return of principal and realized capital gain.
 */
@Getter
public class NonRegisteredAccount extends Account {

    private BigDecimal adjustedCostBase;
    private final AssetMix assetMix;

    public NonRegisteredAccount(BigDecimal balance, BigDecimal adjustedCostBase, AssetMix assetMix) {
        super(balance);
        this.adjustedCostBase = Objects.requireNonNull(adjustedCostBase, "adjustedCostBase must not be null");
        this.assetMix = Objects.requireNonNull(assetMix, "assetMix must not be null");
        if (adjustedCostBase.signum() < 0) {
            throw new IllegalArgumentException("adjustedCostBase must be >= 0");
        }
    }

    public static NonRegisteredAccount of(String balance, String adjustedCostBase, AssetMix assetMix) {
        return new NonRegisteredAccount(new BigDecimal(balance), new BigDecimal(adjustedCostBase), assetMix);
    }

    public static NonRegisteredAccount empty() {
        return new NonRegisteredAccount(BigDecimal.ZERO, BigDecimal.ZERO, AssetMix.ALL_GROWTH);
    }

    /**
     * Sells up to {@code amount}. The realized gain is the sold share of the unrealized gain,
     * and the cost base shrinks in the same proportion as the balance.
     */
    public Sale sell(BigDecimal amount) {
        requireNonNegative(amount);
        BigDecimal before = balance;
        BigDecimal taken = amount.min(before);
        if (taken.signum() == 0) {
            return new Sale(BigDecimal.ZERO, BigDecimal.ZERO);
        }
        BigDecimal gainRatio = Money.floorAtZero(BigDecimal.ONE.subtract(Money.ratio(adjustedCostBase, before)));
        BigDecimal realizedGain = taken.multiply(gainRatio, Money.MATH_CONTEXT);
        BigDecimal soldShare = Money.ratio(taken, before);
        adjustedCostBase = adjustedCostBase.multiply(BigDecimal.ONE.subtract(soldShare), Money.MATH_CONTEXT);
        balance = before.subtract(taken);
        return new Sale(taken, realizedGain);
    }

    @Override
    public BigDecimal withdraw(BigDecimal amount) {
        return sell(amount).getProceeds();
    }

    /** New money is principal, so the cost base rises with the balance. */
    @Override
    public void deposit(BigDecimal amount) {
        super.deposit(amount);
        adjustedCostBase = adjustedCostBase.add(amount);
    }

    /** Only the capital-growth share of the mix compounds; yield is paid out as cash. */
    @Override
    public void grow(BigDecimal rate) {
        super.grow(rate.multiply(assetMix.getCapitalGain(), Money.MATH_CONTEXT));
    }

    /** Interest paid this year on the interest-weighted share of the balance. */
    public BigDecimal interestYield(BigDecimal interestRate) {
        return balance.multiply(assetMix.getInterest(), Money.MATH_CONTEXT).multiply(interestRate, Money.MATH_CONTEXT);
    }

    /** Cash dividends paid this year on the dividend-weighted share of the balance. */
    public BigDecimal dividendYield(BigDecimal dividendRate) {
        return balance.multiply(assetMix.getDividend(), Money.MATH_CONTEXT).multiply(dividendRate, Money.MATH_CONTEXT);
    }

    public BigDecimal unrealizedGain() {
        return Money.floorAtZero(balance.subtract(adjustedCostBase));
    }

    /** Takes over another open account's balance and cost base, emptying it. */
    public void absorb(NonRegisteredAccount other) {
        BigDecimal otherAcb = other.adjustedCostBase;
        balance = balance.add(other.drain());
        adjustedCostBase = adjustedCostBase.add(otherAcb);
        other.adjustedCostBase = BigDecimal.ZERO;
    }

    @Override
    public NonRegisteredAccount copy() {
        return new NonRegisteredAccount(balance, adjustedCostBase, assetMix);
    }

    /** Proceeds of one sale and the capital gain it realized. */
    @Value
    public static class Sale {
        BigDecimal proceeds;
        BigDecimal realizedGain;
    }
}
