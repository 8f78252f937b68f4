package com.gillianbc.retirement.model;

import com.gillianbc.retirement.numeric.Money;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A registered account balance owned by exactly one person. Balances never go negative:
 * withdrawals are capped at the balance and growth floors at zero.
 */
@Getter
public class Account {

    protected BigDecimal balance;

    public Account(BigDecimal balance) {
        Objects.requireNonNull(balance, "balance must not be null");
        if (balance.signum() < 0) {
            throw new IllegalArgumentException("balance must be >= 0");
        }
        this.balance = balance;
    }

    public static Account of(String balance) {
        return new Account(new BigDecimal(balance));
    }

    public static Account empty() {
        return new Account(BigDecimal.ZERO);
    }

    /**
     * Takes up to {@code amount} out of the account.
     *
     * @return the amount actually withdrawn
     */
    public BigDecimal withdraw(BigDecimal amount) {
        requireNonNegative(amount);
        BigDecimal taken = amount.min(balance);
        balance = balance.subtract(taken);
        return taken;
    }

    public void deposit(BigDecimal amount) {
        requireNonNegative(amount);
        balance = balance.add(amount);
    }

    /** Applies one year of growth at {@code rate}; a loss of more than 100% leaves the account empty. */
    public void grow(BigDecimal rate) {
        balance = Money.floorAtZero(balance.multiply(BigDecimal.ONE.add(rate), Money.MATH_CONTEXT));
    }

    /** Moves the whole balance out, leaving this account empty. */
    public BigDecimal drain() {
        BigDecimal all = balance;
        balance = BigDecimal.ZERO;
        return all;
    }

    public Account copy() {
        return new Account(balance);
    }

    protected static void requireNonNegative(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be >= 0");
        }
    }
}
