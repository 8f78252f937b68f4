package com.gillianbc.retirement.model;

import com.gillianbc.retirement.numeric.Money;
import lombok.Value;

import java.math.BigDecimal;

/** End-of-year balances for one person, rounded to cents. */
@Value
public class AccountSnapshot {

    BigDecimal rrsp;
    BigDecimal tfsa;
    BigDecimal nonRegistered;
    BigDecimal nonRegisteredAcb;

    public static AccountSnapshot of(Person person) {
        return new AccountSnapshot(
                Money.round(person.getRrsp().getBalance()),
                Money.round(person.getTfsa().getBalance()),
                Money.round(person.getNonRegistered().getBalance()),
                Money.round(person.getNonRegistered().getAdjustedCostBase()));
    }
}
