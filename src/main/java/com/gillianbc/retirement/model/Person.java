package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.math.BigDecimal;

/**
 * One member of the household. Ages are whole years; {@code lifeExpectancy} is the age of the
 * final projected year.
 * <p>
 * Scalar fields are fixed. The three accounts are mutable and are owned exclusively by this
 * person, so a projection always works on a {@link #copy()}.
 */
@Getter
@Builder(toBuilder = true)
public class Person {

    private final int age;
    private final int retirementAge;
    private final int lifeExpectancy;
    @NonNull @Builder.Default private final BigDecimal currentIncome = BigDecimal.ZERO;
    @Builder.Default private final int cppStartAge = 65;
    /** Years of CPP contributions; 40 or more earns the full pension. */
    @Builder.Default private final int cppContributedYears = 40;
    @Builder.Default private final int oasStartAge = 65;
    /** Age at which the voluntary RRSP melt begins; null means at retirement. */
    private final Integer rrspMeltStartAge;
    /** Fixed annual voluntary RRSP withdrawal; zero disables the melt. */
    @NonNull @Builder.Default private final BigDecimal rrspMeltAmount = BigDecimal.ZERO;
    @NonNull @Builder.Default private final Account rrsp = Account.empty();
    @NonNull @Builder.Default private final Account tfsa = Account.empty();
    @NonNull @Builder.Default private final NonRegisteredAccount nonRegistered = NonRegisteredAccount.empty();

    /** Deep copy: the copy's accounts are independent of this person's. */
    public Person copy() {
        return toBuilder()
                .rrsp(rrsp.copy())
                .tfsa(tfsa.copy())
                .nonRegistered(nonRegistered.copy())
                .build();
    }

    public int meltStartAge() {
        return rrspMeltStartAge != null ? rrspMeltStartAge : retirementAge;
    }

    public boolean hasMelt() {
        return rrspMeltAmount.signum() > 0;
    }

    public BigDecimal totalAssets() {
        return rrsp.getBalance().add(tfsa.getBalance()).add(nonRegistered.getBalance());
    }
}
