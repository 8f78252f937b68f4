package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One projected year for the household. Monetary values are nominal and rounded to cents.
 * Net figures per source allocate each person's total tax pro rata over their taxable income;
 * TFSA and open-account withdrawals are reported as cash received.
 */
@Value
@Builder
public class SimulationResult {

    int year;
    int age;
    /** Null when there is no spouse. */
    Integer spouseAge;
    boolean personAlive;
    boolean spouseAlive;

    String jurisdiction;
    boolean jurisdictionFallback;
    BigDecimal inflationFactor;
    /** Capital growth rate applied at the end of this year. */
    BigDecimal capitalGrowthRate;

    BigDecimal totalAssets;
    AccountSnapshot personAccounts;
    /** Null when there is no spouse. */
    AccountSnapshot spouseAccounts;

    /** Household taxable income. */
    BigDecimal grossIncome;
    BigDecimal employmentIncome;
    BigDecimal cppIncome;
    BigDecimal oasIncome;
    /** Interest plus cash dividends. */
    BigDecimal investmentIncome;
    BigDecimal totalRrspWithdrawal;
    BigDecimal totalTfsaWithdrawal;
    BigDecimal totalNonRegWithdrawal;
    BigDecimal totalRealizedCapitalGains;
    BigDecimal oneTimeInflows;

    BigDecimal spending;
    BigDecimal taxPaid;
    BigDecimal oasClawback;
    BigDecimal netIncome;
    BigDecimal householdSurplus;
    /** Spending that could not be funded after every account was exhausted. */
    BigDecimal unmetSpending;

    BigDecimal netEmploymentIncome;
    BigDecimal netCppIncome;
    BigDecimal netOasIncome;
    BigDecimal netInvestmentIncome;
    BigDecimal netRrspWithdrawal;
    BigDecimal netTfsaWithdrawal;
    BigDecimal netNonRegWithdrawal;

    BigDecimal personNetRrsp;
    BigDecimal spouseNetRrsp;
    BigDecimal personNetTfsa;
    BigDecimal spouseNetTfsa;
    BigDecimal personNetNonReg;
    BigDecimal spouseNetNonReg;

    BigDecimal reinvestedTfsa;
    BigDecimal reinvestedRrsp;
    BigDecimal reinvestedNonReg;

    BigDecimal pensionSplitAmount;
    SplitDirection pensionSplitDirection;
    BigDecimal taxSavingsFromSplit;

    boolean personDeathThisYear;
    boolean spouseDeathThisYear;
    BigDecimal rrspRolledToSpouse;
    BigDecimal terminalTaxOnRrsp;
    BigDecimal terminalTaxOnCapitalGains;
    BigDecimal totalTerminalTax;
    BigDecimal grossEstateValue;
    BigDecimal netEstateValue;

    public boolean isDeathYear() {
        return personDeathThisYear || spouseDeathThisYear;
    }
}
