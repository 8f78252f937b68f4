package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Immutable table of the tax and benefit constants for one tax year.
 * <p>
 * Every jurisdiction code used by a caller should resolve to a bracket set and a basic
 * personal amount. Codes that do not resolve fall back to {@link #getDefaultJurisdiction()},
 * and the fallback is reported through {@link #resolveJurisdiction(String)}.
 */
@Value
@Builder(toBuilder = true)
public class TaxRates {

    /** Approximate 2025 constants (2024 values where 2025 was not confirmed). */
    public static final TaxRates CANADA_2025 = TaxRates.builder()
            .version("CA-2025")
            .defaultJurisdiction("ON")
            .federalBrackets(List.of(
                    TaxBracket.of(0, "0.15"),
                    TaxBracket.of(55867, "0.205"),
                    TaxBracket.of(111733, "0.26"),
                    TaxBracket.of(173205, "0.29"),
                    TaxBracket.of(246752, "0.33")))
            .regionalBracket("AB", List.of(
                    TaxBracket.of(0, "0.10"),
                    TaxBracket.of(157978, "0.12"),
                    TaxBracket.of(189574, "0.13"),
                    TaxBracket.of(252765, "0.14"),
                    TaxBracket.of(379148, "0.15")))
            .regionalBracket("BC", List.of(
                    TaxBracket.of(0, "0.0506"),
                    TaxBracket.of(49279, "0.077"),
                    TaxBracket.of(98560, "0.105"),
                    TaxBracket.of(113158, "0.1229"),
                    TaxBracket.of(137407, "0.147"),
                    TaxBracket.of(186306, "0.168"),
                    TaxBracket.of(259829, "0.205")))
            .regionalBracket("MB", List.of(
                    TaxBracket.of(0, "0.108"),
                    TaxBracket.of(47000, "0.1275"),
                    TaxBracket.of(100000, "0.174")))
            .regionalBracket("NB", List.of(
                    TaxBracket.of(0, "0.094"),
                    TaxBracket.of(51306, "0.14"),
                    TaxBracket.of(102614, "0.16"),
                    TaxBracket.of(190060, "0.195")))
            .regionalBracket("NL", List.of(
                    TaxBracket.of(0, "0.087"),
                    TaxBracket.of(44192, "0.145"),
                    TaxBracket.of(88382, "0.158"),
                    TaxBracket.of(157792, "0.178"),
                    TaxBracket.of(220910, "0.198"),
                    TaxBracket.of(282214, "0.208"),
                    TaxBracket.of(564429, "0.213"),
                    TaxBracket.of(1128858, "0.218")))
            .regionalBracket("NS", List.of(
                    TaxBracket.of(0, "0.0879"),
                    TaxBracket.of(30507, "0.1495"),
                    TaxBracket.of(61015, "0.1667"),
                    TaxBracket.of(95883, "0.175"),
                    TaxBracket.of(154650, "0.21")))
            .regionalBracket("NT", List.of(
                    TaxBracket.of(0, "0.059"),
                    TaxBracket.of(51964, "0.086"),
                    TaxBracket.of(103930, "0.122"),
                    TaxBracket.of(168967, "0.1405")))
            .regionalBracket("NU", List.of(
                    TaxBracket.of(0, "0.04"),
                    TaxBracket.of(54707, "0.07"),
                    TaxBracket.of(109413, "0.09"),
                    TaxBracket.of(177881, "0.115")))
            .regionalBracket("ON", List.of(
                    TaxBracket.of(0, "0.0505"),
                    TaxBracket.of(52886, "0.0915"),
                    TaxBracket.of(105775, "0.1116"),
                    TaxBracket.of(150000, "0.1216"),
                    TaxBracket.of(220000, "0.1316")))
            .regionalBracket("PE", List.of(
                    TaxBracket.of(0, "0.095"),
                    TaxBracket.of(33328, "0.1347"),
                    TaxBracket.of(64656, "0.166"),
                    TaxBracket.of(105000, "0.1762"),
                    TaxBracket.of(140000, "0.19")))
            .regionalBracket("QC", List.of(
                    TaxBracket.of(0, "0.14"),
                    TaxBracket.of(53255, "0.19"),
                    TaxBracket.of(106495, "0.24"),
                    TaxBracket.of(129590, "0.2575")))
            .regionalBracket("SK", List.of(
                    TaxBracket.of(0, "0.105"),
                    TaxBracket.of(53463, "0.125"),
                    TaxBracket.of(152750, "0.145")))
            .regionalBracket("YT", List.of(
                    TaxBracket.of(0, "0.064"),
                    TaxBracket.of(57375, "0.09"),
                    TaxBracket.of(114750, "0.109"),
                    TaxBracket.of(177882, "0.128"),
                    TaxBracket.of(500000, "0.15")))
            .federalBasicPersonalAmount(new BigDecimal("15705"))
            .regionalBasicPersonalAmount("AB", new BigDecimal("21885"))
            .regionalBasicPersonalAmount("BC", new BigDecimal("12588"))
            .regionalBasicPersonalAmount("MB", new BigDecimal("15780"))
            .regionalBasicPersonalAmount("NB", new BigDecimal("13044"))
            .regionalBasicPersonalAmount("NL", new BigDecimal("10818"))
            // NS amount varies with income; the base amount is used
            .regionalBasicPersonalAmount("NS", new BigDecimal("11481"))
            .regionalBasicPersonalAmount("NT", new BigDecimal("17373"))
            .regionalBasicPersonalAmount("NU", new BigDecimal("18767"))
            .regionalBasicPersonalAmount("ON", new BigDecimal("12399"))
            .regionalBasicPersonalAmount("PE", new BigDecimal("13500"))
            .regionalBasicPersonalAmount("QC", new BigDecimal("18056"))
            .regionalBasicPersonalAmount("SK", new BigDecimal("18491"))
            .regionalBasicPersonalAmount("YT", new BigDecimal("15705"))
            .regionalDividendCreditRate("AB", new BigDecimal("0.0812"))
            .regionalDividendCreditRate("BC", new BigDecimal("0.12"))
            .regionalDividendCreditRate("MB", new BigDecimal("0.08"))
            .regionalDividendCreditRate("NB", new BigDecimal("0.14"))
            .regionalDividendCreditRate("NL", new BigDecimal("0.063"))
            .regionalDividendCreditRate("NS", new BigDecimal("0.0885"))
            .regionalDividendCreditRate("NT", new BigDecimal("0.115"))
            .regionalDividendCreditRate("NU", new BigDecimal("0.0551"))
            .regionalDividendCreditRate("ON", new BigDecimal("0.10"))
            .regionalDividendCreditRate("PE", new BigDecimal("0.105"))
            .regionalDividendCreditRate("QC", new BigDecimal("0.117"))
            .regionalDividendCreditRate("SK", new BigDecimal("0.11"))
            .regionalDividendCreditRate("YT", new BigDecimal("0.1202"))
            .cpp(PensionPlanConstants.builder()
                    .maxPensionableEarnings(new BigDecimal("68500"))
                    .basicExemption(new BigDecimal("3500"))
                    .maxContribution(new BigDecimal("3867"))
                    .maxAnnualBenefit(new BigDecimal("17196"))
                    .build())
            .oas(OldAgeSecurityConstants.builder()
                    .maxAnnualBenefit(new BigDecimal("8820"))
                    .clawbackThreshold(new BigDecimal("90997"))
                    .build())
            .tfsaAnnualLimit(new BigDecimal("7000"))
            .rrspDollarLimit(new BigDecimal("31000"))
            .build();

    /** Default regional dividend credit rate for jurisdictions missing from the table. */
    public static final BigDecimal DEFAULT_REGIONAL_DIVIDEND_CREDIT_RATE = new BigDecimal("0.10");

    @NonNull String version;
    @NonNull String defaultJurisdiction;
    @NonNull List<TaxBracket> federalBrackets;
    @Singular Map<String, List<TaxBracket>> regionalBrackets;
    @NonNull BigDecimal federalBasicPersonalAmount;
    @Singular Map<String, BigDecimal> regionalBasicPersonalAmounts;
    @Singular Map<String, BigDecimal> regionalDividendCreditRates;
    @NonNull PensionPlanConstants cpp;
    @NonNull OldAgeSecurityConstants oas;
    @NonNull BigDecimal tfsaAnnualLimit;
    @NonNull BigDecimal rrspDollarLimit;

    /**
     * Resolves a jurisdiction code against this table. A code counts as known only when both
     * its brackets and its basic personal amount are present.
     */
    public JurisdictionResolution resolveJurisdiction(String code) {
        if (code != null && regionalBrackets.containsKey(code) && regionalBasicPersonalAmounts.containsKey(code)) {
            return new JurisdictionResolution(code, code, false);
        }
        return new JurisdictionResolution(code, defaultJurisdiction, true);
    }

    /** Brackets for an already-resolved jurisdiction. */
    public List<TaxBracket> regionalBracketsFor(String resolvedJurisdiction) {
        List<TaxBracket> brackets = regionalBrackets.get(resolvedJurisdiction);
        if (brackets == null) {
            throw new IllegalStateException("Default jurisdiction " + resolvedJurisdiction + " has no brackets in table " + version);
        }
        return brackets;
    }

    public BigDecimal regionalBasicPersonalAmountFor(String resolvedJurisdiction) {
        BigDecimal amount = regionalBasicPersonalAmounts.get(resolvedJurisdiction);
        if (amount == null) {
            throw new IllegalStateException("Default jurisdiction " + resolvedJurisdiction + " has no basic personal amount in table " + version);
        }
        return amount;
    }

    public BigDecimal regionalDividendCreditRateFor(String resolvedJurisdiction) {
        return regionalDividendCreditRates.getOrDefault(resolvedJurisdiction, DEFAULT_REGIONAL_DIVIDEND_CREDIT_RATE);
    }
}
