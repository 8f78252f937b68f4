package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.RetirementProperties;
import com.gillianbc.retirement.model.AccountSnapshot;
import com.gillianbc.retirement.model.AssetMix;
import com.gillianbc.retirement.model.DeferredSplitPolicy;
import com.gillianbc.retirement.model.EventType;
import com.gillianbc.retirement.model.NonRegisteredAccount;
import com.gillianbc.retirement.model.OneTimeEvent;
import com.gillianbc.retirement.model.Person;
import com.gillianbc.retirement.model.ReturnAssumptions;
import com.gillianbc.retirement.model.SimulationInputs;
import com.gillianbc.retirement.model.SimulationResult;
import com.gillianbc.retirement.model.SplitDirection;
import com.gillianbc.retirement.model.WithdrawalStrategy;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.gillianbc.retirement.service.EngineFixtures.account;
import static com.gillianbc.retirement.service.EngineFixtures.money;
import static com.gillianbc.retirement.service.EngineFixtures.retiree;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class ProjectionServiceTest {

    private final EngineFixtures engine = new EngineFixtures();
    private final ProjectionService service = engine.projectionService;

    @Test
    @DisplayName("Single retiree, 65 to 66, RRSP only and nothing to spend: two years, balances untouched, RRSP taxed at death")
    void singleRetireeTwoYears() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(65, 66).rrsp(account("100000")).build())
                .startYear(2030)
                .build();

        List<SimulationResult> results = service.runSimulation(inputs);
        logResults("single retiree", results);

        assertEquals(2, results.size());
        SimulationResult first = results.get(0);
        assertEquals(2030, first.getYear());
        assertEquals(65, first.getAge());
        assertNull(first.getSpouseAge());
        assertEquals(money("100000.00"), first.getTotalAssets());
        assertEquals(money("100000.00"), first.getPersonAccounts().getRrsp());
        assertEquals(money("0.00"), first.getTotalRrspWithdrawal());
        assertEquals(money("0.00"), first.getTaxPaid());
        assertEquals("ON", first.getJurisdiction());
        assertFalse(first.isJurisdictionFallback());
        assertFalse(first.isDeathYear());

        SimulationResult last = results.get(1);
        assertEquals(2031, last.getYear());
        assertEquals(66, last.getAge());
        assertEquals(money("100000.00"), last.getTotalAssets());
        assertTrue(last.isPersonDeathThisYear());
        assertTrue(last.isDeathYear());
        // Ontario tax on 100,000 at 66, after the partly reduced age credit
        assertEquals(money("22297.44"), last.getTerminalTaxOnRrsp());
        assertEquals(money("0.00"), last.getTerminalTaxOnCapitalGains());
        assertEquals(money("22297.44"), last.getTotalTerminalTax());
        assertEquals(money("100000.00"), last.getGrossEstateValue());
        assertEquals(money("77702.56"), last.getNetEstateValue());
    }

    @Test
    @DisplayName("Impossible age configuration yields no projection")
    void invalidInputsGiveEmptyResults() {
        SimulationInputs diedAlready = SimulationInputs.builder()
                .person(retiree(65, 60).build())
                .build();
        SimulationInputs retiresAfterDeath = SimulationInputs.builder()
                .person(retiree(50, 80).retirementAge(85).build())
                .build();
        SimulationInputs noPerson = SimulationInputs.builder().build();
        SimulationInputs badSpouse = SimulationInputs.builder()
                .person(retiree(65, 90).build())
                .spouse(retiree(70, 65).build())
                .build();

        assertTrue(service.runSimulation(diedAlready).isEmpty());
        assertTrue(service.runSimulation(retiresAfterDeath).isEmpty());
        assertTrue(service.runSimulation(noPerson).isEmpty());
        assertTrue(service.runSimulation(badSpouse).isEmpty());
    }

    @Test
    @DisplayName("Deterministic runs are repeatable and leave the caller's accounts alone")
    void deterministicAndSideEffectFree() {
        Person person = Person.builder()
                .age(55)
                .retirementAge(62)
                .lifeExpectancy(90)
                .currentIncome(money("90000"))
                .rrsp(account("300000"))
                .tfsa(account("60000"))
                .nonRegistered(NonRegisteredAccount.of("80000", "50000", AssetMix.of("0.2", "0.3", "0.5")))
                .build();
        SimulationInputs inputs = SimulationInputs.builder()
                .person(person)
                .jurisdiction("BC")
                .inflationRate(money("0.025"))
                .preRetirementSpend(money("60000"))
                .postRetirementSpend(money("55000"))
                .returnRates(ReturnAssumptions.builder()
                        .interest(money("0.03"))
                        .dividend(money("0.03"))
                        .capitalGrowth(money("0.05"))
                        .build())
                .startYear(2025)
                .build();

        List<SimulationResult> first = service.runSimulation(inputs);
        List<SimulationResult> second = service.runSimulation(inputs);

        assertEquals(36, first.size());
        assertEquals(first, second);
        assertEquals(0, money("300000").compareTo(person.getRrsp().getBalance()));
        assertEquals(0, money("80000").compareTo(person.getNonRegistered().getBalance()));
    }

    @Test
    @DisplayName("Spending beyond every pool: balances never go negative and the shortfall is reported")
    void noNegativeBalances() {
        Person person = retiree(65, 72)
                .rrsp(account("50000"))
                .tfsa(account("10000"))
                .nonRegistered(NonRegisteredAccount.of("10000", "5000", AssetMix.ALL_GROWTH))
                .build();
        SimulationInputs inputs = SimulationInputs.builder()
                .person(person)
                .postRetirementSpend(money("60000"))
                .build();

        List<SimulationResult> results = service.runSimulation(inputs);
        logResults("overspending", results);

        assertEquals(8, results.size());
        for (SimulationResult r : results) {
            AccountSnapshot a = r.getPersonAccounts();
            assertTrue(a.getRrsp().signum() >= 0);
            assertTrue(a.getTfsa().signum() >= 0);
            assertTrue(a.getNonRegistered().signum() >= 0);
            assertTrue(a.getNonRegisteredAcb().signum() >= 0);
            assertTrue(r.getUnmetSpending().signum() >= 0);
        }
        SimulationResult first = results.get(0);
        // open account first, then TFSA, then RRSP
        assertEquals(money("10000.00"), first.getTotalNonRegWithdrawal());
        assertEquals(money("10000.00"), first.getTotalTfsaWithdrawal());
        assertEquals(money("5000.00"), first.getTotalRealizedCapitalGains());
        assertTrue(first.getTotalRrspWithdrawal().signum() > 0);

        SimulationResult last = results.get(results.size() - 1);
        assertEquals(money("0.00"), last.getTotalAssets());
        assertEquals(money("60000.00"), last.getUnmetSpending());
    }

    @Test
    @DisplayName("A deficit covered from the RRSP is grossed up for tax")
    void rrspGrossUp() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(65, 66).rrsp(account("500000")).build())
                .jurisdiction("AB")
                .postRetirementSpend(money("40000"))
                .build();

        SimulationResult year = service.runSimulation(inputs).get(0);

        assertEquals(money("0.00"), year.getUnmetSpending());
        assertTrue(year.getTotalRrspWithdrawal().compareTo(money("40000")) > 0);
        assertTrue(year.getTaxPaid().signum() > 0);
        assertTrue(year.getNetRrspWithdrawal().compareTo(money("39999")) >= 0, "net " + year.getNetRrspWithdrawal());
        BigDecimal left = money("500000").subtract(year.getTotalRrspWithdrawal());
        assertTrue(left.subtract(year.getPersonAccounts().getRrsp()).abs().compareTo(money("0.01")) <= 0);
    }

    @Test
    @DisplayName("Strategy order: RRSP first drains the RRSP before the TFSA")
    void withdrawalStrategies() {
        SimulationInputs taxEfficient = SimulationInputs.builder()
                .person(retiree(65, 66).rrsp(account("100000")).tfsa(account("100000")).build())
                .postRetirementSpend(money("30000"))
                .build();
        SimulationInputs rrspFirst = taxEfficient.toBuilder()
                .withdrawalStrategy(WithdrawalStrategy.RRSP_FIRST)
                .build();

        SimulationResult efficient = service.runSimulation(taxEfficient).get(0);
        SimulationResult deferredFirst = service.runSimulation(rrspFirst).get(0);

        assertEquals(money("30000.00"), efficient.getTotalTfsaWithdrawal());
        assertEquals(money("0.00"), efficient.getTotalRrspWithdrawal());
        assertEquals(money("0.00"), deferredFirst.getTotalTfsaWithdrawal());
        assertTrue(deferredFirst.getTotalRrspWithdrawal().compareTo(money("30000")) > 0);
    }

    @Test
    @DisplayName("Even deferred split: a short spouse's remainder falls to the other")
    void evenSplitWithSecondPass() {
        RetirementProperties properties = new RetirementProperties();
        properties.getProjection().setDeferredSplit(DeferredSplitPolicy.EVEN);
        ProjectionService even = new EngineFixtures(properties).projectionService;

        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(65, 66).rrsp(account("10000")).build())
                .spouse(retiree(65, 66).rrsp(account("500000")).build())
                .jurisdiction("AB")
                .postRetirementSpend(money("60000"))
                .build();

        SimulationResult year = even.runSimulation(inputs).get(0);

        assertEquals(money("0.00"), year.getPersonAccounts().getRrsp());
        assertEquals(money("0.00"), year.getUnmetSpending());
        assertEquals(money("10000.00"), year.getPersonNetRrsp());
        assertTrue(year.getSpouseNetRrsp().compareTo(money("49000")) > 0);
    }

    @Test
    @DisplayName("By default the deferred split follows RRSP balances")
    void balanceWeightedSplit() {
        assertEquals(DeferredSplitPolicy.BALANCE_WEIGHTED, engine.properties.getProjection().getDeferredSplit());

        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(65, 66).rrsp(account("10000")).build())
                .spouse(retiree(65, 66).rrsp(account("500000")).build())
                .jurisdiction("AB")
                .postRetirementSpend(money("60000"))
                .build();

        SimulationResult year = service.runSimulation(inputs).get(0);
        assertTrue(year.getPersonAccounts().getRrsp().signum() > 0);
        assertEquals(money("0.00"), year.getUnmetSpending());
        // 60,000 x 10,000 / 510,000, under the basic personal amount so untaxed
        assertTrue(year.getPersonNetRrsp().subtract(money("1176.47")).abs().compareTo(money("3")) < 0,
                "person net " + year.getPersonNetRrsp());
    }

    @Test
    @DisplayName("RRSP withdrawals at 65 and over are grossed up with the pension credit, so net income matches spending")
    void rrspDrawWithPensionCreditMeetsSpending() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(66, 67).rrsp(account("500000")).build())
                .jurisdiction("AB")
                .postRetirementSpend(money("40000"))
                .build();

        SimulationResult year = service.runSimulation(inputs).get(0);
        log.info("gross {} tax {} net {}", year.getTotalRrspWithdrawal(), year.getTaxPaid(), year.getNetIncome());

        assertEquals(money("0.00"), year.getUnmetSpending());
        assertEquals(money("0.00"), year.getHouseholdSurplus());
        assertTrue(year.getNetIncome().subtract(year.getSpending()).abs().compareTo(BigDecimal.ONE) <= 0,
                "net income " + year.getNetIncome());
    }

    @Test
    @DisplayName("RRSP first with dividend income: the gross-up carries the dividend credit and net income matches spending")
    void rrspFirstWithDividendsMeetsSpending() {
        Person person = retiree(66, 67)
                .rrsp(account("1000000"))
                .nonRegistered(NonRegisteredAccount.of("1000000", "1000000", AssetMix.of("0", "1", "0")))
                .build();
        SimulationInputs inputs = SimulationInputs.builder()
                .person(person)
                .jurisdiction("AB")
                .withdrawalStrategy(WithdrawalStrategy.RRSP_FIRST)
                .postRetirementSpend(money("80000"))
                .returnRates(ReturnAssumptions.builder().dividend(money("0.04")).build())
                .build();

        SimulationResult year = service.runSimulation(inputs).get(0);
        log.info("gross {} tax {} net {}", year.getTotalRrspWithdrawal(), year.getTaxPaid(), year.getNetIncome());

        assertEquals(money("40000.00"), year.getInvestmentIncome());
        assertEquals(money("0.00"), year.getTotalNonRegWithdrawal());
        assertEquals(money("0.00"), year.getUnmetSpending());
        assertTrue(year.getNetIncome().subtract(year.getSpending()).abs().compareTo(BigDecimal.ONE) <= 0,
                "net income " + year.getNetIncome());
    }

    @Test
    @DisplayName("Salary stays at its stated amount while spending inflates")
    void employmentIncomeIsNotIndexed() {
        Person worker = Person.builder()
                .age(40)
                .retirementAge(65)
                .lifeExpectancy(90)
                .currentIncome(money("100000"))
                .build();
        SimulationInputs inputs = SimulationInputs.builder()
                .person(worker)
                .jurisdiction("AB")
                .inflationRate(money("0.03"))
                .preRetirementSpend(money("40000"))
                .build();

        List<SimulationResult> results = service.runSimulation(inputs);

        assertEquals(money("100000.00"), results.get(0).getEmploymentIncome());
        assertEquals(money("100000.00"), results.get(10).getEmploymentIncome());
        assertTrue(results.get(10).getSpending().compareTo(money("40000")) > 0);
    }

    @Test
    @DisplayName("One-time expenses add to spending and inflows add cash, both inflated from today's money")
    void oneTimeEvents() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(60, 62).tfsa(account("100000")).build())
                .inflationRate(money("0.10"))
                .oneTimeEvent(OneTimeEvent.builder().name("inheritance").amount(money("5000")).age(60).type(EventType.INFLOW).build())
                .oneTimeEvent(OneTimeEvent.builder().name("roof").amount(money("20000")).age(61).build())
                .build();

        List<SimulationResult> results = service.runSimulation(inputs);
        logResults("one-time events", results);

        SimulationResult inflowYear = results.get(0);
        assertEquals(money("5000.00"), inflowYear.getOneTimeInflows());
        assertEquals(money("5000.00"), inflowYear.getHouseholdSurplus());
        assertEquals(money("5000.00"), inflowYear.getReinvestedTfsa());
        assertEquals(money("105000.00"), inflowYear.getPersonAccounts().getTfsa());

        SimulationResult expenseYear = results.get(1);
        assertEquals(money("22000.00"), expenseYear.getSpending());
        assertEquals(money("22000.00"), expenseYear.getTotalTfsaWithdrawal());
        assertEquals(money("83000.00"), expenseYear.getPersonAccounts().getTfsa());
        assertEquals(money("0.00"), expenseYear.getTaxPaid());

        assertEquals(money("0.00"), results.get(2).getSpending());
    }

    @Test
    @DisplayName("The voluntary RRSP melt runs from its start age, and not once retired under RRSP first")
    void rrspMelt() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(60, 62).rrsp(account("100000")).rrspMeltAmount(money("10000")).build())
                .build();

        SimulationResult melting = service.runSimulation(inputs).get(0);
        assertEquals(money("10000.00"), melting.getTotalRrspWithdrawal());
        assertEquals(money("0.00"), melting.getTaxPaid());
        assertEquals(money("7000.00"), melting.getReinvestedTfsa());
        assertEquals(money("3000.00"), melting.getReinvestedNonReg());

        SimulationResult rrspFirst = service.runSimulation(inputs.toBuilder()
                .withdrawalStrategy(WithdrawalStrategy.RRSP_FIRST)
                .build()).get(0);
        assertEquals(money("0.00"), rrspFirst.getTotalRrspWithdrawal());
    }

    @Test
    @DisplayName("RRIF minimums start after 71")
    void rrifMinimums() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(71, 73).rrsp(account("100000")).build())
                .build();

        List<SimulationResult> results = service.runSimulation(inputs);
        assertEquals(money("0.00"), results.get(0).getTotalRrspWithdrawal());
        // 5.40% at 72
        assertEquals(money("5400.00"), results.get(1).getTotalRrspWithdrawal());
    }

    @Test
    @DisplayName("Salary surplus fills TFSA room, then RRSP room, then the open account")
    void surplusWaterfall() {
        Person worker = Person.builder()
                .age(40)
                .retirementAge(65)
                .lifeExpectancy(90)
                .currentIncome(money("100000"))
                .build();
        SimulationInputs inputs = SimulationInputs.builder()
                .person(worker)
                .jurisdiction("AB")
                .preRetirementSpend(money("40000"))
                .build();

        SimulationResult year = service.runSimulation(inputs).get(0);
        assertEquals(money("7000.00"), year.getReinvestedTfsa());
        assertEquals(money("18000.00"), year.getReinvestedRrsp());
        assertTrue(year.getReinvestedNonReg().signum() > 0);
        assertEquals(year.getHouseholdSurplus(),
                year.getReinvestedTfsa().add(year.getReinvestedRrsp()).add(year.getReinvestedNonReg()));
    }

    @Test
    @DisplayName("First death rolls accounts to the survivor; the last death triggers terminal tax")
    void rolloverThenTerminalTax() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(70, 70).rrsp(account("50000")).build())
                .spouse(retiree(68, 75).tfsa(account("20000")).build())
                .build();

        List<SimulationResult> results = service.runSimulation(inputs);
        logResults("rollover", results);

        assertEquals(8, results.size());
        SimulationResult firstDeath = results.get(0);
        assertTrue(firstDeath.isPersonDeathThisYear());
        assertFalse(firstDeath.isSpouseDeathThisYear());
        assertEquals(money("50000.00"), firstDeath.getRrspRolledToSpouse());
        assertEquals(money("50000.00"), firstDeath.getPersonAccounts().getRrsp());
        assertEquals(money("0.00"), firstDeath.getTotalTerminalTax());
        assertEquals(money("0.00"), firstDeath.getGrossEstateValue());

        SimulationResult widowed = results.get(1);
        assertFalse(widowed.isPersonAlive());
        assertTrue(widowed.isSpouseAlive());
        assertEquals(69, widowed.getSpouseAge());
        assertEquals(money("50000.00"), widowed.getSpouseAccounts().getRrsp());
        assertEquals(money("70000.00"), widowed.getTotalAssets());

        SimulationResult last = results.get(7);
        assertTrue(last.isSpouseDeathThisYear());
        assertTrue(last.getTotalTerminalTax().signum() > 0);
        assertEquals(last.getTotalAssets(), last.getGrossEstateValue());
        BigDecimal expectedNet = last.getGrossEstateValue().subtract(last.getTotalTerminalTax());
        assertTrue(expectedNet.subtract(last.getNetEstateValue()).abs().compareTo(money("0.01")) <= 0);
    }

    @Test
    @DisplayName("Pension splitting moves RRSP income to the lower-income spouse and lowers the household's tax")
    void incomeSplitting() {
        SimulationInputs withoutSplit = SimulationInputs.builder()
                .person(retiree(70, 71).rrsp(account("1000000")).rrspMeltAmount(money("80000")).build())
                .spouse(retiree(70, 71).build())
                .jurisdiction("AB")
                .build();
        SimulationInputs withSplit = withoutSplit.toBuilder().useIncomeSplitting(true).build();

        SimulationResult plain = service.runSimulation(withoutSplit).get(0);
        SimulationResult split = service.runSimulation(withSplit).get(0);
        log.info("tax without split {} with split {} saving {}", plain.getTaxPaid(), split.getTaxPaid(), split.getTaxSavingsFromSplit());

        assertEquals(SplitDirection.NONE, plain.getPensionSplitDirection());
        assertEquals(SplitDirection.FIRST_TO_SECOND, split.getPensionSplitDirection());
        assertTrue(split.getPensionSplitAmount().signum() > 0);
        assertTrue(split.getTaxSavingsFromSplit().signum() > 0);
        assertTrue(split.getTaxPaid().compareTo(plain.getTaxPaid()) < 0);
    }

    @Test
    @DisplayName("Unknown jurisdiction is projected with the default and flagged")
    void fallbackJurisdictionIsFlagged() {
        SimulationInputs inputs = SimulationInputs.builder()
                .person(retiree(65, 66).build())
                .jurisdiction("XX")
                .build();

        SimulationResult year = service.runSimulation(inputs).get(0);
        assertEquals("ON", year.getJurisdiction());
        assertTrue(year.isJurisdictionFallback());
    }

    private static void logResults(String title, List<SimulationResult> results) {
        log.info("=== {} ===", title);
        for (SimulationResult r : results) {
            log.info("{} age {} assets {} tax {} unmet {}", r.getYear(), r.getAge(), r.getTotalAssets(), r.getTaxPaid(), r.getUnmetSpending());
        }
    }
}
