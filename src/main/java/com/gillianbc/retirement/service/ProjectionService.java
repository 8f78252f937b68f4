package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.RetirementProperties;
import com.gillianbc.retirement.model.AccountSnapshot;
import com.gillianbc.retirement.model.DeferredSplitPolicy;
import com.gillianbc.retirement.model.EventType;
import com.gillianbc.retirement.model.JurisdictionResolution;
import com.gillianbc.retirement.model.NonRegisteredAccount;
import com.gillianbc.retirement.model.OneTimeEvent;
import com.gillianbc.retirement.model.Person;
import com.gillianbc.retirement.model.ReturnAssumptions;
import com.gillianbc.retirement.model.SimulationInputs;
import com.gillianbc.retirement.model.SimulationResult;
import com.gillianbc.retirement.model.SplitDirection;
import com.gillianbc.retirement.model.TaxRates;
import com.gillianbc.retirement.model.WithdrawalStrategy;
import com.gillianbc.retirement.numeric.GaussianSampler;
import com.gillianbc.retirement.numeric.Money;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Year;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.BiFunction;

/**
 * Year-by-year household cash-flow projection.
 * <p>
 * Each year, for every living person:
 * <ol>
 *     <li>forced income: salary before retirement, CPP and OAS from their start ages, the RRIF
 *     minimum after age 71, the voluntary RRSP melt, and open-account interest and dividends;</li>
 *     <li>the household's net cash is compared with the year's spending target;</li>
 *     <li>a deficit is drawn from savings in the order set by the {@link WithdrawalStrategy};</li>
 *     <li>a surplus is saved to TFSA room, then RRSP room, then the open account;</li>
 *     <li>tax is recalculated on the final income, optionally with pension splitting;</li>
 *     <li>accounts grow, deaths are settled (spousal rollover or terminal tax), and one
 *     {@link SimulationResult} is emitted.</li>
 * </ol>
 * The caller's {@link Person} records are never modified; each run works on copies.
 */
@Slf4j
@Service
public class ProjectionService {

    /** Last age before RRIF minimums apply; RRSP contributions are allowed below it. */
    static final int RRIF_CONVERSION_AGE = 71;
    static final int PENSION_CREDIT_AGE = 65;
    static final BigDecimal DIVIDEND_GROSS_UP = new BigDecimal("1.38");
    static final BigDecimal CAPITAL_GAINS_INCLUSION = new BigDecimal("0.5");
    static final BigDecimal RRSP_CONTRIBUTION_RATE = new BigDecimal("0.18");
    static final BigDecimal TFSA_ROOM_ROUNDING = new BigDecimal("500");

    private final IncomeTaxCalculator taxCalculator;
    private final GovernmentBenefitCalculator benefitCalculator;
    private final GrossUpSolver grossUpSolver;
    private final IncomeSplitOptimizer splitOptimizer;
    private final ProjectionInputValidator validator;
    private final RetirementProperties properties;

    public ProjectionService(IncomeTaxCalculator taxCalculator,
                             GovernmentBenefitCalculator benefitCalculator,
                             GrossUpSolver grossUpSolver,
                             IncomeSplitOptimizer splitOptimizer,
                             ProjectionInputValidator validator,
                             RetirementProperties properties) {
        this.taxCalculator = Objects.requireNonNull(taxCalculator, "taxCalculator must not be null");
        this.benefitCalculator = Objects.requireNonNull(benefitCalculator, "benefitCalculator must not be null");
        this.grossUpSolver = Objects.requireNonNull(grossUpSolver, "grossUpSolver must not be null");
        this.splitOptimizer = Objects.requireNonNull(splitOptimizer, "splitOptimizer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /** Deterministic projection. */
    public List<SimulationResult> runSimulation(SimulationInputs inputs) {
        return runSimulation(inputs, (GaussianSampler) null);
    }

    /**
     * @param stochastic when true, each year's capital growth is drawn from a normal
     *                   distribution with a fresh, unseeded source
     */
    public List<SimulationResult> runSimulation(SimulationInputs inputs, boolean stochastic) {
        return runSimulation(inputs, stochastic ? new GaussianSampler(new Random()) : null);
    }

    /**
     * Runs the projection. With a sampler, capital growth each year is
     * {@code mean + volatility x Z}; without one it is the mean.
     *
     * @return one record per year, or an empty list when the inputs are rejected
     */
    public List<SimulationResult> runSimulation(SimulationInputs inputs, GaussianSampler sampler) {
        Objects.requireNonNull(inputs, "inputs must not be null");
        List<String> violations = validator.validate(inputs);
        if (!violations.isEmpty()) {
            violations.forEach(v -> log.warn("Rejected projection inputs: {}", v));
            return Collections.emptyList();
        }

        JurisdictionResolution jurisdiction = taxCalculator.resolve(inputs.getJurisdiction());
        Member first = new Member(inputs.getPerson().copy(), true);
        Member second = inputs.hasSpouse() ? new Member(inputs.getSpouse().copy(), false) : null;

        int years = ProjectionInputValidator.projectedYears(inputs);
        int maxYears = properties.getProjection().getMaxYears();
        int startYear = inputs.getStartYear() != null ? inputs.getStartYear() : Year.now().getValue();

        List<SimulationResult> results = new ArrayList<>(years);
        for (int offset = 0; offset < years && offset < maxYears; offset++) {
            first.startYear(offset);
            if (second != null) {
                second.startYear(offset);
            }
            if (!first.alive && (second == null || !second.alive)) {
                break;
            }
            YearContext year = new YearContext(inputs, jurisdiction, startYear + offset,
                    Money.compound(inputs.getInflationRate(), offset),
                    growthRate(inputs.getReturnRates(), sampler));
            results.add(simulateYear(year, first, second));
        }
        log.debug("Projected {} years for jurisdiction {}", results.size(), jurisdiction.getResolved());
        return Collections.unmodifiableList(results);
    }

    private SimulationResult simulateYear(YearContext year, Member first, Member second) {
        List<Member> living = new ArrayList<>(2);
        if (first.alive) {
            living.add(first);
        }
        if (second != null && second.alive) {
            living.add(second);
        }

        // 1. Spending target for the year
        boolean householdRetired = living.stream().allMatch(m -> m.age >= m.person.getRetirementAge());
        BigDecimal baseSpend = householdRetired ? year.inputs.getPostRetirementSpend() : year.inputs.getPreRetirementSpend();
        BigDecimal spend = baseSpend.multiply(year.inflationFactor, Money.MATH_CONTEXT);
        BigDecimal expenses = BigDecimal.ZERO;
        BigDecimal inflows = BigDecimal.ZERO;
        for (OneTimeEvent event : year.inputs.getOneTimeEvents()) {
            if (event.getAge() == first.age) {
                BigDecimal amount = event.getAmount().multiply(year.inflationFactor, Money.MATH_CONTEXT);
                if (event.getType() == EventType.INFLOW) {
                    inflows = inflows.add(amount);
                } else {
                    expenses = expenses.add(amount);
                }
            }
        }
        BigDecimal need = spend.add(expenses);

        // 2. Forced income and the tax on it
        BigDecimal baseNetCash = inflows;
        for (Member m : living) {
            collectForcedIncome(m, year);
            baseNetCash = baseNetCash.add(m.forcedCash()).subtract(totalTax(m, year));
        }
        BigDecimal deficit = Money.floorAtZero(need.subtract(baseNetCash));
        BigDecimal surplus = Money.floorAtZero(baseNetCash.subtract(need));

        // 3. Deficit waterfall
        BigDecimal unmet = BigDecimal.ZERO;
        if (deficit.signum() > 0) {
            unmet = drawDeficit(deficit, living, year);
        }

        // 4. Surplus waterfall
        Reinvestment reinvested = new Reinvestment();
        if (surplus.signum() > 0) {
            reinvest(surplus, living, year, reinvested);
        }

        // 5. Final tax on the year's actual income
        for (Member m : living) {
            m.taxableIncome = m.taxableIncome();
            m.clawback = taxCalculator.computeClawback(m.taxableIncome, m.oas, year.inflationFactor);
            m.tax = totalTax(m, year);
        }
        SplitOutcome split = applyIncomeSplitting(first, second, year);

        // 6. Growth
        for (Member m : living) {
            m.person.getRrsp().grow(year.growthRate);
            m.person.getTfsa().grow(year.growthRate);
            m.person.getNonRegistered().grow(year.growthRate);
        }

        SimulationResult.SimulationResultBuilder record = SimulationResult.builder();
        describeYear(record, year, first, second, living);
        record.spending(Money.round(need))
                .oneTimeInflows(Money.round(inflows))
                .householdSurplus(Money.round(surplus))
                .unmetSpending(Money.round(unmet))
                .reinvestedTfsa(Money.round(reinvested.tfsa))
                .reinvestedRrsp(Money.round(reinvested.rrsp))
                .reinvestedNonReg(Money.round(reinvested.nonRegistered))
                .pensionSplitAmount(Money.round(split.amount))
                .pensionSplitDirection(split.direction)
                .taxSavingsFromSplit(Money.round(split.savings));
        describeIncome(record, living, first, second, inflows, surplus);

        // 7. Deaths: rollover to a survivor, otherwise terminal tax
        settleDeaths(record, living, year);

        return record.build();
    }

    private void collectForcedIncome(Member m, YearContext year) {
        Person p = m.person;
        ReturnAssumptions rates = year.inputs.getReturnRates();
        boolean retired = m.age >= p.getRetirementAge();

        m.employment = retired ? BigDecimal.ZERO : p.getCurrentIncome();
        m.cpp = m.age >= p.getCppStartAge()
                ? benefitCalculator.estimateCpp(p.getCppContributedYears(), p.getCppStartAge(), year.inflationFactor)
                : BigDecimal.ZERO;
        m.oas = benefitCalculator.estimateOas(m.age, p.getOasStartAge(), year.inflationFactor);

        if (m.age > RRIF_CONVERSION_AGE) {
            BigDecimal minimum = p.getRrsp().getBalance().multiply(RrifMinimums.factor(m.age), Money.MATH_CONTEXT);
            m.rrif = p.getRrsp().withdraw(minimum);
        }

        boolean meltAllowed = !(year.inputs.getWithdrawalStrategy() == WithdrawalStrategy.RRSP_FIRST && retired);
        m.meltActive = meltAllowed && p.hasMelt() && m.age >= p.meltStartAge() && m.age <= RRIF_CONVERSION_AGE;
        if (m.meltActive) {
            m.melt = p.getRrsp().withdraw(p.getRrspMeltAmount());
        }

        NonRegisteredAccount open = p.getNonRegistered();
        m.interest = open.interestYield(rates.getInterest());
        m.dividends = open.dividendYield(rates.getDividend());
        m.grossedUpDividends = m.dividends.multiply(DIVIDEND_GROSS_UP, Money.MATH_CONTEXT);
    }

    /**
     * Draws the deficit from savings in strategy order.
     *
     * @return the part of the deficit that could not be funded
     */
    private BigDecimal drawDeficit(BigDecimal deficit, List<Member> living, YearContext year) {
        BigDecimal remaining = deficit;
        if (year.inputs.getWithdrawalStrategy() == WithdrawalStrategy.RRSP_FIRST) {
            remaining = drawRrsp(remaining, living, year);
            remaining = drawOpenAccounts(remaining, living);
            remaining = drawTfsa(remaining, living);
        } else {
            remaining = drawOpenAccounts(remaining, living);
            remaining = drawTfsa(remaining, living);
            remaining = drawRrsp(remaining, living, year);
        }
        return remaining;
    }

    /** Sells open-account holdings pro rata by balance; proceeds count in full toward the deficit. */
    private BigDecimal drawOpenAccounts(BigDecimal remaining, List<Member> living) {
        if (remaining.signum() <= 0) {
            return remaining;
        }
        BigDecimal pool = BigDecimal.ZERO;
        for (Member m : living) {
            pool = pool.add(m.person.getNonRegistered().getBalance());
        }
        if (pool.signum() <= 0) {
            return remaining;
        }
        BigDecimal take = remaining.min(pool);
        BigDecimal taken = BigDecimal.ZERO;
        for (Member m : living) {
            NonRegisteredAccount open = m.person.getNonRegistered();
            BigDecimal share = take.multiply(Money.ratio(open.getBalance(), pool), Money.MATH_CONTEXT);
            NonRegisteredAccount.Sale sale = open.sell(share);
            m.realizedGains = m.realizedGains.add(sale.getRealizedGain());
            m.nonRegWithdrawal = m.nonRegWithdrawal.add(sale.getProceeds());
            taken = taken.add(sale.getProceeds());
        }
        return Money.floorAtZero(remaining.subtract(taken));
    }

    private BigDecimal drawTfsa(BigDecimal remaining, List<Member> living) {
        if (remaining.signum() <= 0) {
            return remaining;
        }
        BigDecimal pool = BigDecimal.ZERO;
        for (Member m : living) {
            pool = pool.add(m.person.getTfsa().getBalance());
        }
        if (pool.signum() <= 0) {
            return remaining;
        }
        BigDecimal take = remaining.min(pool);
        BigDecimal taken = BigDecimal.ZERO;
        for (Member m : living) {
            BigDecimal share = take.multiply(Money.ratio(m.person.getTfsa().getBalance(), pool), Money.MATH_CONTEXT);
            BigDecimal got = m.person.getTfsa().withdraw(share);
            m.tfsaWithdrawal = m.tfsaWithdrawal.add(got);
            taken = taken.add(got);
        }
        return Money.floorAtZero(remaining.subtract(taken));
    }

    /**
     * Grosses up RRSP withdrawals to cover the remaining net requirement. The requirement is
     * shared between spouses per {@link DeferredSplitPolicy}; whatever one spouse's balance
     * cannot cover is offered to the other in a second pass.
     */
    private BigDecimal drawRrsp(BigDecimal remaining, List<Member> living, YearContext year) {
        if (remaining.signum() <= 0) {
            return remaining;
        }
        List<Member> holders = new ArrayList<>(2);
        BigDecimal pool = BigDecimal.ZERO;
        for (Member m : living) {
            if (m.person.getRrsp().getBalance().signum() > 0) {
                holders.add(m);
                pool = pool.add(m.person.getRrsp().getBalance());
            }
        }
        if (holders.isEmpty()) {
            return remaining;
        }

        DeferredSplitPolicy policy = properties.getProjection().getDeferredSplit();
        BigDecimal requirement = remaining;
        BigDecimal left = remaining;
        for (Member m : holders) {
            BigDecimal share = policy == DeferredSplitPolicy.BALANCE_WEIGHTED
                    ? requirement.multiply(Money.ratio(m.person.getRrsp().getBalance(), pool), Money.MATH_CONTEXT)
                    : requirement.divide(BigDecimal.valueOf(holders.size()), Money.MATH_CONTEXT);
            left = left.subtract(withdrawRrspNet(m, share.min(Money.floorAtZero(left)), year));
        }
        for (Member m : holders) {
            if (left.compareTo(GrossUpSolver.TOLERANCE) < 0) {
                break;
            }
            if (m.person.getRrsp().getBalance().signum() > 0) {
                left = left.subtract(withdrawRrspNet(m, left, year));
            }
        }
        // within the solver's tolerance counts as met
        return left.compareTo(GrossUpSolver.TOLERANCE) < 0 ? BigDecimal.ZERO : left;
    }

    /**
     * Withdraws the gross needed for {@code targetNet}, capped at the balance.
     *
     * @return the net cash actually obtained
     */
    private BigDecimal withdrawRrspNet(Member m, BigDecimal targetNet, YearContext year) {
        if (targetNet.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal currentTaxable = m.taxableIncome();
        BigDecimal currentPension = m.eligiblePensionIncome();
        boolean pensionEligible = m.age >= PENSION_CREDIT_AGE;
        GrossUpSolver.GrossUpResult solved = grossUpSolver.solveGrossWithdrawal(
                targetNet, currentTaxable, m.oas, year.region(), year.inflationFactor, m.age,
                currentPension, m.grossedUpDividends, pensionEligible);
        BigDecimal gross = solved.getGross();
        BigDecimal net = solved.getNet();
        BigDecimal balance = m.person.getRrsp().getBalance();
        if (gross.compareTo(balance) > 0) {
            gross = balance;
            net = gross.subtract(grossUpSolver.marginalTax(gross, currentTaxable, m.oas, year.region(),
                    year.inflationFactor, m.age, currentPension, m.grossedUpDividends, pensionEligible));
        }
        m.extraRrsp = m.extraRrsp.add(m.person.getRrsp().withdraw(gross));
        return net;
    }

    private void reinvest(BigDecimal surplus, List<Member> living, YearContext year, Reinvestment reinvested) {
        TaxRates rates = taxCalculator.getTaxRates();
        BigDecimal remaining = surplus;

        BigDecimal tfsaRoom = rates.getTfsaAnnualLimit().multiply(year.inflationFactor, Money.MATH_CONTEXT)
                .divide(TFSA_ROOM_ROUNDING, 0, RoundingMode.HALF_UP)
                .multiply(TFSA_ROOM_ROUNDING);
        for (Member m : living) {
            BigDecimal put = remaining.min(tfsaRoom);
            if (put.signum() > 0) {
                m.person.getTfsa().deposit(put);
                reinvested.tfsa = reinvested.tfsa.add(put);
                remaining = remaining.subtract(put);
            }
        }

        for (Member m : living) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (m.age < RRIF_CONVERSION_AGE && m.employment.signum() > 0 && !m.meltActive) {
                BigDecimal room = m.employment.multiply(RRSP_CONTRIBUTION_RATE, Money.MATH_CONTEXT)
                        .min(rates.getRrspDollarLimit().multiply(year.inflationFactor, Money.MATH_CONTEXT));
                BigDecimal put = remaining.min(room);
                m.person.getRrsp().deposit(put);
                reinvested.rrsp = reinvested.rrsp.add(put);
                remaining = remaining.subtract(put);
            }
        }

        if (remaining.signum() > 0) {
            BigDecimal each = remaining.divide(BigDecimal.valueOf(living.size()), Money.MATH_CONTEXT);
            for (Member m : living) {
                m.person.getNonRegistered().deposit(each);
            }
            reinvested.nonRegistered = remaining;
        }
    }

    private SplitOutcome applyIncomeSplitting(Member first, Member second, YearContext year) {
        if (!year.inputs.isUseIncomeSplitting() || second == null || !first.alive || !second.alive) {
            return SplitOutcome.NONE;
        }
        IncomeSplitOptimizer.SplitResult result = splitOptimizer.computeOptimalSplit(
                first.splitCandidate(), second.splitCandidate(), year.region(), year.inflationFactor);
        if (!result.isSplit()) {
            return SplitOutcome.NONE;
        }
        BigDecimal shift = result.getDirection() == SplitDirection.FIRST_TO_SECOND ? result.getAmount() : result.getAmount().negate();
        first.tax = result.getFirstNewTax();
        second.tax = result.getSecondNewTax();
        first.clawback = taxCalculator.computeClawback(first.taxableIncome.subtract(shift), first.oas, year.inflationFactor);
        second.clawback = taxCalculator.computeClawback(second.taxableIncome.add(shift), second.oas, year.inflationFactor);
        return new SplitOutcome(result.getAmount(), result.getDirection(), result.getSavings());
    }

    private void describeYear(SimulationResult.SimulationResultBuilder record, YearContext year,
                              Member first, Member second, List<Member> living) {
        BigDecimal totalAssets = BigDecimal.ZERO;
        for (Member m : living) {
            totalAssets = totalAssets.add(m.person.totalAssets());
        }
        record.year(year.calendarYear)
                .age(first.age)
                .spouseAge(second != null ? second.age : null)
                .personAlive(first.alive)
                .spouseAlive(second != null && second.alive)
                .jurisdiction(year.region())
                .jurisdictionFallback(year.jurisdiction.isFallback())
                .inflationFactor(year.inflationFactor.setScale(6, RoundingMode.HALF_UP))
                .capitalGrowthRate(year.growthRate.setScale(6, RoundingMode.HALF_UP))
                .totalAssets(Money.round(totalAssets))
                .personAccounts(AccountSnapshot.of(first.person))
                .spouseAccounts(second != null ? AccountSnapshot.of(second.person) : null);
    }

    /**
     * Gross and net figures per income source. Each person's tax is spread over their taxable
     * components in proportion to size; TFSA and open-account withdrawals are cash as received.
     */
    private void describeIncome(SimulationResult.SimulationResultBuilder record, List<Member> living,
                                Member first, Member second, BigDecimal inflows, BigDecimal surplus) {
        Totals gross = new Totals();
        Totals net = new Totals();
        BigDecimal taxable = BigDecimal.ZERO;
        BigDecimal tax = BigDecimal.ZERO;
        BigDecimal clawback = BigDecimal.ZERO;
        BigDecimal gains = BigDecimal.ZERO;

        for (Member m : living) {
            BiFunction<BigDecimal, BigDecimal, BigDecimal> afterTax = (cash, taxablePart) ->
                    cash.subtract(Money.ratio(taxablePart, m.taxableIncome).multiply(m.tax, Money.MATH_CONTEXT));

            gross.employment = gross.employment.add(m.employment);
            gross.cpp = gross.cpp.add(m.cpp);
            gross.oas = gross.oas.add(m.oas);
            gross.investment = gross.investment.add(m.interest).add(m.dividends);
            gross.rrsp = gross.rrsp.add(m.rrspIncome());
            gross.tfsa = gross.tfsa.add(m.tfsaWithdrawal);
            gross.nonRegistered = gross.nonRegistered.add(m.nonRegWithdrawal);

            net.employment = net.employment.add(afterTax.apply(m.employment, m.employment));
            net.cpp = net.cpp.add(afterTax.apply(m.cpp, m.cpp));
            net.oas = net.oas.add(afterTax.apply(m.oas, m.oas));
            net.investment = net.investment.add(afterTax.apply(m.interest.add(m.dividends), m.interest.add(m.grossedUpDividends)));
            m.netRrsp = afterTax.apply(m.rrspIncome(), m.rrspIncome());
            net.rrsp = net.rrsp.add(m.netRrsp);

            taxable = taxable.add(m.taxableIncome);
            tax = tax.add(m.tax);
            clawback = clawback.add(m.clawback);
            gains = gains.add(m.realizedGains);
        }

        BigDecimal cash = gross.employment.add(gross.cpp).add(gross.oas).add(gross.investment)
                .add(gross.rrsp).add(gross.tfsa).add(gross.nonRegistered).add(inflows);

        boolean hasSecond = second != null && second.alive;
        record.grossIncome(Money.round(taxable))
                .employmentIncome(Money.round(gross.employment))
                .cppIncome(Money.round(gross.cpp))
                .oasIncome(Money.round(gross.oas))
                .investmentIncome(Money.round(gross.investment))
                .totalRrspWithdrawal(Money.round(gross.rrsp))
                .totalTfsaWithdrawal(Money.round(gross.tfsa))
                .totalNonRegWithdrawal(Money.round(gross.nonRegistered))
                .totalRealizedCapitalGains(Money.round(gains))
                .taxPaid(Money.round(tax))
                .oasClawback(Money.round(clawback))
                .netIncome(Money.round(cash.subtract(tax).subtract(surplus)))
                .netEmploymentIncome(Money.round(net.employment))
                .netCppIncome(Money.round(net.cpp))
                .netOasIncome(Money.round(net.oas))
                .netInvestmentIncome(Money.round(net.investment))
                .netRrspWithdrawal(Money.round(net.rrsp))
                .netTfsaWithdrawal(Money.round(gross.tfsa))
                .netNonRegWithdrawal(Money.round(gross.nonRegistered))
                .personNetRrsp(Money.round(first.alive ? first.netRrsp : BigDecimal.ZERO))
                .spouseNetRrsp(Money.round(hasSecond ? second.netRrsp : BigDecimal.ZERO))
                .personNetTfsa(Money.round(first.alive ? first.tfsaWithdrawal : BigDecimal.ZERO))
                .spouseNetTfsa(Money.round(hasSecond ? second.tfsaWithdrawal : BigDecimal.ZERO))
                .personNetNonReg(Money.round(first.alive ? first.nonRegWithdrawal : BigDecimal.ZERO))
                .spouseNetNonReg(Money.round(hasSecond ? second.nonRegWithdrawal : BigDecimal.ZERO));
    }

    /**
     * A person dies at the end of the year they reach life expectancy. With a surviving spouse
     * every account rolls over tax-free; for the last death the RRSP and unrealized gains are
     * taxed as if cashed in. Balances in the record are those before any rollover.
     */
    private void settleDeaths(SimulationResult.SimulationResultBuilder record, List<Member> living, YearContext year) {
        List<Member> dying = new ArrayList<>(2);
        List<Member> survivors = new ArrayList<>(2);
        for (Member m : living) {
            (m.age == m.person.getLifeExpectancy() ? dying : survivors).add(m);
        }

        BigDecimal rolled = BigDecimal.ZERO;
        BigDecimal rrspTax = BigDecimal.ZERO;
        BigDecimal gainsTax = BigDecimal.ZERO;
        BigDecimal estate = BigDecimal.ZERO;
        boolean terminal = !dying.isEmpty() && survivors.isEmpty();

        for (Member m : dying) {
            m.diedThisYear = true;
            if (!survivors.isEmpty()) {
                Person heir = survivors.get(0).person;
                BigDecimal rrsp = m.person.getRrsp().drain();
                rolled = rolled.add(rrsp);
                heir.getRrsp().deposit(rrsp);
                heir.getTfsa().deposit(m.person.getTfsa().drain());
                heir.getNonRegistered().absorb(m.person.getNonRegistered());
                log.debug("Rolled {} of RRSP to surviving spouse at age {}", rrsp, m.age);
            } else {
                BigDecimal base = m.taxableIncome;
                BigDecimal rrsp = m.person.getRrsp().getBalance();
                BigDecimal gains = m.person.getNonRegistered().unrealizedGain().multiply(CAPITAL_GAINS_INCLUSION, Money.MATH_CONTEXT);
                BigDecimal taxBase = terminalTax(m, base, year);
                BigDecimal taxWithRrsp = terminalTax(m, base.add(rrsp), year);
                BigDecimal taxWithAll = terminalTax(m, base.add(rrsp).add(gains), year);
                rrspTax = rrspTax.add(taxWithRrsp.subtract(taxBase));
                gainsTax = gainsTax.add(taxWithAll.subtract(taxWithRrsp));
                estate = estate.add(m.person.totalAssets());
            }
        }

        BigDecimal totalTerminal = rrspTax.add(gainsTax);
        record.personDeathThisYear(living.stream().anyMatch(m -> m.diedThisYear && m.primary))
                .spouseDeathThisYear(living.stream().anyMatch(m -> m.diedThisYear && !m.primary))
                .rrspRolledToSpouse(Money.round(rolled))
                .terminalTaxOnRrsp(Money.round(rrspTax))
                .terminalTaxOnCapitalGains(Money.round(gainsTax))
                .totalTerminalTax(Money.round(totalTerminal))
                .grossEstateValue(Money.round(terminal ? estate : BigDecimal.ZERO))
                .netEstateValue(Money.round(terminal ? estate.subtract(totalTerminal) : BigDecimal.ZERO));
    }

    private BigDecimal terminalTax(Member m, BigDecimal taxable, YearContext year) {
        return taxCalculator.computeTotalTax(taxable, year.region(), year.inflationFactor, m.age,
                m.eligiblePensionIncome(), m.grossedUpDividends, m.oas);
    }

    private BigDecimal totalTax(Member m, YearContext year) {
        return taxCalculator.computeTotalTax(m.taxableIncome(), year.region(), year.inflationFactor, m.age,
                m.eligiblePensionIncome(), m.grossedUpDividends, m.oas);
    }

    private static BigDecimal growthRate(ReturnAssumptions rates, GaussianSampler sampler) {
        if (sampler == null) {
            return rates.getCapitalGrowth();
        }
        double z = sampler.next();
        if (rates.getVolatility() == 0.0) {
            return rates.getCapitalGrowth();
        }
        return rates.getCapitalGrowth().add(BigDecimal.valueOf(rates.getVolatility() * z));
    }

    /** Fixed facts about the year being simulated. */
    private static final class YearContext {
        final SimulationInputs inputs;
        final JurisdictionResolution jurisdiction;
        final int calendarYear;
        final BigDecimal inflationFactor;
        final BigDecimal growthRate;

        YearContext(SimulationInputs inputs, JurisdictionResolution jurisdiction, int calendarYear,
                    BigDecimal inflationFactor, BigDecimal growthRate) {
            this.inputs = inputs;
            this.jurisdiction = jurisdiction;
            this.calendarYear = calendarYear;
            this.inflationFactor = inflationFactor;
            this.growthRate = growthRate;
        }

        String region() {
            return jurisdiction.getResolved();
        }
    }

    /**
     * A person's working copy plus the running ledger for the current year.
     */
    private static final class Member {
        final Person person;
        final boolean primary;
        int age;
        boolean alive;
        boolean diedThisYear;

        BigDecimal employment;
        BigDecimal cpp;
        BigDecimal oas;
        BigDecimal rrif;
        BigDecimal melt;
        boolean meltActive;
        BigDecimal extraRrsp;
        BigDecimal interest;
        BigDecimal dividends;
        BigDecimal grossedUpDividends;
        BigDecimal realizedGains;
        BigDecimal tfsaWithdrawal;
        BigDecimal nonRegWithdrawal;
        BigDecimal taxableIncome;
        BigDecimal tax;
        BigDecimal clawback;
        BigDecimal netRrsp;

        Member(Person person, boolean primary) {
            this.person = person;
            this.primary = primary;
        }

        void startYear(int offset) {
            age = person.getAge() + offset;
            alive = age <= person.getLifeExpectancy();
            diedThisYear = false;
            employment = BigDecimal.ZERO;
            cpp = BigDecimal.ZERO;
            oas = BigDecimal.ZERO;
            rrif = BigDecimal.ZERO;
            melt = BigDecimal.ZERO;
            meltActive = false;
            extraRrsp = BigDecimal.ZERO;
            interest = BigDecimal.ZERO;
            dividends = BigDecimal.ZERO;
            grossedUpDividends = BigDecimal.ZERO;
            realizedGains = BigDecimal.ZERO;
            tfsaWithdrawal = BigDecimal.ZERO;
            nonRegWithdrawal = BigDecimal.ZERO;
            taxableIncome = BigDecimal.ZERO;
            tax = BigDecimal.ZERO;
            clawback = BigDecimal.ZERO;
            netRrsp = BigDecimal.ZERO;
        }

        BigDecimal rrspIncome() {
            return rrif.add(melt).add(extraRrsp);
        }

        BigDecimal eligiblePensionIncome() {
            return age >= PENSION_CREDIT_AGE ? rrspIncome() : BigDecimal.ZERO;
        }

        BigDecimal forcedCash() {
            return employment.add(cpp).add(oas).add(rrif).add(melt).add(interest).add(dividends);
        }

        /** Taxable income from everything recorded so far this year. */
        BigDecimal taxableIncome() {
            return employment.add(cpp).add(oas).add(rrspIncome()).add(interest).add(grossedUpDividends)
                    .add(realizedGains.multiply(CAPITAL_GAINS_INCLUSION, Money.MATH_CONTEXT));
        }

        IncomeSplitOptimizer.SplitCandidate splitCandidate() {
            return IncomeSplitOptimizer.SplitCandidate.builder()
                    .age(age)
                    .taxableIncome(taxableIncome)
                    .eligiblePensionIncome(eligiblePensionIncome())
                    .oasIncome(oas)
                    .grossedUpDividends(grossedUpDividends)
                    .build();
        }
    }

    private static final class Reinvestment {
        BigDecimal tfsa = BigDecimal.ZERO;
        BigDecimal rrsp = BigDecimal.ZERO;
        BigDecimal nonRegistered = BigDecimal.ZERO;
    }

    private static final class Totals {
        BigDecimal employment = BigDecimal.ZERO;
        BigDecimal cpp = BigDecimal.ZERO;
        BigDecimal oas = BigDecimal.ZERO;
        BigDecimal investment = BigDecimal.ZERO;
        BigDecimal rrsp = BigDecimal.ZERO;
        BigDecimal tfsa = BigDecimal.ZERO;
        BigDecimal nonRegistered = BigDecimal.ZERO;
    }

    private static final class SplitOutcome {
        static final SplitOutcome NONE = new SplitOutcome(BigDecimal.ZERO, SplitDirection.NONE, BigDecimal.ZERO);

        final BigDecimal amount;
        final SplitDirection direction;
        final BigDecimal savings;

        SplitOutcome(BigDecimal amount, SplitDirection direction, BigDecimal savings) {
            this.amount = amount;
            this.direction = direction;
            this.savings = savings;
        }
    }
}
