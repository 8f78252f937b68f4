package com.gillianbc.retirement.service;

import com.gillianbc.retirement.config.RetirementProperties;
import com.gillianbc.retirement.model.OneTimeEvent;
import com.gillianbc.retirement.model.Person;
import com.gillianbc.retirement.model.SimulationInputs;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks the age and lifespan configuration a projection depends on. An empty list means the
 * inputs can be projected.
 */
@Component
public class ProjectionInputValidator {

    private final RetirementProperties properties;

    public ProjectionInputValidator(RetirementProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    public List<String> validate(SimulationInputs inputs) {
        List<String> violations = new ArrayList<>();
        if (inputs.getPerson() == null) {
            violations.add("person is required");
            return violations;
        }
        validatePerson("person", inputs.getPerson(), violations);
        if (inputs.hasSpouse()) {
            validatePerson("spouse", inputs.getSpouse(), violations);
        }
        if (!violations.isEmpty()) {
            return violations;
        }

        int years = projectedYears(inputs);
        int maxYears = properties.getProjection().getMaxYears();
        if (years > maxYears) {
            violations.add("projection spans " + years + " years, more than the limit of " + maxYears);
        }
        if (inputs.getInflationRate().compareTo(BigDecimal.ONE.negate()) <= 0) {
            violations.add("inflationRate must be greater than -1");
        }
        if (inputs.getPreRetirementSpend().signum() < 0 || inputs.getPostRetirementSpend().signum() < 0) {
            violations.add("spending targets must be >= 0");
        }
        for (OneTimeEvent event : inputs.getOneTimeEvents()) {
            if (event.getAmount().signum() < 0) {
                violations.add("one-time event '" + event.getName() + "' amount must be >= 0");
            }
        }
        return violations;
    }

    /**
     * Number of projected years: until the later of the two deaths, counted in the primary
     * person's ages.
     */
    static int projectedYears(SimulationInputs inputs) {
        Person person = inputs.getPerson();
        int endAge = person.getLifeExpectancy();
        if (inputs.hasSpouse()) {
            Person spouse = inputs.getSpouse();
            endAge = Math.max(endAge, spouse.getLifeExpectancy() - spouse.getAge() + person.getAge());
        }
        return endAge - person.getAge() + 1;
    }

    private static void validatePerson(String label, Person person, List<String> violations) {
        if (person.getAge() < 0 || person.getRetirementAge() < 0 || person.getLifeExpectancy() < 0
                || person.getCppStartAge() < 0 || person.getOasStartAge() < 0) {
            violations.add(label + " ages must be >= 0");
        }
        if (person.getRrspMeltStartAge() != null && person.getRrspMeltStartAge() < 0) {
            violations.add(label + " rrspMeltStartAge must be >= 0");
        }
        if (person.getLifeExpectancy() < person.getAge()) {
            violations.add(label + " lifeExpectancy " + person.getLifeExpectancy() + " is before current age " + person.getAge());
        }
        if (person.getRetirementAge() > person.getLifeExpectancy()) {
            violations.add(label + " retirementAge " + person.getRetirementAge() + " is after lifeExpectancy " + person.getLifeExpectancy());
        }
        if (person.getCurrentIncome().signum() < 0 || person.getRrspMeltAmount().signum() < 0) {
            violations.add(label + " income and melt amounts must be >= 0");
        }
    }
}
