package com.gillianbc.retirement.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A single expense or inflow in today's money, triggered in the year the primary person
 * reaches {@code age}.
 */
@Value
@Builder
public class OneTimeEvent {
    String name;
    @NonNull BigDecimal amount;
    int age;
    @NonNull @Builder.Default EventType type = EventType.EXPENSE;
}
