package com.gillianbc.retirement.model;

/** How a household's RRSP net requirement is shared between two living spouses. */
public enum DeferredSplitPolicy {
    /** In proportion to each spouse's RRSP balance. */
    BALANCE_WEIGHTED,
    /** Half each. */
    EVEN
}
