package com.gillianbc.retirement.model;

/** Which spouse transfers eligible pension income to the other. */
public enum SplitDirection {
    NONE,
    FIRST_TO_SECOND,
    SECOND_TO_FIRST
}
