package com.gillianbc.retirement.model;

/** Order in which savings are drawn to cover a spending deficit. */
public enum WithdrawalStrategy {
    /** Open account, then TFSA, then RRSP. */
    TAX_EFFICIENT,
    /** RRSP, then open account, then TFSA. The voluntary melt is switched off once retired. */
    RRSP_FIRST
}
