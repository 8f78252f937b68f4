package com.gillianbc.retirement.model;

public enum EventType {
    EXPENSE,
    INFLOW
}
