package com.companya.scd.model;

public enum Outcome {
    NEW,
    CHANGED,
    UNCHANGED,
    REMOVED
}
