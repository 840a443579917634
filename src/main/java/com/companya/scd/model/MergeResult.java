package com.companya.scd.model;

/**
 * Mutations written by one merge transaction.
 */
public record MergeResult(int inserted, int closed) {

    public static final MergeResult EMPTY = new MergeResult(0, 0);
}
