package com.ruchira.nest.model;

/**
 * The available ways of building a nested structure out of flat records.
 */
public enum NestingRealization {

    /**
     * One pass per record, descending the tree with an explicit cursor.
     */
    ITERATIVE,

    /**
     * One grouping pass per level, recursing into each group for the remaining levels.
     * Call depth grows with the number of nesting levels.
     */
    RECURSIVE;

    public static NestingRealization of(boolean useRecursiveRealization) {
        return useRecursiveRealization ? RECURSIVE : ITERATIVE;
    }
}
