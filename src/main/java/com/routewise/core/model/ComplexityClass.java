package com.routewise.core.model;

/**
 * Derived complexity of a request. The rank drives both the default
 * provider category and the complexity term of plan confidence.
 */
public enum ComplexityClass {
    SIMPLE(1),
    MEDIUM(2),
    COMPLEX(3);

    private final int rank;

    ComplexityClass(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
