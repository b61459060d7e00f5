package com.lynkvertx.tbce.model;

/**
 * Check categories in governing priority order: when several checks fail,
 * the first failing category in declaration order is reported as governing.
 */
public enum CheckCategory {
    BENDING("bending"),
    DEFLECTION("deflection"),
    ROD("rod"),
    ANCHOR("anchor");

    private final String key;

    CheckCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
