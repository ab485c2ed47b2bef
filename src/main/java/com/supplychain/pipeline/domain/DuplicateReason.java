package com.supplychain.pipeline.domain;

/**
 * Which signature matched a previously seen event. Checked in declaration order.
 */
public enum DuplicateReason {
    NONE,
    /** Same title, description and location byte for byte. */
    EXACT,
    /** Same text after lowercasing and whitespace collapsing. */
    CONTENT,
    /** Same set of meaningful words, regardless of order or punctuation. */
    FUZZY;

    public boolean isDuplicate() {
        return this != NONE;
    }
}
