package com.example.nodelearn.suggest;

/**
 * What expansion does with a candidate whose topic already exists elsewhere in the tree.
 */
public enum DuplicatePolicy {
    /** Drop the candidate. */
    SKIP,
    /** Keep it as a cross-link from the expanded node to the existing node. */
    CROSS_LINK
}
