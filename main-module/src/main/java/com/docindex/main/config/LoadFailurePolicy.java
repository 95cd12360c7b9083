package com.docindex.main.config;

/** What to do when the persisted index cannot be read at startup */
public enum LoadFailurePolicy {
    /** Log the failure and start with an empty index */
    FRESH,
    /** Fail startup */
    FAIL
}
