package com.fhi.fixture_isolation.fixture;

/**
 * How a captured fixture is put back into its slot before each test.
 */
public enum RestoreStrategy
{
    /** Fresh deep copy of the snapshot taken after one-time setup. */
    DEEP_COPY,

    /**
     * Fresh object fetched from the store by persistent identity. Values without one (plain
     * data, unsaved entities) fall back to {@link #DEEP_COPY}. Picks up changes other tests
     * committed to the store.
     */
    RELOAD
}
