package com.fhi.fixture_isolation.fixture;

import java.util.Map;

/**
 * The attribute slots of a test class: named, rebindable values that one-time setup assigns
 * and every test reads.
 */
public interface ClassState
{
    /**
     * Name to current value of every slot, in a stable order.
     */
    Map<String, Object> values();

    boolean has(String name);

    Object get(String name);

    void set(String name, Object value);
}
