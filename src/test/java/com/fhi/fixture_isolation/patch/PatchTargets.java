package com.fhi.fixture_isolation.patch;

/**
 * Static fields patched by the patch tests.
 */
public class PatchTargets
{
    static String greeting = "hello";
    static int retries = 3;
    static Number limit = 10;

    static final String CONSTANT = "constant";

    String instanceField = "instance";

    public static class Nested
    {
        static String value = "nested";
    }
}
