package com.fhi.fixture_isolation.testapp;

/**
 * Application settings held in static fields, overridable in tests.
 */
public final class ProjectDefaults
{
    static int pageSize = 20;
    static String currency = "EUR";
    static boolean archivingEnabled = true;

    public static final int MAX_BUDGET = 1_000_000;

    // Private constructor to prevent instantiation
    private ProjectDefaults() {}

    public static int pageSize()
    {   return pageSize;
    }

    public static String currency()
    {   return currency;
    }

    public static boolean archivingEnabled()
    {   return archivingEnabled;
    }
}
