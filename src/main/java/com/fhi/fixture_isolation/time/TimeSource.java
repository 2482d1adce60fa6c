package com.fhi.fixture_isolation.time;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * The time layer that application and test code read "now" from.
 *
 * <p>Both seams are static, non-final fields so they can be patched: {@link #clock} answers
 * "what instant is it", {@link #dateTimeFactory} constructs date-time values for now. During a
 * test with virtual time, both are redirected to the test's {@link VirtualClock}.</p>
 *
 * <p>Holders of the same shape in application code (a static {@code Clock} field) can be
 * virtualised as well, see {@code VirtualTime#clockField()}.</p>
 */
public final class TimeSource
{
    /** Patched by {@link ClockVirtualization}. */
    private static Clock clock = Clock.systemUTC();

    /** Patched by {@link ClockVirtualization}. */
    private static DateTimeFactory dateTimeFactory = DateTimeFactory.system();

    public static final String CLOCK_FIELD = TimeSource.class.getName() + ".clock";
    public static final String DATE_TIME_FACTORY_FIELD = TimeSource.class.getName() + ".dateTimeFactory";

    // Private constructor to prevent instantiation
    private TimeSource() {}

    public static Clock clock()
    {   return clock;
    }

    public static Instant now()
    {   return clock.instant();
    }

    public static LocalDate today()
    {   return LocalDate.now(clock);
    }

    public static ZonedDateTime now(ZoneId zone)
    {   return dateTimeFactory.now(zone);
    }

    public static OffsetDateTime utcNow()
    {   return dateTimeFactory.utcNow();
    }
}
