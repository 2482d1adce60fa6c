package com.fhi.fixture_isolation.time;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Constructs date-time values representing "now".
 *
 * <p>Second seam of the time layer next to the {@link Clock}: code that builds timestamps
 * (creation dates, audit columns) goes through it rather than {@code ZonedDateTime.now()}.</p>
 */
@FunctionalInterface
public interface DateTimeFactory
{
    /**
     * The current date-time in the given zone.
     */
    ZonedDateTime now(ZoneId zone);

    /**
     * The current date-time in UTC.
     */
    default OffsetDateTime utcNow()
    {   return now(ZoneOffset.UTC).toOffsetDateTime();
    }

    /**
     * Factory reading the system clock.
     */
    static DateTimeFactory system()
    {   return ZonedDateTime::now;
    }

    /**
     * Factory deriving every value from the given clock's instant, read at call time.
     */
    static DateTimeFactory fromClock(Clock clock)
    {   Objects.requireNonNull(clock, "clock");
        return zone -> ZonedDateTime.ofInstant(clock.instant(), zone);
    }
}
