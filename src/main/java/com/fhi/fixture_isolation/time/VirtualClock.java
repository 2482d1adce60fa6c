package com.fhi.fixture_isolation.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Clock} whose instant is set by the test.
 *
 * <p>The instant does not move on its own: two reads without an intervening {@link #set} or
 * {@link #advance} return the same value. Views obtained through {@link #withZone(ZoneId)}
 * share the instant of the clock they come from, so setting it is seen through every view
 * immediately.</p>
 */
public final class VirtualClock extends Clock
{
    private final AtomicReference<Instant> instant;
    private final ZoneId zone;

    public VirtualClock(Instant start, ZoneId zone)
    {   this(new AtomicReference<>(Objects.requireNonNull(start, "start")), zone);
    }

    private VirtualClock(AtomicReference<Instant> instant, ZoneId zone)
    {   this.instant = instant;
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    /**
     * A virtual clock starting at the real current instant.
     */
    public static VirtualClock startingNow(ZoneId zone)
    {   return new VirtualClock(Instant.now(), zone);
    }

    @Override
    public ZoneId getZone()
    {   return zone;
    }

    @Override
    public Clock withZone(ZoneId zone)
    {   return zone.equals(this.zone) ? this : new VirtualClock(instant, zone);
    }

    @Override
    public Instant instant()
    {   return instant.get();
    }

    public ZonedDateTime dateTime()
    {   return ZonedDateTime.ofInstant(instant.get(), zone);
    }

    public void set(Instant newInstant)
    {   instant.set(Objects.requireNonNull(newInstant, "newInstant"));
    }

    public void set(ZonedDateTime dateTime)
    {   set(dateTime.toInstant());
    }

    /**
     * Moves the clock by the given amount (negative to go back).
     */
    public Instant advance(Duration amount)
    {   return instant.updateAndGet(i -> i.plus(amount));
    }

    @Override
    public String toString()
    {   return "VirtualClock[" + instant.get() + ", " + zone + "]";
    }
}
