package com.fhi.fixture_isolation.time;

import java.util.Objects;

import com.fhi.fixture_isolation.patch.Patch;
import com.fhi.fixture_isolation.patch.PatchException;
import com.fhi.fixture_isolation.patch.PatchRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Redirects the time layer to a {@link VirtualClock} for the lifetime of one test.
 *
 * <p>Two patches are installed on {@link #activate()}:</p>
 * <ul>
 *   <li>{@value #CLOCK_PATCH}: the clock field (default {@link TimeSource#CLOCK_FIELD}) is
 *       replaced by the virtual clock, redirecting "read current time";</li>
 *   <li>{@value #DATE_TIME_PATCH}: the date-time factory field (default
 *       {@link TimeSource#DATE_TIME_FACTORY_FIELD}) is replaced by a factory deriving its
 *       values from the same virtual clock.</li>
 * </ul>
 * <p>Both are registered by name in the {@link PatchRegistry}, so they can be suspended.
 * {@link #deactivate()} stops them whatever the test outcome.</p>
 *
 * <p>Activation never falls back to real time: if a target cannot be patched, the error
 * propagates and nothing stays patched.</p>
 */
@Slf4j
public class ClockVirtualization
{
    public static final String CLOCK_PATCH = "clock";
    public static final String DATE_TIME_PATCH = "dateTimeFactory";

    private final PatchRegistry registry;
    private final VirtualClock clock;
    private final String clockField;
    private final String dateTimeField;

    private Patch clockPatch;
    private Patch dateTimePatch;
    private boolean active;

    public ClockVirtualization(PatchRegistry registry, VirtualClock clock)
    {   this(registry, clock, TimeSource.CLOCK_FIELD, TimeSource.DATE_TIME_FACTORY_FIELD);
    }

    /**
     * @param clockField    static {@code Clock} field to redirect
     * @param dateTimeField static {@link DateTimeFactory} field to redirect; blank for holders
     *                      that only expose a clock
     */
    public ClockVirtualization(PatchRegistry registry, VirtualClock clock, String clockField, String dateTimeField)
    {   this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.clockField = Objects.requireNonNull(clockField, "clockField");
        this.dateTimeField = dateTimeField;
    }

    /**
     * Inactive to Active.
     *
     * @throws PatchException if already active or if a target cannot be patched
     */
    public void activate()
    {
        if (active)
        {   throw PatchException.doubleActivation(clockField);
        }
        clockPatch = registry.register(CLOCK_PATCH, Patch.of(clockField, clock));
        registry.start(clockPatch);

        if (dateTimeField != null && !dateTimeField.isBlank())
        {   dateTimePatch = registry.register(DATE_TIME_PATCH, Patch.of(dateTimeField, DateTimeFactory.fromClock(clock)));
            try
            {   registry.start(dateTimePatch);
            }
            catch (RuntimeException e)
            {   registry.stop(clockPatch);
                throw e;
            }
        }
        active = true;
        log.debug("Virtual time active at {}", clock.instant());
    }

    /**
     * Active to Inactive. Patches currently suspended are not stopped twice.
     */
    public void deactivate()
    {
        if (!active) return;
        active = false;

        RuntimeException failure = null;
        for (Patch patch : new Patch[] { dateTimePatch, clockPatch })
        {   if (patch == null || !patch.isActive()) continue;
            try
            {   registry.stop(patch);
            }
            catch (RuntimeException e)
            {   if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        log.debug("Virtual time deactivated at {}", clock.instant());
        if (failure != null) throw failure;
    }

    public boolean isActive()
    {   return active;
    }

    public VirtualClock getClock()
    {   return clock;
    }
}
