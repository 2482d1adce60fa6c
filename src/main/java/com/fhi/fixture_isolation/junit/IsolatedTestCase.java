package com.fhi.fixture_isolation.junit;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;

import com.fhi.fixture_isolation.fixture.FixtureSupport;
import com.fhi.fixture_isolation.patch.PatchSuspension;
import com.fhi.fixture_isolation.patch.SettingsOverride;
import com.fhi.fixture_isolation.time.VirtualClock;

/**
 * Parent of test classes that want isolated fixtures and virtual time without wiring the
 * annotations themselves.
 *
 * <p>Fixtures are built in {@code @BeforeAll} methods and assigned to static fields (or to
 * instance fields with {@code @TestInstance(PER_CLASS)}); each test gets fresh copies. Each
 * test runs on its own virtual clock, starting at the real current time unless the subclass
 * or the method says otherwise with {@link VirtualTime}.</p>
 */
@IsolatedFixtures
@VirtualTime
public abstract class IsolatedTestCase
{
    protected static final Duration SECOND = Duration.ofSeconds(1);
    protected static final Duration MINUTE = Duration.ofMinutes(1);
    protected static final Duration HOUR   = Duration.ofHours(1);
    protected static final Duration DAY    = Duration.ofDays(1);

    private FixtureSupport fixtures;
    private VirtualClock clock;

    @BeforeEach
    protected final void bindIsolationSupport(FixtureSupport fixtures, VirtualClock clock)
    {   this.fixtures = fixtures;
        this.clock = clock;
    }

    protected FixtureSupport fixtures()
    {   return fixtures;
    }

    protected VirtualClock clock()
    {   return clock;
    }

    // =====================================================================
    // Fixtures
    // =====================================================================

    protected <T> T cloneFixture(T fixture, Map<String, ?> overrides)
    {   return fixtures.cloneFixture(fixture, overrides);
    }

    protected <T> T cloneFixture(T fixture)
    {   return fixtures.cloneFixture(fixture);
    }

    protected void updateInStore(Object fixture, Map<String, ?> fields)
    {   fixtures.updateInStore(fixture, fields);
    }

    protected void updateInStore(Object fixture, Object... namesAndValues)
    {   fixtures.updateInStore(fixture, namesAndValues);
    }

    protected <T> T reloadFromStore(T fixture)
    {   return fixtures.reloadFromStore(fixture);
    }

    protected void assertFieldsMatchStore(Object fixture, Map<String, ?> expected)
    {   fixtures.assertFieldsMatchStore(fixture, expected);
    }

    protected void assertFieldsMatchStore(Object fixture, Object... namesAndValues)
    {   fixtures.assertFieldsMatchStore(fixture, namesAndValues);
    }

    protected Optional<String> forget(Object fixture)
    {   return fixtures.forget(fixture);
    }

    // =====================================================================
    // Time
    // =====================================================================

    protected Instant getNow()
    {   return clock.instant();
    }

    protected void setNow(Instant now)
    {   clock.set(now);
    }

    protected void setNow(ZonedDateTime now)
    {   clock.set(now);
    }

    /**
     * Moves virtual time forward (or backward, with a negative amount).
     */
    protected Instant shiftTime(Duration amount)
    {   return clock.advance(amount);
    }

    // =====================================================================
    // Patches
    // =====================================================================

    /**
     * Enabled override of the given settings, tracked by the class's patch registry. Meant for
     * try-with-resources.
     */
    protected SettingsOverride overrideSettings(Class<?> namespace, Map<String, ?> settings)
    {   return new SettingsOverride(fixtures.getPatchRegistry(), namespace.getName(), settings).enable();
    }

    /**
     * Suspends the named patches (e.g. {@code "clock"}) until the returned scope is closed.
     */
    protected PatchSuspension suspendPatches(String... names)
    {   return fixtures.getPatchRegistry().suspend(names);
    }
}
