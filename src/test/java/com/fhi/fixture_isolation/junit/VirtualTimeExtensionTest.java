package com.fhi.fixture_isolation.junit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.fixture_isolation.patch.SuspendPatches;
import com.fhi.fixture_isolation.time.ClockVirtualization;
import com.fhi.fixture_isolation.time.TimeSource;
import com.fhi.fixture_isolation.time.VirtualClock;

@VirtualTime(start = "2024-06-15T12:00:00Z")
class VirtualTimeExtensionTest
{
    private static final Instant START = Instant.parse("2024-06-15T12:00:00Z");

    /** Application-side holder with only a clock. */
    static class BillingClock
    {
        static Clock clock = Clock.systemUTC();
    }

    @BeforeEach
    void clockIsAlreadyActive(VirtualClock clock)
    {   assertThat(Arrays.asList(TimeSource.clock(), BillingClock.clock)).contains(clock);
    }

    @AfterAll
    static void realTimeIsBack()
    {   assertThat(TimeSource.now()).isAfter(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(BillingClock.clock).isNotInstanceOf(VirtualClock.class);
    }

    @Test
    void startsAtTheConfiguredInstant(VirtualClock clock)
    {
        assertThat(clock.instant()).isEqualTo(START);
        assertThat(TimeSource.now()).isEqualTo(START);
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void advancingIsSeenByTheTimeLayer(VirtualClock clock)
    {
        clock.advance(Duration.ofMinutes(90));

        assertThat(TimeSource.utcNow().toInstant()).isEqualTo(START.plus(Duration.ofMinutes(90)));
    }

    @Test
    @VirtualTime(start = "2024-06-15T12:00:00Z", zone = "UTC")
    void utcByNameIsTheUtcOffset(VirtualClock clock)
    {
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
        assertThat(TimeSource.now(clock.getZone()).getOffset()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    @VirtualTime(start = "2020-01-01T00:00", zone = "Europe/Paris")
    @DisplayName("A method annotation replaces the class one; local start times use the zone")
    void methodLevelSettings(VirtualClock clock)
    {
        assertThat(clock.getZone()).isEqualTo(ZoneId.of("Europe/Paris"));
        assertThat(TimeSource.now()).isEqualTo(Instant.parse("2019-12-31T23:00:00Z"));
    }

    @Test
    @VirtualTime(start = "2024-06-15T12:00:00Z", dateTimeField = "",
                 clockField = "com.fhi.fixture_isolation.junit.VirtualTimeExtensionTest$BillingClock.clock")
    void anyClockHolder(VirtualClock clock)
    {
        assertThat(BillingClock.clock).isSameAs(clock);
        assertThat(TimeSource.clock()).isNotSameAs(clock);
    }

    @Test
    @SuspendPatches({ ClockVirtualization.CLOCK_PATCH, ClockVirtualization.DATE_TIME_PATCH })
    void suspendedPatchesGiveRealTime()
    {
        assertThat(TimeSource.now()).isAfter(Instant.parse("2025-01-01T00:00:00Z"));
        assertThat(TimeSource.utcNow().toInstant()).isAfter(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void invalidStartsAreRejected()
    {
        assertThatThrownBy(() -> VirtualTimeExtension.parseStart("yesterday", ZoneOffset.UTC))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("yesterday");
        assertThat(VirtualTimeExtension.parseStart("", ZoneOffset.UTC)).isAfter(Instant.parse("2025-01-01T00:00:00Z"));
    }
}
