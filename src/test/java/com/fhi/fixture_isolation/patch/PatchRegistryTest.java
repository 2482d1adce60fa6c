package com.fhi.fixture_isolation.patch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.fixture_isolation.patch.PatchException.Cause;

class PatchRegistryTest
{
    private final PatchRegistry registry = new PatchRegistry();

    @AfterEach
    void restoreTargets()
    {   registry.stopAll();
        PatchTargets.greeting = "hello";
        PatchTargets.retries = 3;
    }

    @Test
    void stopAllStopsInReverseOrder()
    {
        Patch greeting = Patch.of(PatchTargets.class, "greeting", "bonjour");
        Patch retries = Patch.of(PatchTargets.class, "retries", 9);
        registry.start(greeting);
        registry.start(retries);

        // WHEN:
        registry.stopAll();

        // THEN:
        assertThat(PatchTargets.greeting).isEqualTo("hello");
        assertThat(PatchTargets.retries).isEqualTo(3);
        assertThat(registry.getActivePatches()).isEmpty();
    }

    @Test
    void twoActivePatchesOnOneTargetConflict()
    {
        registry.start(Patch.of(PatchTargets.class, "greeting", "bonjour"));

        assertThatThrownBy(() -> registry.start(Patch.of(PatchTargets.class, "greeting", "hallo")))
            .isInstanceOfSatisfying(PatchException.class, e -> assertThat(e.getCauseEnum()).isEqualTo(Cause.TARGET_CONFLICT));
        assertThat(PatchTargets.greeting).isEqualTo("bonjour");
    }

    @Test
    void aPatchStoppedDirectlyIsNoLongerTracked()
    {
        Patch greeting = Patch.of(PatchTargets.class, "greeting", "bonjour");
        registry.start(greeting);
        greeting.stop();

        assertThat(registry.getActivePatches()).isEmpty();
        registry.start(Patch.of(PatchTargets.class, "greeting", "hallo"));
        assertThat(PatchTargets.greeting).isEqualTo("hallo");
    }

    @Test
    void unknownNamesAreRejected()
    {
        registry.register("greeting", Patch.of(PatchTargets.class, "greeting", "bonjour"));

        assertThat(registry.find("greeting").getTarget()).endsWith("PatchTargets.greeting");
        assertThatThrownBy(() -> registry.find("clock"))
            .isInstanceOfSatisfying(PatchException.class, e -> assertThat(e.getCauseEnum()).isEqualTo(Cause.UNKNOWN_PATCH))
            .hasMessageContaining("greeting");
    }

    // =====================================================================
    // Suspension
    // =====================================================================

    @DisplayName("A suspension restores the original values and resumes exactly the active patches")
    @Test
    void suspendAndResume()
    {
        // GIVEN:
        Patch greeting = registry.register("greeting", Patch.of(PatchTargets.class, "greeting", "bonjour"));
        Patch retries = registry.register("retries", Patch.of(PatchTargets.class, "retries", 9));
        registry.start(greeting);

        // WHEN:
        PatchSuspension suspension = registry.suspend("greeting", "retries");

        // THEN: retries was never active, so it is not part of the suspension
        assertThat(PatchTargets.greeting).isEqualTo("hello");
        assertThat(suspension.getSuspended()).containsExactly(greeting);

        // WHEN:
        suspension.resume();

        // THEN:
        assertThat(PatchTargets.greeting).isEqualTo("bonjour");
        assertThat(greeting.isActive()).isTrue();
        assertThat(retries.isActive()).isFalse();
        assertThat(PatchTargets.retries).isEqualTo(3);
    }

    @Test
    void resumeIsIdempotent()
    {
        Patch greeting = Patch.of(PatchTargets.class, "greeting", "bonjour");
        registry.start(greeting);

        try (PatchSuspension suspension = registry.suspend(greeting))
        {   suspension.resume();
            assertThat(suspension.isResumed()).isTrue();
        }

        assertThat(PatchTargets.greeting).isEqualTo("bonjour");
    }

    @Test
    void suspendedWorkResumesEvenWhenItFails()
    {
        Patch greeting = Patch.of(PatchTargets.class, "greeting", "bonjour");
        registry.start(greeting);

        assertThatThrownBy(() -> registry.suspended(List.of(greeting), (Runnable) () ->
        {   assertThat(PatchTargets.greeting).isEqualTo("hello");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(PatchTargets.greeting).isEqualTo("bonjour");
    }

    @Test
    void suspendedReturnsTheWorkResult() throws Exception
    {
        Patch greeting = Patch.of(PatchTargets.class, "greeting", "bonjour");
        registry.start(greeting);

        String seen = registry.suspended(List.of(greeting), () -> PatchTargets.greeting);

        assertThat(seen).isEqualTo("hello");
        assertThat(PatchTargets.greeting).isEqualTo("bonjour");
    }

    // =====================================================================
    // Balance
    // =====================================================================

    @Test
    void closeStopsLeftoversAndReportsThem()
    {
        PatchRegistry strict = new PatchRegistry(true);
        strict.start(Patch.of(PatchTargets.class, "greeting", "bonjour"));

        assertThatThrownBy(strict::close)
            .isInstanceOfSatisfying(PatchException.class, e -> assertThat(e.getCauseEnum()).isEqualTo(Cause.UNBALANCED))
            .hasMessageContaining("PatchTargets.greeting");
        assertThat(PatchTargets.greeting).isEqualTo("hello");
    }

    @Test
    void lenientCloseOnlyWarns()
    {
        PatchRegistry lenient = new PatchRegistry(false);
        lenient.start(Patch.of(PatchTargets.class, "retries", 5));

        lenient.close();

        assertThat(PatchTargets.retries).isEqualTo(3);
        assertThat(lenient.getActivePatches()).isEmpty();
    }

    @Test
    void balancedCloseIsSilent()
    {
        Patch greeting = Patch.of(PatchTargets.class, "greeting", "bonjour");
        registry.start(greeting);
        registry.stop(greeting);

        registry.close();

        assertThat(PatchTargets.greeting).isEqualTo("hello");
    }
}
