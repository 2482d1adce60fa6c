package com.fhi.fixture_isolation.patch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.fixture_isolation.patch.PatchException.Cause;

class SettingsOverrideTest
{
    @Test
    void scopedFormRestoresOnExit()
    {
        try (SettingsOverride ignored = SettingsOverride.of(PatchTargets.class, Map.of("greeting", "hi", "retries", 1)).enable())
        {   assertThat(PatchTargets.greeting).isEqualTo("hi");
            assertThat(PatchTargets.retries).isEqualTo(1);
        }

        assertThat(PatchTargets.greeting).isEqualTo("hello");
        assertThat(PatchTargets.retries).isEqualTo(3);
    }

    @Test
    void wrappedWorkSeesTheOverride()
    {
        StringBuilder seen = new StringBuilder();
        Runnable work = SettingsOverride.of(PatchTargets.class, Map.of("greeting", "hey"))
                                        .wrap(() -> seen.append(PatchTargets.greeting));

        work.run();
        work.run();

        assertThat(seen).hasToString("heyhey");
        assertThat(PatchTargets.greeting).isEqualTo("hello");
    }

    @Test
    void callRestoresWhenTheWorkThrows()
    {
        SettingsOverride override = SettingsOverride.of(PatchTargets.class, Map.of("retries", "42"));

        assertThatThrownBy(() -> override.call(() ->
        {   throw new IllegalArgumentException("retries=" + PatchTargets.retries);
        })).hasMessage("retries=42");

        assertThat(PatchTargets.retries).isEqualTo(3);
        assertThat(override.isEnabled()).isFalse();
    }

    @DisplayName("enable() is all-or-nothing: a bad setting rolls back the good ones")
    @Test
    void failedEnableRollsBack()
    {
        // GIVEN: the second setting does not exist
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put("greeting", "hi");
        settings.put("doesNotExist", "x");
        SettingsOverride override = SettingsOverride.of(PatchTargets.class, settings);

        // WHEN / THEN:
        assertThatThrownBy(override::enable)
            .isInstanceOfSatisfying(PatchException.class, e -> assertThat(e.getCauseEnum()).isEqualTo(Cause.TARGET_NOT_FOUND));
        assertThat(PatchTargets.greeting).isEqualTo("hello");
        assertThat(override.isEnabled()).isFalse();
    }

    @Test
    void enablingTwiceFails()
    {
        try (SettingsOverride override = SettingsOverride.of(PatchTargets.class, Map.of("greeting", "hi")).enable())
        {   assertThatThrownBy(override::enable)
                .isInstanceOfSatisfying(PatchException.class, e -> assertThat(e.getCauseEnum()).isEqualTo(Cause.DOUBLE_ACTIVATION));
        }
        assertThat(PatchTargets.greeting).isEqualTo("hello");
    }

    @Test
    void overridesSharingARegistryConflictOnTheSameSetting()
    {
        PatchRegistry registry = new PatchRegistry();
        try (SettingsOverride first = new SettingsOverride(registry, PatchTargets.class.getName(), Map.of("greeting", "a")).enable())
        {   SettingsOverride second = new SettingsOverride(registry, PatchTargets.class.getName(), Map.of("greeting", "b"));

            assertThatThrownBy(second::enable)
                .isInstanceOfSatisfying(PatchException.class, e -> assertThat(e.getCauseEnum()).isEqualTo(Cause.TARGET_CONFLICT));
            assertThat(PatchTargets.greeting).isEqualTo("a");
        }
        registry.close();
    }
}
