package com.fhi.fixture_isolation.patch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.fhi.fixture_isolation.patch.OverrideSettings.Setting;

@OverrideSettings(namespace = PatchTargets.class, value = @Setting(name = "greeting", value = "class-level"))
class OverrideSettingsAnnotationTest
{
    @BeforeEach
    @AfterEach
    void settingsAreOnlyOverriddenAroundTheTestBody()
    {   assertThat(PatchTargets.greeting).isEqualTo("hello");
        assertThat(PatchTargets.retries).isEqualTo(3);
    }

    @Test
    void classLevelOverrideApplies()
    {   assertThat(PatchTargets.greeting).isEqualTo("class-level");
    }

    @Test
    @OverrideSettings(namespace = PatchTargets.class, value = { @Setting(name = "greeting", value = "method-level"),
                                                                @Setting(name = "retries", value = "12") })
    void methodLevelOverrideWins()
    {   assertThat(PatchTargets.greeting).isEqualTo("method-level");
        assertThat(PatchTargets.retries).isEqualTo(12);
    }

    @Test
    @OverrideSettings(namespaceName = "com.fhi.fixture_isolation.patch.PatchTargets$Nested",
                      value = @Setting(name = "value", value = "by name"))
    void namespaceCanBeGivenByName()
    {   assertThat(PatchTargets.Nested.value).isEqualTo("by name");
        assertThat(PatchTargets.greeting).isEqualTo("class-level");
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2 })
    void appliesToParameterizedTests(int ignored)
    {   assertThat(PatchTargets.greeting).isEqualTo("class-level");
    }
}
