package com.fhi.fixture_isolation.fixture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FieldClassStateTest
{
    static class Base
    {
        static String shared = "base";
        static String shadowed = "base";
        static final String CONSTANT = "constant";
    }

    static class Derived extends Base
    {
        static String shadowed = "derived";
        static Integer count;
        String perInstance = "instance";
    }

    @Test
    void staticSlotsIncludeInheritedOnesAndSkipFinals()
    {
        FieldClassState state = FieldClassState.ofStatics(Derived.class);

        assertThat(state.values()).containsOnlyKeys("shadowed", "count", "shared");
        assertThat(state.get("shadowed")).isEqualTo("derived");
        assertThat(state.has("perInstance")).isFalse();
        assertThat(state.has("CONSTANT")).isFalse();
    }

    @Test
    void instanceSlotsNeedAnInstance()
    {
        Derived instance = new Derived();
        FieldClassState state = new FieldClassState(Derived.class, instance);

        state.set("perInstance", "changed");

        assertThat(instance.perInstance).isEqualTo("changed");
        assertThat(state.values()).containsKey("perInstance");
    }

    @Test
    void setWritesTheField()
    {
        FieldClassState state = FieldClassState.ofStatics(Derived.class);

        state.set("count", 5);
        try
        {   assertThat(Derived.count).isEqualTo(5);
        }
        finally
        {   Derived.count = null;
        }
    }

    @Test
    void unknownSlotsAreRejected()
    {
        assertThatThrownBy(() -> FieldClassState.ofStatics(Derived.class).get("nope"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
    }
}
