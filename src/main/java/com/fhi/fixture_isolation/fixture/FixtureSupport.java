package com.fhi.fixture_isolation.fixture;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.springframework.beans.ConfigurablePropertyAccessor;
import org.springframework.beans.PropertyAccessorFactory;

import com.fhi.fixture_isolation.copy.FixtureCopier;
import com.fhi.fixture_isolation.patch.PatchRegistry;
import com.fhi.fixture_isolation.store.FixtureStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-class fixture helpers handed to tests: cloning fixtures into the store, writing to the
 * store behind a fixture's back, reloading and asserting against the store, forgetting.
 *
 * <p>Field names are field names of the entity (accessed directly, not through getters);
 * nested paths such as {@code "owner.name"} are accepted.</p>
 */
@Slf4j
public class FixtureSupport
{
    private final FixtureRegistry registry;
    private final ClassState classState;
    private final FixtureCopier copier;
    private final FixtureStore store;
    private final PatchRegistry patchRegistry;

    /**
     * @param store may be null; store operations then fail with {@link IllegalStateException}
     */
    public FixtureSupport(FixtureRegistry registry, ClassState classState, FixtureCopier copier,
                          FixtureStore store, PatchRegistry patchRegistry)
    {   this.registry = Objects.requireNonNull(registry, "registry");
        this.classState = Objects.requireNonNull(classState, "classState");
        this.copier = Objects.requireNonNull(copier, "copier");
        this.store = store;
        this.patchRegistry = Objects.requireNonNull(patchRegistry, "patchRegistry");
    }

    /**
     * Deep copy of the fixture, with its persistent identity cleared and the overrides
     * applied, inserted into the store as a new record.
     *
     * @return the copy, carrying its new identity; the original is untouched
     */
    public <T> T cloneFixture(T fixture, Map<String, ?> overrides)
    {
        FixtureStore target = requireStore();
        T copy = copier.copy(fixture);
        target.clearIdentity(copy);
        applyFields(copy, overrides);
        Object id = target.insert(copy);
        log.debug("Cloned {} as new record {}", describe(fixture), id);
        return copy;
    }

    public <T> T cloneFixture(T fixture)
    {   return cloneFixture(fixture, Map.of());
    }

    /**
     * Writes the field values to the stored record of the fixture. The in-memory fixture keeps
     * its old values: only the store changes.
     */
    public void updateInStore(Object fixture, Map<String, ?> fields)
    {
        FixtureStore target = requireStore();
        Object id = target.identityOf(fixture)
                          .orElseThrow(() -> new IllegalArgumentException(describe(fixture) + " has no persistent identity"));
        target.update(fixture.getClass(), id, new LinkedHashMap<>(fields));
    }

    /**
     * {@link #updateInStore(Object, Map)} with alternating names and values:
     * {@code updateInStore(pet, "name", "Rex", "age", 3)}.
     */
    public void updateInStore(Object fixture, Object... namesAndValues)
    {   updateInStore(fixture, pairs(namesAndValues));
    }

    /**
     * A fresh object with the stored state of the fixture.
     */
    @SuppressWarnings("unchecked")
    public <T> T reloadFromStore(T fixture)
    {
        FixtureStore target = requireStore();
        Object id = target.identityOf(fixture)
                          .orElseThrow(() -> new IllegalArgumentException(describe(fixture) + " has no persistent identity"));
        return (T) target.get(fixture.getClass(), id);
    }

    /**
     * Asserts that the stored record of the fixture (or the fixture itself, when it has no
     * persistent identity) holds the expected field values. Fails on the first mismatch.
     */
    public void assertFieldsMatchStore(Object fixture, Map<String, ?> expected)
    {
        Object actual = fixture;
        if (store != null && store.identityOf(fixture).isPresent())
        {   actual = reloadFromStore(fixture);
        }
        ConfigurablePropertyAccessor fields = PropertyAccessorFactory.forDirectFieldAccess(actual);
        for (Map.Entry<String, ?> entry : expected.entrySet())
        {   assertThat(fields.getPropertyValue(entry.getKey()))
                .as("field '%s' of %s", entry.getKey(), describe(fixture))
                .isEqualTo(entry.getValue());
        }
    }

    public void assertFieldsMatchStore(Object fixture, Object... namesAndValues)
    {   assertFieldsMatchStore(fixture, pairs(namesAndValues));
    }

    /**
     * Removes the fixture from the restore cycle for the rest of the class run.
     *
     * @return the slot name it was registered under; empty if it was not registered
     */
    public Optional<String> forget(Object fixture)
    {   return registry.forget(classState, fixture);
    }

    public FixtureRegistry getRegistry()
    {   return registry;
    }

    public ClassState getClassState()
    {   return classState;
    }

    public PatchRegistry getPatchRegistry()
    {   return patchRegistry;
    }

    /**
     * @throws IllegalStateException if no store is configured for the test class
     */
    public FixtureStore getStore()
    {   return requireStore();
    }

    public boolean hasStore()
    {   return store != null;
    }

    // =====================================================================

    private FixtureStore requireStore()
    {
        if (store == null)
        {   throw new IllegalStateException("No FixtureStore configured: declare one with @IsolatedFixtures(store = ...) "
                                          + "or run the test with a Spring context providing a FixtureStore bean");
        }
        return store;
    }

    private static void applyFields(Object target, Map<String, ?> values)
    {
        if (values.isEmpty()) return;
        ConfigurablePropertyAccessor fields = PropertyAccessorFactory.forDirectFieldAccess(target);
        values.forEach(fields::setPropertyValue);
    }

    static Map<String, Object> pairs(Object... namesAndValues)
    {
        if (namesAndValues.length % 2 != 0)
        {   throw new IllegalArgumentException("Expected name/value pairs, got " + namesAndValues.length + " argument(s)");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2)
        {   map.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
        }
        return map;
    }

    private String describe(Object fixture)
    {
        if (fixture == null) return "null";
        String id = store == null ? null : store.identityOf(fixture).map(String::valueOf).orElse(null);
        return fixture.getClass().getSimpleName() + (id != null ? "#" + id : "");
    }
}
