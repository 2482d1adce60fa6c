package com.fhi.fixture_isolation.fixture;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fhi.fixture_isolation.copy.FixtureCopier;
import com.fhi.fixture_isolation.store.FixtureStore;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixtures created by the one-time setup of one test class, and their snapshots.
 *
 * <p>Lifecycle:</p>
 * <ol>
 *   <li>{@link #beginCapture(ClassState)} before one-time setup records the slot values;</li>
 *   <li>{@link #completeCapture(ClassState)} after it registers every slot whose value is new
 *       or changed, and keeps a deep copy of each as snapshot;</li>
 *   <li>{@link #restore(ClassState)} before each test rebinds every registered slot to a fresh
 *       copy of its snapshot, so a test mutating a fixture never affects the next one;</li>
 *   <li>{@link #forget(ClassState, Object)} drops a fixture from the restore cycle for the rest
 *       of the class run (e.g. after deleting it from the store).</li>
 * </ol>
 *
 * <p>Snapshots are never handed out: the slot always receives a copy.</p>
 */
@Slf4j
public class FixtureRegistry
{
    private static final ObjectMapper DUMP_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private enum Phase { NEW, CAPTURING, CAPTURED }

    private final String owner;
    private final FixtureCopier copier;
    private final FixtureStore store;
    private final RestoreStrategy strategy;

    private Phase phase = Phase.NEW;
    private Map<String, Object> before = Map.of();
    private final Map<String, Object> snapshots = new LinkedHashMap<>();
    private final Set<String> forgotten = new LinkedHashSet<>();
    private final List<Object> forgottenBeforeCapture = new ArrayList<>();

    /**
     * @param owner    name used in log messages, usually the test class name
     * @param store    backing store used to tell persistent identities and to reload; may be null
     * @param strategy how slots are restored
     */
    public FixtureRegistry(String owner, FixtureCopier copier, FixtureStore store, RestoreStrategy strategy)
    {   this.owner = owner;
        this.copier = Objects.requireNonNull(copier, "copier");
        this.store = store;
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    // =====================================================================
    // Capture
    // =====================================================================

    public void beginCapture(ClassState state)
    {
        if (phase != Phase.NEW)
        {   log.debug("{}: capture already begun, ignoring", owner);
            return;
        }
        before = new LinkedHashMap<>(state.values());
        phase = Phase.CAPTURING;
        log.debug("{}: capture begun over {} slot(s)", owner, before.size());
    }

    /**
     * Registers the slots one-time setup assigned and snapshots them. Only the first call
     * captures; later calls return an empty set.
     *
     * @return the captured keys
     * @throws IllegalStateException if {@link #beginCapture(ClassState)} was not called
     */
    public Set<String> completeCapture(ClassState state)
    {
        if (phase == Phase.CAPTURED)
        {   return Collections.emptySet();
        }
        if (phase == Phase.NEW)
        {   throw new IllegalStateException(owner + ": capture completed before it was begun");
        }

        Set<String> captured = new LinkedHashSet<>();
        for (Map.Entry<String, Object> entry : state.values().entrySet())
        {   String key = entry.getKey();
            Object value = entry.getValue();
            Object previous = before.get(key);
            if (previous == value || Objects.equals(previous, value)) continue;

            captured.add(key);
            if (matchesAny(value, forgottenBeforeCapture))
            {   forgotten.add(key);
                log.debug("{}: '{}' was forgotten during setup, not snapshotted", owner, key);
                continue;
            }
            snapshots.put(key, copier.copy(value));
        }
        forgottenBeforeCapture.clear();
        before = Map.of();
        phase = Phase.CAPTURED;
        log.info("{}: captured {} fixture(s) {}", owner, snapshots.size(), snapshots.keySet());
        if (log.isDebugEnabled())
        {   log.debug("{}: registry {}", owner, dump());
        }
        return captured;
    }

    /**
     * Begin, run the setup, complete. On a registry already capturing or captured, only runs
     * the setup.
     */
    public Set<String> captureAround(ClassState state, Runnable setup)
    {
        if (phase != Phase.NEW)
        {   log.debug("{}: setup already wrapped, running it without capture", owner);
            setup.run();
            return Collections.emptySet();
        }
        beginCapture(state);
        setup.run();
        return completeCapture(state);
    }

    // =====================================================================
    // Restore / forget
    // =====================================================================

    /**
     * Rebinds every registered, not forgotten slot to a fresh copy of its snapshot.
     */
    public void restore(ClassState state)
    {
        if (phase != Phase.CAPTURED)
        {   throw new IllegalStateException(owner + ": nothing captured yet");
        }
        for (Map.Entry<String, Object> entry : snapshots.entrySet())
        {   state.set(entry.getKey(), freshValue(entry.getValue()));
        }
        log.debug("{}: restored {} fixture(s)", owner, snapshots.size());
    }

    private Object freshValue(Object snapshot)
    {
        if (strategy == RestoreStrategy.RELOAD && store != null && snapshot != null)
        {   Optional<Object> id = store.identityOf(snapshot);
            if (id.isPresent())
            {   return store.get(snapshot.getClass(), id.get());
            }
        }
        return copier.copy(snapshot);
    }

    /**
     * Removes the fixture matching the given value from the restore cycle, for the rest of
     * the class run. A value matches when it has the same type and persistent identity as the
     * slot's live value or its snapshot (the same reference, for values without identity).
     *
     * <p>Called during one-time setup, the request is remembered and applied when the capture
     * completes.</p>
     *
     * @return the key removed, empty if no registered fixture matches
     */
    public Optional<String> forget(ClassState state, Object value)
    {
        if (phase != Phase.CAPTURED)
        {   forgottenBeforeCapture.add(value);
            Optional<String> key = state.values().entrySet().stream()
                                        .filter(e -> sameFixture(e.getValue(), value))
                                        .map(Map.Entry::getKey)
                                        .findFirst();
            log.debug("{}: forget {} before capture (slot {})", owner, value, key.orElse("unknown"));
            return key;
        }
        for (Map.Entry<String, Object> entry : snapshots.entrySet())
        {   String key = entry.getKey();
            Object live = state.has(key) ? state.get(key) : null;
            if (sameFixture(live, value) || sameFixture(entry.getValue(), value))
            {   snapshots.remove(key);
                forgotten.add(key);
                log.debug("{}: forgot '{}'", owner, key);
                return Optional.of(key);
            }
        }
        log.debug("{}: forget {} ignored, not a registered fixture", owner, value);
        return Optional.empty();
    }

    private boolean matchesAny(Object value, List<Object> candidates)
    {
        for (Object candidate : candidates)
        {   if (sameFixture(value, candidate)) return true;
        }
        return false;
    }

    boolean sameFixture(Object a, Object b)
    {
        if (a == null || b == null) return false;
        if (a == b) return true;
        if (store == null || a.getClass() != b.getClass()) return false;
        Optional<Object> idA = store.identityOf(a);
        return idA.isPresent() && idA.equals(store.identityOf(b));
    }

    // =====================================================================
    // Introspection
    // =====================================================================

    public boolean isCaptured()
    {   return phase == Phase.CAPTURED;
    }

    public Set<String> getRegisteredKeys()
    {   return Collections.unmodifiableSet(new LinkedHashSet<>(snapshots.keySet()));
    }

    public Set<String> getForgottenKeys()
    {   return Collections.unmodifiableSet(new LinkedHashSet<>(forgotten));
    }

    public RestoreStrategy getStrategy()
    {   return strategy;
    }

    Object snapshotOf(String key)
    {   return snapshots.get(key);
    }

    /**
     * JSON description of the registry (keys, types, identities), for debug logs.
     */
    public String dump()
    {
        Map<String, Object> description = new LinkedHashMap<>();
        snapshots.forEach((key, value) ->
        {   Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", value == null ? null : value.getClass().getName());
            entry.put("id", store == null || value == null ? null : store.identityOf(value).map(String::valueOf).orElse(null));
            description.put(key, entry);
        });
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("owner", owner);
        root.put("strategy", strategy);
        root.put("fixtures", description);
        root.put("forgotten", forgotten);
        try
        {   return DUMP_MAPPER.writeValueAsString(root);
        }
        catch (JsonProcessingException e)
        {   return root.toString();
        }
    }
}
