package com.fhi.fixture_isolation.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

import lombok.extern.slf4j.Slf4j;

/**
 * Overrides default values held in static fields of a "namespace" class, for the duration of
 * a block or of a test.
 *
 * <p>One {@link Patch} is created per setting, targeting {@code <namespace>.<settingName>}.
 * Works as a scoped context:</p>
 * <pre>{@code
 * try (SettingsOverride o = SettingsOverride.of(Defaults.class, Map.of("pageSize", 5)).enable())
 * {   ...
 * }
 * }</pre>
 * <p>as a wrapper around a unit of work ({@link #call(Callable)}, {@link #run(Runnable)},
 * {@link #wrap(Runnable)}), or declaratively through {@link OverrideSettings} on a test.</p>
 *
 * <p>{@link #enable()} is all-or-nothing: if one setting cannot be patched, the settings
 * already patched by the same call are restored before the error propagates.</p>
 */
@Slf4j
public class SettingsOverride implements AutoCloseable
{
    private final PatchRegistry registry;
    private final String namespace;
    private final Map<String, Object> settings;
    private final List<Patch> started = new ArrayList<>();

    /**
     * @param registry  registry that tracks the patches (usually the test class's one)
     * @param namespace fully-qualified name of the class holding the setting fields
     * @param settings  setting name to override value, applied in iteration order
     */
    public SettingsOverride(PatchRegistry registry, String namespace, Map<String, ?> settings)
    {   this.registry = Objects.requireNonNull(registry, "registry");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(settings));
    }

    /**
     * Standalone override with its own registry.
     */
    public static SettingsOverride of(String namespace, Map<String, ?> settings)
    {   return new SettingsOverride(new PatchRegistry(), namespace, settings);
    }

    public static SettingsOverride of(Class<?> namespace, Map<String, ?> settings)
    {   return of(namespace.getName(), settings);
    }

    /**
     * Patches all settings.
     *
     * @return this, so {@code enable()} can be called in a try-with-resources header
     * @throws PatchException if the override is already enabled or a setting cannot be patched;
     *                        in the latter case nothing stays patched
     */
    public SettingsOverride enable()
    {
        if (!started.isEmpty())
        {   throw PatchException.doubleActivation(namespace + ".*");
        }
        log.debug("Enabling {} setting override(s) on {}", settings.size(), namespace);
        for (Map.Entry<String, Object> setting : settings.entrySet())
        {   Patch patch = Patch.of(namespace + "." + setting.getKey(), setting.getValue());
            try
            {   registry.start(patch);
            }
            catch (RuntimeException e)
            {   log.debug("Setting '{}' could not be overridden, rolling back {} started patch(es)",
                          setting.getKey(), started.size());
                rollBack(e);
                throw e;
            }
            started.add(patch);
        }
        return this;
    }

    /**
     * Restores all settings, in reverse order. Does nothing if not enabled.
     */
    public void disable()
    {
        RuntimeException failure = null;
        for (int i = started.size() - 1; i >= 0; i--)
        {   try
            {   registry.stop(started.get(i));
            }
            catch (RuntimeException e)
            {   if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        started.clear();
        if (failure != null) throw failure;
    }

    public boolean isEnabled()
    {   return !started.isEmpty();
    }

    @Override
    public void close()
    {   disable();
    }

    /**
     * Runs the work with the settings overridden; they are restored even if the work throws.
     */
    public <T> T call(Callable<T> work) throws Exception
    {
        enable();
        try
        {   return work.call();
        }
        finally
        {   disable();
        }
    }

    public void run(Runnable work)
    {
        enable();
        try
        {   work.run();
        }
        finally
        {   disable();
        }
    }

    /**
     * Decorator form: returns a runnable that runs the given one with the settings overridden.
     */
    public Runnable wrap(Runnable work)
    {   return () -> run(work);
    }

    public String getNamespace()
    {   return namespace;
    }

    public Map<String, Object> getSettings()
    {   return settings;
    }

    private void rollBack(RuntimeException cause)
    {
        for (int i = started.size() - 1; i >= 0; i--)
        {   try
            {   registry.stop(started.get(i));
            }
            catch (RuntimeException e)
            {   cause.addSuppressed(e);
            }
        }
        started.clear();
    }
}
