package com.fhi.fixture_isolation.patch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;

import lombok.extern.slf4j.Slf4j;

/**
 * Owner of the active patches of one test class.
 *
 * <p>Every patch started through the registry is tracked until it is stopped through the
 * registry. At the end of the test class, {@link #close()} checks that no patch is still
 * active: leftovers are stopped and reported, since a patch that outlives its test silently
 * changes the behaviour of the next test class.</p>
 *
 * <p>Patches may also be registered under a name, which lets {@link SuspendPatches} and
 * {@link #suspend(String...)} refer to them without holding a reference.</p>
 *
 * <p>The registry is not thread-safe: test methods of one class run one after the other.</p>
 */
@Slf4j
public class PatchRegistry implements AutoCloseable
{
    private final List<Patch> active = new ArrayList<>();
    private final Map<String, Patch> named = new LinkedHashMap<>();
    private final boolean failOnUnbalanced;

    public PatchRegistry()
    {   this(true);
    }

    /**
     * @param failOnUnbalanced if true, {@link #close()} throws when patches are still active;
     *                         otherwise it stops them and logs a warning.
     */
    public PatchRegistry(boolean failOnUnbalanced)
    {   this.failOnUnbalanced = failOnUnbalanced;
    }

    // =====================================================================
    // start / stop
    // =====================================================================

    /**
     * Starts the patch and tracks it.
     *
     * @throws PatchException {@code DOUBLE_ACTIVATION} if the patch is already active,
     *                        {@code TARGET_CONFLICT} if another active patch of this registry
     *                        has the same target, or a resolution cause from {@link Patch#start()}
     */
    public void start(Patch patch)
    {
        Objects.requireNonNull(patch, "patch");
        if (patch.isActive())
        {   throw PatchException.doubleActivation(patch.getTarget());
        }
        pruneStopped();
        for (Patch other : active)
        {   if (other.getTarget().equals(patch.getTarget()))
            {   throw PatchException.targetConflict(patch.getTarget());
            }
        }
        patch.start();
        active.add(patch);
    }

    /**
     * Stops the patch and stops tracking it.
     *
     * @throws PatchException {@code INACTIVE_PATCH_STOP} if the patch is not active
     */
    public void stop(Patch patch)
    {
        Objects.requireNonNull(patch, "patch");
        patch.stop();
        active.removeIf(p -> p == patch);
    }

    /**
     * Stops every tracked patch, most recently started first.
     */
    public void stopAll()
    {
        pruneStopped();
        List<Patch> reversed = new ArrayList<>(active);
        Collections.reverse(reversed);
        for (Patch patch : reversed)
        {   stop(patch);
        }
    }

    public List<Patch> getActivePatches()
    {   pruneStopped();
        return Collections.unmodifiableList(new ArrayList<>(active));
    }

    // patches stopped directly, bypassing the registry
    private void pruneStopped()
    {   active.removeIf(p -> !p.isActive());
    }

    // =====================================================================
    // Named patches
    // =====================================================================

    /**
     * Registers a patch under a name. A later registration with the same name replaces the
     * earlier one (each test registers its own clock patches, for instance).
     *
     * @return the patch, for chaining
     */
    public Patch register(String name, Patch patch)
    {   named.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(patch, "patch"));
        return patch;
    }

    /**
     * @throws PatchException {@code UNKNOWN_PATCH} if no patch is registered under that name
     */
    public Patch find(String name)
    {
        Patch patch = named.get(name);
        if (patch == null)
        {   throw PatchException.unknownPatch(name, named.keySet());
        }
        return patch;
    }

    // =====================================================================
    // Suspension
    // =====================================================================

    /**
     * Stops the active patches among the given ones, in order, and returns the scope that
     * restarts them. Inactive patches are skipped and stay inactive after the resume.
     *
     * <p>If stopping one of them fails, the ones already stopped are restarted before the
     * failure propagates.</p>
     */
    public PatchSuspension suspend(List<Patch> patches)
    {
        List<Patch> stopped = new ArrayList<>();
        for (Patch patch : patches)
        {   if (!patch.isActive())
            {   log.debug("Not suspending {}: not active", patch.getTarget());
                continue;
            }
            try
            {   stop(patch);
            }
            catch (RuntimeException e)
            {   new PatchSuspension(this, stopped).resume();
                throw e;
            }
            stopped.add(patch);
        }
        log.debug("Suspended {} patch(es): {}", stopped.size(), stopped);
        return new PatchSuspension(this, stopped);
    }

    public PatchSuspension suspend(Patch... patches)
    {   return suspend(Arrays.asList(patches));
    }

    /**
     * Suspends the patches registered under the given names.
     *
     * @throws PatchException {@code UNKNOWN_PATCH} if a name is not registered
     */
    public PatchSuspension suspend(String... names)
    {
        List<Patch> patches = new ArrayList<>();
        for (String name : names)
        {   patches.add(find(name));
        }
        return suspend(patches);
    }

    /**
     * Runs the work with the given patches suspended. The patches are resumed on every exit
     * path; an exception thrown by the work propagates after the resume.
     */
    public <T> T suspended(List<Patch> patches, Callable<T> work) throws Exception
    {
        try (PatchSuspension ignored = suspend(patches))
        {   return work.call();
        }
    }

    /**
     * Same as {@link #suspended(List, Callable)} for work that returns nothing and throws
     * no checked exception.
     */
    public void suspended(List<Patch> patches, Runnable work)
    {
        try (PatchSuspension ignored = suspend(patches))
        {   work.run();
        }
    }

    // =====================================================================
    // End of class
    // =====================================================================

    /**
     * Balance check: every patch started through this registry must have been stopped.
     *
     * @throws PatchException {@code UNBALANCED} listing the leftover patches (after stopping them)
     */
    @Override
    public void close()
    {
        pruneStopped();
        if (active.isEmpty())
        {   log.debug("PatchRegistry closed, all patches balanced");
            return;
        }
        List<String> leftovers = active.stream().map(Patch::getTarget).toList();
        stopAll();
        PatchException unbalanced = PatchException.unbalanced(leftovers);
        if (failOnUnbalanced)
        {   throw unbalanced;
        }
        log.warn("{} (stopped now)", unbalanced.getMessage());
    }
}
