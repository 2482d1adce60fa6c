package com.fhi.fixture_isolation.patch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * A scope during which a set of previously active patches is stopped.
 *
 * <p>Obtained from {@link PatchRegistry#suspend(List)}. {@link #resume()} (or {@link #close()},
 * so the scope works with try-with-resources) restarts exactly the patches that were active
 * when the suspension began, in the same order. Patches that were inactive are left alone,
 * so the state of every patch after the resume equals its state before the suspension.</p>
 *
 * <pre>{@code
 * try (PatchSuspension s = registry.suspend(registry.find("clock")))
 * {   // real time here
 * }
 * // virtual time again
 * }</pre>
 */
@Slf4j
public final class PatchSuspension implements AutoCloseable
{
    private final PatchRegistry registry;
    private final List<Patch> suspended;
    private boolean resumed;

    PatchSuspension(PatchRegistry registry, List<Patch> suspended)
    {   this.registry = registry;
        this.suspended = new ArrayList<>(suspended);
    }

    /**
     * Patches stopped by this suspension, in suspension order.
     */
    public List<Patch> getSuspended()
    {   return Collections.unmodifiableList(suspended);
    }

    public boolean isResumed()
    {   return resumed;
    }

    /**
     * Restarts the suspended patches. Every patch is attempted even if an earlier one fails;
     * the first failure is rethrown with the others attached as suppressed exceptions.
     * Calling it a second time does nothing.
     */
    public void resume()
    {
        if (resumed) return;
        resumed = true;

        RuntimeException failure = null;
        for (Patch patch : suspended)
        {   try
            {   registry.start(patch);
            }
            catch (RuntimeException e)
            {   if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        log.debug("Resumed {} patch(es)", suspended.size());
        if (failure != null) throw failure;
    }

    @Override
    public void close()
    {   resume();
    }
}
