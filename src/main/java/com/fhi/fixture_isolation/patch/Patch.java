package com.fhi.fixture_isolation.patch;

import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

/**
 * A single global substitution: while active, the static field named by {@link #getTarget()}
 * holds the replacement value instead of its original one.
 *
 * <p>Lifecycle: created inactive, {@link #start()} saves the original value and installs the
 * replacement, {@link #stop()} puts the original value back. The target is resolved on
 * {@code start()}, so a missing or unpatchable target fails when the patch is activated.</p>
 *
 * <p>Patches are process-wide state. Use a {@link PatchRegistry} to pair every start with a stop.</p>
 */
@Slf4j
public class Patch
{
    private final String target;
    private final Object replacement;

    private PatchTarget resolved;
    private Object original;
    private boolean active;

    public Patch(String target, Object replacement)
    {   this.target = Objects.requireNonNull(target, "target");
        this.replacement = replacement;
    }

    public static Patch of(String target, Object replacement)
    {   return new Patch(target, replacement);
    }

    public static Patch of(Class<?> owner, String fieldName, Object replacement)
    {   return new Patch(owner.getName() + "." + fieldName, replacement);
    }

    /**
     * Activates the substitution.
     *
     * @throws PatchException {@code DOUBLE_ACTIVATION} if already active, or any resolution
     *                        cause if the target cannot be patched with the replacement
     */
    public void start()
    {
        if (active)
        {   throw PatchException.doubleActivation(target);
        }
        if (resolved == null)
        {   resolved = PatchTarget.resolve(target);
        }
        Object value = resolved.adapt(replacement);
        original = resolved.read();
        resolved.write(value);
        active = true;
        log.debug("Patch started: {} = {} (was {})", target, value, original);
    }

    /**
     * Restores the original value.
     *
     * @throws PatchException {@code INACTIVE_PATCH_STOP} if the patch is not active
     */
    public void stop()
    {
        if (!active)
        {   throw PatchException.inactivePatchStop(target);
        }
        resolved.write(original);
        active = false;
        log.debug("Patch stopped: {} restored to {}", target, original);
        original = null;
    }

    public boolean isActive()
    {   return active;
    }

    public String getTarget()
    {   return target;
    }

    public Object getReplacement()
    {   return replacement;
    }

    @Override
    public String toString()
    {   return "Patch[" + target + (active ? ", active]" : ", inactive]");
    }
}
