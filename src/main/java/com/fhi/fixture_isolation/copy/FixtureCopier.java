package com.fhi.fixture_isolation.copy;

/**
 * Deep-copy primitive used for fixture snapshots and restores.
 *
 * <p>A copy must be structurally equal to its source and share no mutable state with it:
 * mutating the copy, or anything reachable from it, never changes the source.</p>
 */
public interface FixtureCopier
{
    /**
     * @return an independent deep copy of {@code value}; {@code null} for {@code null}
     * @throws FixtureCopyException if some part of the value graph cannot be copied
     */
    <T> T copy(T value);
}
