package com.fhi.fixture_isolation.store;

import java.util.Map;
import java.util.Optional;

import com.fhi.fixture_isolation.copy.FixtureCopier;
import com.fhi.fixture_isolation.copy.ReflectiveFixtureCopier;

/**
 * The backing store fixtures are persisted in, addressed by persistent identity.
 *
 * <p>Implementations do not catch or retry failures: an unavailable store surfaces as the
 * implementation's own exception, unmodified.</p>
 */
public interface FixtureStore
{
    /**
     * Fetches a fresh in-memory representation of the stored entity. Two calls never return
     * the same instance, and the result shares no state with previously fetched objects.
     *
     * @throws RuntimeException (implementation specific) if nothing is stored under that id
     */
    <T> T get(Class<T> type, Object id);

    /**
     * Writes the given field values to the stored entity, without touching any in-memory
     * instance of it.
     */
    void update(Class<?> type, Object id, Map<String, Object> fields);

    /**
     * Stores a new entity. The entity receives its new persistent identity.
     *
     * @return the new persistent identity
     */
    Object insert(Object entity);

    /**
     * The persistent identity of the given value, if it is a stored entity type and has one.
     */
    Optional<Object> identityOf(Object value);

    /**
     * Clears the persistent identity (and any version marker) of an in-memory entity, so that
     * {@link #insert(Object)} creates a new record for it.
     */
    void clearIdentity(Object entity);

    /**
     * Copier suited to the objects this store hands out.
     */
    default FixtureCopier fixtureCopier()
    {   return new ReflectiveFixtureCopier();
    }
}
