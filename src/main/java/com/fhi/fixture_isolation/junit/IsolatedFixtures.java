package com.fhi.fixture_isolation.junit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.extension.ExtendWith;

import com.fhi.fixture_isolation.store.FixtureStore;

/**
 * Isolates the fixtures a test class builds in its one-time setup ({@code @BeforeAll}).
 *
 * <p>Every non-final static field (and, with {@code @TestInstance(PER_CLASS)}, instance field)
 * assigned by the {@code @BeforeAll} methods is snapshotted once, then rebound to a fresh copy
 * of its snapshot before each test. Tests may mutate fixtures freely.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 *    @IsolatedFixtures
 *    class ProjectTest
 *    {
 *        static Project project;
 *
 *        @BeforeAll
 *        static void setUp(FixtureSupport fixtures) { project = ...; }
 *
 *        @Test
 *        void renames() { project.setName("x"); }      // next test sees the original name
 *    }
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@ExtendWith(FixtureIsolationExtension.class)
@ExtendWith(PatchLifecycleExtension.class)
public @interface IsolatedFixtures
{
    /**
     * How fixtures are restored. Defaults to {@code fixture.isolation.restore}, itself
     * defaulting to deep copies.
     */
    Restore restore() default Restore.CONFIGURED;

    /**
     * How fixtures are copied. Defaults to {@code fixture.isolation.copier}, itself defaulting
     * to the reflective copier (the store's own flavour of it, when there is a store).
     */
    Copier copier() default Copier.CONFIGURED;

    /**
     * Store implementation to instantiate for the class (must have a no-arg constructor).
     * When left to {@code FixtureStore.class}, the store is the {@link FixtureStore} bean of the
     * Spring test context, if the class runs with one; otherwise there is no store.
     */
    Class<? extends FixtureStore> store() default FixtureStore.class;

    enum Restore { CONFIGURED, DEEP_COPY, RELOAD }

    enum Copier { CONFIGURED, REFLECTIVE, JACKSON }
}
