package com.fhi.fixture_isolation.patch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.extension.ExtendWith;

import com.fhi.fixture_isolation.junit.PatchLifecycleExtension;

/**
 * Suspends the named patches of the test class's {@link PatchRegistry} while the annotated
 * test method runs, and resumes them afterwards.
 *
 * <pre>{@code
 *    @SuspendPatches({ ClockVirtualization.CLOCK_PATCH, ClockVirtualization.DATE_TIME_PATCH })
 *    @Test
 *    void usesRealTime() { ... }
 * }</pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@ExtendWith(PatchLifecycleExtension.class)
public @interface SuspendPatches
{
    /**
     * Names under which the patches were registered.
     */
    String[] value();
}
