package com.fhi.fixture_isolation.junit;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Runs each test against a {@link com.fhi.fixture_isolation.time.VirtualClock}.
 *
 * <p>Before each test, a new virtual clock is created and the time layer
 * ({@link com.fhi.fixture_isolation.time.TimeSource} by default) is redirected to it. After
 * the test, real time is restored. The clock can be injected as a parameter:</p>
 * <pre>{@code
 *    @Test
 *    @VirtualTime(start = "2024-02-29T10:00:00Z")
 *    void expiresAfterOneDay(VirtualClock clock)
 *    {   clock.advance(Duration.ofDays(1));
 *        ...
 *    }
 * }</pre>
 *
 * <p>A method annotation takes precedence over the class one.</p>
 */
@Target({ ElementType.TYPE, ElementType.METHOD })
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@ExtendWith(VirtualTimeExtension.class)
@ExtendWith(PatchLifecycleExtension.class)
public @interface VirtualTime
{
    /**
     * Start instant, ISO-8601 ({@code 2024-02-29T10:00:00Z}, with an offset or zone, or a local
     * date-time interpreted in {@link #zone()}). Blank: the real current instant.
     */
    String start() default "";

    /**
     * Zone of the clock. Blank: {@code fixture.isolation.virtual-time.zone}, itself defaulting
     * to UTC.
     */
    String zone() default "";

    /**
     * Static {@code Clock} field to redirect, {@code fully.qualified.Class.field}.
     */
    String clockField() default "com.fhi.fixture_isolation.time.TimeSource.clock";

    /**
     * Static {@code DateTimeFactory} field to redirect. Blank for holders with only a clock.
     */
    String dateTimeField() default "com.fhi.fixture_isolation.time.TimeSource.dateTimeFactory";
}
