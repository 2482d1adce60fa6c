package com.fhi.fixture_isolation.patch;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.extension.ExtendWith;

import com.fhi.fixture_isolation.junit.PatchLifecycleExtension;

/**
 * Overrides static setting fields of a namespace class while a test method runs.
 *
 * <p>On a method, applies to that method; on a class, applies to every test method of the
 * class. The settings are patched just before the test method body is invoked and restored
 * right after it, whatever the outcome.</p>
 *
 * <p>Example:</p>
 * <pre>{@code
 *    @OverrideSettings(namespace = Defaults.class,
 *                      value = { @Setting(name = "pageSize", value = "5"),
 *                                @Setting(name = "currency", value = "EUR") })
 *    @Test
 *    void pagesAreSmall() { ... }
 * }</pre>
 *
 * <p>Values are strings, converted to the field type (see {@link PatchTarget#adapt(Object)}).</p>
 */
@Target({ ElementType.TYPE, ElementType.METHOD })
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
@Repeatable(OverrideSettings.List.class)
@ExtendWith(PatchLifecycleExtension.class)
public @interface OverrideSettings
{
    /**
     * Class holding the setting fields.
     */
    Class<?> namespace() default void.class;

    /**
     * Fully-qualified name of the class holding the setting fields, for classes not visible
     * from the test. Used when {@link #namespace()} is not set.
     */
    String namespaceName() default "";

    Setting[] value();

    /**
     * One overridden setting.
     */
    @Target({})
    @Retention(RetentionPolicy.RUNTIME)
    @interface Setting
    {
        String name();

        String value();
    }

    @Target({ ElementType.TYPE, ElementType.METHOD })
    @Retention(RetentionPolicy.RUNTIME)
    @Documented
    @Inherited
    @ExtendWith(PatchLifecycleExtension.class)
    @interface List
    {
        OverrideSettings[] value();
    }
}
