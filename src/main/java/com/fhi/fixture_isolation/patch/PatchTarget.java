package com.fhi.fixture_isolation.patch;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Objects;

import org.springframework.beans.SimpleTypeConverter;
import org.springframework.beans.TypeMismatchException;
import org.springframework.util.ClassUtils;
import org.springframework.util.ReflectionUtils;

/**
 * A resolved patch target: a non-final static field addressed by its fully-qualified
 * symbol path, e.g. {@code com.acme.orders.Defaults.pageSize}.
 *
 * <p>The part before the last dot is the class name (nested classes may use either
 * {@code Outer.Inner} or {@code Outer$Inner}), the part after it is the field name. The
 * field may be declared by a superclass of the named class.</p>
 */
public final class PatchTarget
{
    private final String path;
    private final Field field;

    private PatchTarget(String path, Field field)
    {   this.path = path;
        this.field = field;
    }

    /**
     * Resolves the given symbol path.
     *
     * @throws PatchException {@code TARGET_NOT_FOUND} if the class or the field does not exist,
     *                        {@code TARGET_NOT_PATCHABLE} if the field is final or not static
     */
    public static PatchTarget resolve(String path)
    {
        Objects.requireNonNull(path, "path");
        int lastDot = path.lastIndexOf('.');
        if (lastDot <= 0 || lastDot == path.length() - 1)
        {   throw PatchException.targetNotFound(path, "expected <fully.qualified.ClassName>.<fieldName>", null);
        }
        String className = path.substring(0, lastDot);
        String fieldName = path.substring(lastDot + 1);

        Class<?> owner;
        try
        {   owner = ClassUtils.forName(className, PatchTarget.class.getClassLoader());
        }
        catch (ClassNotFoundException | LinkageError e)
        {   throw PatchException.targetNotFound(path, "class '" + className + "' not found", e);
        }

        Field field = ReflectionUtils.findField(owner, fieldName);
        if (field == null)
        {   throw PatchException.targetNotFound(path, "no field '" + fieldName + "' in " + owner.getName(), null);
        }
        int modifiers = field.getModifiers();
        if (!Modifier.isStatic(modifiers))
        {   throw PatchException.targetNotPatchable(path, "field is not static");
        }
        if (Modifier.isFinal(modifiers))
        {   throw PatchException.targetNotPatchable(path, "field is final");
        }
        ReflectionUtils.makeAccessible(field);
        return new PatchTarget(path, field);
    }

    /**
     * Convenience for {@code resolve(owner.getName() + "." + fieldName)}.
     */
    public static PatchTarget resolve(Class<?> owner, String fieldName)
    {   return resolve(owner.getName() + "." + fieldName);
    }

    public String getPath()
    {   return path;
    }

    public Class<?> getType()
    {   return field.getType();
    }

    Object read()
    {   return ReflectionUtils.getField(field, null);
    }

    void write(Object value)
    {   ReflectionUtils.setField(field, null, value);
    }

    /**
     * Returns the given value in a form assignable to the target field.
     *
     * <p>Values that are already assignable are returned as-is. Strings are converted with
     * Spring's {@link SimpleTypeConverter} (so an annotation value {@code "42"} can patch an
     * {@code int} field).</p>
     *
     * @throws PatchException {@code INCOMPATIBLE_REPLACEMENT} if no conversion applies
     */
    public Object adapt(Object value)
    {
        Class<?> type = field.getType();
        if (value == null)
        {   if (type.isPrimitive())
            {   throw PatchException.incompatibleReplacement(path, type, null, null);
            }
            return null;
        }
        if (ClassUtils.isAssignableValue(type, value))
        {   return value;
        }
        if (value instanceof String)
        {   try
            {   return new SimpleTypeConverter().convertIfNecessary(value, type);
            }
            catch (TypeMismatchException e)
            {   throw PatchException.incompatibleReplacement(path, type, value, e);
            }
        }
        throw PatchException.incompatibleReplacement(path, type, value, null);
    }

    @Override
    public String toString()
    {   return path;
    }
}
