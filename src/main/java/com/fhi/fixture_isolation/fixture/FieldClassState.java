package com.fhi.fixture_isolation.fixture;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.util.ReflectionUtils;

/**
 * {@link ClassState} over the fields of a test class.
 *
 * <p>Slots are the non-final static fields of the class and its superclasses and, when a test
 * instance is given (single instance per class), its non-final instance fields. A field
 * declared in a subclass hides a superclass field of the same name.</p>
 */
public class FieldClassState implements ClassState
{
    private final Object testInstance;
    private final Map<String, Field> fields = new LinkedHashMap<>();

    /**
     * @param testInstance the shared test instance, or null to only consider static fields
     */
    public FieldClassState(Class<?> testClass, Object testInstance)
    {
        this.testInstance = testInstance;
        for (Class<?> current = testClass; current != null && current != Object.class; current = current.getSuperclass())
        {   for (Field field : current.getDeclaredFields())
            {   int modifiers = field.getModifiers();
                if (field.isSynthetic() || Modifier.isFinal(modifiers)) continue;
                if (!Modifier.isStatic(modifiers) && testInstance == null) continue;
                if (fields.containsKey(field.getName())) continue;
                ReflectionUtils.makeAccessible(field);
                fields.put(field.getName(), field);
            }
        }
    }

    public static FieldClassState ofStatics(Class<?> testClass)
    {   return new FieldClassState(testClass, null);
    }

    @Override
    public Map<String, Object> values()
    {
        Map<String, Object> values = new LinkedHashMap<>();
        fields.forEach((name, field) -> values.put(name, read(field)));
        return Collections.unmodifiableMap(values);
    }

    @Override
    public boolean has(String name)
    {   return fields.containsKey(name);
    }

    @Override
    public Object get(String name)
    {   return read(field(name));
    }

    @Override
    public void set(String name, Object value)
    {
        Field field = field(name);
        ReflectionUtils.setField(field, Modifier.isStatic(field.getModifiers()) ? null : testInstance, value);
    }

    private Field field(String name)
    {
        Field field = fields.get(name);
        if (field == null)
        {   throw new IllegalArgumentException("No fixture slot named '" + name + "', known: " + fields.keySet());
        }
        return field;
    }

    private Object read(Field field)
    {   return ReflectionUtils.getField(field, Modifier.isStatic(field.getModifiers()) ? null : testInstance);
    }
}
