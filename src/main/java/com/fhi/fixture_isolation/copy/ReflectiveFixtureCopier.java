package com.fhi.fixture_isolation.copy;

import java.io.File;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.InetAddress;
import java.net.URI;
import java.net.URL;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Currency;
import java.util.Date;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

import org.springframework.objenesis.Objenesis;
import org.springframework.objenesis.SpringObjenesis;
import org.springframework.util.ReflectionUtils;

import lombok.extern.slf4j.Slf4j;

/**
 * Reflection-based deep copy of arbitrary object graphs.
 *
 * <p>How each value is handled:</p>
 * <ul>
 *   <li>immutable values ({@code String}, boxed primitives, enums, {@code java.time} types,
 *       {@code BigDecimal}, {@code UUID}, {@code Class}, ...) are shared;</li>
 *   <li>arrays, collections and maps are rebuilt with deep-copied elements. JDK collections
 *       with a public no-arg constructor keep their class, sorted ones keep their comparator,
 *       unmodifiable ones stay unmodifiable, anything else (e.g. an ORM's persistent
 *       collections) becomes the closest JDK collection;</li>
 *   <li>records are rebuilt through their canonical constructor;</li>
 *   <li>{@code Date} and {@code Calendar} are cloned;</li>
 *   <li>{@code StringBuilder}, atomics and cloneable JDK types (e.g. {@code BitSet}) are
 *       copied through their own API; stateless JDK values (comparators, lambdas) and handles
 *       ({@code Path}, {@code Charset}, reflection members, ...) are shared. Any other JDK type
 *       raises {@link FixtureCopyException}: its internals cannot be opened reflectively;</li>
 *   <li>every other object is instantiated without running a constructor and has each
 *       instance field (including inherited ones) deep-copied.</li>
 * </ul>
 *
 * <p>An identity map of already-copied objects makes the copy cycle safe and preserves
 * aliasing: two references to one source object become two references to one copy.</p>
 *
 * <p>Two hooks adapt the copier to a persistence provider: {@code shareAsIs} marks values
 * that must not be traversed (uninitialised lazy associations), {@code unwrap} replaces a
 * value by the object to copy (the target of a proxy).</p>
 */
@Slf4j
public class ReflectiveFixtureCopier implements FixtureCopier
{
    private static final Set<Class<?>> IMMUTABLE_TYPES = Set.of(
            String.class, Boolean.class, Character.class, Byte.class, Short.class, Integer.class,
            Long.class, Float.class, Double.class, BigDecimal.class, BigInteger.class, UUID.class,
            Class.class, Locale.class, Currency.class, URI.class, URL.class, Pattern.class);

    // stateless, or handles to shared infrastructure
    private static final List<Class<?>> SHARED_JDK_TYPES = List.of(
            Comparator.class, Charset.class, Path.class, File.class, InetAddress.class, Member.class, ClassLoader.class);

    private static final List<String> JDK_PACKAGE_PREFIXES = List.of("java.", "javax.", "jdk.", "sun.", "com.sun.");

    private final Predicate<Object> shareAsIs;
    private final UnaryOperator<Object> unwrap;
    private final Objenesis objenesis = new SpringObjenesis();

    public ReflectiveFixtureCopier()
    {   this(value -> false, UnaryOperator.identity());
    }

    /**
     * @param shareAsIs values for which this returns true are shared, not copied
     * @param unwrap    applied to every value before it is copied
     */
    public ReflectiveFixtureCopier(Predicate<Object> shareAsIs, UnaryOperator<Object> unwrap)
    {   this.shareAsIs = shareAsIs;
        this.unwrap = unwrap;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T copy(T value)
    {   return (T) copy(value, new IdentityHashMap<>());
    }

    private Object copy(Object source, Map<Object, Object> copies)
    {
        if (source == null) return null;
        if (shareAsIs.test(source)) return source;

        Object known = copies.get(source);
        if (known != null) return known;

        Object value = unwrap.apply(source);
        if (value == null) return null;
        if (value != source)
        {   known = copies.get(value);
            if (known != null)
            {   copies.put(source, known);
                return known;
            }
        }

        Object copy = copyValue(value, copies);
        copies.put(value, copy);
        if (value != source) copies.put(source, copy);
        return copy;
    }

    private Object copyValue(Object value, Map<Object, Object> copies)
    {
        Class<?> type = value.getClass();
        if (isImmutable(value)) return value;

        try
        {   if (type.isArray())                return copyArray(value, copies);
            if (value instanceof Collection)   return copyCollection((Collection<?>) value, copies);
            if (value instanceof Map)          return copyMap((Map<?, ?>) value, copies);
            if (value instanceof Optional)     return copyOptional((Optional<?>) value, copies);
            if (type.isRecord())               return copyRecord(value, copies);
            if (value instanceof Date)         return ((Date) value).clone();
            if (value instanceof Calendar)     return ((Calendar) value).clone();
            if (isJdkType(type))               return copyJdkValue(value, copies);
            return copyFields(value, copies);
        }
        catch (FixtureCopyException e)
        {   throw e;
        }
        catch (RuntimeException | ReflectiveOperationException e)
        {   throw new FixtureCopyException(type, e.getMessage(), e);
        }
    }

    // =====================================================================
    // Leaves
    // =====================================================================

    private static boolean isImmutable(Object value)
    {
        Class<?> type = value.getClass();
        return IMMUTABLE_TYPES.contains(type)
            || value instanceof Enum
            || type.getPackageName().startsWith("java.time");
    }

    private static boolean isJdkType(Class<?> type)
    {
        String name = type.getName();
        for (String prefix : JDK_PACKAGE_PREFIXES)
        {   if (name.startsWith(prefix)) return true;
        }
        return false;
    }

    private static boolean isSharedJdkValue(Object value)
    {
        Class<?> type = value.getClass();
        return type == Object.class
            || type.isHidden()
            || SHARED_JDK_TYPES.stream().anyMatch(shared -> shared.isInstance(value));
    }

    /**
     * JDK internals cannot be opened reflectively: the common mutable types are copied through
     * their own API, anything else that is neither shareable nor cloneable is refused.
     */
    private Object copyJdkValue(Object value, Map<Object, Object> copies) throws ReflectiveOperationException
    {
        Class<?> type = value.getClass();
        if (isSharedJdkValue(value))
        {   log.trace("Sharing JDK value of type {}", type.getName());
            return value;
        }
        if (value instanceof StringBuilder) return new StringBuilder((StringBuilder) value);
        if (value instanceof StringBuffer)  return new StringBuffer((StringBuffer) value);
        if (value instanceof AtomicInteger) return new AtomicInteger(((AtomicInteger) value).get());
        if (value instanceof AtomicLong)    return new AtomicLong(((AtomicLong) value).get());
        if (value instanceof AtomicBoolean) return new AtomicBoolean(((AtomicBoolean) value).get());
        if (value instanceof AtomicReference)
        {   AtomicReference<Object> copy = new AtomicReference<>();
            copies.put(value, copy);
            copy.set(copy(((AtomicReference<?>) value).get(), copies));
            return copy;
        }
        if (value instanceof Cloneable)
        {   Method clone = type.getMethod("clone");
            return clone.invoke(value);
        }
        throw new FixtureCopyException(type, "mutable JDK type without a known copy, share it through the copier hook "
                                           + "or keep it out of fixtures", null);
    }

    // =====================================================================
    // Containers
    // =====================================================================

    private Object copyArray(Object array, Map<Object, Object> copies)
    {
        int length = Array.getLength(array);
        Class<?> componentType = array.getClass().getComponentType();
        Object copy = Array.newInstance(componentType, length);
        copies.put(array, copy);
        if (componentType.isPrimitive())
        {   System.arraycopy(array, 0, copy, 0, length);
            return copy;
        }
        for (int i = 0; i < length; i++)
        {   Array.set(copy, i, copy(Array.get(array, i), copies));
        }
        return copy;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private Object copyCollection(Collection<?> source, Map<Object, Object> copies)
    {
        if (source instanceof EnumSet)
        {   return ((EnumSet) source).clone();
        }
        Collection<Object> target = newCollection(source);
        copies.put(source, target);
        for (Object element : source)
        {   target.add(copy(element, copies));
        }
        if (!isUnmodifiable(source))
        {   return target;
        }
        if (target instanceof SortedSet) return Collections.unmodifiableSortedSet((SortedSet<Object>) target);
        if (target instanceof Set)       return Collections.unmodifiableSet((Set<Object>) target);
        if (target instanceof List)      return Collections.unmodifiableList((List<Object>) target);
        return Collections.unmodifiableCollection(target);
    }

    @SuppressWarnings("unchecked")
    private Collection<Object> newCollection(Collection<?> source)
    {
        if (source instanceof SortedSet)
        {   return new TreeSet<>((Comparator<Object>) ((SortedSet<?>) source).comparator());
        }
        Object instance = instantiateJdkContainer(source.getClass());
        if (instance != null)
        {   return (Collection<Object>) instance;
        }
        if (source instanceof Set)   return new LinkedHashSet<>();
        if (source instanceof Deque) return new ArrayDeque<>();
        return new ArrayList<>();
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private Object copyMap(Map<?, ?> source, Map<Object, Object> copies)
    {
        Map<Object, Object> target;
        if (source instanceof SortedMap)
        {   target = new TreeMap<>((Comparator<Object>) ((SortedMap<?, ?>) source).comparator());
        }
        else if (source instanceof EnumMap)
        {   target = new EnumMap((EnumMap) source);
            target.clear();
        }
        else
        {   Object instance = instantiateJdkContainer(source.getClass());
            target = instance != null ? (Map<Object, Object>) instance : new LinkedHashMap<>();
        }
        copies.put(source, target);
        for (Map.Entry<?, ?> entry : source.entrySet())
        {   target.put(copy(entry.getKey(), copies), copy(entry.getValue(), copies));
        }
        if (!isUnmodifiable(source))
        {   return target;
        }
        return target instanceof SortedMap
                ? Collections.unmodifiableSortedMap((SortedMap<Object, Object>) target)
                : Collections.unmodifiableMap(target);
    }

    private Object copyOptional(Optional<?> source, Map<Object, Object> copies)
    {   return source.map(inner -> copy(inner, copies));
    }

    /**
     * A new empty instance of a public {@code java.util} container class through its public
     * no-arg constructor, or null if there is none.
     */
    private static Object instantiateJdkContainer(Class<?> type)
    {
        if (!type.getName().startsWith("java.util.") || !Modifier.isPublic(type.getModifiers()))
        {   return null;
        }
        try
        {   return type.getConstructor().newInstance();
        }
        catch (ReflectiveOperationException | RuntimeException e)
        {   return null;
        }
    }

    private static boolean isUnmodifiable(Object container)
    {
        String name = container.getClass().getName();
        return name.startsWith("java.util.ImmutableCollections$")
            || name.startsWith("java.util.Collections$Unmodifiable");
    }

    // =====================================================================
    // Records and plain objects
    // =====================================================================

    private Object copyRecord(Object record, Map<Object, Object> copies) throws ReflectiveOperationException
    {
        RecordComponent[] components = record.getClass().getRecordComponents();
        Class<?>[] parameterTypes = new Class<?>[components.length];
        Object[] arguments = new Object[components.length];
        for (int i = 0; i < components.length; i++)
        {   parameterTypes[i] = components[i].getType();
            ReflectionUtils.makeAccessible(components[i].getAccessor());
            arguments[i] = copy(components[i].getAccessor().invoke(record), copies);
        }
        Constructor<?> canonical = record.getClass().getDeclaredConstructor(parameterTypes);
        ReflectionUtils.makeAccessible(canonical);
        return canonical.newInstance(arguments);
    }

    private Object copyFields(Object source, Map<Object, Object> copies)
    {
        Class<?> type = source.getClass();
        Object target = objenesis.newInstance(type);
        copies.put(source, target);

        for (Class<?> current = type; current != null && !isJdkType(current); current = current.getSuperclass())
        {   for (Field field : current.getDeclaredFields())
            {   if (Modifier.isStatic(field.getModifiers())) continue;
                try
                {   ReflectionUtils.makeAccessible(field);
                }
                catch (InaccessibleObjectException e)
                {   throw new FixtureCopyException(type, "field '" + field.getName() + "' is not accessible", e);
                }
                Object fieldValue = ReflectionUtils.getField(field, source);
                Object fieldCopy = field.getType().isPrimitive() ? fieldValue : copy(fieldValue, copies);
                ReflectionUtils.setField(field, target, fieldCopy);
            }
        }
        return target;
    }
}
