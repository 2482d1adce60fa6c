package com.fhi.fixture_isolation.junit;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.InvocationInterceptor;
import org.junit.jupiter.api.extension.ReflectiveInvocationContext;
import org.junit.platform.commons.support.AnnotationSupport;

import com.fhi.fixture_isolation.patch.OverrideSettings;
import com.fhi.fixture_isolation.patch.PatchRegistry;
import com.fhi.fixture_isolation.patch.PatchSuspension;
import com.fhi.fixture_isolation.patch.SettingsOverride;
import com.fhi.fixture_isolation.patch.SuspendPatches;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies the declarative patch annotations around each test method invocation:
 * {@link OverrideSettings} (class-level and method-level, the latter winning for a setting
 * declared on both) and {@link SuspendPatches}.
 *
 * <p>The overrides are enabled, then the suspensions applied, right before the test method
 * body, and everything is undone right after it in reverse order, whatever the outcome.
 * {@code @BeforeEach} and {@code @AfterEach} methods see the settings as they are outside the
 * test.</p>
 *
 * <p>The extension also owns the test class's {@link PatchRegistry}: it is created in
 * {@code beforeAll} and its balance check runs when the class is done.</p>
 */
@Slf4j
public class PatchLifecycleExtension implements BeforeAllCallback, InvocationInterceptor
{
    @Override
    public void beforeAll(ExtensionContext context)
    {   IsolationStores.patchRegistry(context);
    }

    @Override
    public void interceptTestMethod(Invocation<Void> invocation, ReflectiveInvocationContext<Method> invocationContext,
                                    ExtensionContext extensionContext) throws Throwable
    {   proceedPatched(invocation, extensionContext);
    }

    @Override
    public void interceptTestTemplateMethod(Invocation<Void> invocation, ReflectiveInvocationContext<Method> invocationContext,
                                            ExtensionContext extensionContext) throws Throwable
    {   proceedPatched(invocation, extensionContext);
    }

    private void proceedPatched(Invocation<Void> invocation, ExtensionContext context) throws Throwable
    {
        PatchRegistry registry = IsolationStores.patchRegistry(context);
        List<SettingsOverride> overrides = settingsOverrides(context, registry);
        String[] suspendedNames = AnnotationSupport.findAnnotation(context.getTestMethod(), SuspendPatches.class)
                                                   .map(SuspendPatches::value)
                                                   .orElse(new String[0]);

        List<SettingsOverride> enabled = new ArrayList<>();
        try
        {   for (SettingsOverride override : overrides)
            {   enabled.add(override.enable());
            }
            PatchSuspension suspension = suspendedNames.length == 0 ? null : registry.suspend(suspendedNames);
            try
            {   invocation.proceed();
            }
            finally
            {   if (suspension != null) suspension.resume();
            }
        }
        finally
        {   disableAll(enabled);
        }
    }

    private static void disableAll(List<SettingsOverride> enabled)
    {
        RuntimeException failure = null;
        for (int i = enabled.size() - 1; i >= 0; i--)
        {   try
            {   enabled.get(i).disable();
            }
            catch (RuntimeException e)
            {   if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        if (failure != null) throw failure;
    }

    private static List<SettingsOverride> settingsOverrides(ExtensionContext context, PatchRegistry registry)
    {
        List<OverrideSettings> annotations = new ArrayList<>(
                AnnotationSupport.findRepeatableAnnotations(context.getRequiredTestClass(), OverrideSettings.class));
        context.getTestMethod().ifPresent(method ->
                annotations.addAll(AnnotationSupport.findRepeatableAnnotations(method, OverrideSettings.class)));

        // a method-level setting replaces a class-level one of the same name
        Map<String, Map<String, Object>> byNamespace = new LinkedHashMap<>();
        for (OverrideSettings annotation : annotations)
        {   Map<String, Object> settings = byNamespace.computeIfAbsent(namespaceOf(annotation), ns -> new LinkedHashMap<>());
            Arrays.stream(annotation.value()).forEach(setting -> settings.put(setting.name(), setting.value()));
        }
        List<SettingsOverride> overrides = new ArrayList<>();
        byNamespace.forEach((namespace, settings) -> overrides.add(new SettingsOverride(registry, namespace, settings)));
        if (!overrides.isEmpty())
        {   log.debug("{} settings override(s) around {}", overrides.size(), context.getDisplayName());
        }
        return overrides;
    }

    private static String namespaceOf(OverrideSettings annotation)
    {
        if (annotation.namespace() != void.class)
        {   return annotation.namespace().getName();
        }
        if (annotation.namespaceName().isBlank())
        {   throw new IllegalArgumentException("@OverrideSettings needs a namespace or a namespaceName");
        }
        return annotation.namespaceName();
    }
}
