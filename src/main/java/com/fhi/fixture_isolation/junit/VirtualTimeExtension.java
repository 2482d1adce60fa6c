package com.fhi.fixture_isolation.junit;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.platform.commons.support.AnnotationSupport;

import com.fhi.fixture_isolation.time.ClockVirtualization;
import com.fhi.fixture_isolation.time.VirtualClock;

import lombok.extern.slf4j.Slf4j;

/**
 * JUnit 5 extension behind {@link VirtualTime}: one {@link ClockVirtualization} per test
 * method, activated before each and deactivated after each, whatever the outcome.
 */
@Slf4j
public class VirtualTimeExtension implements BeforeEachCallback, AfterEachCallback, ParameterResolver
{
    @Override
    public void beforeEach(ExtensionContext context)
    {
        VirtualTime settings = findSettings(context);
        if (settings == null) return;

        ZoneId zone = IsolationSettings.zone(context, settings.zone());
        VirtualClock clock = new VirtualClock(parseStart(settings.start(), zone), zone);
        ClockVirtualization virtualization = new ClockVirtualization(IsolationStores.patchRegistry(context), clock,
                                                                     settings.clockField(), settings.dateTimeField());
        context.getStore(IsolationStores.NAMESPACE).put(ClockVirtualization.class, virtualization);
        virtualization.activate();
    }

    @Override
    public void afterEach(ExtensionContext context)
    {
        ClockVirtualization virtualization = context.getStore(IsolationStores.NAMESPACE)
                                                    .remove(ClockVirtualization.class, ClockVirtualization.class);
        if (virtualization != null)
        {   virtualization.deactivate();
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {   return parameterContext.getParameter().getType() == VirtualClock.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {
        ClockVirtualization virtualization = extensionContext.getStore(IsolationStores.NAMESPACE)
                                                             .get(ClockVirtualization.class, ClockVirtualization.class);
        if (virtualization == null)
        {   throw new ParameterResolutionException("No virtual clock in " + extensionContext.getDisplayName()
                                                 + ": it only exists around test methods annotated (or in a class annotated) with @VirtualTime");
        }
        return virtualization.getClock();
    }

    // =====================================================================

    private static VirtualTime findSettings(ExtensionContext context)
    {
        Optional<VirtualTime> onMethod = AnnotationSupport.findAnnotation(context.getTestMethod(), VirtualTime.class);
        if (onMethod.isPresent()) return onMethod.get();
        return AnnotationSupport.findAnnotation(context.getRequiredTestClass(), VirtualTime.class).orElse(null);
    }

    static Instant parseStart(String start, ZoneId zone)
    {
        if (start == null || start.isBlank())
        {   return Instant.now();
        }
        try
        {   return ZonedDateTime.parse(start).toInstant();
        }
        catch (DateTimeParseException e)
        {   log.trace("'{}' is not a zoned date-time, trying a local one", start);
        }
        try
        {   return LocalDateTime.parse(start).atZone(zone).toInstant();
        }
        catch (DateTimeParseException e)
        {   throw new IllegalArgumentException("Invalid @VirtualTime start '" + start
                                             + "': expected an ISO-8601 date-time such as 2024-02-29T10:00:00Z", e);
        }
    }
}
