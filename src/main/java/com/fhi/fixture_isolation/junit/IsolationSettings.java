package com.fhi.fixture_isolation.junit;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

import org.junit.jupiter.api.extension.ExtensionContext;

import com.fhi.fixture_isolation.copy.FixtureCopier;
import com.fhi.fixture_isolation.copy.JacksonFixtureCopier;
import com.fhi.fixture_isolation.copy.ReflectiveFixtureCopier;
import com.fhi.fixture_isolation.fixture.RestoreStrategy;
import com.fhi.fixture_isolation.store.FixtureStore;

/**
 * JUnit configuration parameters (e.g. in {@code junit-platform.properties}) read by the
 * isolation extensions. Annotation attributes, when set, take precedence.
 *
 * <pre>
 * fixture.isolation.restore=deep_copy|reload
 * fixture.isolation.copier=reflective|jackson
 * fixture.isolation.virtual-time.zone=UTC
 * fixture.isolation.patches.fail-on-unbalanced=true
 * </pre>
 */
public final class IsolationSettings
{
    public static final String RESTORE = "fixture.isolation.restore";
    public static final String COPIER = "fixture.isolation.copier";
    public static final String VIRTUAL_TIME_ZONE = "fixture.isolation.virtual-time.zone";
    public static final String FAIL_ON_UNBALANCED = "fixture.isolation.patches.fail-on-unbalanced";

    // Private constructor to prevent instantiation
    private IsolationSettings() {}

    static RestoreStrategy restore(ExtensionContext context, IsolatedFixtures annotation)
    {
        if (annotation != null && annotation.restore() != IsolatedFixtures.Restore.CONFIGURED)
        {   return RestoreStrategy.valueOf(annotation.restore().name());
        }
        return context.getConfigurationParameter(RESTORE)
                      .map(value -> RestoreStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_')))
                      .orElse(RestoreStrategy.DEEP_COPY);
    }

    /**
     * @param store the class's store, may be null; supplies the default copier
     */
    static FixtureCopier copier(ExtensionContext context, IsolatedFixtures annotation, FixtureStore store)
    {
        String choice;
        if (annotation != null && annotation.copier() != IsolatedFixtures.Copier.CONFIGURED)
        {   choice = annotation.copier().name();
        }
        else
        {   choice = context.getConfigurationParameter(COPIER).orElse("reflective");
        }
        return switch (choice.trim().toLowerCase(Locale.ROOT))
        {   case "jackson"    -> new JacksonFixtureCopier();
            case "reflective" -> store != null ? store.fixtureCopier() : new ReflectiveFixtureCopier();
            default           -> throw new IllegalArgumentException("Unknown " + COPIER + ": '" + choice + "' (expected reflective or jackson)");
        };
    }

    /**
     * Fixed-offset zones come back normalized, so {@code "UTC"} and the default are the same
     * {@link ZoneOffset#UTC}.
     */
    static ZoneId zone(ExtensionContext context, String annotationZone)
    {
        if (annotationZone != null && !annotationZone.isBlank())
        {   return ZoneId.of(annotationZone.trim()).normalized();
        }
        return context.getConfigurationParameter(VIRTUAL_TIME_ZONE)
                      .map(value -> ZoneId.of(value.trim()).normalized())
                      .orElse(ZoneOffset.UTC);
    }

    static boolean failOnUnbalanced(ExtensionContext context)
    {   return context.getConfigurationParameter(FAIL_ON_UNBALANCED, Boolean::parseBoolean).orElse(true);
    }
}
