package com.fhi.fixture_isolation.junit;

import java.lang.annotation.Annotation;
import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.TestInstance.Lifecycle;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.BeforeEachCallback;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.platform.commons.support.AnnotationSupport;
import org.springframework.beans.BeanUtils;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import com.fhi.fixture_isolation.copy.FixtureCopier;
import com.fhi.fixture_isolation.fixture.ClassState;
import com.fhi.fixture_isolation.fixture.FieldClassState;
import com.fhi.fixture_isolation.fixture.FixtureRegistry;
import com.fhi.fixture_isolation.fixture.FixtureSupport;
import com.fhi.fixture_isolation.fixture.RestoreStrategy;
import com.fhi.fixture_isolation.store.FixtureStore;

import lombok.extern.slf4j.Slf4j;

/**
 * JUnit 5 extension behind {@link IsolatedFixtures}.
 *
 * <ul>
 *   <li>{@code beforeAll}: creates the class's {@link FixtureRegistry} and records the class
 *       state, before any {@code @BeforeAll} method of the class runs;</li>
 *   <li>{@code beforeEach}: on the first call, all {@code @BeforeAll} methods have returned, so
 *       the fixtures they assigned are captured; then, on every call, the fixtures are
 *       restored.</li>
 * </ul>
 *
 * <p>Also resolves {@link FixtureSupport} parameters of lifecycle and test methods, including
 * {@code @BeforeAll} ones, so a fixture can be forgotten during one-time setup.</p>
 */
@Slf4j
public class FixtureIsolationExtension implements BeforeAllCallback, BeforeEachCallback, ParameterResolver
{
    // JUnit registers an extension type once per class, however many annotations declare it.
    // A second beginCapture on the same registry is ignored.

    @Override
    public void beforeAll(ExtensionContext context)
    {
        FixtureSupport support = IsolationStores.fixtureSupport(context);
        if (support == null)
        {   support = createFixtureSupport(context);
            IsolationStores.putFixtureSupport(context, support);
        }
        support.getRegistry().beginCapture(support.getClassState());
    }

    /**
     * Restores the fixtures of the test class and, for a {@code @Nested} class, those of its
     * enclosing classes, outermost first.
     */
    @Override
    public void beforeEach(ExtensionContext context)
    {
        if (IsolationStores.fixtureSupport(context) == null)
        {   throw new IllegalStateException("Fixture isolation was not initialised for " + context.getRequiredTestClass().getName());
        }
        for (FixtureSupport support : IsolationStores.enclosingFixtureSupports(context))
        {   FixtureRegistry registry = support.getRegistry();
            registry.completeCapture(support.getClassState());
            registry.restore(support.getClassState());
        }
    }

    // =====================================================================
    // Parameter resolution
    // =====================================================================

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {   return parameterContext.getParameter().getType() == FixtureSupport.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {
        FixtureSupport support = IsolationStores.fixtureSupport(extensionContext);
        if (support == null)
        {   throw new ParameterResolutionException("No FixtureSupport for " + extensionContext.getRequiredTestClass().getName()
                                                 + ": is the class annotated with @IsolatedFixtures?");
        }
        return support;
    }

    // =====================================================================
    // Set up
    // =====================================================================

    private FixtureSupport createFixtureSupport(ExtensionContext context)
    {
        Class<?> testClass = context.getRequiredTestClass();
        IsolatedFixtures annotation = findOnClassOrEnclosing(testClass, IsolatedFixtures.class);

        FixtureStore store = locateStore(context, annotation);
        FixtureCopier copier = IsolationSettings.copier(context, annotation, store);
        RestoreStrategy strategy = IsolationSettings.restore(context, annotation);

        // With a single instance per class, @BeforeAll methods may assign instance fields.
        Object sharedInstance = context.getTestInstanceLifecycle()
                                       .filter(lifecycle -> lifecycle == Lifecycle.PER_CLASS)
                                       .flatMap(lifecycle -> context.getTestInstance())
                                       .orElse(null);
        ClassState state = new FieldClassState(testClass, sharedInstance);

        FixtureRegistry registry = new FixtureRegistry(testClass.getSimpleName(), copier, store, strategy);
        log.debug("Fixture isolation for {}: strategy={}, copier={}, store={}",
                  testClass.getSimpleName(), strategy, copier.getClass().getSimpleName(),
                  store == null ? "none" : store.getClass().getSimpleName());
        return new FixtureSupport(registry, state, copier, store, IsolationStores.patchRegistry(context));
    }

    /**
     * The store declared on the annotation, else the Spring context's one, else none.
     */
    private static FixtureStore locateStore(ExtensionContext context, IsolatedFixtures annotation)
    {
        if (annotation != null && annotation.store() != FixtureStore.class)
        {   return BeanUtils.instantiateClass(annotation.store());
        }
        if (!runsWithSpring(context.getRequiredTestClass()))
        {   return null;
        }
        // We can't @Autowire into the extension: JUnit, not Spring, creates it.
        return SpringExtension.getApplicationContext(context)
                              .getBeanProvider(FixtureStore.class)
                              .getIfAvailable();
    }

    private static boolean runsWithSpring(Class<?> testClass)
    {
        for (Class<?> current = testClass; current != null; current = current.getEnclosingClass())
        {   boolean spring = AnnotationSupport.findRepeatableAnnotations(current, ExtendWith.class).stream()
                                              .anyMatch(extendWith -> Arrays.asList(extendWith.value()).contains(SpringExtension.class));
            if (spring) return true;
        }
        return false;
    }

    /**
     * A {@code @Nested} class inherits the settings of the class it is declared in.
     */
    private static <A extends Annotation> A findOnClassOrEnclosing(Class<?> testClass, Class<A> annotationType)
    {
        for (Class<?> current = testClass; current != null; current = current.getEnclosingClass())
        {   Optional<A> annotation = AnnotationSupport.findAnnotation(current, annotationType);
            if (annotation.isPresent()) return annotation.get();
        }
        return null;
    }
}
