package com.fhi.fixture_isolation.junit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;

import com.fhi.fixture_isolation.fixture.FixtureSupport;
import com.fhi.fixture_isolation.patch.PatchRegistry;

/**
 * Per-class state shared by the isolation extensions, kept in the extension store of the test
 * class context so JUnit closes it when the class is done.
 *
 * <p>A {@code @Nested} class gets its own fixture support but shares the patch registry of its
 * outermost class.</p>
 */
final class IsolationStores
{
    static final Namespace NAMESPACE = Namespace.create("com.fhi.fixture_isolation");

    // Private constructor to prevent instantiation
    private IsolationStores() {}

    /**
     * The context of the test class, from a class or method context.
     */
    static ExtensionContext classContext(ExtensionContext context)
    {
        ExtensionContext current = context;
        while (current.getTestMethod().isPresent() && current.getParent().isPresent())
        {   current = current.getParent().get();
        }
        return current;
    }

    /**
     * The test class's patch registry, created on first use. Its balance check runs when the
     * class context is closed.
     */
    static PatchRegistry patchRegistry(ExtensionContext context)
    {
        ExtensionContext classContext = classContext(context);
        return classContext.getStore(NAMESPACE)
                           .getOrComputeIfAbsent(ClosingPatchRegistry.class,
                                                 key -> new ClosingPatchRegistry(new PatchRegistry(IsolationSettings.failOnUnbalanced(classContext))),
                                                 ClosingPatchRegistry.class)
                           .registry;
    }

    // Stores are looked up through the parent contexts: the key names the class so that a
    // @Nested class does not see the support of its enclosing class as its own.

    static void putFixtureSupport(ExtensionContext context, FixtureSupport support)
    {
        ExtensionContext classContext = classContext(context);
        classContext.getStore(NAMESPACE).put(supportKey(classContext), support);
    }

    /**
     * @return the class's fixture support, null if the class is not isolated
     */
    static FixtureSupport fixtureSupport(ExtensionContext context)
    {
        ExtensionContext classContext = classContext(context);
        return classContext.getStore(NAMESPACE).get(supportKey(classContext), FixtureSupport.class);
    }

    /**
     * Fixture supports of the test class and of the classes enclosing it ({@code @Nested}),
     * outermost first.
     */
    static List<FixtureSupport> enclosingFixtureSupports(ExtensionContext context)
    {
        Deque<FixtureSupport> supports = new ArrayDeque<>();
        Optional<ExtensionContext> current = Optional.of(classContext(context));
        while (current.isPresent() && current.get().getTestClass().isPresent())
        {   ExtensionContext classContext = current.get();
            FixtureSupport support = classContext.getStore(NAMESPACE).get(supportKey(classContext), FixtureSupport.class);
            if (support != null) supports.addFirst(support);
            current = classContext.getParent();
        }
        return new ArrayList<>(supports);
    }

    private static String supportKey(ExtensionContext classContext)
    {   return FixtureSupport.class.getSimpleName() + ":" + classContext.getRequiredTestClass().getName();
    }

    private static final class ClosingPatchRegistry implements ExtensionContext.Store.CloseableResource
    {
        private final PatchRegistry registry;

        ClosingPatchRegistry(PatchRegistry registry)
        {   this.registry = registry;
        }

        @Override
        public void close()
        {   registry.close();
        }
    }
}
