package com.fhi.fixture_isolation.spring;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import com.fhi.fixture_isolation.store.JpaFixtureStore;

import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Registers the {@link JpaFixtureStore} of the application's persistence unit, which the
 * isolation extensions pick up from the Spring test context.
 *
 * <p>Imported by {@link IsolatedSpringTest}. Can be switched off with:</p>
 * <pre>
 *   fixture-isolation.store.enabled=false
 * </pre>
 * <p>in the test profile (e.g. in {@code application-test.yml}); store-backed helpers then
 * fail with an {@link IllegalStateException}.</p>
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(name = "fixture-isolation.store.enabled", havingValue = "true", matchIfMissing = true)
public class FixtureIsolationConfig
{
    @Bean
    public JpaFixtureStore jpaFixtureStore(EntityManagerFactory entityManagerFactory, PlatformTransactionManager transactionManager)
    {
        log.info("Registering JpaFixtureStore for fixture isolation");
        return new JpaFixtureStore(entityManagerFactory, transactionManager);
    }
}
