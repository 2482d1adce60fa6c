package com.fhi.fixture_isolation.spring;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.Tag;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import com.fhi.fixture_isolation.junit.IsolatedFixtures;
import com.fhi.fixture_isolation.junit.VirtualTime;

/**
 * Meta-annotation for Spring Boot integration tests with isolated fixtures.
 *
 * This annotation:
 * - Boots the Spring application context (once per test class, cached across classes)
 * - Runs each test method in a transaction rolled back afterwards
 * - Snapshots the fixtures built in {@code @BeforeAll} and restores them before each test
 * - Runs each test on a virtual clock
 * - Registers the {@link com.fhi.fixture_isolation.store.JpaFixtureStore} used by the
 *   store helpers (clone, update, reload, assert)
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited

// Declared first so that the Spring extension is registered before the isolation extensions,
// which look the fixture store up in the test application context.
@SpringBootTest

// Activates the Spring 'test' profile: application.yml, overridden by application-test.yml.
@ActiveProfiles("test")

// Each test method runs in a transaction rolled back after the test. Store writes done by a
// test (updateInStore, cloneFixture) join that transaction and vanish with it.
// @BeforeAll methods run outside of it: their fixtures are committed.
@Transactional

@IsolatedFixtures
@VirtualTime

@Import(FixtureIsolationConfig.class)

// Filter with e.g. mvn test -Dgroups=IsolatedSpringTest
@Tag("IsolatedSpringTest")

public @interface IsolatedSpringTest
{}
