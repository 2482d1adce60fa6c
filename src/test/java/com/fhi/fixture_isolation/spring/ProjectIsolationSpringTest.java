package com.fhi.fixture_isolation.spring;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;

import com.fhi.fixture_isolation.fixture.FixtureSupport;
import com.fhi.fixture_isolation.junit.VirtualTime;
import com.fhi.fixture_isolation.patch.OverrideSettings;
import com.fhi.fixture_isolation.patch.OverrideSettings.Setting;
import com.fhi.fixture_isolation.store.JpaFixtureStore;
import com.fhi.fixture_isolation.testapp.Project;
import com.fhi.fixture_isolation.testapp.ProjectDefaults;
import com.fhi.fixture_isolation.testapp.ProjectRepository;
import com.fhi.fixture_isolation.testapp.ProjectStatus;
import com.fhi.fixture_isolation.testapp.Team;
import com.fhi.fixture_isolation.testapp.TeamRepository;
import com.fhi.fixture_isolation.time.VirtualClock;

import lombok.extern.slf4j.Slf4j;

/**
 * Run with
 * $ mvn clean test -Dtest=ProjectIsolationSpringTest
 */
@IsolatedSpringTest

// Single test instance, so the @BeforeAll method can use the injected repositories.
@TestInstance(TestInstance.Lifecycle.PER_CLASS)

// Ensures test methods are run in a specific order using @Order(n)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)

@Slf4j
class ProjectIsolationSpringTest
{
    @Autowired
    private ProjectRepository projectRepository;

    @Autowired
    private TeamRepository teamRepository;

    private Team team;
    private Project project;
    private Project project2;

    @BeforeAll
    void buildFixtures(FixtureSupport fixtures)
    {
        log.debug("");
        team = teamRepository.save(new Team("Core"));
        project = projectRepository.save(new Project("Apollo", team));
        project2 = projectRepository.save(new Project("Gemini", team));

        // project2 is deleted by a test below; keep it out of the restore cycle from the start
        fixtures.forget(project2);
    }

    @Order(1)
    @Test
    void storeComesFromTheSpringContext(FixtureSupport fixtures)
    {
        assertThat(fixtures.getStore()).isInstanceOf(JpaFixtureStore.class);
        assertThat(fixtures.getRegistry().getRegisteredKeys()).containsExactlyInAnyOrder("team", "project");
    }

    @Order(2)
    @DisplayName("Mutating fixtures in a test...")
    @Test
    void mutateFixtures()
    {
        project.setName("Changed");
        project.getTeam().setName("Changed team");
        project.setStatus(ProjectStatus.ARCHIVED);
        project2.setName("Changed too");
    }

    @Order(3)
    @DisplayName("...does not leak into the next one")
    @Test
    void fixturesAreRestored()
    {
        assertThat(project.getName()).isEqualTo("Apollo");
        assertThat(project.getTeam().getName()).isEqualTo("Core");
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.DRAFT);
        assertThat(project2.getName()).isEqualTo("Changed too");
    }

    @Order(4)
    @DisplayName("updateInStore writes to the database only")
    @Test
    void updateInStore(FixtureSupport fixtures)
    {
        // WHEN:
        fixtures.updateInStore(project, "name", "Apollo (stored)", "budget", 500);

        // THEN:
        assertThat(project.getName()).isEqualTo("Apollo");
        fixtures.assertFieldsMatchStore(project, Map.of("name", "Apollo (stored)", "budget", 500));
        assertThat(projectRepository.findById(project.getId()).orElseThrow().getName()).isEqualTo("Apollo (stored)");
    }

    @Order(5)
    @DisplayName("The test transaction rolled the store update back")
    @Test
    void storeUpdateRolledBack(FixtureSupport fixtures)
    {
        assertThat(fixtures.reloadFromStore(project).getName()).isEqualTo("Apollo");
    }

    @Order(6)
    @VirtualTime(start = "2031-05-01T09:00:00Z")
    @DisplayName("cloneFixture inserts a new row, stamped with virtual time")
    @Test
    void cloneFixture(FixtureSupport fixtures, VirtualClock clock)
    {
        // GIVEN:
        long before = projectRepository.count();

        // WHEN:
        Project clone = fixtures.cloneFixture(project, Map.of("name", "Apollo II"));

        // THEN:
        assertThat(clone.getId()).isNotNull().isNotEqualTo(project.getId());
        assertThat(clone.getCreatedAt()).isEqualTo(Instant.parse("2031-05-01T09:00:00Z")).isEqualTo(clock.instant());
        assertThat(clone.getTeam().getId()).isEqualTo(team.getId());
        fixtures.assertFieldsMatchStore(clone, "name", "Apollo II", "status", ProjectStatus.DRAFT);
        assertThat(project.getName()).isEqualTo("Apollo");
        assertThat(projectRepository.count()).isEqualTo(before + 1);
    }

    @Order(7)
    @OverrideSettings(namespace = ProjectDefaults.class, value = { @Setting(name = "pageSize", value = "5"),
                                                                   @Setting(name = "archivingEnabled", value = "false") })
    @Test
    void settingsOverriddenForThisTest()
    {
        assertThat(ProjectDefaults.pageSize()).isEqualTo(5);
        assertThat(ProjectDefaults.archivingEnabled()).isFalse();
        assertThat(ProjectDefaults.currency()).isEqualTo("EUR");
    }

    @Order(8)
    @Test
    void settingsBackToDefaults()
    {
        assertThat(ProjectDefaults.pageSize()).isEqualTo(20);
        assertThat(ProjectDefaults.archivingEnabled()).isTrue();
    }

    @Order(9)
    @DisplayName("A fixture deleted by a test is forgotten, and stays as the test left it")
    @Test
    void deleteAndForget(FixtureSupport fixtures)
    {
        projectRepository.deleteById(project.getId());
        project.setName("Deleted");

        assertThat(fixtures.forget(project)).contains("project");
    }

    @Order(10)
    @Test
    void forgottenFixtureIsNotRestored(FixtureSupport fixtures)
    {
        assertThat(project.getName()).isEqualTo("Deleted");
        assertThat(team.getName()).isEqualTo("Core");
        assertThat(fixtures.getRegistry().getForgottenKeys()).containsExactly("project2", "project");
    }
}
