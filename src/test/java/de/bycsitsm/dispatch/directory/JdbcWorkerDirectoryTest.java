package de.bycsitsm.dispatch.directory;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class JdbcWorkerDirectoryTest {

    private final EmbeddedDatabase database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .addScript("schema.sql")
            .addScript("calendar-fixture.sql")
            .build();
    private final JdbcWorkerDirectory directory = new JdbcWorkerDirectory(JdbcClient.create(database));

    @AfterEach
    void shutdown() {
        database.shutdown();
    }

    @Test
    void workers_of_organization_carry_their_mapping() {
        var workers = directory.listWorkersInOrg(1);

        assertThat(workers).extracting(Worker::id).containsExactly(1L, 2L, 3L);
        assertThat(workers.get(0).externalAdminId()).isEqualTo(101L);
        assertThat(workers.get(1).externalAdminId()).isNull();
        assertThat(workers.get(2).displayName()).isEqualTo("robin.keller@example.com");
    }

    @Test
    void teams_and_memberships_are_scoped_to_organization() {
        assertThat(directory.listTeams(1)).extracting(Team::name).containsExactly("Installations");
        assertThat(directory.listTeamMemberships(1))
                .extracting(TeamMembership::workerId, TeamMembership::role)
                .containsExactly(
                        tuple(1L, "lead"),
                        tuple(2L, "member"));
    }

    @Test
    void external_mapping_is_empty_for_unmapped_workers() {
        assertThat(directory.getWorkerExternalMapping(1)).contains(101L);
        assertThat(directory.getWorkerExternalMapping(2)).isEmpty();
        assertThat(directory.getWorkerExternalMapping(3)).isEmpty();
    }
}
