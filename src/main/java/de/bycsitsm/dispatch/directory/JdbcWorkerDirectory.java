package de.bycsitsm.dispatch.directory;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * {@link WorkerDirectory} backed by the application's relational database.
 * The field-service mapping lives in {@code worker_calendar_settings}.
 */
@Repository
class JdbcWorkerDirectory implements WorkerDirectory {

    private final JdbcClient jdbcClient;

    JdbcWorkerDirectory(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    @Override
    public List<Worker> listWorkersInOrg(long organizationId) {
        return jdbcClient.sql("""
                        SELECT w.id, w.full_name, w.email, s.external_admin_id
                        FROM workers w
                        LEFT JOIN worker_calendar_settings s ON s.worker_id = w.id
                        WHERE w.organization_id = :organizationId
                        ORDER BY w.id
                        """)
                .param("organizationId", organizationId)
                .query((rs, rowNum) -> new Worker(
                        rs.getLong("id"),
                        rs.getString("full_name") != null ? rs.getString("full_name") : "",
                        rs.getString("email"),
                        rs.getObject("external_admin_id", Long.class)))
                .list();
    }

    @Override
    public List<Team> listTeams(long organizationId) {
        return jdbcClient.sql("SELECT id, name FROM teams WHERE organization_id = :organizationId ORDER BY id")
                .param("organizationId", organizationId)
                .query((rs, rowNum) -> new Team(rs.getLong("id"), rs.getString("name")))
                .list();
    }

    @Override
    public List<TeamMembership> listTeamMemberships(long organizationId) {
        return jdbcClient.sql("""
                        SELECT m.team_id, m.worker_id, m.role
                        FROM team_members m
                        JOIN teams t ON t.id = m.team_id
                        WHERE t.organization_id = :organizationId
                        ORDER BY m.team_id, m.worker_id
                        """)
                .param("organizationId", organizationId)
                .query((rs, rowNum) -> new TeamMembership(
                        rs.getLong("team_id"),
                        rs.getLong("worker_id"),
                        rs.getString("role") != null ? rs.getString("role") : "member"))
                .list();
    }

    @Override
    public Optional<Long> getWorkerExternalMapping(long workerId) {
        return jdbcClient.sql("SELECT external_admin_id FROM worker_calendar_settings WHERE worker_id = :workerId")
                .param("workerId", workerId)
                .query((rs, rowNum) -> rs.getObject("external_admin_id", Long.class))
                .optional();
    }
}
