package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.List;
import java.util.Set;

/**
 * {@link CalendarRepository} backed by the application's relational database.
 */
@Repository
class JdbcCalendarRepository implements CalendarRepository {

    private final JdbcClient jdbcClient;

    JdbcCalendarRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    @Override
    public List<CalendarBlock> findBlocks(long organizationId, DateRange range, @Nullable Set<Long> workerIds) {
        if (workerIds != null && workerIds.isEmpty()) {
            return List.of();
        }

        var sql = new StringBuilder("""
                SELECT id, worker_id, title, block_type, description, start_datetime, end_datetime,
                       is_all_day, recurrence_rule, is_private, blocks_availability, color
                FROM calendar_blocks
                WHERE organization_id = :organizationId
                  AND start_datetime < :rangeEnd
                  AND end_datetime >= :rangeStart
                """);
        var params = new HashMap<String, Object>();
        params.put("organizationId", organizationId);
        params.put("rangeStart", range.firstMoment());
        params.put("rangeEnd", range.end().plusDays(1).atStartOfDay());
        if (workerIds != null) {
            sql.append(" AND worker_id IN (:workerIds)");
            params.put("workerIds", workerIds);
        }
        sql.append(" ORDER BY start_datetime, id");

        return jdbcClient.sql(sql.toString())
                .params(params)
                .query((rs, rowNum) -> new CalendarBlock(
                        rs.getLong("id"),
                        rs.getLong("worker_id"),
                        rs.getString("title"),
                        rs.getString("block_type") != null ? rs.getString("block_type") : "other",
                        rs.getString("description"),
                        rs.getTimestamp("start_datetime").toLocalDateTime(),
                        rs.getTimestamp("end_datetime").toLocalDateTime(),
                        rs.getBoolean("is_all_day"),
                        rs.getString("recurrence_rule"),
                        rs.getBoolean("is_private"),
                        rs.getBoolean("blocks_availability"),
                        rs.getString("color")))
                .list();
    }

    @Override
    public List<LeaveRequest> findApprovedLeave(long organizationId, DateRange range, @Nullable Set<Long> workerIds) {
        if (workerIds != null && workerIds.isEmpty()) {
            return List.of();
        }

        var sql = new StringBuilder("""
                SELECT id, worker_id, start_date, end_date, leave_type, status, days_count, notes
                FROM leave_requests
                WHERE organization_id = :organizationId
                  AND status = 'approved'
                  AND start_date <= :rangeEnd
                  AND end_date >= :rangeStart
                """);
        var params = new HashMap<String, Object>();
        params.put("organizationId", organizationId);
        params.put("rangeStart", range.start());
        params.put("rangeEnd", range.end());
        if (workerIds != null) {
            sql.append(" AND worker_id IN (:workerIds)");
            params.put("workerIds", workerIds);
        }
        sql.append(" ORDER BY start_date, id");

        return jdbcClient.sql(sql.toString())
                .params(params)
                .query((rs, rowNum) -> new LeaveRequest(
                        rs.getLong("id"),
                        rs.getLong("worker_id"),
                        rs.getDate("start_date").toLocalDate(),
                        rs.getDate("end_date").toLocalDate(),
                        rs.getString("leave_type"),
                        LeaveStatus.parse(rs.getString("status")),
                        rs.getBigDecimal("days_count"),
                        rs.getString("notes")))
                .list();
    }

    @Override
    public List<PublicHoliday> findPublicHolidays(long organizationId, DateRange range) {
        return jdbcClient.sql("""
                        SELECT id, name, holiday_date, country, region
                        FROM public_holidays
                        WHERE organization_id = :organizationId
                          AND holiday_date BETWEEN :rangeStart AND :rangeEnd
                        ORDER BY holiday_date, id
                        """)
                .param("organizationId", organizationId)
                .param("rangeStart", range.start())
                .param("rangeEnd", range.end())
                .query((rs, rowNum) -> new PublicHoliday(
                        rs.getLong("id"),
                        rs.getString("name"),
                        rs.getDate("holiday_date").toLocalDate(),
                        rs.getString("country"),
                        rs.getString("region")))
                .list();
    }

    @Override
    public List<WorkItem> findWorkItems(long organizationId, DateRange range,
                                        @Nullable Set<Long> workerIds, @Nullable Set<Long> teamIds) {
        var sql = new StringBuilder("""
                SELECT id, title, due_date, assigned_to, team_id, status, work_item_type
                FROM work_items
                WHERE organization_id = :organizationId
                  AND due_date BETWEEN :rangeStart AND :rangeEnd
                """);
        var params = new HashMap<String, Object>();
        params.put("organizationId", organizationId);
        params.put("rangeStart", range.start());
        params.put("rangeEnd", range.end());

        if (workerIds != null || teamIds != null) {
            var hasWorkers = workerIds != null && !workerIds.isEmpty();
            var hasTeams = teamIds != null && !teamIds.isEmpty();
            if (!hasWorkers && !hasTeams) {
                return List.of();
            }
            if (hasWorkers && hasTeams) {
                sql.append(" AND (assigned_to IN (:workerIds) OR team_id IN (:teamIds))");
                params.put("workerIds", workerIds);
                params.put("teamIds", teamIds);
            } else if (hasWorkers) {
                sql.append(" AND assigned_to IN (:workerIds)");
                params.put("workerIds", workerIds);
            } else {
                sql.append(" AND team_id IN (:teamIds)");
                params.put("teamIds", teamIds);
            }
        }
        sql.append(" ORDER BY due_date, id");

        return jdbcClient.sql(sql.toString())
                .params(params)
                .query((rs, rowNum) -> new WorkItem(
                        rs.getLong("id"),
                        rs.getString("title"),
                        rs.getDate("due_date") != null ? rs.getDate("due_date").toLocalDate() : null,
                        nullableLong(rs, "assigned_to"),
                        nullableLong(rs, "team_id"),
                        rs.getString("status"),
                        rs.getString("work_item_type")))
                .list();
    }

    private static @Nullable Long nullableLong(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, Long.class);
    }
}
