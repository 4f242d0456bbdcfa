package com.p14n.pollevent.query;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.pollevent.buffer.EventBuffer;
import com.p14n.pollevent.data.MonitorConfig;
import com.p14n.pollevent.data.PersistedEvent;
import com.p14n.pollevent.db.EventStore;
import com.p14n.pollevent.db.SQL;

/**
 * Read-only access to persisted events. Never takes the write path, so it
 * keeps serving while ingestion is suppressed.
 */
public class QueryService {

    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 10_000;

    private final MonitorConfig config;
    private final EventStore store;
    private final EventBuffer buffer;

    private EventStatistics cachedStatistics;
    private long cachedVersion = -1;

    /**
     * @param config configuration
     * @param store  the store, {@code null} when monitoring is disabled
     * @param buffer the live buffer
     */
    public QueryService(MonitorConfig config, EventStore store, EventBuffer buffer) {
        this.config = config;
        this.store = store;
        this.buffer = buffer;
    }

    /**
     * Runs a filtered, paginated query.
     *
     * @throws InvalidQueryException    for invalid paging or time range
     * @throws IllegalStateException    when monitoring is disabled
     * @throws QueryFailedException     when the store cannot be read
     */
    public QueryResult query(EventQuery query) {
        if (store == null) {
            throw new IllegalStateException("Event monitoring is disabled");
        }
        int limit = query.limit() == null ? DEFAULT_LIMIT : query.limit();
        int offset = query.offset() == null ? 0 : query.offset();
        validate(query, limit, offset);

        StringBuilder where = new StringBuilder(" WHERE 1=1");
        List<Object> params = new ArrayList<>();
        if (query.startTime() != null) {
            where.append(" AND event_time >= ?");
            params.add(query.startTime());
        }
        if (query.endTime() != null) {
            where.append(" AND event_time < ?");
            params.add(query.endTime());
        }
        if (query.changeGroupId() != null) {
            where.append(" AND change_group_id = ?");
            params.add(query.changeGroupId());
        }
        if (!query.controls().isEmpty()) {
            where.append(" AND (");
            for (int i = 0; i < query.controls().size(); i++) {
                where.append(i == 0 ? "" : " OR ").append("control_path = ? OR control_name = ?");
                params.add(query.controls().get(i));
                params.add(query.controls().get(i));
            }
            where.append(")");
        }
        if (!query.components().isEmpty()) {
            where.append(" AND component_name IN (")
                    .append(String.join(",", Collections.nCopies(query.components().size(), "?")))
                    .append(")");
            params.addAll(query.components());
        }

        String countSql = "SELECT COUNT(*) FROM events" + where;
        String pageSql = "SELECT " + SQL.SELECT_COLS + " FROM events" + where + SQL.ORDER + " LIMIT ? OFFSET ?";
        try (Connection conn = store.dataSource().getConnection()) {
            long total;
            try (PreparedStatement stmt = conn.prepareStatement(countSql)) {
                setParams(stmt, params);
                try (ResultSet rs = stmt.executeQuery()) {
                    rs.next();
                    total = rs.getLong(1);
                }
            }
            List<PersistedEvent> events = new ArrayList<>();
            if (offset < total) {
                try (PreparedStatement stmt = conn.prepareStatement(pageSql)) {
                    setParams(stmt, params);
                    stmt.setInt(params.size() + 1, limit);
                    stmt.setInt(params.size() + 2, offset);
                    try (ResultSet rs = stmt.executeQuery()) {
                        while (rs.next()) {
                            events.add(SQL.eventFromResultSet(rs));
                        }
                    }
                }
            }
            return new QueryResult(events, total, limit, offset);
        } catch (SQLException e) {
            logger.atError().setCause(e).log("Query failed");
            throw new QueryFailedException("Query failed: " + e.getMessage(), e);
        }
    }

    private static void validate(EventQuery query, int limit, int offset) {
        if (limit <= 0) {
            throw new InvalidQueryException("limit must be positive: " + limit);
        }
        if (limit > MAX_LIMIT) {
            throw new InvalidQueryException("limit cannot exceed " + MAX_LIMIT + ": " + limit);
        }
        if (offset < 0) {
            throw new InvalidQueryException("offset cannot be negative: " + offset);
        }
        if (query.startTime() != null && query.endTime() != null && query.startTime() >= query.endTime()) {
            throw new InvalidQueryException("startTime must be before endTime");
        }
    }

    private static void setParams(PreparedStatement stmt, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            if (p instanceof Long l) {
                stmt.setLong(i + 1, l);
            } else {
                stmt.setString(i + 1, (String) p);
            }
        }
    }

    /**
     * Aggregates over the store plus live buffer numbers. Store aggregates are
     * recomputed only when the store has changed since the last call.
     */
    public EventStatistics statistics() {
        if (store == null) {
            return EventStatistics.disabled(config.retentionDays());
        }
        EventStatistics stored;
        synchronized (this) {
            long version = store.version();
            if (cachedStatistics == null || cachedVersion != version) {
                cachedStatistics = loadStatistics();
                cachedVersion = version;
            }
            stored = cachedStatistics;
        }
        return stored.withBuffer(buffer.size(), buffer.capacity(), buffer.overflowCount(), store.sizeBytes());
    }

    private EventStatistics loadStatistics() {
        String sql = """
                SELECT COUNT(*), COUNT(DISTINCT control_path), COUNT(DISTINCT change_group_id),
                       MIN(event_time), MAX(event_time)
                FROM events""";
        try (Connection conn = store.dataSource().getConnection();
                PreparedStatement stmt = conn.prepareStatement(sql);
                ResultSet rs = stmt.executeQuery()) {
            rs.next();
            long total = rs.getLong(1);
            Long oldest = total == 0 ? null : rs.getLong(4);
            Long newest = total == 0 ? null : rs.getLong(5);
            return new EventStatistics(total, rs.getLong(2), rs.getLong(3), oldest, newest, 0, 0, 0, 0, true,
                    config.retentionDays());
        } catch (SQLException e) {
            logger.atError().setCause(e).log("Statistics query failed");
            throw new QueryFailedException("Statistics query failed: " + e.getMessage(), e);
        }
    }
}
