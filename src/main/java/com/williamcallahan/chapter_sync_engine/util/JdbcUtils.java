package com.williamcallahan.chapter_sync_engine.util;

import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Shared JDBC helpers so repositories do not repeat optional-result and timestamp boilerplate.
 */
public final class JdbcUtils {

    private JdbcUtils() {
    }

    /**
     * Query for an optional single value, handling EmptyResultDataAccessException gracefully.
     */
    public static <T> Optional<T> queryForOptional(JdbcTemplate jdbc, String sql, Class<T> type, Object... params) {
        try {
            return Optional.ofNullable(jdbc.queryForObject(sql, type, params));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    /**
     * Query for a single object with a RowMapper, returning Optional.
     */
    public static <T> Optional<T> queryForOptionalObject(JdbcTemplate jdbc, String sql, RowMapper<T> rowMapper, Object... params) {
        List<T> results = jdbc.query(sql, rowMapper, params);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Query for a count, treating a missing row as zero.
     */
    public static long queryForCount(JdbcTemplate jdbc, String sql, Object... params) {
        return queryForOptional(jdbc, sql, Long.class, params).orElse(0L);
    }

    /**
     * Execute an update and return whether any rows were affected.
     */
    public static boolean executeUpdate(JdbcTemplate jdbc, String sql, Object... params) {
        return jdbc.update(sql, params) > 0;
    }

    public static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    public static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }

    public static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    public static List<String> stringList(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return List.of();
        }
        Object[] values = (Object[]) array.getArray();
        return Arrays.stream(values).map(String::valueOf).toList();
    }
}
