/**
 * Session-scoped Postgres advisory locks
 *
 * Features:
 * - Each held lock pins one pooled connection until the handle is closed
 * - Acquisition polls pg_try_advisory_lock until the timeout, never pg_advisory_lock
 * - isHeld() consults pg_locks so the scheduler can skip sources another worker is writing
 */

package com.williamcallahan.chapter_sync_engine.concurrency;

import com.williamcallahan.chapter_sync_engine.util.LoggingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class PostgresAdvisoryLockProvider implements ResourceLockProvider {

    private static final long POLL_INTERVAL_MS = 50;

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;

    public PostgresAdvisoryLockProvider(DataSource dataSource, JdbcTemplate jdbcTemplate) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<LockHandle> tryAcquire(ResourceKey key, Duration timeout) {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            connection.setAutoCommit(true);
            long deadline = System.nanoTime() + timeout.toNanos();
            while (true) {
                if (tryLock(connection, key.value())) {
                    log.debug("Acquired advisory lock {} ({})", key.describe(), key.value());
                    return Optional.of(new Handle(key, connection));
                }
                if (System.nanoTime() >= deadline) {
                    closeQuietly(connection);
                    return Optional.empty();
                }
                TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(connection);
            return Optional.empty();
        } catch (SQLException e) {
            closeQuietly(connection);
            throw new IllegalStateException("Failed to acquire advisory lock " + key.describe(), e);
        }
    }

    @Override
    public boolean isHeld(ResourceKey key) {
        Boolean held = jdbcTemplate.queryForObject(
            """
            SELECT EXISTS (
                SELECT 1 FROM pg_locks
                WHERE locktype = 'advisory' AND objsubid = 1
                  AND classid::bigint = ? AND objid::bigint = ?
            )
            """,
            Boolean.class,
            key.value() >>> 32,
            key.value() & 0xFFFFFFFFL
        );
        return Boolean.TRUE.equals(held);
    }

    private static boolean tryLock(Connection connection, long key) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_try_advisory_lock(?)")) {
            statement.setLong(1, key);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        }
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            LoggingUtils.warn(log, e, "Failed to return lock connection to the pool");
        }
    }

    // A session that may still hold the lock must not go back to the pool
    private static void abortQuietly(Connection connection) {
        try {
            connection.abort(Runnable::run);
        } catch (SQLException e) {
            LoggingUtils.warn(log, e, "Failed to abort lock connection");
            closeQuietly(connection);
        }
    }

    private static final class Handle implements LockHandle {
        private final ResourceKey key;
        private final Connection connection;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Handle(ResourceKey key, Connection connection) {
            this.key = key;
            this.connection = connection;
        }

        @Override
        public ResourceKey key() {
            return key;
        }

        @Override
        public void close() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
                statement.setLong(1, key.value());
                statement.execute();
                closeQuietly(connection);
            } catch (SQLException e) {
                LoggingUtils.warn(log, e, "Failed to unlock advisory lock {}, discarding its connection", key.describe());
                abortQuietly(connection);
            }
        }
    }
}
