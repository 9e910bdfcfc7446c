package com.photofeed.feedcache.repository;

import com.photofeed.feedcache.config.PhotoFeedProperties;
import com.photofeed.feedcache.exception.StoreUnavailableException;
import com.zaxxer.hikari.HikariDataSource;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * 关系库连接的唯一持有者
 * <ul>
 *   <li>借出前做存活检查，失效连接从池中剔除后重新获取</li>
 *   <li>获取连接失败按指数退避重试，耗尽后抛出 {@link StoreUnavailableException}</li>
 *   <li>回调拿到的 JdbcTemplate 绑定在同一条连接上，任何退出路径都会归还连接</li>
 * </ul>
 * 只重试连接获取，不重放已发出的语句，写操作不会被重复执行。
 */
@Component
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private final DataSource dataSource;
    private final Retry acquireRetry;
    private final int queryTimeoutSeconds;
    private final int validationTimeoutSeconds;
    private final Counter evictedCounter;

    public ConnectionManager(DataSource dataSource, PhotoFeedProperties properties, MeterRegistry meterRegistry) {
        PhotoFeedProperties.Store store = properties.getStore();
        PhotoFeedProperties.Retry retry = store.getRetry();

        this.dataSource = dataSource;
        this.queryTimeoutSeconds = toSeconds(store.getReadWriteTimeout().toMillis());
        this.validationTimeoutSeconds = toSeconds(store.getValidationTimeout().toMillis());

        RetryConfig retryConfig = RetryConfig.custom()
            .maxAttempts(retry.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                retry.getInitialBackoff().toMillis(), retry.getMultiplier()))
            .build();
        this.acquireRetry = Retry.of("store-acquire", retryConfig);
        this.acquireRetry.getEventPublisher()
            .onRetry(event -> log.warn("Store connection acquire failed, attempt {}/{}, retrying in {}ms: {}",
                event.getNumberOfRetryAttempts(), retry.getMaxAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()));

        this.evictedCounter = Counter.builder("photofeed.store.connections.evicted")
            .description("Connections failing the liveness check")
            .register(meterRegistry);
    }

    /**
     * 借一条连接执行回调（自动提交）
     *
     * @param operation 操作名，用于日志
     */
    public <T> T execute(String operation, StoreCallback<T> callback) {
        Connection connection = acquire(operation);
        try {
            return callback.doInStore(bind(connection));
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException e) {
            throw new StoreUnavailableException("Store failure during " + operation, e);
        } finally {
            release(connection);
        }
    }

    /**
     * 借一条连接并在单个事务中执行回调，回调或提交失败则回滚
     */
    public <T> T executeInTransaction(String operation, StoreCallback<T> callback) {
        Connection connection = acquire(operation);
        try {
            connection.setAutoCommit(false);
            try {
                T result = callback.doInStore(bind(connection));
                connection.commit();
                return result;
            } catch (RuntimeException | SQLException e) {
                // 提交失败同样回滚，否则恢复自动提交时会把未决事务提交出去
                rollback(connection, operation);
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Store transaction failure during " + operation, e);
        } catch (TransientDataAccessException | DataAccessResourceFailureException | RecoverableDataAccessException e) {
            throw new StoreUnavailableException("Store failure during " + operation, e);
        } finally {
            release(connection);
        }
    }

    /**
     * 健康检查
     */
    public boolean ping() {
        Integer one = execute("ping", jdbc -> jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class));
        return one != null && one == 1;
    }

    Connection acquire(String operation) {
        try {
            return acquireRetry.executeCallable(this::acquireLive);
        } catch (Exception e) {
            log.error("Store unavailable for {} after {} attempts", operation,
                acquireRetry.getRetryConfig().getMaxAttempts(), e);
            throw new StoreUnavailableException("Store unavailable for " + operation, e);
        }
    }

    private Connection acquireLive() throws SQLException {
        Connection connection = dataSource.getConnection();
        boolean valid;
        try {
            valid = connection.isValid(validationTimeoutSeconds);
        } catch (SQLException e) {
            valid = false;
        }
        if (!valid) {
            evict(connection);
            throw new SQLException("Borrowed connection failed liveness check");
        }
        return connection;
    }

    private void evict(Connection connection) {
        evictedCounter.increment();
        if (dataSource instanceof HikariDataSource hikariDataSource) {
            hikariDataSource.evictConnection(connection);
            return;
        }
        release(connection);
    }

    private NamedParameterJdbcTemplate bind(Connection connection) {
        JdbcTemplate jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
        jdbcTemplate.setQueryTimeout(queryTimeoutSeconds);
        return new NamedParameterJdbcTemplate(jdbcTemplate);
    }

    private void rollback(Connection connection, String operation) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed for {}", operation, e);
        }
    }

    private void release(Connection connection) {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to release store connection", e);
        }
    }

    private static int toSeconds(long millis) {
        return (int) Math.max(1, (millis + 999) / 1000);
    }
}
