package com.photofeed.feedcache.repository;

import com.photofeed.feedcache.entity.UserRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 身份存储访问（JDBC）
 */
@Repository
@RequiredArgsConstructor
public class JdbcIdentityRepository implements IdentityRepository {

    private static final String SESSION_USER_ID =
        "SELECT user_id FROM sessions WHERE token = :token AND expires_at > :now";

    private static final String ACTIVE_USER_BY_ID =
        "SELECT " + StoreRowMappers.USER_COLUMNS + " FROM users u WHERE u.id = :id AND u.del_flg = 0";

    private static final String ACTIVE_USER_BY_ACCOUNT =
        "SELECT " + StoreRowMappers.USER_COLUMNS + " FROM users u WHERE u.account_name = :accountName AND u.del_flg = 0";

    private final ConnectionManager connectionManager;

    @Override
    public Optional<UserRecord> findUserBySessionToken(String token, Instant now) {
        return connectionManager.execute("findUserBySessionToken", jdbc -> {
            List<Long> userIds = jdbc.queryForList(SESSION_USER_ID,
                new MapSqlParameterSource("token", token).addValue("now", StoreRowMappers.timestamp(now)),
                Long.class);
            if (userIds.isEmpty()) {
                return Optional.empty();
            }
            List<UserRecord> users = jdbc.query(ACTIVE_USER_BY_ID,
                new MapSqlParameterSource("id", userIds.get(0)), StoreRowMappers.USER);
            return users.stream().findFirst();
        });
    }

    @Override
    public Optional<UserRecord> findActiveUserByAccountName(String accountName) {
        return connectionManager.execute("findActiveUserByAccountName", jdbc -> jdbc.query(ACTIVE_USER_BY_ACCOUNT,
                new MapSqlParameterSource("accountName", accountName), StoreRowMappers.USER)
            .stream()
            .findFirst());
    }
}
