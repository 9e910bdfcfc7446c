package com.photofeed.feedcache.repository;

import com.photofeed.feedcache.dto.CommentPreview;
import com.photofeed.feedcache.dto.FeedCursor;
import com.photofeed.feedcache.dto.ImageBlob;
import com.photofeed.feedcache.dto.UserStats;
import com.photofeed.feedcache.entity.CommentRecord;
import com.photofeed.feedcache.entity.PostRecord;
import com.photofeed.feedcache.entity.UserRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 内容存储访问（JDBC）
 */
@Repository
@RequiredArgsConstructor
public class JdbcContentRepository implements ContentRepository {

    private static final String WINDOW_SELECT =
        "SELECT " + StoreRowMappers.POST_COLUMNS + " FROM posts p JOIN users u ON u.id = p.user_id"
            + " WHERE u.del_flg = 0";

    private static final String AFTER_CURSOR =
        " AND (p.created_at < :cursorCreatedAt OR (p.created_at = :cursorCreatedAt AND p.id < :cursorId))";

    private static final String WINDOW_ORDER = " ORDER BY p.created_at DESC, p.id DESC LIMIT :limit";

    private static final String POSTS_BY_IDS = WINDOW_SELECT + " AND p.id IN (:ids)";

    private static final String POST_BY_ID = "SELECT " + StoreRowMappers.POST_COLUMNS + " FROM posts p WHERE p.id = :id";

    private static final String USERS_BY_IDS =
        "SELECT " + StoreRowMappers.USER_COLUMNS + " FROM users u WHERE u.id IN (:ids)";

    private static final String COMMENT_COUNTS =
        "SELECT post_id, COUNT(*) AS cnt FROM comments WHERE post_id IN (:ids) GROUP BY post_id";

    private static final String RECENT_COMMENTS =
        "SELECT c.id, c.post_id, c.user_id, c.comment, c.created_at, u.account_name FROM ("
            + " SELECT id, post_id, user_id, comment, created_at,"
            + " ROW_NUMBER() OVER (PARTITION BY post_id ORDER BY created_at DESC, id DESC) AS rn"
            + " FROM comments WHERE post_id IN (:ids)) c"
            + " JOIN users u ON u.id = c.user_id"
            + " WHERE c.rn <= :perPost"
            + " ORDER BY c.post_id, c.created_at ASC, c.id ASC";

    private static final String USER_STATS =
        "SELECT (SELECT COUNT(*) FROM posts WHERE user_id = :userId) AS post_count,"
            + " (SELECT COUNT(*) FROM comments WHERE user_id = :userId) AS comment_count,"
            + " (SELECT COUNT(*) FROM comments c JOIN posts p ON p.id = c.post_id WHERE p.user_id = :userId)"
            + " AS commented_count";

    private static final String IMAGE = "SELECT mime, imgdata FROM posts WHERE id = :id";

    private static final String INSERT_POST =
        "INSERT INTO posts (user_id, mime, imgdata, body, created_at) VALUES (:userId, :mime, :imgdata, :body, :createdAt)";

    private static final String INSERT_COMMENT =
        "INSERT INTO comments (post_id, user_id, comment, created_at) VALUES (:postId, :userId, :comment, :createdAt)";

    private final ConnectionManager connectionManager;

    @Override
    public List<PostRecord> findPostWindow(FeedCursor cursor, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", limit);
        String sql = WINDOW_SELECT + afterCursor(cursor, params) + WINDOW_ORDER;
        return connectionManager.execute("findPostWindow", jdbc -> jdbc.query(sql, params, StoreRowMappers.POST));
    }

    @Override
    public List<PostRecord> findUserPostWindow(long userId, FeedCursor cursor, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource("limit", limit).addValue("userId", userId);
        String sql = WINDOW_SELECT + " AND p.user_id = :userId" + afterCursor(cursor, params) + WINDOW_ORDER;
        return connectionManager.execute("findUserPostWindow", jdbc -> jdbc.query(sql, params, StoreRowMappers.POST));
    }

    @Override
    public List<PostRecord> findPostsByIds(Collection<Long> postIds) {
        if (postIds.isEmpty()) {
            return List.of();
        }
        return connectionManager.execute("findPostsByIds", jdbc -> jdbc.query(POSTS_BY_IDS,
            new MapSqlParameterSource("ids", postIds), StoreRowMappers.POST));
    }

    @Override
    public Map<Long, UserRecord> findUsersByIds(Collection<Long> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        List<UserRecord> users = connectionManager.execute("findUsersByIds", jdbc -> jdbc.query(USERS_BY_IDS,
            new MapSqlParameterSource("ids", userIds), StoreRowMappers.USER));
        Map<Long, UserRecord> result = new HashMap<>();
        users.forEach(user -> result.put(user.getId(), user));
        return result;
    }

    @Override
    public Map<Long, Long> countCommentsByPostIds(Collection<Long> postIds) {
        if (postIds.isEmpty()) {
            return Map.of();
        }
        Map<Long, Long> counts = new HashMap<>();
        connectionManager.execute("countCommentsByPostIds", jdbc -> {
            jdbc.query(COMMENT_COUNTS, new MapSqlParameterSource("ids", postIds),
                rs -> {
                    counts.put(rs.getLong("post_id"), rs.getLong("cnt"));
                });
            return null;
        });
        return counts;
    }

    @Override
    public Map<Long, List<CommentPreview>> findRecentCommentsByPostIds(Collection<Long> postIds, int perPost) {
        if (postIds.isEmpty() || perPost <= 0) {
            return Map.of();
        }
        List<CommentPreview> rows = connectionManager.execute("findRecentCommentsByPostIds",
            jdbc -> jdbc.query(RECENT_COMMENTS,
                new MapSqlParameterSource("ids", postIds).addValue("perPost", perPost),
                StoreRowMappers.COMMENT_PREVIEW));
        Map<Long, List<CommentPreview>> result = new LinkedHashMap<>();
        for (CommentPreview row : rows) {
            result.computeIfAbsent(row.getPostId(), id -> new ArrayList<>()).add(row);
        }
        return result;
    }

    @Override
    public UserStats countUserStats(long userId) {
        return connectionManager.execute("countUserStats", jdbc -> jdbc.queryForObject(USER_STATS,
            new MapSqlParameterSource("userId", userId),
            (rs, rowNum) -> UserStats.builder()
                .userId(userId)
                .postCount(rs.getLong("post_count"))
                .commentCount(rs.getLong("comment_count"))
                .commentedCount(rs.getLong("commented_count"))
                .build()));
    }

    @Override
    public Optional<ImageBlob> findImage(long postId) {
        return connectionManager.execute("findImage", jdbc -> jdbc.query(IMAGE,
                new MapSqlParameterSource("id", postId),
                (rs, rowNum) -> ImageBlob.builder()
                    .mime(rs.getString("mime"))
                    .data(rs.getBytes("imgdata"))
                    .build())
            .stream()
            .filter(blob -> blob.getData() != null)
            .findFirst());
    }

    @Override
    public Optional<PostRecord> findPostById(long postId) {
        return connectionManager.execute("findPostById", jdbc -> jdbc.query(POST_BY_ID,
                new MapSqlParameterSource("id", postId), StoreRowMappers.POST)
            .stream()
            .findFirst());
    }

    @Override
    public PostRecord insertPost(long userId, String mime, byte[] imageData, String body, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource("userId", userId)
            .addValue("mime", mime)
            .addValue("imgdata", imageData)
            .addValue("body", body)
            .addValue("createdAt", StoreRowMappers.timestamp(createdAt));
        long id = connectionManager.execute("insertPost", jdbc -> insertReturningId(jdbc, INSERT_POST, params));
        return PostRecord.builder()
            .id(id)
            .userId(userId)
            .mime(mime)
            .body(body)
            .createdAt(createdAt)
            .build();
    }

    @Override
    public CommentRecord insertComment(long postId, long userId, String comment, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource("postId", postId)
            .addValue("userId", userId)
            .addValue("comment", comment)
            .addValue("createdAt", StoreRowMappers.timestamp(createdAt));
        long id = connectionManager.execute("insertComment", jdbc -> insertReturningId(jdbc, INSERT_COMMENT, params));
        return CommentRecord.builder()
            .id(id)
            .postId(postId)
            .userId(userId)
            .comment(comment)
            .createdAt(createdAt)
            .build();
    }

    @Override
    public boolean deletePost(long postId) {
        MapSqlParameterSource params = new MapSqlParameterSource("id", postId);
        return connectionManager.executeInTransaction("deletePost", jdbc -> {
            jdbc.update("DELETE FROM comments WHERE post_id = :id", params);
            return jdbc.update("DELETE FROM posts WHERE id = :id", params) > 0;
        });
    }

    @Override
    public boolean deactivateUser(long userId) {
        return connectionManager.execute("deactivateUser", jdbc -> jdbc.update(
            "UPDATE users SET del_flg = 1 WHERE id = :id", new MapSqlParameterSource("id", userId)) > 0);
    }

    private static String afterCursor(FeedCursor cursor, MapSqlParameterSource params) {
        if (cursor.isFirst()) {
            return "";
        }
        params.addValue("cursorCreatedAt", StoreRowMappers.timestamp(cursor.createdAt()));
        params.addValue("cursorId", cursor.id());
        return AFTER_CURSOR;
    }

    private static long insertReturningId(NamedParameterJdbcTemplate jdbc, String sql, MapSqlParameterSource params) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(sql, params, keyHolder, new String[]{"id"});
        return Objects.requireNonNull(keyHolder.getKey(), "generated id").longValue();
    }
}
