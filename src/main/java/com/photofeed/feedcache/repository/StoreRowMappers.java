package com.photofeed.feedcache.repository;

import com.photofeed.feedcache.dto.CommentPreview;
import com.photofeed.feedcache.entity.PostRecord;
import com.photofeed.feedcache.entity.UserRecord;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;

/**
 * 表行映射
 */
final class StoreRowMappers {

    private StoreRowMappers() {}

    static final String USER_COLUMNS = "u.id, u.account_name, u.passhash, u.authority, u.del_flg, u.created_at";

    static final String POST_COLUMNS = "p.id, p.user_id, p.mime, p.body, p.created_at";

    static final RowMapper<UserRecord> USER = (rs, rowNum) -> UserRecord.builder()
        .id(rs.getLong("id"))
        .accountName(rs.getString("account_name"))
        .passhash(rs.getString("passhash"))
        .authority(rs.getInt("authority"))
        .active(rs.getInt("del_flg") == 0)
        .createdAt(instant(rs, "created_at"))
        .build();

    static final RowMapper<PostRecord> POST = (rs, rowNum) -> PostRecord.builder()
        .id(rs.getLong("id"))
        .userId(rs.getLong("user_id"))
        .mime(rs.getString("mime"))
        .body(rs.getString("body"))
        .createdAt(instant(rs, "created_at"))
        .build();

    static final RowMapper<CommentPreview> COMMENT_PREVIEW = (rs, rowNum) -> CommentPreview.builder()
        .id(rs.getLong("id"))
        .postId(rs.getLong("post_id"))
        .userId(rs.getLong("user_id"))
        .accountName(rs.getString("account_name"))
        .comment(rs.getString("comment"))
        .createdAt(instant(rs, "created_at"))
        .build();

    static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(column);
        return timestamp == null ? null : timestamp.toInstant();
    }

    static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }
}
