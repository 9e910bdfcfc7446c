package com.photofeed.feedcache.dto;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Feed 键集游标：(createdAt, id)
 * 下一页取严格排在游标之后的帖子，排序为 created_at DESC, id DESC
 */
public record FeedCursor(Instant createdAt, Long id) {

    private static final String FIRST = "first";

    private static final FeedCursor FIRST_PAGE = new FeedCursor(null, null);

    public static FeedCursor first() {
        return FIRST_PAGE;
    }

    public static FeedCursor after(Instant createdAt, long id) {
        return new FeedCursor(createdAt, id);
    }

    public boolean isFirst() {
        return createdAt == null || id == null;
    }

    /**
     * 可放入缓存 Key 与响应中的字符串形式
     */
    public String token() {
        return isFirst() ? FIRST : createdAt + "_" + id;
    }

    public static FeedCursor parse(String token) {
        if (token == null || token.isBlank() || FIRST.equals(token)) {
            return FIRST_PAGE;
        }
        int sep = token.lastIndexOf('_');
        if (sep <= 0 || sep == token.length() - 1) {
            throw new IllegalArgumentException("Malformed feed cursor: " + token);
        }
        try {
            return new FeedCursor(Instant.parse(token.substring(0, sep)), Long.parseLong(token.substring(sep + 1)));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Malformed feed cursor: " + token, e);
        }
    }
}
