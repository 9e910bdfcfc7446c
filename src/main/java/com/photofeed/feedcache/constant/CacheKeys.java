package com.photofeed.feedcache.constant;

import com.photofeed.feedcache.dto.FeedCursor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 缓存 Key 空间
 * 写路径的失效前缀与读路径的 Key 必须出自同一处
 */
public final class CacheKeys {

    private CacheKeys() {}

    // ==================== 命名空间前缀 ====================

    /** 身份相关（会话、登录） */
    public static final String IDENTITY_PREFIX = "identity:";

    /** 会话 → 身份 */
    public static final String SESSION_PREFIX = "identity:session:";

    /** 登录结果 */
    public static final String LOGIN_PREFIX = "identity:login:";

    /** 单条聚合帖子 */
    public static final String POST_PREFIX = "post:";

    /** 全部 Feed 页 */
    public static final String FEED_PREFIX = "feed:";

    /** 全站 Feed 页 */
    public static final String FEED_PAGE_PREFIX = "feed:page:";

    /** 用户个人页 */
    public static final String FEED_USER_PREFIX = "feed:user:";

    /** 图片 */
    public static final String IMAGE_PREFIX = "image:";

    /** 图片不存在标记 */
    public static final String IMAGE_MISSING_PREFIX = "image:missing:";

    /** 用户个人页计数 */
    public static final String USER_STATS_PREFIX = "user:stats:";

    // ==================== 缓存类别（指标 tag） ====================

    public static final String CLASS_SESSION = "session";
    public static final String CLASS_LOGIN = "login";
    public static final String CLASS_POST = "post";
    public static final String CLASS_FEED_PAGE = "feed_page";
    public static final String CLASS_IMAGE = "image";
    public static final String CLASS_USER_STATS = "user_stats";

    // ==================== Key 构造 ====================

    /** 原始令牌不进入 Key，只保留摘要 */
    public static String session(String token) {
        return SESSION_PREFIX + sha256Hex(token);
    }

    public static String login(String accountName, String password) {
        return LOGIN_PREFIX + sha256Hex(accountName + '\0' + password);
    }

    public static String post(long postId) {
        return POST_PREFIX + postId;
    }

    public static String feedPage(FeedCursor cursor, int pageSize) {
        return FEED_PAGE_PREFIX + cursor.token() + ":" + pageSize;
    }

    public static String userFeedPrefix(long userId) {
        return FEED_USER_PREFIX + userId + ":";
    }

    public static String userFeedPage(long userId, FeedCursor cursor, int pageSize) {
        return userFeedPrefix(userId) + cursor.token() + ":" + pageSize;
    }

    public static String userStats(long userId) {
        return USER_STATS_PREFIX + userId;
    }

    public static String image(long imageId) {
        return IMAGE_PREFIX + imageId;
    }

    public static String imageMissing(long imageId) {
        return IMAGE_MISSING_PREFIX + imageId;
    }

    static String sha256Hex(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
