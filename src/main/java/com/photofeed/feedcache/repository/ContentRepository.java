package com.photofeed.feedcache.repository;

import com.photofeed.feedcache.dto.CommentPreview;
import com.photofeed.feedcache.dto.FeedCursor;
import com.photofeed.feedcache.dto.ImageBlob;
import com.photofeed.feedcache.dto.UserStats;
import com.photofeed.feedcache.entity.CommentRecord;
import com.photofeed.feedcache.entity.PostRecord;
import com.photofeed.feedcache.entity.UserRecord;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 帖子、评论与图片的存储访问
 * 批量方法对任意数量的 ID 都只发出一条查询
 */
public interface ContentRepository {

    /**
     * 全站 Feed 窗口：游标之后、作者未封禁的帖子，(created_at DESC, id DESC)
     */
    List<PostRecord> findPostWindow(FeedCursor cursor, int limit);

    /**
     * 单个用户的帖子窗口
     */
    List<PostRecord> findUserPostWindow(long userId, FeedCursor cursor, int limit);

    /**
     * 按 ID 批量取帖子（作者已封禁的不返回），顺序不保证
     */
    List<PostRecord> findPostsByIds(Collection<Long> postIds);

    Map<Long, UserRecord> findUsersByIds(Collection<Long> userIds);

    /**
     * 没有评论的帖子不出现在结果中
     */
    Map<Long, Long> countCommentsByPostIds(Collection<Long> postIds);

    /**
     * 每个帖子最新的 perPost 条评论（带评论者账号名），列表内按时间从旧到新
     */
    Map<Long, List<CommentPreview>> findRecentCommentsByPostIds(Collection<Long> postIds, int perPost);

    /**
     * 发帖数、评论数、被评论数，一条查询取回
     */
    UserStats countUserStats(long userId);

    /**
     * 只投影 mime 与图片字节
     */
    Optional<ImageBlob> findImage(long postId);

    /**
     * 不论作者状态
     */
    Optional<PostRecord> findPostById(long postId);

    PostRecord insertPost(long userId, String mime, byte[] imageData, String body, Instant createdAt);

    CommentRecord insertComment(long postId, long userId, String comment, Instant createdAt);

    /**
     * 连同评论一起删除
     */
    boolean deletePost(long postId);

    /**
     * 封禁用户（del_flg = 1）
     */
    boolean deactivateUser(long userId);
}
