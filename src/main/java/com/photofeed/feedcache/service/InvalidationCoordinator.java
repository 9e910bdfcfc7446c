package com.photofeed.feedcache.service;

import com.photofeed.feedcache.cachestore.CacheTemplate;
import com.photofeed.feedcache.constant.CacheKeys;
import com.photofeed.feedcache.entity.CommentRecord;
import com.photofeed.feedcache.entity.PostRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 写后失效
 * 每种写操作对应一组固定的 Key / 前缀，只能在存储写入提交之后调用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InvalidationCoordinator {

    private final CacheTemplate cacheTemplate;

    /**
     * 新帖子：全站 Feed 页（含首页）、作者个人页与计数、该 ID 的图片不存在标记
     * 其它帖子的单条缓存不受影响
     */
    public void onPostCreated(PostRecord post) {
        cacheTemplate.invalidatePrefix(CacheKeys.FEED_PAGE_PREFIX);
        cacheTemplate.invalidatePrefix(CacheKeys.userFeedPrefix(post.getUserId()));
        cacheTemplate.invalidate(CacheKeys.imageMissing(post.getId()));
        cacheTemplate.invalidate(CacheKeys.userStats(post.getUserId()));
        log.info("Invalidated after post created: postId={}, userId={}", post.getId(), post.getUserId());
    }

    /**
     * 新评论：评论数与最新评论都在帖子条目里，失效该帖子；另失效评论者与帖子作者的计数
     *
     * @param postUserId 被评论帖子的作者
     */
    public void onCommentCreated(CommentRecord comment, long postUserId) {
        cacheTemplate.invalidate(CacheKeys.post(comment.getPostId()));
        cacheTemplate.invalidate(CacheKeys.userStats(comment.getUserId()));
        cacheTemplate.invalidate(CacheKeys.userStats(postUserId));
        log.info("Invalidated after comment created: postId={}, userId={}, postUserId={}",
            comment.getPostId(), comment.getUserId(), postUserId);
    }

    /**
     * 删除帖子会连带删除评论，评论者不确定，计数按前缀整体失效
     */
    public void onPostDeleted(PostRecord post) {
        cacheTemplate.invalidate(CacheKeys.post(post.getId()));
        cacheTemplate.invalidate(CacheKeys.image(post.getId()));
        cacheTemplate.invalidatePrefix(CacheKeys.FEED_PAGE_PREFIX);
        cacheTemplate.invalidatePrefix(CacheKeys.userFeedPrefix(post.getUserId()));
        cacheTemplate.invalidatePrefix(CacheKeys.USER_STATS_PREFIX);
        log.info("Invalidated after post deleted: postId={}, userId={}", post.getId(), post.getUserId());
    }

    /**
     * 封禁用户：其帖子从所有 Feed 消失、其评论从所有帖子预览消失、其会话与登录结果作废
     */
    public void onUserDeactivated(long userId) {
        cacheTemplate.invalidatePrefix(CacheKeys.FEED_PREFIX);
        cacheTemplate.invalidatePrefix(CacheKeys.POST_PREFIX);
        cacheTemplate.invalidatePrefix(CacheKeys.IDENTITY_PREFIX);
        log.info("Invalidated after user deactivated: userId={}", userId);
    }
}
