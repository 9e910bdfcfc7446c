package com.photofeed.feedcache.service;

import com.photofeed.feedcache.cachestore.CacheTemplate;
import com.photofeed.feedcache.config.PhotoFeedProperties;
import com.photofeed.feedcache.constant.CacheKeys;
import com.photofeed.feedcache.dto.AuthorSummary;
import com.photofeed.feedcache.dto.CachedPageIds;
import com.photofeed.feedcache.dto.CommentPreview;
import com.photofeed.feedcache.dto.EnrichedPost;
import com.photofeed.feedcache.dto.FeedCursor;
import com.photofeed.feedcache.dto.FeedPage;
import com.photofeed.feedcache.dto.UserStats;
import com.photofeed.feedcache.entity.PostRecord;
import com.photofeed.feedcache.entity.UserRecord;
import com.photofeed.feedcache.exception.StoreUnavailableException;
import com.photofeed.feedcache.repository.ContentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Feed 聚合服务
 * <p>
 * 一页帖子的组装固定为：1 次窗口查询 + 3 次批量查询（作者、评论数、最新评论），与页大小无关。
 * 页缓存只存帖子 ID 序列，帖子本身按 post:&lt;id&gt; 单独缓存，评论变更只需失效单个帖子。
 * <p>
 * 评论数或最新评论获取失败时返回降级结果（评论为空、degraded = true），降级结果不写缓存；
 * 窗口与作者获取失败直接向上抛出。
 */
@Slf4j
@Service
public class ContentAggregator {

    static final String METRIC_BULK_FETCH = "photofeed.feed.bulk.fetch";

    private final ContentRepository contentRepository;
    private final CacheTemplate cacheTemplate;
    private final PhotoFeedProperties properties;
    private final MeterRegistry meterRegistry;

    public ContentAggregator(ContentRepository contentRepository, CacheTemplate cacheTemplate,
                             PhotoFeedProperties properties, MeterRegistry meterRegistry) {
        this.contentRepository = contentRepository;
        this.cacheTemplate = cacheTemplate;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    public FeedPage getFeedPage(FeedCursor cursor) {
        return getFeedPage(cursor, properties.getFeed().getDefaultPageSize());
    }

    /**
     * 全站 Feed 一页
     *
     * @param cursor   FeedCursor.first() 或上一页返回的游标
     * @param pageSize 1 ~ photofeed.feed.max-page-size
     */
    public FeedPage getFeedPage(FeedCursor cursor, int pageSize) {
        checkPageSize(pageSize);
        return loadPage(CacheKeys.feedPage(cursor, pageSize), pageSize,
            () -> contentRepository.findPostWindow(cursor, pageSize));
    }

    /**
     * 单个用户的帖子页
     */
    public FeedPage getUserFeedPage(long userId, FeedCursor cursor, int pageSize) {
        checkPageSize(pageSize);
        return loadPage(CacheKeys.userFeedPage(userId, cursor, pageSize), pageSize,
            () -> contentRepository.findUserPostWindow(userId, cursor, pageSize));
    }

    /**
     * 单条聚合帖子，作者已封禁或帖子不存在时为空
     */
    public Optional<EnrichedPost> getPost(long postId) {
        String key = CacheKeys.post(postId);
        Optional<EnrichedPost> cached = cacheTemplate.get(CacheKeys.CLASS_POST, key, EnrichedPost.class);
        if (cached.isPresent()) {
            return cached;
        }

        List<PostRecord> posts = contentRepository.findPostsByIds(List.of(postId));
        if (posts.isEmpty()) {
            return Optional.empty();
        }
        Enrichment enrichment = enrich(posts);
        if (!enrichment.degraded()) {
            cachePosts(enrichment.posts());
        }
        return enrichment.posts().stream().findFirst();
    }

    /**
     * 用户个人页的三项计数，命中缓存时不访问存储
     */
    public UserStats getUserStats(long userId) {
        String key = CacheKeys.userStats(userId);
        Optional<UserStats> cached = cacheTemplate.get(CacheKeys.CLASS_USER_STATS, key, UserStats.class);
        if (cached.isPresent()) {
            return cached.get();
        }

        UserStats stats = timed("user_stats", () -> contentRepository.countUserStats(userId));
        cacheTemplate.put(key, stats, properties.getTtl().getUserStats());
        return stats;
    }

    private FeedPage loadPage(String pageKey, int pageSize, Supplier<List<PostRecord>> windowLoader) {
        Optional<CachedPageIds> cachedIds = cacheTemplate.get(CacheKeys.CLASS_FEED_PAGE, pageKey, CachedPageIds.class);
        if (cachedIds.isPresent()) {
            return assembleFromIds(cachedIds.get());
        }

        List<PostRecord> window = windowLoader.get();
        Enrichment enrichment = enrich(window);

        FeedCursor nextCursor = null;
        if (!window.isEmpty() && window.size() == pageSize) {
            PostRecord last = window.get(window.size() - 1);
            nextCursor = FeedCursor.after(last.getCreatedAt(), last.getId());
        }

        if (enrichment.degraded()) {
            log.warn("Feed page degraded, not cached: key={}", pageKey);
        } else {
            cachePosts(enrichment.posts());
            List<Long> ids = enrichment.posts().stream().map(EnrichedPost::getId).toList();
            cacheTemplate.put(pageKey, CachedPageIds.builder()
                    .postIds(new ArrayList<>(ids))
                    .nextCursor(nextCursor == null ? null : nextCursor.token())
                    .build(),
                properties.getTtl().getFeedPage());
        }
        return new FeedPage(enrichment.posts(), nextCursor, enrichment.degraded());
    }

    /**
     * 页缓存命中：逐条读帖子缓存，缺失的合并为一轮批量回源
     */
    private FeedPage assembleFromIds(CachedPageIds page) {
        Map<Long, EnrichedPost> byId = new HashMap<>();
        List<Long> missing = new ArrayList<>();
        for (Long id : page.getPostIds()) {
            Optional<EnrichedPost> post = cacheTemplate.get(CacheKeys.CLASS_POST, CacheKeys.post(id), EnrichedPost.class);
            if (post.isPresent()) {
                byId.put(id, post.get());
            } else {
                missing.add(id);
            }
        }

        boolean degraded = false;
        if (!missing.isEmpty()) {
            log.debug("Feed page hit with {} post entries missing, re-enriching", missing.size());
            Enrichment enrichment = enrich(contentRepository.findPostsByIds(missing));
            degraded = enrichment.degraded();
            if (!degraded) {
                cachePosts(enrichment.posts());
            }
            enrichment.posts().forEach(post -> byId.put(post.getId(), post));
        }

        // 按缓存的顺序输出，已删除的帖子跳过
        List<EnrichedPost> posts = new ArrayList<>();
        for (Long id : page.getPostIds()) {
            EnrichedPost post = byId.get(id);
            if (post != null) {
                posts.add(post);
            }
        }
        FeedCursor nextCursor = page.getNextCursor() == null ? null : FeedCursor.parse(page.getNextCursor());
        return new FeedPage(posts, nextCursor, degraded);
    }

    /**
     * 批量补全作者、评论数与最新评论，帖子顺序保持不变
     */
    private Enrichment enrich(List<PostRecord> posts) {
        if (posts.isEmpty()) {
            return new Enrichment(List.of(), false);
        }

        Set<Long> postIds = new LinkedHashSet<>();
        Set<Long> userIds = new LinkedHashSet<>();
        for (PostRecord post : posts) {
            postIds.add(post.getId());
            userIds.add(post.getUserId());
        }

        Map<Long, UserRecord> authors = timed("authors", () -> contentRepository.findUsersByIds(userIds));

        boolean degraded = false;
        Map<Long, Long> counts;
        try {
            counts = timed("comment_counts", () -> contentRepository.countCommentsByPostIds(postIds));
        } catch (StoreUnavailableException | DataAccessException e) {
            log.warn("Comment count fetch failed, degrading {} posts", postIds.size(), e);
            counts = Map.of();
            degraded = true;
        }

        Map<Long, List<CommentPreview>> recent;
        try {
            int perPost = properties.getFeed().getRecentComments();
            recent = timed("recent_comments", () -> contentRepository.findRecentCommentsByPostIds(postIds, perPost));
        } catch (StoreUnavailableException | DataAccessException e) {
            log.warn("Recent comment fetch failed, degrading {} posts", postIds.size(), e);
            recent = Map.of();
            degraded = true;
        }

        List<EnrichedPost> enriched = new ArrayList<>(posts.size());
        for (PostRecord post : posts) {
            UserRecord author = authors.get(post.getUserId());
            if (author == null || !author.isActive()) {
                // 窗口查询之后作者被封禁
                continue;
            }
            enriched.add(EnrichedPost.builder()
                .id(post.getId())
                .userId(post.getUserId())
                .body(post.getBody())
                .mime(post.getMime())
                .createdAt(post.getCreatedAt())
                .author(AuthorSummary.builder()
                    .id(author.getId())
                    .accountName(author.getAccountName())
                    .authority(author.getAuthority())
                    .build())
                .commentCount(counts.getOrDefault(post.getId(), 0L))
                .comments(new ArrayList<>(recent.getOrDefault(post.getId(), Collections.emptyList())))
                .degraded(degraded)
                .build());
        }
        return new Enrichment(enriched, degraded);
    }

    private void cachePosts(List<EnrichedPost> posts) {
        for (EnrichedPost post : posts) {
            cacheTemplate.put(CacheKeys.post(post.getId()), post, properties.getTtl().getPost());
        }
    }

    private <T> T timed(String query, Supplier<T> fetch) {
        return Timer.builder(METRIC_BULK_FETCH)
            .description("Feed bulk fetch latency")
            .tag("query", query)
            .register(meterRegistry)
            .record(fetch);
    }

    private void checkPageSize(int pageSize) {
        int max = properties.getFeed().getMaxPageSize();
        if (pageSize < 1 || pageSize > max) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + max + ": " + pageSize);
        }
    }

    private record Enrichment(List<EnrichedPost> posts, boolean degraded) {
    }
}
