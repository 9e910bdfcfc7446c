package com.photofeed.feedcache.dto;

import java.util.List;
import java.util.Optional;

/**
 * Feed 页
 *
 * @param posts      按 (createdAt DESC, id DESC) 排列的帖子
 * @param nextCursor 下一页游标，本页不满时为空
 * @param degraded   任一帖子降级时为 true
 */
public record FeedPage(List<EnrichedPost> posts, FeedCursor nextCursor, boolean degraded) {

    public FeedPage {
        posts = List.copyOf(posts);
    }

    public Optional<FeedCursor> next() {
        return Optional.ofNullable(nextCursor);
    }

    public int size() {
        return posts.size();
    }
}
