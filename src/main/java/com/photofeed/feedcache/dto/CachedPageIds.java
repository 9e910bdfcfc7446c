package com.photofeed.feedcache.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Feed 页的缓存形态：有序帖子 ID + 下一页游标
 * 帖子本身按 post:<id> 单独缓存
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedPageIds {

    @Builder.Default
    private List<Long> postIds = new ArrayList<>();

    /** FeedCursor.token()，没有下一页时为空 */
    private String nextCursor;
}
