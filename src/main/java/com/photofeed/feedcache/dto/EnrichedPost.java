package com.photofeed.feedcache.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 聚合后的帖子：帖子字段 + 作者 + 评论数 + 最新评论预览
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichedPost {

    private Long id;

    private Long userId;

    private String body;

    private String mime;

    private Instant createdAt;

    private AuthorSummary author;

    /** 评论总数 */
    private long commentCount;

    /** 最新 N 条评论，按时间从旧到新 */
    @Builder.Default
    private List<CommentPreview> comments = new ArrayList<>();

    /** 评论数据缺失时为 true，这类结果不进缓存 */
    private boolean degraded;
}
