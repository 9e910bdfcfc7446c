package com.photofeed.feedcache.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 帖子表行（posts），不含图片字节
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostRecord {

    private Long id;

    private Long userId;

    /** 可为空 */
    private String mime;

    /** 可为空 */
    private String body;

    private Instant createdAt;
}
