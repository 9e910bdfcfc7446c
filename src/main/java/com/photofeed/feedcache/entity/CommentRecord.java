package com.photofeed.feedcache.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 评论表行（comments）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentRecord {

    private Long id;

    private Long postId;

    private Long userId;

    private String comment;

    private Instant createdAt;
}
