package com.photofeed.feedcache.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Feed 中展示的评论预览（带评论者账号名）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommentPreview {

    private Long id;

    private Long postId;

    private Long userId;

    /** 评论者账号名 */
    private String accountName;

    private String comment;

    private Instant createdAt;
}
