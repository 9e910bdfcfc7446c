package com.photofeed.feedcache.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 帖子作者摘要
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthorSummary {

    private Long id;

    private String accountName;

    private Integer authority;
}
