package com.photofeed.feedcache.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户个人页计数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserStats {

    private Long userId;

    /** 发帖数 */
    private long postCount;

    /** 发出的评论数 */
    private long commentCount;

    /** 自己帖子收到的评论数 */
    private long commentedCount;
}
