package com.photofeed.feedcache.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;

/**
 * 用户表行（users）
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRecord {

    private Long id;

    /** 账号名，同时作为展示名 */
    private String accountName;

    /** 口令摘要，只交给凭据校验使用 */
    @ToString.Exclude
    private String passhash;

    /** 0 普通用户，1 管理员 */
    private Integer authority;

    /** del_flg = 0 */
    private boolean active;

    private Instant createdAt;
}
