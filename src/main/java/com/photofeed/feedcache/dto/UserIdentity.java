package com.photofeed.feedcache.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.photofeed.feedcache.entity.UserRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已认证身份
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserIdentity {

    private Long id;

    private String accountName;

    private Integer authority;

    private boolean active;

    @JsonIgnore
    public boolean isAdmin() {
        return authority != null && authority == 1;
    }

    public static UserIdentity from(UserRecord user) {
        return UserIdentity.builder()
            .id(user.getId())
            .accountName(user.getAccountName())
            .authority(user.getAuthority())
            .active(user.isActive())
            .build();
    }
}
