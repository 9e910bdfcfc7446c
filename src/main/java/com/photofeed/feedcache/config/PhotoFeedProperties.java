package com.photofeed.feedcache.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 读路径加速层配置属性
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "photofeed")
public class PhotoFeedProperties {

    /** 关系库连接配置 */
    @Valid
    private Store store = new Store();

    /** 缓存后端配置 */
    @Valid
    private Cache cache = new Cache();

    /** 各缓存类别 TTL */
    @Valid
    private Ttl ttl = new Ttl();

    /** Feed 分页配置 */
    @Valid
    private Feed feed = new Feed();

    /** 单张图片上传上限 */
    @NotNull
    private DataSize uploadLimit = DataSize.ofMegabytes(10);

    @Data
    public static class Store {
        /** JDBC URL */
        @NotBlank
        private String url = "jdbc:mysql://localhost:3306/isuconp?useUnicode=true&characterEncoding=utf8mb4";
        private String username = "root";
        private String password = "";
        /** 连接池最大连接数 */
        @Min(1)
        private int maximumPoolSize = 10;
        /** 建连超时（同时作为从池中借出连接的最长等待） */
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        /** 读写超时（语句级） */
        @NotNull
        private Duration readWriteTimeout = Duration.ofSeconds(30);
        /** 借出前存活检查超时 */
        @NotNull
        private Duration validationTimeout = Duration.ofSeconds(2);
        @Valid
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        /** 获取连接的最大尝试次数（含首次） */
        @Min(1)
        private int maxAttempts = 3;
        /** 首次退避间隔 */
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(100);
        /** 退避倍数 */
        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Data
    public static class Cache {
        /** 缓存后端：caffeine | memcached */
        @NotBlank
        private String backend = "caffeine";
        /** Caffeine 按字节计的容量上限 */
        @Min(1)
        private long maximumWeightBytes = 256L * 1024 * 1024;
        @Valid
        private Memcached memcached = new Memcached();
    }

    @Data
    public static class Memcached {
        /** 服务器列表，逗号分隔 host:port */
        private String servers = "127.0.0.1:11211";
        /** 单次操作超时 */
        @NotNull
        private Duration opTimeout = Duration.ofSeconds(1);
    }

    @Data
    public static class Ttl {
        /** 会话 → 身份 */
        @NotNull
        private Duration session = Duration.ofSeconds(60);
        /** 登录结果 */
        @NotNull
        private Duration login = Duration.ofSeconds(300);
        /** 单条聚合帖子 */
        @NotNull
        private Duration post = Duration.ofSeconds(60);
        /** Feed 页（帖子 ID 序列） */
        @NotNull
        private Duration feedPage = Duration.ofSeconds(60);
        /** 用户个人页计数 */
        @NotNull
        private Duration userStats = Duration.ofSeconds(60);
        /** 图片 */
        @NotNull
        private Duration image = Duration.ofSeconds(3600);
        /** 图片不存在标记，0 表示不做负缓存 */
        @NotNull
        private Duration imageMissing = Duration.ofSeconds(5);
    }

    @Data
    public static class Feed {
        @Min(1)
        private int defaultPageSize = 20;
        /** 分页上限，禁止无界扫描 */
        @Min(1)
        private int maxPageSize = 100;
        /** 每条帖子预览的最新评论数 */
        @Min(0)
        private int recentComments = 3;
    }
}
