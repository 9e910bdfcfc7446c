package com.photofeed.feedcache.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 关系库连接池配置
 * 连接的创建与销毁只由 ConnectionManager 借还，其它组件不直接触碰 DataSource
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean(destroyMethod = "close")
    public HikariDataSource photoFeedDataSource(PhotoFeedProperties properties) {
        PhotoFeedProperties.Store store = properties.getStore();

        HikariConfig config = new HikariConfig();
        config.setPoolName("photofeed-store");
        config.setJdbcUrl(store.getUrl());
        config.setUsername(store.getUsername());
        config.setPassword(store.getPassword());
        config.setMaximumPoolSize(store.getMaximumPoolSize());
        // 借出连接的最长等待即建连超时
        config.setConnectionTimeout(store.getConnectTimeout().toMillis());
        config.setValidationTimeout(store.getValidationTimeout().toMillis());
        config.setAutoCommit(true);
        // 库不可用时也允许进程启动，已缓存的读请求继续可用
        config.setInitializationFailTimeout(-1);

        log.info("Store pool initialized: url={}, maximumPoolSize={}, connectTimeout={}, readWriteTimeout={}",
            store.getUrl(), store.getMaximumPoolSize(), store.getConnectTimeout(), store.getReadWriteTimeout());

        return new HikariDataSource(config);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
