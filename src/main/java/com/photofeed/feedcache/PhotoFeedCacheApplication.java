package com.photofeed.feedcache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 照片 Feed 读路径加速层启动类
 * 身份解析、Feed 批量聚合、图片缓存、写后失效
 */
@SpringBootApplication
public class PhotoFeedCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(PhotoFeedCacheApplication.class, args);
    }
}
