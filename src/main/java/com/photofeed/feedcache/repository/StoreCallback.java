package com.photofeed.feedcache.repository;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * 在一条借出的连接上执行的存储操作
 */
@FunctionalInterface
public interface StoreCallback<T> {

    T doInStore(NamedParameterJdbcTemplate jdbc);
}
