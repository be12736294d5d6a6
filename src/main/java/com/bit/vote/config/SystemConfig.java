package com.bit.vote.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 系统配置 system.*
 */
@Data
@ConfigurationProperties(prefix = "system")
public class SystemConfig {
    /**
     * 管理员地址（Base58），创建项目与结算项目只允许该地址调用
     */
    private String admin;

    /**
     * 金库地址（Base58），质押的代币与奖励池都记在该地址名下
     */
    private String vault;

    /**
     * 数据库类型 memory / rocksdb
     */
    private String dbType = "memory";

    private String path = "./data";//RocksDB保存路径

    private Integer maxSize = 2000;//项目缓存最大条数

    /**
     * 获胜者取回质押时的倍数
     */
    private long winnerMultiplier = 2;
}
