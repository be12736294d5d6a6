package com.bit.vote.config;

import com.bit.vote.common.Address;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.memory.MemoryDb;
import com.bit.vote.database.rocksDb.RocksDb;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class CommonConfig {

    /**
     * 时间源 所有时间窗口判断都以调用时刻的时钟为准
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public DataBase dataBase(SystemConfig config) {
        DataBase dataBase;
        if ("rocksdb".equalsIgnoreCase(config.getDbType())) {
            dataBase = new RocksDb();
        } else {
            dataBase = new MemoryDb();
        }
        log.info("系统数据路径:{} 数据库类型:{}", config.getPath(), config.getDbType());
        if (!dataBase.createDatabase(config)) {
            throw new IllegalStateException("数据库创建失败");
        }
        return dataBase;
    }

    /**
     * 管理员身份
     */
    @Bean
    public Address adminAddress(SystemConfig config) {
        if (config.getAdmin() == null || config.getAdmin().isEmpty()) {
            throw new IllegalStateException("system.admin 未配置");
        }
        Address admin = Address.fromBase58(config.getAdmin());
        log.info("管理员地址: {}", admin);
        return admin;
    }

    @Bean
    public Address vaultAddress(SystemConfig config) {
        if (config.getVault() == null || config.getVault().isEmpty()) {
            throw new IllegalStateException("system.vault 未配置");
        }
        Address vault = Address.fromBase58(config.getVault());
        log.info("金库地址: {}", vault);
        return vault;
    }
}
