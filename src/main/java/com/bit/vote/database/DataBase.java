package com.bit.vote.database;

import com.bit.vote.config.SystemConfig;

import java.util.List;

//KV数据库操作
public interface DataBase {

    /**
     * 创建数据库
     * @param config
     * @return
     */
    boolean createDatabase(SystemConfig config);

    /**
     * 判断是否存在
     */
    boolean isExist(TableEnum table, byte[] key);

    /**
     * 插入一条数据
     */
    void insert(TableEnum table, byte[] key, byte[] value);

    /**
     * 删除一条数据
     */
    void delete(TableEnum table, byte[] key);

    /**
     * 修改一条数据
     */
    void update(TableEnum table, byte[] key, byte[] value);

    /**
     * 获取一条数据 不存在返回null
     */
    byte[] get(TableEnum table, byte[] key);

    /**
     * 数据数量
     */
    int count(TableEnum table);

    /**
     * 原子执行一组跨表写操作 要么全部生效要么全部不生效
     * @param operations 事务操作列表
     * @return 事务是否成功
     */
    boolean dataTransaction(List<DbOperation> operations);

    /**
     * 按键范围查询数据（[startKey, endKey)）
     * @param startKey 起始键（包含，null 表示最小键）
     * @param endKey 结束键（不包含，null 表示最大键）
     */
    List<KeyValue> rangeQuery(TableEnum table, byte[] startKey, byte[] endKey);

    /**
     * 按键范围查询并限制条数
     */
    List<KeyValue> rangeQueryWithLimit(TableEnum table, byte[] startKey, byte[] endKey, int limit);

    /**
     * 迭代器遍历
     * @param handler 迭代器处理器（处理每条键值对）
     */
    void iterate(TableEnum table, KeyValueHandler handler);

    void close();

    // 辅助类：封装键值对（用于范围查询返回结果）
    class KeyValue {
        private final byte[] key;
        private final byte[] value;

        public KeyValue(byte[] key, byte[] value) {
            this.key = key;
            this.value = value;
        }

        public byte[] getKey() { return key; }
        public byte[] getValue() { return value; }
    }
}
