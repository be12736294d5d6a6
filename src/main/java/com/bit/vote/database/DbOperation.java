package com.bit.vote.database;

import lombok.Getter;

/**
 * 事务中的单个写操作
 */
@Getter
public class DbOperation {
    public enum OpType {
        PUT,
        DELETE
    }

    private final TableEnum table;
    private final byte[] key;
    private final byte[] value;
    private final OpType type;

    private DbOperation(TableEnum table, byte[] key, byte[] value, OpType type) {
        this.table = table;
        this.key = key;
        this.value = value;
        this.type = type;
    }

    public static DbOperation put(TableEnum table, byte[] key, byte[] value) {
        return new DbOperation(table, key, value, OpType.PUT);
    }

    public static DbOperation delete(TableEnum table, byte[] key) {
        return new DbOperation(table, key, null, OpType.DELETE);
    }
}
