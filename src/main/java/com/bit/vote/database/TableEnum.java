package com.bit.vote.database;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * 表枚举（集中管理所有表的元信息，作为唯一数据源）
 */
public enum TableEnum {
    PROJECT((short) 1, "project"),          // 项目ID -> 项目
    STAKE((short) 2, "stake"),              // 项目ID+地址 -> 质押记录
    VOTER((short) 3, "voter"),              // 项目ID+序号 -> 地址（按首次投票顺序追加）
    PARTICIPANT((short) 4, "participant"),  // 地址 -> 跨项目质押总额
    BALANCE((short) 5, "balance"),          // 地址 -> 代币余额
    ALLOWANCE((short) 6, "allowance"),      // 所有者+被授权者 -> 额度
    EVENT((short) 7, "event"),              // 事件序号 -> 事件JSON
    META((short) 8, "meta");                // 计数器等

    @Getter private final short code;  // 表唯一标识
    @Getter private final String columnFamilyName;  // 列族实际存储名称

    TableEnum(short code, String columnFamilyName) {
        this.code = code;
        this.columnFamilyName = columnFamilyName;
    }

    // 缓存：标识 -> 枚举实例（提高查询效率）
    private static final Map<Short, TableEnum> CODE_TO_ENUM = new HashMap<>();

    static {
        for (TableEnum table : values()) {
            CODE_TO_ENUM.put(table.code, table);
        }
    }

    public static TableEnum getByCode(short code) {
        return CODE_TO_ENUM.get(code);
    }
}
