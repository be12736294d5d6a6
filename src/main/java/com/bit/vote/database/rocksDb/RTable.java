package com.bit.vote.database.rocksDb;

import com.bit.vote.database.TableEnum;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 表枚举 -> 列族句柄映射
 */
@Slf4j
public class RTable {

    private final Map<TableEnum, ColumnFamilyHandle> handles = new EnumMap<>(TableEnum.class);

    /**
     * 每个表一个列族 点查多的表加布隆过滤器减少磁盘IO
     */
    public static Map<TableEnum, ColumnFamilyDescriptor> getColumnFamilyDescriptors() {
        Map<TableEnum, ColumnFamilyDescriptor> descriptors = new LinkedHashMap<>();
        for (TableEnum table : TableEnum.values()) {
            ColumnFamilyOptions options = new ColumnFamilyOptions();
            if (table == TableEnum.STAKE || table == TableEnum.BALANCE || table == TableEnum.ALLOWANCE) {
                options.setTableFormatConfig(new BlockBasedTableConfig()
                        .setFilterPolicy(new BloomFilter(10, false)));
            }
            descriptors.put(table, new ColumnFamilyDescriptor(
                    table.getColumnFamilyName().getBytes(StandardCharsets.UTF_8), options));
        }
        return descriptors;
    }

    public ColumnFamilyHandle getColumnFamilyHandle(TableEnum table) {
        if (table == null) {
            log.warn("表枚举为空，无法获取列族句柄");
            return null;
        }
        return handles.get(table);
    }

    public void setColumnFamilyHandle(TableEnum table, ColumnFamilyHandle handle) {
        if (table == null || handle == null) {
            log.warn("绑定列族句柄失败：表枚举或句柄为空");
            return;
        }
        handles.put(table, handle);
    }

    public void closeAll() {
        for (Map.Entry<TableEnum, ColumnFamilyHandle> entry : handles.entrySet()) {
            entry.getValue().close();
            log.debug("已关闭表[{}]的列族句柄", entry.getKey());
        }
        handles.clear();
    }
}
