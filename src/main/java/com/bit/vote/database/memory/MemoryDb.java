package com.bit.vote.database.memory;

import com.bit.vote.config.SystemConfig;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.DbOperation;
import com.bit.vote.database.KeyValueHandler;
import com.bit.vote.database.TableEnum;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存数据库 键按无符号字节序排列 与RocksDB默认比较器一致
 */
@Slf4j
public class MemoryDb implements DataBase {

    private final Map<TableEnum, ConcurrentSkipListMap<byte[], byte[]>> tables = new EnumMap<>(TableEnum.class);
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    public MemoryDb() {
        for (TableEnum table : TableEnum.values()) {
            tables.put(table, new ConcurrentSkipListMap<>(Arrays::compareUnsigned));
        }
    }

    @Override
    public boolean createDatabase(SystemConfig config) {
        log.info("内存数据库创建成功，表数量: {}", tables.size());
        return true;
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            tables.get(table).put(key.clone(), value.clone());
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            tables.get(table).remove(key);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            byte[] value = tables.get(table).get(key);
            return value == null ? null : value.clone();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        rwLock.readLock().lock();
        try {
            return tables.get(table).size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            log.warn("事务操作列表为空，无需执行");
            return true;
        }
        rwLock.writeLock().lock();
        try {
            for (DbOperation op : operations) {
                if (op.getType() == DbOperation.OpType.DELETE) {
                    tables.get(op.getTable()).remove(op.getKey());
                } else {
                    tables.get(op.getTable()).put(op.getKey().clone(), op.getValue().clone());
                }
            }
            log.debug("事务执行成功，操作数: {}", operations.size());
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public List<KeyValue> rangeQuery(TableEnum table, byte[] startKey, byte[] endKey) {
        return rangeQueryWithLimit(table, startKey, endKey, Integer.MAX_VALUE);
    }

    @Override
    public List<KeyValue> rangeQueryWithLimit(TableEnum table, byte[] startKey, byte[] endKey, int limit) {
        if (table == null || limit <= 0) {
            throw new IllegalArgumentException("无效参数：表名不能为空或limit必须为正数");
        }
        if (startKey != null && endKey != null && startKey.length > 0 && endKey.length > 0
                && Arrays.compareUnsigned(startKey, endKey) >= 0) {
            return new ArrayList<>();
        }
        rwLock.readLock().lock();
        try {
            NavigableMap<byte[], byte[]> view = tables.get(table);
            if (startKey != null && startKey.length > 0) {
                view = view.tailMap(startKey, true);
            }
            if (endKey != null && endKey.length > 0) {
                view = view.headMap(endKey, false);
            }
            List<KeyValue> result = new ArrayList<>();
            for (Map.Entry<byte[], byte[]> entry : view.entrySet()) {
                if (result.size() >= limit) {
                    break;
                }
                result.add(new KeyValue(entry.getKey().clone(), entry.getValue().clone()));
            }
            return result;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        rwLock.readLock().lock();
        try {
            for (Map.Entry<byte[], byte[]> entry : tables.get(table).entrySet()) {
                if (!handler.handle(entry.getKey().clone(), entry.getValue().clone())) {
                    break;
                }
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            tables.values().forEach(Map::clear);
            log.info("内存数据库已清空");
        } finally {
            rwLock.writeLock().unlock();
        }
    }
}
