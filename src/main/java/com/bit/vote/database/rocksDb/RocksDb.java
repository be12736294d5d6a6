package com.bit.vote.database.rocksDb;

import com.bit.vote.config.SystemConfig;
import com.bit.vote.database.DataBase;
import com.bit.vote.database.DbOperation;
import com.bit.vote.database.KeyValueHandler;
import com.bit.vote.database.TableEnum;
import lombok.extern.slf4j.Slf4j;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.DBOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 持久化存储 每个表一个列族
 */
@Slf4j
public class RocksDb implements DataBase {

    static {
        RocksDB.loadLibrary();
    }

    private RocksDB db;
    private DBOptions options;
    private final RTable rTable = new RTable();
    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();
    private String dbPath;

    @Override
    public boolean createDatabase(SystemConfig config) {
        String path = config.getPath();
        if (path == null) {
            return false;
        }
        dbPath = path;

        try {
            File dbDir = new File(dbPath);
            if (!dbDir.exists() && !dbDir.mkdirs()) {
                log.error("创建数据库目录失败: {}", dbPath);
                return false;
            }

            List<ColumnFamilyDescriptor> cfDescriptors = new ArrayList<>();
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            // 1. 默认列族（索引0）
            cfDescriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, new ColumnFamilyOptions()));

            // 2. 自定义列族 顺序与TableEnum一致
            Map<TableEnum, ColumnFamilyDescriptor> customDescriptors = RTable.getColumnFamilyDescriptors();
            List<TableEnum> tableEnums = new ArrayList<>(customDescriptors.keySet());
            for (TableEnum table : tableEnums) {
                cfDescriptors.add(customDescriptors.get(table));
            }

            options = new DBOptions()
                    .setCreateIfMissing(true)
                    .setCreateMissingColumnFamilies(true)
                    .setInfoLogLevel(InfoLogLevel.ERROR_LEVEL);

            db = RocksDB.open(options, dbPath, cfDescriptors, cfHandles);

            if (cfHandles.size() != cfDescriptors.size()) {
                throw new IllegalStateException("列族句柄数量与描述符不匹配，初始化失败");
            }
            // 自定义列族从索引1开始绑定
            for (int i = 0; i < tableEnums.size(); i++) {
                rTable.setColumnFamilyHandle(tableEnums.get(i), cfHandles.get(i + 1));
                log.debug("绑定表[{}]的列族句柄，索引: {}", tableEnums.get(i), i + 1);
            }
            log.info("RocksDB创建成功，路径: {}，列族总数: {}", dbPath, cfDescriptors.size());
            return true;
        } catch (RocksDBException e) {
            log.error("创建RocksDB失败", e);
            return false;
        }
    }

    @Override
    public boolean isExist(TableEnum table, byte[] key) {
        return get(table, key) != null;
    }

    @Override
    public void insert(TableEnum table, byte[] key, byte[] value) {
        rwLock.writeLock().lock();
        try {
            db.put(requireHandle(table), key, value);
        } catch (RocksDBException e) {
            log.error("插入数据失败, table={}", table, e);
            throw new IllegalStateException("插入数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void delete(TableEnum table, byte[] key) {
        rwLock.writeLock().lock();
        try {
            db.delete(requireHandle(table), key);
        } catch (RocksDBException e) {
            log.error("删除数据失败, table={}", table, e);
            throw new IllegalStateException("删除数据失败", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public void update(TableEnum table, byte[] key, byte[] value) {
        // RocksDB的更新就是覆盖写入
        insert(table, key, value);
    }

    @Override
    public byte[] get(TableEnum table, byte[] key) {
        rwLock.readLock().lock();
        try {
            return db.get(requireHandle(table), key);
        } catch (RocksDBException e) {
            log.error("获取数据失败, table={}", table, e);
            throw new IllegalStateException("获取数据失败", e);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public int count(TableEnum table) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            iterator.seekToFirst();
            int count = 0;
            while (iterator.isValid()) {
                count++;
                iterator.next();
            }
            return count;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    /**
     * 执行跨列族事务（原子操作）
     */
    @Override
    public boolean dataTransaction(List<DbOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            log.warn("事务操作列表为空，无需执行");
            return true;
        }

        rwLock.writeLock().lock();
        try (WriteBatch writeBatch = new WriteBatch();
             WriteOptions writeOptions = new WriteOptions()) {
            writeOptions.setSync(true);
            for (DbOperation op : operations) {
                ColumnFamilyHandle cfHandle = requireHandle(op.getTable());
                if (op.getType() == DbOperation.OpType.DELETE) {
                    writeBatch.delete(cfHandle, op.getKey());
                } else {
                    writeBatch.put(cfHandle, op.getKey(), op.getValue());
                }
            }
            // WriteBatch 要么全成功，要么全失败
            db.write(writeOptions, writeBatch);
            log.debug("事务执行成功，操作数: {}", operations.size());
            return true;
        } catch (RocksDBException e) {
            log.error("事务执行失败", e);
            return false;
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

        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            List<KeyValue> result = new ArrayList<>();
            if (startKey != null && startKey.length > 0) {
                iterator.seek(startKey);
            } else {
                iterator.seekToFirst();
            }
            // 遍历范围 [startKey, endKey)
            while (iterator.isValid() && result.size() < limit) {
                byte[] currentKey = iterator.key();
                if (endKey != null && endKey.length > 0 && Arrays.compareUnsigned(currentKey, endKey) >= 0) {
                    break;
                }
                result.add(new KeyValue(currentKey, iterator.value()));
                iterator.next();
            }
            return result.isEmpty() ? Collections.emptyList() : result;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void iterate(TableEnum table, KeyValueHandler handler) {
        rwLock.readLock().lock();
        try (RocksIterator iterator = db.newIterator(requireHandle(table))) {
            iterator.seekToFirst();
            while (iterator.isValid()) {
                if (!handler.handle(iterator.key(), iterator.value())) {
                    break;
                }
                iterator.next();
            }
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public void close() {
        rwLock.writeLock().lock();
        try {
            if (db != null) {
                rTable.closeAll();
                db.close();
                db = null;
                log.info("RocksDB连接已关闭");
            }
            if (options != null) {
                options.close();
                options = null;
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private ColumnFamilyHandle requireHandle(TableEnum table) {
        ColumnFamilyHandle cfHandle = rTable.getColumnFamilyHandle(table);
        if (cfHandle == null) {
            throw new IllegalArgumentException("表不存在: " + table);
        }
        return cfHandle;
    }
}
