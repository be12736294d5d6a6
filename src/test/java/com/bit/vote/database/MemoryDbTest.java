package com.bit.vote.database;

import com.bit.vote.config.SystemConfig;
import com.bit.vote.database.memory.MemoryDb;
import com.bit.vote.util.ByteUtils;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
public class MemoryDbTest {

    private DataBase dataBase;

    @BeforeEach
    void setUp() {
        dataBase = new MemoryDb();
        assertTrue(dataBase.createDatabase(new SystemConfig()));
    }

    @Test
    void basicCrud() {
        byte[] key = "key".getBytes();
        dataBase.insert(TableEnum.META, key, "value".getBytes());
        assertArrayEquals("value".getBytes(), dataBase.get(TableEnum.META, key));
        assertTrue(dataBase.isExist(TableEnum.META, key));
        // 不同表互不影响
        assertNull(dataBase.get(TableEnum.PROJECT, key));

        dataBase.update(TableEnum.META, key, "v2".getBytes());
        assertArrayEquals("v2".getBytes(), dataBase.get(TableEnum.META, key));
        dataBase.delete(TableEnum.META, key);
        assertFalse(dataBase.isExist(TableEnum.META, key));
    }

    @Test
    void transactionAppliesAllOperations() {
        dataBase.insert(TableEnum.META, "gone".getBytes(), new byte[]{1});
        List<DbOperation> ops = new ArrayList<>();
        ops.add(DbOperation.put(TableEnum.META, "a".getBytes(), new byte[]{1}));
        ops.add(DbOperation.put(TableEnum.PROJECT, "b".getBytes(), new byte[]{2}));
        ops.add(DbOperation.delete(TableEnum.META, "gone".getBytes()));
        assertTrue(dataBase.dataTransaction(ops));
        assertEquals(1, dataBase.count(TableEnum.META));
        assertEquals(1, dataBase.count(TableEnum.PROJECT));
    }

    @Test
    void rangeQueryUsesUnsignedOrder() {
        for (long i = 0; i < 5; i++) {
            dataBase.insert(TableEnum.VOTER, ByteUtils.indexKey(7, (int) i), ByteUtils.longToBytes(i));
        }
        dataBase.insert(TableEnum.VOTER, ByteUtils.indexKey(7, 200), ByteUtils.longToBytes(200));
        dataBase.insert(TableEnum.VOTER, ByteUtils.indexKey(8, 0), ByteUtils.longToBytes(99));

        List<DataBase.KeyValue> rows = dataBase.rangeQuery(TableEnum.VOTER,
                ByteUtils.longToBytes(7), ByteUtils.longToBytes(8));
        assertEquals(6, rows.size());
        assertEquals(200, ByteUtils.bytesToLong(rows.get(5).getValue()));

        assertEquals(2, dataBase.rangeQueryWithLimit(TableEnum.VOTER,
                ByteUtils.longToBytes(7), ByteUtils.longToBytes(8), 2).size());
        // 起点不小于终点时返回空
        assertTrue(dataBase.rangeQuery(TableEnum.VOTER,
                ByteUtils.longToBytes(8), ByteUtils.longToBytes(7)).isEmpty());
    }

    @Test
    void iterateStopsWhenHandlerReturnsFalse() {
        for (int i = 0; i < 10; i++) {
            dataBase.insert(TableEnum.EVENT, ByteUtils.longToBytes(i), new byte[]{(byte) i});
        }
        List<Byte> seen = new ArrayList<>();
        dataBase.iterate(TableEnum.EVENT, (key, value) -> {
            seen.add(value[0]);
            return seen.size() < 3;
        });
        assertEquals(List.of((byte) 0, (byte) 1, (byte) 2), seen);
    }
}
