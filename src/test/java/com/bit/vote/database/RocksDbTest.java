package com.bit.vote.database;

import com.bit.vote.config.SystemConfig;
import com.bit.vote.database.rocksDb.RocksDb;
import com.bit.vote.util.ByteUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RocksDbTest {

    @TempDir
    Path dir;

    private SystemConfig config() {
        SystemConfig config = new SystemConfig();
        config.setDbType("rocksdb");
        config.setPath(dir.toString());
        return config;
    }

    @Test
    void dataSurvivesReopen() {
        RocksDb first = new RocksDb();
        assertTrue(first.createDatabase(config()));
        assertTrue(first.dataTransaction(List.of(
                DbOperation.put(TableEnum.PROJECT, ByteUtils.longToBytes(0), "p0".getBytes()),
                DbOperation.put(TableEnum.META, "count".getBytes(), ByteUtils.longToBytes(1)))));
        first.close();

        RocksDb second = new RocksDb();
        assertTrue(second.createDatabase(config()));
        try {
            assertArrayEquals("p0".getBytes(), second.get(TableEnum.PROJECT, ByteUtils.longToBytes(0)));
            assertEquals(1, ByteUtils.bytesToLong(second.get(TableEnum.META, "count".getBytes())));
            assertNull(second.get(TableEnum.STAKE, ByteUtils.longToBytes(0)));
        } finally {
            second.close();
        }
    }

    @Test
    void rangeQueryWithinPrefix() {
        RocksDb db = new RocksDb();
        assertTrue(db.createDatabase(config()));
        try {
            for (int i = 0; i < 4; i++) {
                db.insert(TableEnum.VOTER, ByteUtils.indexKey(1, i), ByteUtils.longToBytes(i));
            }
            db.insert(TableEnum.VOTER, ByteUtils.indexKey(2, 0), ByteUtils.longToBytes(9));
            List<DataBase.KeyValue> rows = db.rangeQuery(TableEnum.VOTER,
                    ByteUtils.longToBytes(1), ByteUtils.longToBytes(2));
            assertEquals(4, rows.size());
            assertEquals(3, ByteUtils.bytesToLong(rows.get(3).getValue()));
            db.delete(TableEnum.VOTER, ByteUtils.indexKey(1, 0));
            assertEquals(3, db.rangeQuery(TableEnum.VOTER, ByteUtils.longToBytes(1), ByteUtils.longToBytes(2)).size());
        } finally {
            db.close();
        }
    }
}
