package com.bit.vote.util;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/**
 * 存储键编码 统一大端 保证范围扫描按数值顺序返回
 */
public class ByteUtils {

    public static byte[] longToBytes(long value) {
        return Longs.toByteArray(value);
    }

    public static long bytesToLong(byte[] bytes) {
        return Longs.fromByteArray(bytes);
    }

    /**
     * 项目ID + 序号  投票人序列的键
     */
    public static byte[] indexKey(long id, int index) {
        return Bytes.concat(Longs.toByteArray(id), Ints.toByteArray(index));
    }

    /**
     * 前缀 + 任意后缀
     */
    public static byte[] compositeKey(long id, byte[] suffix) {
        return Bytes.concat(Longs.toByteArray(id), suffix);
    }

    public static byte[] compositeKey(byte[] prefix, byte[] suffix) {
        return Bytes.concat(prefix, suffix);
    }
}
