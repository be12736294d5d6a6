package com.bit.vote.common;

import com.bit.vote.util.Base58;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.hash.Hashing;
import lombok.EqualsAndHashCode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 账户地址封装（32字节），参与者、管理员、金库统一用它表示
 */
@EqualsAndHashCode
public class Address {
    public static final int LENGTH = 32;
    private final byte[] value;

    private Address(byte[] value) {
        if (value.length != LENGTH) {
            throw new IllegalArgumentException("地址必须为32字节");
        }
        this.value = value;
    }

    public static Address fromBytes(byte[] bytes) {
        return new Address(Arrays.copyOf(bytes, bytes.length));
    }

    @JsonCreator
    public static Address fromBase58(String base58) {
        if (base58 == null || base58.isEmpty()) {
            throw new IllegalArgumentException("地址不能为空");
        }
        return new Address(Base58.decode(base58));
    }

    /**
     * 由种子字符串派生地址 sha256(seed)
     */
    public static Address ofSeed(String seed) {
        return new Address(Hashing.sha256().hashString(seed, StandardCharsets.UTF_8).asBytes());
    }

    public byte[] toBytes() {
        return Arrays.copyOf(value, LENGTH);
    }

    @JsonValue
    public String toBase58() {
        return Base58.encode(value);
    }

    @Override
    public String toString() {
        return toBase58();
    }
}
