package com.bit.vote.structure.stake;

import lombok.Data;

import java.nio.ByteBuffer;

/**
 * 质押记录（项目ID + 参与者地址 唯一）
 */
@Data
public class StakeRecord {

    /**
     * 该参与者在该项目上的累计质押
     */
    private long amount;

    /**
     * 最近一次投票时间（epoch秒）
     */
    private long lastStakeTime;

    /**
     * 是否已取回 置true后不再回退
     */
    private boolean hasUnstaked;

    public static final int SIZE = 8 + 8 + 1;

    public static StakeRecord empty() {
        return new StakeRecord();
    }

    public byte[] serialize() {
        ByteBuffer buffer = ByteBuffer.allocate(SIZE);
        buffer.putLong(amount);
        buffer.putLong(lastStakeTime);
        buffer.put((byte) (hasUnstaked ? 1 : 0));
        return buffer.array();
    }

    public static StakeRecord deserialize(byte[] data) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        StakeRecord record = new StakeRecord();
        record.setAmount(buffer.getLong());
        record.setLastStakeTime(buffer.getLong());
        record.setHasUnstaked(buffer.get() != 0);
        return record;
    }
}
