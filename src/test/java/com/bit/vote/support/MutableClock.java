package com.bit.vote.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 测试用时钟 可手动拨动
 */
public class MutableClock extends Clock {

    private volatile long epochSecond;

    public MutableClock(long epochSecond) {
        this.epochSecond = epochSecond;
    }

    public void set(long epochSecond) {
        this.epochSecond = epochSecond;
    }

    public void advance(long seconds) {
        this.epochSecond += seconds;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochSecond(epochSecond);
    }
}
