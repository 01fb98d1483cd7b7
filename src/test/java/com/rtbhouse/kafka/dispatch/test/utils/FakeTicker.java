package com.rtbhouse.kafka.dispatch.test.utils;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.Ticker;

public class FakeTicker extends Ticker {

    private final AtomicLong nanos = new AtomicLong();

    public FakeTicker advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
        return this;
    }

    @Override
    public long read() {
        return nanos.get();
    }
}
