package com.vendoretl;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/** Returns the given instants in order, then keeps returning the last one. */
class SteppingClock extends Clock {

    private final List<Instant> instants;
    private final AtomicInteger calls = new AtomicInteger();

    SteppingClock(Instant... instants) {
        this.instants = List.of(instants);
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
        int index = Math.min(calls.getAndIncrement(), instants.size() - 1);
        return instants.get(index);
    }
}
