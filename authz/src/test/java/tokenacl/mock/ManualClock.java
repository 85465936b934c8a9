package tokenacl.mock;

import java.util.concurrent.atomic.AtomicLong;

import tokenacl.core.port.out.MonotonicClock;

/**
 * Monotonic clock advanced by hand.
 */
public class ManualClock implements MonotonicClock {

    private final AtomicLong now;

    public ManualClock(long start) {
        this.now = new AtomicLong(start);
    }

    @Override
    public long nowSeconds() {
        return now.get();
    }

    public void advance(long seconds) {
        now.addAndGet(seconds);
    }
}
