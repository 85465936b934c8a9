package tokenacl.adapter.out.clock;

import jakarta.enterprise.context.ApplicationScoped;

import tokenacl.core.port.out.MonotonicClock;

/**
 * Monotonic clock backed by {@link System#nanoTime()}.
 *
 * <p>Reports whole seconds since the clock was created, rounding to the
 * nearest second with half a second rounding up. Wall-clock adjustments do
 * not affect it.
 */
@ApplicationScoped
public class SystemMonotonicClock implements MonotonicClock {

    private static final long NANOS_PER_SECOND = 1_000_000_000L;
    private static final long HALF_SECOND_NANOS = NANOS_PER_SECOND / 2;

    private final long origin = System.nanoTime();

    @Override
    public long nowSeconds() {
        return toSeconds(System.nanoTime() - origin);
    }

    static long toSeconds(long nanos) {
        final var seconds = Math.floorDiv(nanos, NANOS_PER_SECOND);
        return Math.floorMod(nanos, NANOS_PER_SECOND) >= HALF_SECOND_NANOS ? seconds + 1 : seconds;
    }
}
