package tokenacl.core.port.out;

/**
 * Coarse monotonic time source for cache expiry.
 *
 * <p>Time advances in whole seconds and is unrelated to wall-clock time; only
 * differences between readings are meaningful.
 */
public interface MonotonicClock {

    /**
     * Current monotonic time in whole seconds.
     */
    long nowSeconds();
}
