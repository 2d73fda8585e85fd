package com.projectgroup5.arenasync.service;

public final class CallOptions {

    private static final CallOptions NONE = new CallOptions(0);

    private final long throttleMs;

    private CallOptions(long throttleMs) {
        if (throttleMs < 0) {
            throw new IllegalArgumentException("throttle must be >= 0: " + throttleMs);
        }
        this.throttleMs = throttleMs;
    }

    public static CallOptions none() {
        return NONE;
    }

    /** 同名调用的最小间隔 */
    public static CallOptions throttle(long throttleMs) {
        return new CallOptions(throttleMs);
    }

    public long getThrottleMs() {
        return throttleMs;
    }

    public boolean isThrottled() {
        return throttleMs > 0;
    }

    @Override
    public String toString() {
        return "CallOptions{throttleMs=" + throttleMs + "}";
    }
}
