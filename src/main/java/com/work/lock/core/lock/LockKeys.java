package com.work.lock.core.lock;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 锁名到存储 key 的映射。同名锁在任意进程里都落到同一对 key 上。
 */
public final class LockKeys {

    public static final String HOLDER_PREFIX = "lock:";
    public static final String SIGNAL_PREFIX = "lock-signal:";
    public static final String HOLDER_PATTERN = HOLDER_PREFIX + "*";

    private LockKeys() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String holderKey(String name) {
        return HOLDER_PREFIX + requireNonEmpty(name, "name");
    }

    public static String signalKey(String name) {
        return SIGNAL_PREFIX + requireNonEmpty(name, "name");
    }

    /**
     * 从持有者 key 还原锁名；不是持有者 key 时抛出 IllegalArgumentException。
     */
    public static String nameOf(String holderKey) {
        requireNonNull(holderKey, "holderKey");
        if (!holderKey.startsWith(HOLDER_PREFIX) || holderKey.length() == HOLDER_PREFIX.length()) {
            throw new IllegalArgumentException("not a holder key: " + holderKey);
        }
        return holderKey.substring(HOLDER_PREFIX.length());
    }
}
