package com.work.lock.core.lock;

import java.time.Duration;

/**
 * 一次加锁涉及的不可变坐标：锁名、owner、两个 key 以及过期时间。
 */
final class LockRef {

    private final String name;
    private final String ownerId;
    private final String holderKey;
    private final Duration expire;

    LockRef(String name, String ownerId, Duration expire) {
        this.name = name;
        this.ownerId = ownerId;
        this.holderKey = LockKeys.holderKey(name);
        this.expire = expire;
    }

    String name() {
        return name;
    }

    String ownerId() {
        return ownerId;
    }

    String holderKey() {
        return holderKey;
    }

    Duration expire() {
        return expire;
    }
}
