package com.work.lock.core.lock;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.exception.AlreadyAcquiredException;
import com.work.lock.core.exception.LockConfigurationException;
import com.work.lock.core.store.LockStore;
import com.work.lock.core.support.LockEventListener;

import java.time.Duration;

import static com.work.lock.core.support.ValidationUtils.optionalDuration;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 加锁算法：SET NX 抢占，失败后在唤醒通道上阻塞等待，被唤醒后再抢。
 * <p>
 * 阻塞等待的上限取“剩余 timeout”与“兜底唤醒间隔”中较小者。兜底唤醒间隔默认取 expire：
 * 持有者崩溃后 key 自然过期不会发信号，等待者至多多等一个 expire 就会重试。
 */
public class LockAcquirer {

    private final LockStore store;
    private final LockEventListener listener;
    private final Duration idleWakeInterval;

    /**
     * @param idleWakeInterval 未配置 expire 时的兜底唤醒间隔，null 表示只靠信号唤醒
     */
    public LockAcquirer(LockStore store, LockEventListener listener, Duration idleWakeInterval) {
        this.store = requireNonNull(store, "store");
        this.listener = requireNonNull(listener, "listener");
        this.idleWakeInterval = idleWakeInterval;
    }

    /**
     * 校验 blocking / timeout 与锁参数的组合，返回归一化后的 timeout（null 表示不限时）。
     * 所有检查都在访问存储之前完成。
     */
    public Duration checkArguments(LockOptions options, boolean blocking, Duration timeout) {
        Duration normalized = optionalDuration(timeout, "timeout");
        if (normalized == null) {
            return null;
        }
        Duration expire = options.getExpire();
        if (expire != null && !options.isAutoRenewal() && expire.compareTo(normalized) < 0) {
            throw new LockConfigurationException("timeout (" + normalized + ") 不能大于 expire (" + expire
                    + ")，否则等待期间锁可能已过期；如需长时间持有请开启 autoRenewal");
        }
        if (!blocking) {
            throw new LockConfigurationException("非阻塞获取不能指定 timeout");
        }
        return normalized;
    }

    /**
     * @param timeout 已经过 {@link #checkArguments} 归一化的 timeout
     * @return true 表示加锁成功；非阻塞失败或超时返回 false
     * @throws AlreadyAcquiredException 存储中的持有者就是当前 owner
     */
    boolean acquire(LockRef ref, SignalChannel channel, boolean blocking, Duration timeout) {
        listener.acquiring(ref.name(), ref.ownerId());
        long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();

        while (true) {
            if (store.setIfAbsent(ref.holderKey(), ref.ownerId(), ref.expire())) {
                listener.acquired(ref.name(), ref.ownerId());
                return true;
            }
            if (ref.ownerId().equals(store.get(ref.holderKey()))) {
                throw new AlreadyAcquiredException("lock " + ref.name() + " is already held by owner " + ref.ownerId());
            }
            if (!blocking) {
                listener.acquireFailed(ref.name(), ref.ownerId());
                return false;
            }

            Duration wait = ref.expire() != null ? ref.expire() : idleWakeInterval;
            if (timeout != null) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0L) {
                    listener.acquireFailed(ref.name(), ref.ownerId());
                    return false;
                }
                Duration left = Duration.ofNanos(remaining);
                if (wait == null || left.compareTo(wait) < 0) {
                    wait = left;
                }
            }
            listener.waiting(ref.name(), ref.ownerId(), wait);
            channel.await(wait);
        }
    }
}
