package com.work.lock.core.lock;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.exception.AlreadyAcquiredException;
import com.work.lock.core.exception.LockConfigurationException;
import com.work.lock.core.exception.LockException;
import com.work.lock.core.exception.NotAcquiredException;
import com.work.lock.core.exception.NotExpirableException;
import com.work.lock.core.store.LockStore;

import java.lang.ref.Cleaner;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.lock.core.support.ValidationUtils.optionalDuration;

/**
 * 绑定到一个锁名的句柄，由 {@link DistributedLockFactory} 创建。
 * <p>
 * 用法：
 * <pre>{@code
 * try (DistributedLock lock = factory.newLock("report")) {
 *     lock.acquire();
 *     ...
 * }
 * }</pre>
 * 句柄可以反复 acquire/release，owner id 在句柄生命周期内不变。{@link #isHeld()} 只反映本实例的状态，
 * 另一个进程用同一 owner id 释放后，本实例的 release 会抛出 {@link NotAcquiredException}。
 */
public class DistributedLock implements AutoCloseable {

    private static final Cleaner CLEANER = Cleaner.create();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final LockRef ref;
    private final LockOptions options;
    private final LockStore store;
    private final SignalChannel channel;
    private final LockAcquirer acquirer;
    private final LockReleaser releaser;
    private final LockRenewalScheduler renewalScheduler;
    private final LockAdmin admin;

    private final ReentrantLock guard = new ReentrantLock();
    private final AtomicReference<LockRenewalScheduler.Renewal> renewal = new AtomicReference<>();
    private volatile boolean held;

    DistributedLock(String name,
                    LockOptions options,
                    LockStore store,
                    SignalChannel channel,
                    LockAcquirer acquirer,
                    LockReleaser releaser,
                    LockRenewalScheduler renewalScheduler,
                    LockAdmin admin) {
        this.options = options;
        String ownerId = options.getOwnerId() != null ? options.getOwnerId() : randomOwnerId();
        this.ref = new LockRef(name, ownerId, options.getExpire());
        this.store = store;
        this.channel = channel;
        this.acquirer = acquirer;
        this.releaser = releaser;
        this.renewalScheduler = renewalScheduler;
        this.admin = admin;
        CLEANER.register(this, stopAction(renewal));
    }

    // 不能捕获 this，否则句柄永远不会被回收
    private static Runnable stopAction(AtomicReference<LockRenewalScheduler.Renewal> slot) {
        return () -> {
            LockRenewalScheduler.Renewal r = slot.getAndSet(null);
            if (r != null) {
                r.stop();
            }
        };
    }

    static String randomOwnerId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }

    public String getName() {
        return ref.name();
    }

    /**
     * 本句柄写入存储的 owner id。
     */
    public String getId() {
        return ref.ownerId();
    }

    public LockOptions getOptions() {
        return options;
    }

    /**
     * 本实例是否持有锁（最近一次 acquire 成功且尚未 release）。
     */
    public boolean isHeld() {
        return held;
    }

    /**
     * 续期任务是否在运行。
     */
    public boolean isRenewing() {
        LockRenewalScheduler.Renewal r = renewal.get();
        return r != null && !r.isStopped();
    }

    /**
     * 阻塞获取，timeout 取自 {@link LockOptions#getTimeout()}。
     */
    public boolean acquire() {
        return acquire(true, options.getTimeout());
    }

    /**
     * @param blocking false 时只尝试一次；true 时等待，timeout 取自 {@link LockOptions#getTimeout()}
     */
    public boolean acquire(boolean blocking) {
        return acquire(blocking, blocking ? options.getTimeout() : null);
    }

    /**
     * Redis 存储下 BLPOP 以秒为单位阻塞，超时返回可能比 timeout 晚，最多约 1 秒。
     *
     * @param blocking 是否阻塞等待
     * @param timeout  阻塞等待上限，null 或 0 表示不限时；非阻塞时必须为空
     * @return true 表示获取成功；非阻塞失败或超时返回 false
     * @throws LockConfigurationException timeout 为负，或与 expire / blocking 组合非法
     * @throws AlreadyAcquiredException   本实例已持有，或存储中的持有者就是本 owner id
     * @throws LockException              需要续期但续期调度器已关闭（工厂已 close）
     */
    public boolean acquire(boolean blocking, Duration timeout) {
        Duration normalized = acquirer.checkArguments(options, blocking, timeout);
        if (held) {
            throw new AlreadyAcquiredException("already acquired from this lock instance: " + ref.name());
        }
        if (options.isAutoRenewal() && renewalScheduler.isShutdown()) {
            throw new LockException("renewal scheduler is shut down, cannot acquire " + ref.name() + " with autoRenewal");
        }
        if (!acquirer.acquire(ref, channel, blocking, normalized)) {
            return false;
        }
        guard.lock();
        try {
            held = true;
            if (options.isAutoRenewal()) {
                startRenewalOrUndo();
            }
        } finally {
            guard.unlock();
        }
        return true;
    }

    // 续期启动失败时撤销本次加锁，不留下“已写入但无人续期”的持有者
    private void startRenewalOrUndo() {
        try {
            startRenewal();
        } catch (RuntimeException e) {
            held = false;
            try {
                releaser.release(ref, channel);
            } catch (RuntimeException undo) {
                e.addSuppressed(undo);
            }
            throw e;
        }
    }

    private void startRenewal() {
        LockRenewalScheduler.Renewal previous = renewal.getAndSet(
                renewalScheduler.start(ref, options.getRenewalInterval(), guard));
        if (previous != null) {
            previous.stop();
        }
    }

    private void stopRenewal() {
        LockRenewalScheduler.Renewal r = renewal.getAndSet(null);
        if (r != null) {
            r.stop();
        }
    }

    /**
     * 释放锁并唤醒等待者。即使本实例从未 acquire，也会按 owner id 尝试释放，
     * 便于跨进程“按已知 id 释放”。
     *
     * @throws NotAcquiredException 存储中的持有者不是本 owner id
     */
    public void release() {
        guard.lock();
        try {
            stopRenewal();
            held = false;
            releaser.release(ref, channel);
        } finally {
            guard.unlock();
        }
    }

    /**
     * 按初始 expire 续期。
     *
     * @throws LockConfigurationException 句柄未配置 expire
     */
    public void extend() {
        if (options.getExpire() == null) {
            throw new LockConfigurationException("lock " + ref.name() + " has no expire configured, pass one explicitly");
        }
        extend(options.getExpire());
    }

    /**
     * 把过期时间重置为 expire。持有同一 owner id 的任意句柄都可以续期。
     *
     * @throws NotAcquiredException  持有者不是本 owner id
     * @throws NotExpirableException 持有者 key 没有过期时间
     */
    public void extend(Duration expire) {
        Duration normalized = optionalDuration(expire, "expire");
        if (normalized == null) {
            throw new LockConfigurationException("expire must be > 0");
        }
        releaser.extend(ref, normalized);
    }

    /**
     * 是否有任意 owner 持有该锁。
     */
    public boolean locked() {
        return store.get(ref.holderKey()) != null;
    }

    /**
     * 存储中当前持有者的 owner id，没有持有者时返回 null。
     */
    public String getOwnerId() {
        return store.get(ref.holderKey());
    }

    /**
     * 强制删除该锁（不校验 owner）并唤醒等待者，同时停止本实例的续期。
     */
    public void reset() {
        guard.lock();
        try {
            stopRenewal();
            held = false;
            admin.reset(ref.name());
        } finally {
            guard.unlock();
        }
    }

    /**
     * 持有中则释放，否则什么都不做。
     */
    @Override
    public void close() {
        if (held) {
            release();
        } else {
            stopRenewal();
        }
    }

    @Override
    public String toString() {
        return "DistributedLock{name=" + ref.name() + ", id=" + ref.ownerId() + ", held=" + held + '}';
    }
}
