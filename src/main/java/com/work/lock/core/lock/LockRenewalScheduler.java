package com.work.lock.core.lock;

import com.work.lock.core.store.ExtendResult;
import com.work.lock.core.store.LockStore;
import com.work.lock.core.support.LockEventListener;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

import static com.work.lock.core.support.ValidationUtils.requireNonNull;
import static com.work.lock.core.support.ValidationUtils.requirePositive;

/**
 * 自动续期调度器：每个持有中的锁一个周期任务，按固定间隔做“校验 owner 后续期”。
 * <p>
 * 任务只持有 {@link LockRef} 与句柄的守护锁，不引用句柄本身，句柄被回收后可由 Cleaner 停止任务。
 * 发现锁已被他人持有时任务自行停止并通知 listener，不抛异常。
 */
public class LockRenewalScheduler implements AutoCloseable {

    private final LockStore store;
    private final LockEventListener listener;
    private final ScheduledThreadPoolExecutor executor;

    public LockRenewalScheduler(LockStore store, LockEventListener listener, int threads) {
        this.store = requireNonNull(store, "store");
        this.listener = requireNonNull(listener, "listener");
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be > 0");
        }
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName("redis-lock-renewal-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        this.executor = new ScheduledThreadPoolExecutor(threads, tf);
        // 取消的任务立即移出队列，避免大量短锁堆积
        this.executor.setRemoveOnCancelPolicy(true);
    }

    /**
     * 开始续期。guard 与句柄的 release 共用，保证 release 的删除不会与续期交错。
     */
    Renewal start(LockRef ref, Duration interval, ReentrantLock guard) {
        requirePositive(interval, "interval");
        Renewal renewal = new Renewal(ref, guard);
        long periodMillis = Math.max(interval.toMillis(), 1L);
        renewal.future = executor.scheduleWithFixedDelay(renewal::tick, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        // stop() 可能早于 future 赋值
        if (renewal.stopped) {
            renewal.future.cancel(false);
        }
        return renewal;
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * 单个锁的续期任务。
     */
    final class Renewal {

        private final LockRef ref;
        private final ReentrantLock guard;
        private volatile ScheduledFuture<?> future;
        private volatile boolean stopped;

        private Renewal(LockRef ref, ReentrantLock guard) {
            this.ref = ref;
            this.guard = guard;
        }

        private void tick() {
            guard.lock();
            try {
                if (stopped) {
                    return;
                }
                ExtendResult result = store.expireIfEquals(ref.holderKey(), ref.ownerId(), ref.expire());
                if (result == ExtendResult.EXTENDED) {
                    listener.renewed(ref.name(), ref.ownerId());
                    return;
                }
                stop();
                listener.renewalLost(ref.name(), ref.ownerId(), result);
            } catch (RuntimeException e) {
                listener.renewalFailed(ref.name(), ref.ownerId(), e);
            } finally {
                guard.unlock();
            }
        }

        /**
         * 停止后不会再有新的续期写入；正在执行的一轮由 guard 串行化。
         */
        void stop() {
            stopped = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }

        boolean isStopped() {
            return stopped;
        }
    }
}
