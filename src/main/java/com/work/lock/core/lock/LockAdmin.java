package com.work.lock.core.lock;

import com.work.lock.core.store.LockStore;
import com.work.lock.core.support.LockEventListener;

import java.time.Duration;
import java.util.List;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;
import static com.work.lock.core.support.ValidationUtils.requirePositive;

/**
 * 强制释放锁，通常在进程启动时用于清理崩溃遗留。不校验 owner，请谨慎使用。
 * <p>
 * 只使用存储的单 key 原子操作，不假设独占存储，可与正常的加锁/释放并发执行：
 * 并发的 acquire 最多在 reset 之后重新拿到锁。
 */
public class LockAdmin {

    private final LockStore store;
    private final LockEventListener listener;
    private final Duration signalExpire;

    public LockAdmin(LockStore store, LockEventListener listener, Duration signalExpire) {
        this.store = requireNonNull(store, "store");
        this.listener = requireNonNull(listener, "listener");
        this.signalExpire = requirePositive(signalExpire, "signalExpire");
    }

    /**
     * 删除持有者 key 与唤醒通道，然后推入一个信号让阻塞中的等待者重试。
     */
    public void reset(String name) {
        requireNonEmpty(name, "name");
        store.delete(LockKeys.holderKey(name));
        store.signal(LockKeys.signalKey(name), signalExpire);
        listener.reset(name);
    }

    /**
     * 对所有 {@code lock:*} 持有者 key 执行 {@link #reset(String)}。没有任何锁时不写入任何 key。
     *
     * @return 被重置的锁数量
     */
    public int resetAll() {
        List<String> holderKeys = store.scan(LockKeys.HOLDER_PATTERN);
        int count = 0;
        for (String holderKey : holderKeys) {
            reset(LockKeys.nameOf(holderKey));
            count++;
        }
        return count;
    }
}
