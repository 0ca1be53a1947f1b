package com.work.lock.core.lock;

import com.work.lock.core.exception.NotAcquiredException;
import com.work.lock.core.exception.NotExpirableException;
import com.work.lock.core.store.ExtendResult;
import com.work.lock.core.store.LockStore;
import com.work.lock.core.support.LockEventListener;

import java.time.Duration;

import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 释放与续期，两者都先校验 owner 再操作，校验与写入在存储侧一次完成。
 */
public class LockReleaser {

    private final LockStore store;
    private final LockEventListener listener;

    public LockReleaser(LockStore store, LockEventListener listener) {
        this.store = requireNonNull(store, "store");
        this.listener = requireNonNull(listener, "listener");
    }

    /**
     * compare-and-delete 持有者 key，成功后唤醒等待者。
     *
     * @throws NotAcquiredException 存储中的持有者不是当前 owner（或已不存在）
     */
    void release(LockRef ref, SignalChannel channel) {
        boolean released = store.releaseAndSignal(ref.holderKey(), channel.getKey(), ref.ownerId(),
                channel.getSignalExpire());
        if (!released) {
            throw new NotAcquiredException("lock " + ref.name() + " is not acquired or it already expired");
        }
        listener.released(ref.name(), ref.ownerId());
    }

    /**
     * 把持有者 key 的过期时间重置为 expire。
     *
     * @throws NotAcquiredException  持有者不是当前 owner
     * @throws NotExpirableException 持有者 key 没有过期时间
     */
    void extend(LockRef ref, Duration expire) {
        ExtendResult result = store.expireIfEquals(ref.holderKey(), ref.ownerId(), expire);
        switch (result) {
            case EXTENDED:
                return;
            case NOT_EXPIRABLE:
                throw new NotExpirableException("lock " + ref.name() + " has no expiration time");
            default:
                throw new NotAcquiredException("lock " + ref.name() + " has not been acquired or it already expired");
        }
    }
}
