package com.work.lock.core.lock;

import com.work.lock.core.store.LockStore;

import java.time.Duration;

import static com.work.lock.core.support.ValidationUtils.requireNonNull;
import static com.work.lock.core.support.ValidationUtils.requirePositive;

/**
 * 每个锁名一条的唤醒通道：释放时推入一个令牌，等待者用阻塞弹出来等它，不做轮询。
 * <p>
 * 每次推入前先清空旧令牌并设置较短的过期时间，所以通道里至多只有一个令牌。
 */
public class SignalChannel {

    private final LockStore store;
    private final String key;
    private final Duration signalExpire;

    public SignalChannel(LockStore store, String name, Duration signalExpire) {
        this.store = requireNonNull(store, "store");
        this.key = LockKeys.signalKey(name);
        this.signalExpire = requirePositive(signalExpire, "signalExpire");
    }

    public String getKey() {
        return key;
    }

    public Duration getSignalExpire() {
        return signalExpire;
    }

    /**
     * @param wait 最长等待时间，null 表示等到信号为止
     * @return true 表示被信号唤醒
     */
    public boolean await(Duration wait) {
        return store.blockingPop(key, wait);
    }

    public void signal() {
        store.signal(key, signalExpire);
    }
}
