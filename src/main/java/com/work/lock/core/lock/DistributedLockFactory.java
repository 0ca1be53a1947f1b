package com.work.lock.core.lock;

import com.work.lock.core.config.LockFactoryConfig;
import com.work.lock.core.config.LockOptions;
import com.work.lock.core.store.LockStore;
import com.work.lock.core.support.LockEventListener;
import com.work.lock.core.support.NoopLockEventListener;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 门面（Facade）层：持有存储、配置与续期线程，对业务侧暴露创建句柄和管理操作。
 * <p>
 * 关闭工厂会停止全部续期任务（进程退出时由容器调用）。
 */
public class DistributedLockFactory implements AutoCloseable {

    private final LockStore store;
    private final LockFactoryConfig config;
    private final LockAcquirer acquirer;
    private final LockReleaser releaser;
    private final LockRenewalScheduler renewalScheduler;
    private final LockAdmin admin;

    public DistributedLockFactory(LockStore store) {
        this(store, LockFactoryConfig.defaultConfig(), new NoopLockEventListener());
    }

    public DistributedLockFactory(LockStore store, LockFactoryConfig config, LockEventListener listener) {
        this.store = requireNonNull(store, "store");
        this.config = requireNonNull(config, "config");
        requireNonNull(listener, "listener");
        this.acquirer = new LockAcquirer(store, listener, config.getIdleWakeInterval());
        this.releaser = new LockReleaser(store, listener);
        this.renewalScheduler = new LockRenewalScheduler(store, listener, config.getRenewalThreads());
        this.admin = new LockAdmin(store, listener, config.getSignalExpire());
    }

    public DistributedLock newLock(String name) {
        return newLock(name, LockOptions.defaults());
    }

    public DistributedLock newLock(String name, LockOptions options) {
        requireNonEmpty(name, "name");
        requireNonNull(options, "options");
        SignalChannel channel = new SignalChannel(store, name, config.getSignalExpire());
        return new DistributedLock(name, options, store, channel, acquirer, releaser, renewalScheduler, admin);
    }

    /**
     * 强制释放单个锁。
     */
    public void reset(String name) {
        admin.reset(name);
    }

    /**
     * 强制释放全部锁。
     *
     * @return 被重置的锁数量
     */
    public int resetAll() {
        return admin.resetAll();
    }

    public LockAdmin getAdmin() {
        return admin;
    }

    public LockFactoryConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        renewalScheduler.close();
    }
}
