package com.work.lock.core.lock;

import com.work.lock.core.config.LockOptions;
import com.work.lock.core.exception.LockTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;

/**
 * 在锁内执行一段逻辑的模板，集中管理锁的获取/释放与事务联动。
 */
public class LockCoordinator {

    private static final Logger LOGGER = LoggerFactory.getLogger(LockCoordinator.class);

    private final DistributedLockFactory lockFactory;
    private final LockOptions defaultOptions;

    public LockCoordinator(DistributedLockFactory lockFactory, LockOptions defaultOptions) {
        this.lockFactory = requireNonNull(lockFactory, "lockFactory");
        this.defaultOptions = requireNonNull(defaultOptions, "defaultOptions");
    }

    @FunctionalInterface
    public interface LockCallback<T> {
        T doInLock(DistributedLock lock);
    }

    public <T> T executeWithLock(String name, LockCallback<T> action) {
        return executeWithLock(name, defaultOptions, action);
    }

    /**
     * 阻塞获取锁（timeout 取自 options）后执行 action。
     *
     * @throws LockTimeoutException 在 timeout 内未拿到锁
     */
    public <T> T executeWithLock(String name, LockOptions options, LockCallback<T> action) {
        requireNonEmpty(name, "name");
        requireNonNull(options, "options");
        requireNonNull(action, "action");

        DistributedLock lock = lockFactory.newLock(name, options);
        if (!lock.acquire()) {
            throw new LockTimeoutException("lock contention, not acquired within " + options.getTimeout() + ": " + name);
        }
        boolean releaseByTxCallback = false;
        try {
            releaseByTxCallback = registerReleaseCallback(lock);
            return action.doInLock(lock);
        } finally {
            if (!releaseByTxCallback) {
                releaseSafely(lock);
            }
        }
    }

    /**
     * 若处于事务中，则在事务结束（commit 或 rollback）后释放锁；否则交由调用方 finally 释放。
     */
    private boolean registerReleaseCallback(DistributedLock lock) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                releaseSafely(lock);
            }
        });
        return true;
    }

    /**
     * 释放失败只记录日志，避免在 finally 或事务钩子中覆盖业务结果。
     */
    private void releaseSafely(DistributedLock lock) {
        try {
            lock.release();
        } catch (RuntimeException ex) {
            LOGGER.warn("[lock] release failed after critical section, name={}, owner={}",
                    lock.getName(), lock.getId(), ex);
        }
    }
}
