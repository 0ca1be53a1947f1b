package com.work.lock.core.exception;

/**
 * {@link com.work.lock.core.lock.LockCoordinator} 在给定时间内未能拿到锁。调用方可稍后重试。
 */
public class LockTimeoutException extends LockException {

    public LockTimeoutException(String message) {
        super(message);
    }
}
