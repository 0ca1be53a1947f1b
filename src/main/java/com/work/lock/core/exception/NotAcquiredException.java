package com.work.lock.core.exception;

/**
 * 存储中的持有者与当前 owner id 不一致：从未获取、已释放，或过期后被他人抢占。
 */
public class NotAcquiredException extends LockException {

    public NotAcquiredException(String message) {
        super(message);
    }
}
