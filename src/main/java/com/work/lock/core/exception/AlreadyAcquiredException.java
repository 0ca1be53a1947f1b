package com.work.lock.core.exception;

/**
 * 当前 owner id 已经持有该锁（同一实例重复 acquire，或另一实例复用了同一 id）。
 */
public class AlreadyAcquiredException extends LockException {

    public AlreadyAcquiredException(String message) {
        super(message);
    }
}
