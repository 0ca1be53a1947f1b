package com.work.lock.core.exception;

/**
 * timeout / expire / autoRenewal 等参数组合非法。总是在访问存储之前抛出。
 */
public class LockConfigurationException extends LockException {

    public LockConfigurationException(String message) {
        super(message);
    }
}
