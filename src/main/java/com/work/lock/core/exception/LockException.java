package com.work.lock.core.exception;

/**
 * 锁组件的统一异常根类型，便于业务侧统一捕获或转换为错误码。
 */
public class LockException extends RuntimeException {

    public LockException(String message) {
        super(message);
    }

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
