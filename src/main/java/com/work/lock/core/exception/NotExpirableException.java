package com.work.lock.core.exception;

/**
 * 持有者 key 没有过期时间，无法续期。
 */
public class NotExpirableException extends LockException {

    public NotExpirableException(String message) {
        super(message);
    }
}
