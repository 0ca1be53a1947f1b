package com.work.lock.core.support;

/**
 * 默认 no-op 实现：不关心锁事件时使用。
 */
public class NoopLockEventListener implements LockEventListener {
}
