package com.work.lock.core.support;

import com.work.lock.core.store.ExtendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 基于 SLF4J 的事件输出。常规生命周期走 DEBUG，锁丢失/续期异常走 WARN。
 */
public class LoggingLockEventListener implements LockEventListener {

    private final Logger logger;

    public LoggingLockEventListener() {
        this(LoggerFactory.getLogger(LoggingLockEventListener.class));
    }

    public LoggingLockEventListener(Logger logger) {
        this.logger = ValidationUtils.requireNonNull(logger, "logger");
    }

    @Override
    public void acquiring(String name, String ownerId) {
        logger.debug("[lock] getting name={}, owner={}", name, ownerId);
    }

    @Override
    public void acquired(String name, String ownerId) {
        logger.debug("[lock] got name={}, owner={}", name, ownerId);
    }

    @Override
    public void acquireFailed(String name, String ownerId) {
        logger.debug("[lock] failed to get name={}, owner={}", name, ownerId);
    }

    @Override
    public void waiting(String name, String ownerId, Duration wait) {
        logger.debug("[lock] waiting name={}, owner={}, wait={}", name, ownerId, wait == null ? "signal" : wait);
    }

    @Override
    public void released(String name, String ownerId) {
        logger.debug("[lock] released name={}, owner={}", name, ownerId);
    }

    @Override
    public void renewed(String name, String ownerId) {
        logger.trace("[lock] renewed name={}, owner={}", name, ownerId);
    }

    @Override
    public void renewalLost(String name, String ownerId, ExtendResult result) {
        logger.warn("[lock] lock lost out-of-band, renewal stopped: name={}, owner={}, result={}", name, ownerId, result);
    }

    @Override
    public void renewalFailed(String name, String ownerId, Throwable error) {
        logger.warn("[lock] renewal error, will retry on next tick: name={}, owner={}", name, ownerId, error);
    }

    @Override
    public void reset(String name) {
        logger.info("[lock] reset name={}", name);
    }
}
