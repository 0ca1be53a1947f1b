package com.work.lock.core.support;

import com.work.lock.core.exception.LockConfigurationException;

import java.time.Duration;

/**
 * 参数校验工具类，统一参数校验逻辑，减少代码重复
 */
public final class ValidationUtils {

    private ValidationUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    /**
     * 校验字符串参数不为空
     */
    public static String requireNonEmpty(String value, String paramName) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(paramName + " 不能为空");
        }
        return value;
    }

    /**
     * 校验对象不为null
     */
    public static <T> T requireNonNull(T value, String paramName) {
        if (value == null) {
            throw new IllegalArgumentException(paramName + " 不能为null");
        }
        return value;
    }

    /**
     * 校验Duration必须大于0
     */
    public static Duration requirePositive(Duration duration, String paramName) {
        requireNonNull(duration, paramName);
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(paramName + " 必须大于0");
        }
        return duration;
    }

    /**
     * 可选时长的归一化：null 与 0 视为“未启用”返回 null，负数属于配置错误。
     */
    public static Duration optionalDuration(Duration duration, String paramName) {
        if (duration == null || duration.isZero()) {
            return null;
        }
        if (duration.isNegative()) {
            throw new LockConfigurationException(paramName + " 不能为负数: " + duration);
        }
        return duration;
    }
}
