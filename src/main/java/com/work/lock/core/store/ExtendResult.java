package com.work.lock.core.store;

/**
 * 条件续期的结果。
 */
public enum ExtendResult {
    /** 持有者匹配，过期时间已更新 */
    EXTENDED,
    /** 持有者不存在或不是期望的 owner */
    NOT_OWNER,
    /** 持有者匹配但 key 没有过期时间 */
    NOT_EXPIRABLE
}
