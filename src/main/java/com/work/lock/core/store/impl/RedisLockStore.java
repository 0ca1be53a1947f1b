package com.work.lock.core.store.impl;

import com.work.lock.core.store.ExtendResult;
import com.work.lock.core.store.LockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.work.lock.core.support.ValidationUtils.requireNonEmpty;
import static com.work.lock.core.support.ValidationUtils.requireNonNull;
import static com.work.lock.core.support.ValidationUtils.requirePositive;

/**
 * 基于 Redis 的 {@link LockStore} 实现
 *
 * 特性：
 * 1. 条件删除、条件续期、释放+唤醒都通过 Lua 脚本保证原子性
 * 2. 阻塞等待使用 BLPOP，不做轮询
 * 3. 异常原样抛出（Spring 的 DataAccessException 体系），由调用方决定是否重试
 */
public class RedisLockStore implements LockStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisLockStore.class);

    private static final int SCAN_BATCH = 200;

    // 只有 owner 匹配时才删除
    private static final String COMPARE_AND_DELETE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    // KEYS[1]=holder, KEYS[2]=signal, ARGV[1]=owner, ARGV[2]=signal 保留毫秒数
    private static final String RELEASE_SCRIPT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    redis.call('del', KEYS[2]) " +
            "    redis.call('lpush', KEYS[2], 1) " +
            "    redis.call('pexpire', KEYS[2], ARGV[2]) " +
            "    return redis.call('del', KEYS[1]) " +
            "else " +
            "    return 0 " +
            "end";

    // 0=续期成功 1=owner 不匹配 2=key 没有 TTL
    private static final String EXTEND_SCRIPT =
            "if redis.call('get', KEYS[1]) ~= ARGV[1] then " +
            "    return 1 " +
            "elseif redis.call('pttl', KEYS[1]) < 0 then " +
            "    return 2 " +
            "else " +
            "    redis.call('pexpire', KEYS[1], ARGV[2]) " +
            "    return 0 " +
            "end";

    private static final String SIGNAL_SCRIPT =
            "redis.call('del', KEYS[1]) " +
            "redis.call('lpush', KEYS[1], 1) " +
            "redis.call('pexpire', KEYS[1], ARGV[1]) " +
            "return 1";

    private final StringRedisTemplate redisTemplate;
    private final Duration maxBlock;

    private final DefaultRedisScript<Long> compareAndDeleteScript;
    private final DefaultRedisScript<Long> releaseScript;
    private final DefaultRedisScript<Long> extendScript;
    private final DefaultRedisScript<Long> signalScript;

    /**
     * @param redisTemplate Redis 模板
     * @param maxBlock      单次 BLPOP 的最长阻塞时间，需小于客户端命令超时；超出后返回 false，由上层重试
     */
    public RedisLockStore(StringRedisTemplate redisTemplate, Duration maxBlock) {
        this.redisTemplate = requireNonNull(redisTemplate, "redisTemplate");
        this.maxBlock = requirePositive(maxBlock, "maxBlock");
        this.compareAndDeleteScript = longScript(COMPARE_AND_DELETE_SCRIPT);
        this.releaseScript = longScript(RELEASE_SCRIPT);
        this.extendScript = longScript(EXTEND_SCRIPT);
        this.signalScript = longScript(SIGNAL_SCRIPT);
    }

    private static DefaultRedisScript<Long> longScript(String text) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptText(text);
        script.setResultType(Long.class);
        return script;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        requireNonEmpty(key, "key");
        requireNonNull(value, "value");
        Boolean result = ttl == null
                ? redisTemplate.opsForValue().setIfAbsent(key, value)
                : redisTemplate.opsForValue().setIfAbsent(key, value, ttl);
        return Boolean.TRUE.equals(result);
    }

    @Override
    public String get(String key) {
        return redisTemplate.opsForValue().get(requireNonEmpty(key, "key"));
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        requireNonEmpty(key, "key");
        requireNonNull(expected, "expected");
        Long result = redisTemplate.execute(compareAndDeleteScript, Collections.singletonList(key), expected);
        return result != null && result > 0;
    }

    @Override
    public boolean releaseAndSignal(String holderKey, String signalKey, String expected, Duration signalTtl) {
        requireNonEmpty(holderKey, "holderKey");
        requireNonEmpty(signalKey, "signalKey");
        requireNonNull(expected, "expected");
        requirePositive(signalTtl, "signalTtl");
        Long result = redisTemplate.execute(releaseScript,
                Arrays.asList(holderKey, signalKey),
                expected,
                String.valueOf(signalTtl.toMillis()));
        return result != null && result > 0;
    }

    @Override
    public ExtendResult expireIfEquals(String key, String expected, Duration ttl) {
        requireNonEmpty(key, "key");
        requireNonNull(expected, "expected");
        requirePositive(ttl, "ttl");
        Long result = redisTemplate.execute(extendScript,
                Collections.singletonList(key),
                expected,
                String.valueOf(ttl.toMillis()));
        if (result == null) {
            throw new IllegalStateException("extend script returned null for key " + key);
        }
        if (result == 0L) {
            return ExtendResult.EXTENDED;
        }
        if (result == 2L) {
            return ExtendResult.NOT_EXPIRABLE;
        }
        return ExtendResult.NOT_OWNER;
    }

    /**
     * BLPOP 的超时只支持秒级，向上取整；同时受 maxBlock 限制，避免超过 Lettuce 的命令超时。
     */
    @Override
    public boolean blockingPop(String key, Duration timeout) {
        requireNonEmpty(key, "key");
        Duration wait = (timeout == null || timeout.compareTo(maxBlock) > 0) ? maxBlock : timeout;
        long seconds = toBlockSeconds(wait);
        String token = redisTemplate.opsForList().leftPop(key, seconds, TimeUnit.SECONDS);
        if (token == null) {
            LOGGER.trace("[lock] BLPOP idle wake, key={}, waited={}s", key, seconds);
            return false;
        }
        return true;
    }

    static long toBlockSeconds(Duration wait) {
        long millis = Math.max(wait.toMillis(), 1L);
        return (millis + 999L) / 1000L;
    }

    @Override
    public void signal(String key, Duration ttl) {
        requireNonEmpty(key, "key");
        requirePositive(ttl, "ttl");
        redisTemplate.execute(signalScript, Collections.singletonList(key), String.valueOf(ttl.toMillis()));
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(requireNonEmpty(key, "key"));
    }

    /**
     * 使用 SCAN 增量遍历，不使用 KEYS，避免大库上阻塞 Redis。
     */
    @Override
    public List<String> scan(String pattern) {
        requireNonEmpty(pattern, "pattern");
        List<String> keys = redisTemplate.execute((RedisCallback<List<String>>) connection -> scanKeys(connection, pattern));
        return keys == null ? Collections.emptyList() : keys;
    }

    private static List<String> scanKeys(RedisConnection connection, String pattern) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        try (Cursor<byte[]> cursor = connection.scan(options)) {
            while (cursor.hasNext()) {
                keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
            }
        }
        return keys;
    }
}
