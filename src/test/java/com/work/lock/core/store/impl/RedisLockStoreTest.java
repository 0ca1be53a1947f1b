package com.work.lock.core.store.impl;

import com.work.lock.core.store.ExtendResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@SuppressWarnings({"unchecked", "rawtypes"})
public class RedisLockStoreTest {

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOps;
    private ListOperations<String, String> listOps;
    private RedisLockStore store;

    @BeforeEach
    public void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        listOps = mock(ListOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        store = new RedisLockStore(redisTemplate, Duration.ofSeconds(30));
    }

    @Test
    public void set_if_absent_passes_ttl_when_present() {
        when(valueOps.setIfAbsent("lock:foo", "me", Duration.ofSeconds(5))).thenReturn(true);
        when(valueOps.setIfAbsent("lock:bar", "me")).thenReturn(false);

        assertTrue(store.setIfAbsent("lock:foo", "me", Duration.ofSeconds(5)));
        assertFalse(store.setIfAbsent("lock:bar", "me", null));
    }

    @Test
    public void set_if_absent_treats_null_reply_as_failure() {
        when(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).thenReturn(null);

        assertFalse(store.setIfAbsent("lock:foo", "me", Duration.ofSeconds(5)));
    }

    @Test
    public void release_and_signal_runs_single_script_with_both_keys() {
        when(redisTemplate.execute(any(RedisScript.class),
                eq(Arrays.asList("lock:foo", "lock-signal:foo")), eq("me"), eq("1000")))
                .thenReturn(1L);

        assertTrue(store.releaseAndSignal("lock:foo", "lock-signal:foo", "me", Duration.ofMillis(1000)));
        verify(valueOps, never()).get(anyString());
    }

    @Test
    public void release_and_signal_reports_owner_mismatch() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any())).thenReturn(0L);

        assertFalse(store.releaseAndSignal("lock:foo", "lock-signal:foo", "me", Duration.ofMillis(1000)));
    }

    @Test
    public void compare_and_delete_uses_script() {
        when(redisTemplate.execute(any(RedisScript.class), eq(Collections.singletonList("lock:foo")), eq("me")))
                .thenReturn(1L, 0L);

        assertTrue(store.deleteIfEquals("lock:foo", "me"));
        assertFalse(store.deleteIfEquals("lock:foo", "me"));
    }

    @Test
    public void extend_maps_script_codes() {
        when(redisTemplate.execute(any(RedisScript.class), eq(Collections.singletonList("lock:foo")), eq("me"), eq("2000")))
                .thenReturn(0L, 1L, 2L);

        assertEquals(ExtendResult.EXTENDED, store.expireIfEquals("lock:foo", "me", Duration.ofSeconds(2)));
        assertEquals(ExtendResult.NOT_OWNER, store.expireIfEquals("lock:foo", "me", Duration.ofSeconds(2)));
        assertEquals(ExtendResult.NOT_EXPIRABLE, store.expireIfEquals("lock:foo", "me", Duration.ofSeconds(2)));
    }

    @Test
    public void blocking_pop_rounds_up_and_caps_wait() {
        when(listOps.leftPop(eq("lock-signal:foo"), anyLong(), eq(TimeUnit.SECONDS))).thenReturn(null, "1", null);

        assertFalse(store.blockingPop("lock-signal:foo", Duration.ofMillis(1500)));
        assertTrue(store.blockingPop("lock-signal:foo", null));
        assertFalse(store.blockingPop("lock-signal:foo", Duration.ofSeconds(40)));

        verify(listOps).leftPop("lock-signal:foo", 2L, TimeUnit.SECONDS);
        verify(listOps, times(2)).leftPop("lock-signal:foo", 30L, TimeUnit.SECONDS);
    }

    @Test
    public void block_seconds_never_drop_to_zero() {
        assertEquals(1L, RedisLockStore.toBlockSeconds(Duration.ofMillis(1)));
        assertEquals(1L, RedisLockStore.toBlockSeconds(Duration.ZERO));
        assertEquals(1L, RedisLockStore.toBlockSeconds(Duration.ofMillis(1000)));
        assertEquals(2L, RedisLockStore.toBlockSeconds(Duration.ofMillis(1001)));
    }

    @Test
    public void signal_runs_script_with_ttl_millis() {
        store.signal("lock-signal:foo", Duration.ofMillis(1500));

        verify(redisTemplate).execute(any(RedisScript.class), eq(Collections.singletonList("lock-signal:foo")), eq("1500"));
    }

    @Test
    public void scan_collects_keys_and_closes_cursor() {
        RedisConnection connection = mock(RedisConnection.class);
        Cursor<byte[]> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, true, false);
        when(cursor.next()).thenReturn("lock:a".getBytes(StandardCharsets.UTF_8), "lock:b".getBytes(StandardCharsets.UTF_8));
        when(connection.scan(any(ScanOptions.class))).thenReturn(cursor);
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenAnswer(inv -> ((RedisCallback<?>) inv.getArgument(0)).doInRedis(connection));

        List<String> keys = store.scan("lock:*");

        assertEquals(Arrays.asList("lock:a", "lock:b"), keys);
        verify(cursor).close();
    }

    @Test
    public void store_errors_propagate() {
        when(valueOps.get("lock:foo")).thenThrow(new org.springframework.data.redis.RedisConnectionFailureException("down"));

        assertThrows(org.springframework.data.redis.RedisConnectionFailureException.class, () -> store.get("lock:foo"));
    }
}
