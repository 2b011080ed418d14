package com.socialhub.backend.modules.ratelimit.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;

import com.socialhub.backend.modules.ratelimit.application.CounterSnapshot;
import com.socialhub.backend.modules.ratelimit.application.WindowMode;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

@ExtendWith(MockitoExtension.class)
class RedisRequestCounterStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private RedisScript<List<Long>> rateLimitScript;

    private RedisRequestCounterStore store;

    @BeforeEach
    void setUp() {
        store = new RedisRequestCounterStore(redisTemplate, rateLimitScript);
    }

    @Test
    void passesWindowAndModeToScript() {
        when(redisTemplate.execute(eq(rateLimitScript), eq(List.of("rl:ip:10.0.0.1")), eq("60000"), eq("REARM")))
                .thenReturn(List.of(4L, 59000L));

        CounterSnapshot snapshot = store.increment("rl:ip:10.0.0.1", Duration.ofMinutes(1), WindowMode.REARM);

        assertThat(snapshot.count()).isEqualTo(4);
        assertThat(snapshot.remainingMillis()).isEqualTo(59000);
    }

    @Test
    void emptyScriptReplyIsDataAccessFailure() {
        when(redisTemplate.execute(eq(rateLimitScript), eq(List.of("rl:ip:10.0.0.1")), eq("60000"), eq("FIXED")))
                .thenReturn(List.<Long>of());

        assertThatThrownBy(() -> store.increment("rl:ip:10.0.0.1", Duration.ofMinutes(1), WindowMode.FIXED))
                .isInstanceOf(DataRetrievalFailureException.class);
    }
}
