package com.socialhub.backend.modules.ratelimit.infrastructure;

import java.time.Duration;
import java.util.List;

import com.socialhub.backend.modules.ratelimit.application.CounterSnapshot;
import com.socialhub.backend.modules.ratelimit.application.RequestCounterStore;
import com.socialhub.backend.modules.ratelimit.application.WindowMode;

import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

@Component
public class RedisRequestCounterStore implements RequestCounterStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<List<Long>> rateLimitScript;

    public RedisRequestCounterStore(StringRedisTemplate redisTemplate, RedisScript<List<Long>> rateLimitScript) {
        this.redisTemplate = redisTemplate;
        this.rateLimitScript = rateLimitScript;
    }

    @Override
    public CounterSnapshot increment(String key, Duration window, WindowMode mode) {
        List<Long> result = redisTemplate.execute(
                rateLimitScript,
                List.of(key),
                String.valueOf(window.toMillis()),
                mode.name()
        );
        if (result == null || result.size() < 2) {
            throw new DataRetrievalFailureException("rate limit script returned no result for " + key);
        }
        return new CounterSnapshot(result.get(0), result.get(1));
    }
}
