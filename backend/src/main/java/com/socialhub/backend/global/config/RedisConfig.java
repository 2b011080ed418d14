package com.socialhub.backend.global.config;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Server-side scripts. The rate-limit counter increments and arms its expiry in one round trip.
 */
@Configuration(proxyBeanMethods = false)
public class RedisConfig {

    @Bean
    @SuppressWarnings("unchecked")
    public RedisScript<List<Long>> rateLimitScript() {
        DefaultRedisScript<List<Long>> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("redis/rate-limit.lua"));
        // Lua integer arrays come back as List<Long>
        script.setResultType((Class<List<Long>>) (Class<?>) List.class);
        return script;
    }
}
