package com.example.ContextRetriever.config;

import com.example.ContextRetriever.service.InMemorySessionMemory;
import com.example.ContextRetriever.service.RedisSessionMemory;
import com.example.ContextRetriever.service.SessionMemory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Chooses the session history backend: Redis by default,
 * a process-local map when {@code retriever.session-store=memory}.
 */
@Configuration
public class SessionMemoryConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionMemoryConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "retriever", name = "session-store", havingValue = "redis", matchIfMissing = true)
    public SessionMemory redisSessionMemory(StringRedisTemplate redisTemplate,
                                            ObjectMapper objectMapper,
                                            RetrieverProperties properties) {
        log.info("Session memory: redis (ttl={}, maxMessages={})",
                properties.sessionTtl(), properties.maxSessionMessages());
        return new RedisSessionMemory(redisTemplate, objectMapper, properties);
    }

    @Bean
    @ConditionalOnProperty(prefix = "retriever", name = "session-store", havingValue = "memory")
    public SessionMemory inMemorySessionMemory(RetrieverProperties properties) {
        log.info("Session memory: in-process (ttl={}, maxMessages={})",
                properties.sessionTtl(), properties.maxSessionMessages());
        return new InMemorySessionMemory(properties, Clock.systemUTC());
    }
}
