package com.odin.call_signaling_service.config;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis holds the user -> pod presence entries. Presence writes happen on the
 * socket open/close path, so commands get a short timeout.
 */
@Slf4j
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String host;

    @Value("${spring.data.redis.port:6379}")
    private int port;

    @Value("${spring.data.redis.password:}")
    private String password;

    @Value("${presence.command-timeout-ms:2000}")
    private long commandTimeoutMs;

    @Bean
    public RedisConnectionFactory presenceConnectionFactory() {
        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(host, port);
        if (!password.isEmpty()) {
            server.setPassword(password);
        }
        LettuceClientConfiguration client = LettuceClientConfiguration.builder()
                .commandTimeout(Duration.ofMillis(commandTimeoutMs))
                .build();
        log.info("Presence store at {}:{} (commandTimeoutMs={})", host, port, commandTimeoutMs);
        return new LettuceConnectionFactory(server, client);
    }

    @Bean
    public StringRedisTemplate presenceRedisTemplate(RedisConnectionFactory presenceConnectionFactory) {
        return new StringRedisTemplate(presenceConnectionFactory);
    }
}
