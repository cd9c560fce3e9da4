package com.example.common.token;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SessionTokenProperties.class)
public class SessionTokenConfig {

  @Bean
  SessionTokenCodec sessionTokenCodec(SessionTokenProperties properties, Clock clock) {
    return new SessionTokenCodec(properties, clock);
  }
}
