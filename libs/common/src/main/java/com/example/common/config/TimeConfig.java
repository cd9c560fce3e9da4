/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: state の有効期限やセッショントークンの exp をテストから決定的に進められるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // UTC 固定。各サービスの期限判定はこの Clock のみを参照する
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
