/*
 * どこで: Common 共通設定
 * 何を: UTC の Clock を Bean として提供する
 * なぜ: 指名時刻/イベント時刻を注入した Clock だけから取り、テストでは Clock.fixed を渡せるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock systemClock() {
    return Clock.systemUTC();
  }
}
