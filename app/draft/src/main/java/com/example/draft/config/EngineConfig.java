/*
 * どこで: Draft エンジン設定
 * 何を: 全ルーム共有の単一制御スレッドを提供する
 * なぜ: タイマーと変更通知を 1 スレッドへ直列化し、エンジン内部をロックなしで扱うため
 */
package com.example.draft.config;

import com.example.draft.engine.ExecutorEngineScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {

  @Bean(destroyMethod = "close")
  public ExecutorEngineScheduler engineScheduler() {
    return new ExecutorEngineScheduler("draft-engine");
  }
}
