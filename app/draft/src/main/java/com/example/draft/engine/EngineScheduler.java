/*
 * どこで: Draft エンジン
 * 何を: エンジンの制御スレッドへタスクを投入する抽象を定義する
 * なぜ: タイマー tick と Adapter 通知を 1 本の制御スレッドに直列化し、テストでは仮想時間で駆動するため
 */
package com.example.draft.engine;

import java.time.Duration;

public interface EngineScheduler {

  ScheduledTask schedule(Runnable task, Duration delay);

  /** 制御スレッドで後続実行する。呼び出し元で同期実行はしない。 */
  void execute(Runnable task);
}
