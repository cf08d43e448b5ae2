package com.example.draft.engine;

/** CountdownTimer の通知先。すべて制御スレッド上で呼ばれる。 */
public interface TimerListener {

  default void onTick(int secondsRemaining) {}

  default void onGracePeriodStart() {}

  void onExpire();
}
