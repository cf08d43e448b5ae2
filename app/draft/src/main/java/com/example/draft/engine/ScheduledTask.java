package com.example.draft.engine;

@FunctionalInterface
public interface ScheduledTask {

  /** 未実行なら実行を取り消す。実行済み/取消済みなら何もしない。 */
  void cancel();
}
