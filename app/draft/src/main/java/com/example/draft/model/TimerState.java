package com.example.draft.model;

/** 1 指名分のカウントダウン状態。永続化しない。 */
public record TimerState(
    int secondsRemaining,
    boolean running,
    boolean paused,
    boolean inGracePeriod,
    boolean expired) {

  public static TimerState idle(int seconds) {
    return new TimerState(seconds, false, false, false, false);
  }
}
