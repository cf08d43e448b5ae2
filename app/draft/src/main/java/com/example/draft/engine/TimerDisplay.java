package com.example.draft.engine;

import com.example.draft.model.TimerUrgency;

/** 表示用のタイマー整形。挙動 (自動指名の発火) には影響しない。 */
public final class TimerDisplay {

  public static final int WARNING_THRESHOLD_SECONDS = 10;
  public static final int CRITICAL_THRESHOLD_SECONDS = 5;

  private TimerDisplay() {}

  /** M:SS。負の値は 0 に丸める。 */
  public static String formatTimer(int seconds) {
    final int safe = Math.max(0, seconds);
    return String.format("%d:%02d", safe / 60, safe % 60);
  }

  public static TimerUrgency urgency(int secondsRemaining) {
    if (secondsRemaining <= CRITICAL_THRESHOLD_SECONDS) {
      return TimerUrgency.CRITICAL;
    }
    if (secondsRemaining <= WARNING_THRESHOLD_SECONDS) {
      return TimerUrgency.WARNING;
    }
    return TimerUrgency.NORMAL;
  }

  /** 残り時間の割合 (%)。[0, 100] に収め、total が 0 以下なら 0。 */
  public static double progress(double remaining, double total) {
    if (total <= 0) {
      return 0;
    }
    final double percent = remaining / total * 100;
    return Math.max(0, Math.min(100, percent));
  }
}
