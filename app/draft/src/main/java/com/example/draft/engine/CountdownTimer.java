/*
 * どこで: Draft エンジン
 * 何を: 1 指名分の持ち時間を 1 秒 tick で数え、猶予期間の後に一度だけ onExpire を通知する
 * なぜ: 時間切れの自動指名を同一指名番号につき高々 1 回に抑えるため
 */
package com.example.draft.engine;

import com.example.draft.model.TimerState;
import com.example.draft.model.TimerUrgency;
import java.time.Duration;

/**
 * 制御スレッド専用のカウントダウン。
 *
 * <p>状態の読み出し ({@link #state()}) だけは任意のスレッドから呼べる。それ以外の操作は
 * {@link EngineScheduler} の制御スレッド上で呼ぶこと。取り消した tick/猶予タイマーが遅れて実行されても
 * 世代番号が一致しないため無視される。
 */
public class CountdownTimer {

  private static final Duration TICK = Duration.ofSeconds(1);

  private final EngineScheduler scheduler;
  private final int totalSeconds;
  private final int graceSeconds;
  private final TimerListener listener;

  private int secondsRemaining;
  private boolean running;
  private boolean paused;
  private boolean inGracePeriod;
  private boolean expired;
  private long generation;
  private ScheduledTask pending;
  private volatile TimerState state;

  public CountdownTimer(
      EngineScheduler scheduler, int totalSeconds, int graceSeconds, TimerListener listener) {
    this.scheduler = scheduler;
    this.totalSeconds = totalSeconds;
    this.graceSeconds = Math.max(0, graceSeconds);
    this.listener = listener;
    this.secondsRemaining = totalSeconds;
    publishState();
  }

  /** 初期値に戻してから計測を開始する。 */
  public void start() {
    reset();
    running = true;
    if (secondsRemaining <= 0) {
      enterGracePeriod();
    } else {
      scheduleTick();
    }
    publishState();
  }

  public void pause() {
    if (!running || paused) {
      return;
    }
    paused = true;
    cancelPending();
    publishState();
  }

  /** 猶予期間中に一時停止した場合、猶予期間は最初からやり直す。 */
  public void resume() {
    if (!running || !paused) {
      return;
    }
    paused = false;
    if (inGracePeriod) {
      scheduleGraceTimeout();
    } else {
      scheduleTick();
    }
    publishState();
  }

  /** 初期秒数へ戻し、expired ラッチを含む全フラグを解除する。計測は開始しない。 */
  public void reset() {
    cancelPending();
    secondsRemaining = totalSeconds;
    running = false;
    paused = false;
    inGracePeriod = false;
    expired = false;
    publishState();
  }

  /** tick と猶予タイマーの両方を取り消す。expired ラッチは保持する。 */
  public void cancel() {
    cancelPending();
    running = false;
    paused = false;
    inGracePeriod = false;
    publishState();
  }

  public TimerState state() {
    return state;
  }

  public TimerUrgency urgency() {
    return TimerDisplay.urgency(state.secondsRemaining());
  }

  public int totalSeconds() {
    return totalSeconds;
  }

  private void scheduleTick() {
    final long scheduledGeneration = generation;
    pending = scheduler.schedule(() -> onTick(scheduledGeneration), TICK);
  }

  private void scheduleGraceTimeout() {
    final long scheduledGeneration = generation;
    pending =
        scheduler.schedule(
            () -> onGraceElapsed(scheduledGeneration), Duration.ofSeconds(graceSeconds));
  }

  private void onTick(long scheduledGeneration) {
    if (scheduledGeneration != generation || !running || paused || inGracePeriod) {
      return;
    }
    secondsRemaining = Math.max(0, secondsRemaining - 1);
    publishState();
    listener.onTick(secondsRemaining);
    if (secondsRemaining == 0) {
      enterGracePeriod();
    } else {
      scheduleTick();
    }
  }

  private void enterGracePeriod() {
    inGracePeriod = true;
    publishState();
    listener.onGracePeriodStart();
    scheduleGraceTimeout();
  }

  private void onGraceElapsed(long scheduledGeneration) {
    if (scheduledGeneration != generation || !running || paused || !inGracePeriod) {
      return;
    }
    if (expired) {
      return;
    }
    expired = true;
    running = false;
    inGracePeriod = false;
    pending = null;
    publishState();
    listener.onExpire();
  }

  private void cancelPending() {
    generation++;
    if (pending != null) {
      pending.cancel();
      pending = null;
    }
  }

  private void publishState() {
    state = new TimerState(secondsRemaining, running, paused, inGracePeriod, expired);
  }
}
