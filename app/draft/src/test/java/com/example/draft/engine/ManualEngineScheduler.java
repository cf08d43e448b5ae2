/*
 * どこで: Draft エンジンのテスト基盤
 * 何を: 仮想時間で進む EngineScheduler を提供する
 * なぜ: タイマー tick と自動指名をスリープなしで決定的に再現するため
 */
package com.example.draft.engine;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.PriorityQueue;

/**
 * テスト用のスケジューラ。
 *
 * <p>{@link #execute} で積まれたタスクは {@link #runPending()} か {@link #advance(Duration)} の中で実行される。
 * {@link #trampolining()} で作ると execute の呼び出し元で即座に排出するため、Future を同期的に待つ
 * サービス層のテストでも使える。
 */
public class ManualEngineScheduler implements EngineScheduler {

  private final boolean drainOnExecute;
  private final Deque<Runnable> immediate = new ArrayDeque<>();
  private final PriorityQueue<Entry> timed =
      new PriorityQueue<>(
          Comparator.comparingLong((Entry entry) -> entry.dueAtMillis)
              .thenComparingLong(entry -> entry.sequence));
  private long nowMillis;
  private long sequence;
  private boolean draining;

  public ManualEngineScheduler() {
    this(false);
  }

  private ManualEngineScheduler(boolean drainOnExecute) {
    this.drainOnExecute = drainOnExecute;
  }

  public static ManualEngineScheduler trampolining() {
    return new ManualEngineScheduler(true);
  }

  @Override
  public ScheduledTask schedule(Runnable task, Duration delay) {
    final Entry entry = new Entry(nowMillis + delay.toMillis(), sequence++, task);
    timed.add(entry);
    return () -> entry.cancelled = true;
  }

  @Override
  public void execute(Runnable task) {
    immediate.add(task);
    if (drainOnExecute && !draining) {
      runPending();
    }
  }

  /** 即時タスクと期限到来済みのタスクを、新たに積まれた分も含めて尽きるまで実行する。 */
  public void runPending() {
    draining = true;
    try {
      while (true) {
        if (!immediate.isEmpty()) {
          immediate.poll().run();
          continue;
        }
        final Entry next = timed.peek();
        if (next == null || next.dueAtMillis > nowMillis) {
          return;
        }
        timed.poll();
        if (!next.cancelled) {
          next.task.run();
        }
      }
    } finally {
      draining = false;
    }
  }

  /** 仮想時計を進め、途中で期限が来るタスクを時刻順に実行する。 */
  public void advance(Duration duration) {
    final long target = nowMillis + duration.toMillis();
    runPending();
    while (true) {
      final Entry next = timed.peek();
      if (next == null || next.dueAtMillis > target) {
        break;
      }
      nowMillis = Math.max(nowMillis, next.dueAtMillis);
      runPending();
    }
    nowMillis = target;
    runPending();
  }

  public void advanceSeconds(long seconds) {
    advance(Duration.ofSeconds(seconds));
  }

  public long pendingTimedTasks() {
    return timed.stream().filter(entry -> !entry.cancelled).count();
  }

  private static final class Entry {
    private final long dueAtMillis;
    private final long sequence;
    private final Runnable task;
    private boolean cancelled;

    private Entry(long dueAtMillis, long sequence, Runnable task) {
      this.dueAtMillis = dueAtMillis;
      this.sequence = sequence;
      this.task = task;
    }
  }
}
