package com.example.draft.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 単一スレッドの ScheduledExecutorService による本番用スケジューラ。 */
public class ExecutorEngineScheduler implements EngineScheduler, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ExecutorEngineScheduler.class);

  private final ScheduledExecutorService executor;

  public ExecutorEngineScheduler(String threadName) {
    this.executor =
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat(threadName + "-%d").setDaemon(true).build());
  }

  @Override
  public ScheduledTask schedule(Runnable task, Duration delay) {
    final ScheduledFuture<?> future =
        executor.schedule(guarded(task), Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void execute(Runnable task) {
    executor.execute(guarded(task));
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        // 例外で制御スレッドを止めない
        logger.error("draft engine task failed", ex);
      }
    };
  }
}
