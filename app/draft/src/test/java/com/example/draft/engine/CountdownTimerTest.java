package com.example.draft.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.draft.model.TimerState;
import com.example.draft.model.TimerUrgency;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CountdownTimerTest {

  private final ManualEngineScheduler scheduler = new ManualEngineScheduler();
  private final RecordingListener listener = new RecordingListener();

  @Test
  void ticksOncePerSecond() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 30, 5, listener);

    timer.start();
    scheduler.advanceSeconds(1);
    scheduler.advanceSeconds(9);

    assertThat(timer.state().secondsRemaining()).isEqualTo(20);
    assertThat(timer.state().running()).isTrue();
    assertThat(listener.ticks).hasSize(10).startsWith(29, 28);
  }

  @Test
  void expiresOnceAfterGracePeriod() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 30, 5, listener);

    timer.start();
    scheduler.advanceSeconds(30);

    assertThat(timer.state().inGracePeriod()).isTrue();
    assertThat(timer.state().secondsRemaining()).isZero();
    assertThat(listener.graceStarts).isEqualTo(1);
    assertThat(listener.expirations).isZero();

    scheduler.advanceSeconds(5);
    scheduler.advanceSeconds(60);
    scheduler.runPending();

    final TimerState state = timer.state();
    assertThat(listener.expirations).isEqualTo(1);
    assertThat(state.expired()).isTrue();
    assertThat(state.running()).isFalse();
    assertThat(state.inGracePeriod()).isFalse();
    assertThat(scheduler.pendingTimedTasks()).isZero();
  }

  @Test
  void pauseFreezesCountdown() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 30, 5, listener);

    timer.start();
    scheduler.advanceSeconds(10);
    timer.pause();
    scheduler.advanceSeconds(120);

    assertThat(timer.state().paused()).isTrue();
    assertThat(timer.state().secondsRemaining()).isEqualTo(20);
    assertThat(listener.expirations).isZero();

    timer.resume();
    scheduler.advanceSeconds(24);
    assertThat(listener.expirations).isZero();
    scheduler.advanceSeconds(1);
    assertThat(listener.expirations).isEqualTo(1);
  }

  @Test
  void resumeDuringGraceRestartsFullGracePeriod() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 3, 5, listener);

    timer.start();
    scheduler.advanceSeconds(3);
    scheduler.advanceSeconds(3);
    timer.pause();
    scheduler.advanceSeconds(30);
    timer.resume();
    scheduler.advanceSeconds(4);

    assertThat(timer.state().inGracePeriod()).isTrue();
    assertThat(listener.expirations).isZero();

    scheduler.advanceSeconds(1);
    assertThat(listener.expirations).isEqualTo(1);
  }

  @Test
  void cancelStopsTimerAndKeepsExpiredLatch() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 2, 0, listener);

    timer.start();
    scheduler.advanceSeconds(2);
    assertThat(listener.expirations).isEqualTo(1);

    timer.cancel();

    assertThat(timer.state().expired()).isTrue();
    assertThat(timer.state().running()).isFalse();
  }

  @Test
  void cancelBeforeExpiryPreventsCallback() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 30, 5, listener);

    timer.start();
    scheduler.advanceSeconds(10);
    timer.cancel();
    scheduler.advanceSeconds(100);

    assertThat(listener.expirations).isZero();
    assertThat(timer.state().running()).isFalse();
    assertThat(timer.state().secondsRemaining()).isEqualTo(20);
  }

  @Test
  void resetClearsLatchSoTimerCanFireAgain() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 2, 1, listener);

    timer.start();
    scheduler.advanceSeconds(3);
    timer.reset();

    assertThat(timer.state()).isEqualTo(TimerState.idle(2));

    timer.start();
    scheduler.advanceSeconds(3);

    assertThat(listener.expirations).isEqualTo(2);
  }

  @Test
  void restartInvalidatesPreviousTicks() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 10, 0, listener);

    timer.start();
    scheduler.advanceSeconds(6);
    timer.start();
    scheduler.advanceSeconds(6);

    assertThat(timer.state().secondsRemaining()).isEqualTo(4);
    assertThat(listener.expirations).isZero();
  }

  @Test
  void zeroPickTimeStartsInGracePeriod() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 0, 2, listener);

    timer.start();

    assertThat(timer.state().inGracePeriod()).isTrue();
    scheduler.advanceSeconds(2);
    assertThat(listener.expirations).isEqualTo(1);
  }

  @Test
  void urgencyFollowsRemainingSeconds() {
    final CountdownTimer timer = new CountdownTimer(scheduler, 12, 5, listener);

    timer.start();
    assertThat(timer.urgency()).isEqualTo(TimerUrgency.NORMAL);
    scheduler.advanceSeconds(2);
    assertThat(timer.urgency()).isEqualTo(TimerUrgency.WARNING);
    scheduler.advanceSeconds(5);
    assertThat(timer.urgency()).isEqualTo(TimerUrgency.CRITICAL);
  }

  private static final class RecordingListener implements TimerListener {
    private final List<Integer> ticks = new ArrayList<>();
    private int graceStarts;
    private int expirations;

    @Override
    public void onTick(int secondsRemaining) {
      ticks.add(secondsRemaining);
    }

    @Override
    public void onGracePeriodStart() {
      graceStarts++;
    }

    @Override
    public void onExpire() {
      expirations++;
    }
  }
}
