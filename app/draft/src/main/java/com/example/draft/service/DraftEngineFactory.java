package com.example.draft.service;

import com.example.draft.engine.DraftEngine;
import com.example.draft.engine.EngineScheduler;
import com.example.draft.repository.AutodraftConfigRepository;
import com.example.draft.repository.DraftAdapter;
import com.example.draft.repository.QueueStore;
import java.time.Clock;
import org.springframework.stereotype.Component;

/** ルームごとの DraftEngine を共有コンポーネントから組み立てる。 */
@Component
public class DraftEngineFactory {

  private final DraftAdapter adapter;
  private final AutodraftConfigRepository configRepository;
  private final QueueStore queueStore;
  private final EngineScheduler scheduler;
  private final DraftEventPublisher eventPublisher;
  private final DraftMetrics metrics;
  private final Clock clock;

  public DraftEngineFactory(
      DraftAdapter adapter,
      AutodraftConfigRepository configRepository,
      QueueStore queueStore,
      EngineScheduler scheduler,
      DraftEventPublisher eventPublisher,
      DraftMetrics metrics,
      Clock clock) {
    this.adapter = adapter;
    this.configRepository = configRepository;
    this.queueStore = queueStore;
    this.scheduler = scheduler;
    this.eventPublisher = eventPublisher;
    this.metrics = metrics;
    this.clock = clock;
  }

  public DraftEngine create(String roomId) {
    return new DraftEngine(
        roomId,
        adapter,
        configRepository,
        queueStore,
        scheduler,
        eventPublisher,
        metrics,
        clock);
  }
}
