package com.gentoro.autoreport.orchestrator;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

/** Thread-safe cumulative stage timings for one document. */
final class StageTimer {
  private final Map<ProcessingStage, LongAdder> nanos = new EnumMap<>(ProcessingStage.class);

  StageTimer() {
    for (ProcessingStage stage : ProcessingStage.values()) {
      nanos.put(stage, new LongAdder());
    }
  }

  <T> T time(ProcessingStage stage, Supplier<T> work) {
    long started = System.nanoTime();
    try {
      return work.get();
    } finally {
      nanos.get(stage).add(System.nanoTime() - started);
    }
  }

  Map<ProcessingStage, Long> millis() {
    Map<ProcessingStage, Long> out = new EnumMap<>(ProcessingStage.class);
    nanos.forEach((stage, total) -> out.put(stage, total.sum() / 1_000_000));
    return out;
  }
}
