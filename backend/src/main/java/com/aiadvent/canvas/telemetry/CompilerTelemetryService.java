package com.aiadvent.canvas.telemetry;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class CompilerTelemetryService {

  private static final Logger log = LoggerFactory.getLogger(CompilerTelemetryService.class);

  public enum Outcome {
    COMPILED,
    EMPTY,
    INVALID,
    MALFORMED
  }

  private final Timer compileTimer;
  private final DistributionSummary graphSize;
  private final Map<Outcome, Counter> outcomes = new EnumMap<>(Outcome.class);

  public CompilerTelemetryService(MeterRegistry meterRegistry) {
    MeterRegistry registry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.compileTimer = Timer.builder("workflow_compile_duration").register(registry);
    this.graphSize = DistributionSummary.builder("workflow_compile_nodes").register(registry);
    for (Outcome outcome : Outcome.values()) {
      outcomes.put(
          outcome,
          Counter.builder("workflow_compile_total")
              .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
              .register(registry));
    }
  }

  public void compileFinished(Outcome outcome, int nodeCount, int diagnosticCount, Duration duration) {
    outcomes.get(outcome).increment();
    graphSize.record(nodeCount);
    if (duration != null) {
      compileTimer.record(duration);
    }
    log.info(
        "Workflow compile finished: outcome={}, nodes={}, diagnostics={}, durationMs={}",
        outcome,
        nodeCount,
        diagnosticCount,
        duration != null ? duration.toMillis() : null);
  }

  public void compileRejected(int diagnosticCount) {
    outcomes.get(Outcome.MALFORMED).increment();
    log.warn("Workflow compile rejected malformed input ({} issue(s))", diagnosticCount);
  }
}
