package com.debateleague.pairing.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class PairingMetricsTest {

  @Test
  void recordsRunCounterPerFormatAndResult() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final PairingMetrics metrics = new PairingMetrics(registry);

    metrics.recordRun("single", "generated");
    metrics.recordRun("single", "generated");
    metrics.recordRun("single", "failed");

    assertThat(
            registry
                .get("pairing.run.total")
                .tags("format", "single", "result", "generated")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            registry
                .get("pairing.run.total")
                .tags("format", "single", "result", "failed")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void recordsDurationAndPenalty() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final PairingMetrics metrics = new PairingMetrics(registry);

    metrics.recordDuration("team", Duration.ofMillis(40));
    metrics.recordDuration("team", Duration.ofMillis(-1));
    metrics.recordPenalty("team", 130);

    assertThat(registry.get("pairing.run.duration").tags("format", "team").timer().count())
        .isEqualTo(1);
    assertThat(registry.get("pairing.run.penalty").tags("format", "team").summary().totalAmount())
        .isEqualTo(130.0);
  }

  @Test
  void ignoresZeroUnusedAdjudicators() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final PairingMetrics metrics = new PairingMetrics(registry);

    metrics.recordUnusedAdjudicators("team", 0);
    metrics.recordUnusedAdjudicators("team", 3);

    assertThat(
            registry
                .get("pairing.adjudicator.unused.total")
                .tags("format", "team")
                .counter()
                .count())
        .isEqualTo(3.0);
  }
}
