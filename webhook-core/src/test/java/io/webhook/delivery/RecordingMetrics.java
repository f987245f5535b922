package io.webhook.delivery;

import io.webhook.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class RecordingMetrics implements MetricsExporter {
  final List<String> counters = new ArrayList<>();
  final List<Duration> durations = new ArrayList<>();
  final List<Integer> attempts = new ArrayList<>();

  @Override
  public void incrementDelivery(String tenantId, String eventType, Outcome outcome) {
    counters.add(tenantId + "/" + eventType + "/" + outcome.tag());
  }

  @Override
  public void recordDeliveryDuration(String tenantId, String eventType, Duration duration) {
    durations.add(duration);
  }

  @Override
  public void recordDeliveryAttempts(String tenantId, String eventType, int attempts) {
    this.attempts.add(attempts);
  }
}
