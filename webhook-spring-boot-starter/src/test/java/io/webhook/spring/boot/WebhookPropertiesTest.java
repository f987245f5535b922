package io.webhook.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookPropertiesTest {

  @Test
  void defaults() {
    WebhookProperties props = new WebhookProperties();
    assertEquals("webhook_deliveries", props.getTableName());
    assertEquals(1000, props.getRetry().getBaseDelayMs());
    assertEquals(60000, props.getRetry().getMaxDelayMs());
    assertEquals(0.0, props.getRetry().getJitterRatio());
    assertEquals(Duration.ofSeconds(10), props.getHttp().getConnectTimeout());
    assertFalse(props.getValidation().isAllowLocalhost());
    assertNull(props.getSigning().getSecret());
    assertEquals(300, props.getSigning().getToleranceSeconds());
    assertFalse(props.getCircuitBreaker().isEnabled());
    assertEquals(5, props.getCircuitBreaker().getFailureThreshold());
    assertEquals(2, props.getCircuitBreaker().getSuccessThreshold());
    assertEquals(Duration.ofSeconds(60), props.getCircuitBreaker().getOpenDuration());
    assertTrue(props.getMetrics().isEnabled());
    assertEquals("webhook", props.getMetrics().getNamePrefix());
  }

  @Test
  void bindsRelaxedNames() {
    MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
        "webhook.table-name", "hooks",
        "webhook.retry.jitter-ratio", "0.25",
        "webhook.http.connect-timeout", "3s",
        "webhook.validation.allow-localhost", "true",
        "webhook.circuit-breaker.open-duration", "2m",
        "webhook.metrics.name-prefix", "adcp.webhook"));

    WebhookProperties props = new Binder(source).bind("webhook", WebhookProperties.class).get();

    assertEquals("hooks", props.getTableName());
    assertEquals(0.25, props.getRetry().getJitterRatio());
    assertEquals(Duration.ofSeconds(3), props.getHttp().getConnectTimeout());
    assertTrue(props.getValidation().isAllowLocalhost());
    assertEquals(Duration.ofMinutes(2), props.getCircuitBreaker().getOpenDuration());
    assertEquals("adcp.webhook", props.getMetrics().getNamePrefix());
  }
}
