package cafe.woden.mxclient.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class MatrixPropertiesBindingTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner().withUserConfiguration(MatrixPropertiesTestConfig.class);

  @Test
  void defaultsAreAppliedWhenNoMatrixPropertiesProvided() {
    runner.run(
        ctx -> {
          MatrixProperties props = ctx.getBean(MatrixProperties.class);
          assertNotNull(props.client());
          assertEquals("MXcafe", props.client().deviceDisplayName());
          assertEquals(30_000, props.client().requestTimeoutMs());

          MatrixProperties.Reconnect reconnect = props.client().reconnect();
          assertTrue(reconnect.enabled());
          assertEquals(1_000, reconnect.initialDelayMs());
          assertEquals(120_000, reconnect.maxDelayMs());
          assertEquals(2.0, reconnect.multiplier());
          assertEquals(0.20, reconnect.jitterPct());
          assertEquals(0, reconnect.maxAttempts());

          assertEquals(30_000, props.sync().timeoutMs());
          assertEquals(1_000, props.sync().initialRetryDelayMs());
          assertEquals(60_000, props.sync().maxRetryDelayMs());
          assertEquals(500, props.state().maxTimelineMessages());
          assertEquals(80, props.state().replyPreviewMaxChars());
          assertEquals(3_000, props.verification().displayDelayMs());
          assertTrue(props.session().dir().endsWith("mxcafe"));
        });
  }

  @Test
  void explicitValuesBindToNestedSections() {
    runner
        .withPropertyValues(
            "matrix.client.device-display-name=Desk",
            "matrix.client.request-timeout-ms=5000",
            "matrix.client.connect-timeout-ms=2000",
            "matrix.client.reconnect.enabled=false",
            "matrix.client.reconnect.initial-delay-ms=2500",
            "matrix.client.reconnect.max-delay-ms=7500",
            "matrix.client.reconnect.multiplier=3.0",
            "matrix.client.reconnect.jitter-pct=0.33",
            "matrix.client.reconnect.max-attempts=5",
            "matrix.sync.timeout-ms=10000",
            "matrix.state.max-timeline-messages=50",
            "matrix.verification.display-delay-ms=1500",
            "matrix.session.dir=/tmp/mxcafe-test")
        .run(
            ctx -> {
              MatrixProperties props = ctx.getBean(MatrixProperties.class);
              assertEquals("Desk", props.client().deviceDisplayName());
              assertEquals(5_000, props.client().requestTimeoutMs());
              assertEquals(2_000, props.client().connectTimeoutMs());

              MatrixProperties.Reconnect reconnect = props.client().reconnect();
              assertFalse(reconnect.enabled());
              assertEquals(2_500, reconnect.initialDelayMs());
              assertEquals(7_500, reconnect.maxDelayMs());
              assertEquals(3.0, reconnect.multiplier());
              assertEquals(0.33, reconnect.jitterPct());
              assertEquals(5, reconnect.maxAttempts());

              assertEquals(10_000, props.sync().timeoutMs());
              assertEquals(50, props.state().maxTimelineMessages());
              assertEquals(80, props.state().replyPreviewMaxChars());
              assertEquals(1_500, props.verification().displayDelayMs());
              assertEquals("/tmp/mxcafe-test", props.session().dir());
            });
  }

  @Test
  void outOfRangeValuesAreClamped() {
    MatrixProperties.Reconnect reconnect =
        new MatrixProperties.Reconnect(true, 5_000, 1_000, 0.5, 0.9, -3);
    assertEquals(5_000, reconnect.maxDelayMs());
    assertEquals(2.0, reconnect.multiplier());
    assertEquals(0.75, reconnect.jitterPct());
    assertEquals(0, reconnect.maxAttempts());

    MatrixProperties.Sync sync = new MatrixProperties.Sync(-1, 0, 0, 1.0, -0.5);
    assertEquals(30_000, sync.timeoutMs());
    assertEquals(0, sync.retryJitterPct());
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(MatrixProperties.class)
  static class MatrixPropertiesTestConfig {}
}
