package cafe.woden.mxclient.config;

import cafe.woden.mxclient.util.NamedThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors and Rx schedulers.
 *
 * <p>These remain workload-specific to preserve ordering and avoid cross-feature contention, while
 * giving Spring ownership of creation/shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String SYNC_LOOP_EXECUTOR = "syncLoopExecutor";
  public static final String RECONNECT_SCHEDULER = "reconnectScheduler";
  public static final String VERIFICATION_EXECUTOR = "verificationExecutor";
  public static final String VERIFICATION_SCHEDULER = "verificationRxScheduler";
  public static final String EVENT_DELIVERY_SCHEDULER = "eventDeliveryRxScheduler";
  public static final String COMMAND_SCHEDULER = "commandRxScheduler";

  @Bean(name = SYNC_LOOP_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService syncLoopExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("mxcafe-sync");
  }

  @Bean(name = RECONNECT_SCHEDULER, destroyMethod = "shutdown")
  public ScheduledExecutorService reconnectScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("mxcafe-reconnect");
  }

  @Bean(name = VERIFICATION_EXECUTOR, destroyMethod = "shutdown")
  public ScheduledExecutorService verificationExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("mxcafe-verification");
  }

  @Bean(name = VERIFICATION_SCHEDULER)
  public Scheduler verificationRxScheduler(
      @Qualifier(VERIFICATION_EXECUTOR) ScheduledExecutorService verificationExecutor) {
    return Schedulers.from(verificationExecutor);
  }

  /** Each bus subscriber gets its own worker from this scheduler. */
  @Bean(name = EVENT_DELIVERY_SCHEDULER)
  public Scheduler eventDeliveryRxScheduler() {
    return Schedulers.io();
  }

  @Bean(name = COMMAND_SCHEDULER)
  public Scheduler commandRxScheduler() {
    return Schedulers.io();
  }
}
