package ca.gc.cra.relay.application.stage;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.StageContext;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Statically replicated stage: {@code n} FIFO replicas of the same transform contend on one input feed and one
 * output feed.
 *
 * <p>Each input item is consumed by exactly one replica, whichever is free first. {@link #run} returns after every
 * replica has returned; a failing replica never stops its siblings.</p>
 *
 * @since 0.1.0
 */
public final class FixedPoolStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(FixedPoolStage.class);

  private final List<Stage> replicas;
  private final MetricsPort metrics;

  FixedPoolStage(List<Stage> replicas, MetricsPort metrics) {
    this.replicas = List.copyOf(replicas);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (this.replicas.isEmpty()) {
      throw new IllegalArgumentException("replicas must not be empty");
    }
  }

  /**
   * Returns the number of replicas started per run.
   *
   * @return replica count
   */
  public int size() {
    return replicas.size();
  }

  @Override
  public void run(CancellationSignal cancel, StageContext context) {
    ExecutorService executor =
        ExecutorFactories.newStagePool(replicas.size(), "relay-fixed-" + context.position(), null);
    try {
      List<Future<?>> running = Replicas.startAll(executor, replicas, cancel, i -> context);
      log.info("Fixed pool stage {} started {} replicas", context.position(), replicas.size());
      metrics.observe("stage.fixed.replicas", replicas.size());
      Replicas.joinAll(running, context);
    } finally {
      ExecutorFactories.shutdownAndAwait(executor);
    }
    log.info("Fixed pool stage {} joined {} replicas", context.position(), replicas.size());
  }

  @Override
  public String toString() {
    return "FixedPoolStage[replicas=" + replicas.size() + "]";
  }
}
