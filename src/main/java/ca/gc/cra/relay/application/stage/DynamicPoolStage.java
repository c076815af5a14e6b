package ca.gc.cra.relay.application.stage;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.application.flow.PermitPool;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.StageContext;
import ca.gc.cra.relay.application.port.Transform;
import ca.gc.cra.relay.domain.item.Item;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Elastic stage that launches one concurrent unit per input item, bounded by a pool of {@code max} permits.
 *
 * <p>The accept loop takes a permit before launching each unit, so acceptance stalls while {@code max} units are in
 * flight. Each unit returns its permit when it finishes, whatever the outcome. Once the loop exits (input exhausted or
 * cancellation), {@link #run} waits for every permit to come back, so no unit outlives the call and the pool is
 * full again for the next run.</p>
 *
 * <p>Units already launched when cancellation fires run to completion. Their output send races the cancellation;
 * if cancellation wins the output is dropped and counted under {@code stage.dynamic.output.dropped}.</p>
 *
 * @since 0.1.0
 */
public final class DynamicPoolStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(DynamicPoolStage.class);

  private final Transform transform;
  private final PermitPool permits;
  private final MetricsPort metrics;

  DynamicPoolStage(Transform transform, int max, MetricsPort metrics) {
    this.transform = Objects.requireNonNull(transform, "transform");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.permits = new PermitPool(max);
  }

  /**
   * Returns the permit pool bounding in-flight units; exposed for instrumentation.
   *
   * @return permit pool shared by every run of this stage
   */
  public PermitPool permits() {
    return permits;
  }

  @Override
  public void run(CancellationSignal cancel, StageContext context) {
    ExecutorService executor =
        ExecutorFactories.newStagePool(permits.max(), "relay-dynamic-" + context.position(), null);
    long dispatched = 0;
    try {
      while (true) {
        Optional<Item> next = context.input().receive(cancel);
        if (next.isEmpty()) {
          break;
        }
        if (!permits.acquire(cancel)) {
          log.debug("Dynamic pool stage {} cancelled while waiting for a permit", context.position());
          break;
        }
        Item item = next.get();
        try {
          executor.execute(() -> runUnit(cancel, context, item));
        } catch (RejectedExecutionException ex) {
          permits.release();
          StageFailures.report(log, context, ex);
          break;
        }
        dispatched++;
        metrics.increment("stage.dynamic.dispatched");
        metrics.observe("stage.dynamic.inFlight", permits.max() - permits.available());
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.debug("Dynamic pool stage {} interrupted", context.position());
    } finally {
      permits.awaitAllReturned();
      ExecutorFactories.shutdownAndAwait(executor);
    }
    log.info("Dynamic pool stage {} drained after dispatching {} units (peak in flight {} of {})",
        context.position(), dispatched, permits.peakInUse(), permits.max());
  }

  private void runUnit(CancellationSignal cancel, StageContext context, Item item) {
    MDC.put("stage", Integer.toString(context.position()));
    try {
      Optional<Item> produced;
      try {
        produced = transform.process(cancel, item);
      } catch (Exception ex) {
        metrics.increment("stage.dynamic.failed");
        StageFailures.report(log, context, ex);
        if (ex instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        return;
      }
      if (produced == null || produced.isEmpty()) {
        item.markProcessed();
        return;
      }
      if (!context.output().send(cancel, produced.get())) {
        metrics.increment("stage.dynamic.output.dropped");
        log.debug("Dynamic pool stage {} dropped output after cancellation", context.position());
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      metrics.increment("stage.dynamic.output.dropped");
    } catch (RuntimeException ex) {
      metrics.increment("stage.dynamic.failed");
      StageFailures.report(log, context, ex);
    } finally {
      permits.release();
      MDC.remove("stage");
    }
  }

  @Override
  public String toString() {
    return "DynamicPoolStage[max=" + permits.max() + "]";
  }
}
