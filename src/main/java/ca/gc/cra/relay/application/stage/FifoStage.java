package ca.gc.cra.relay.application.stage;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.StageContext;
import ca.gc.cra.relay.application.port.Transform;
import ca.gc.cra.relay.domain.item.Item;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequential stage: processes one item at a time in arrival order.
 *
 * <p>Failed items are reported and dropped; the loop continues with the next item. Items for which the transform
 * produces nothing are marked processed; a failing acknowledgement is reported like a transform failure. The stage
 * returns once its input is exhausted or cancellation wins a receive or send.</p>
 *
 * @since 0.1.0
 */
public final class FifoStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(FifoStage.class);

  private final Transform transform;
  private final MetricsPort metrics;

  FifoStage(Transform transform, MetricsPort metrics) {
    this.transform = Objects.requireNonNull(transform, "transform");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run(CancellationSignal cancel, StageContext context) {
    long processed = 0;
    try {
      while (true) {
        Optional<Item> next = context.input().receive(cancel);
        if (next.isEmpty()) {
          break;
        }
        Item item = next.get();
        Optional<Item> produced;
        try {
          produced = transform.process(cancel, item);
        } catch (Exception ex) {
          // A transform throwing InterruptedException fails its item only; the signal decides when to stop.
          metrics.increment("stage.fifo.failed");
          StageFailures.report(log, context, ex);
          if (cancel.isCancelled()) {
            break;
          }
          continue;
        }
        processed++;
        metrics.increment("stage.fifo.processed");
        if (produced == null || produced.isEmpty()) {
          acknowledge(context, item);
          continue;
        }
        if (!context.output().send(cancel, produced.get())) {
          break;
        }
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.debug("FIFO stage {} interrupted", context.position());
    }
    log.debug("FIFO stage {} exiting after {} items (cancelled={})",
        context.position(), processed, cancel.isCancelled());
  }

  private void acknowledge(StageContext context, Item item) {
    try {
      item.markProcessed();
    } catch (RuntimeException ex) {
      metrics.increment("stage.fifo.failed");
      StageFailures.report(log, context, ex);
    }
  }

  @Override
  public String toString() {
    return "FifoStage[" + transform + "]";
  }
}
