package ca.gc.cra.relay.application.stage;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.application.flow.Feed;
import ca.gc.cra.relay.application.flow.FeedClosedException;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.StageContext;
import ca.gc.cra.relay.domain.item.Item;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replicates every input item to each wrapped FIFO replica; all replicas emit into the shared output feed.
 *
 * <p>Each replica reads from a private feed created per run. Replica 0 receives the original item; every other
 * replica receives its own {@link Item#copy() copy}, so branches never share a mutable payload. Output order across
 * branches is unspecified. A replica that stops early (a crash) no longer receives deliveries; the others keep
 * going and the crash is reported once every replica has been joined.</p>
 *
 * @since 0.1.0
 */
public final class BroadcastStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(BroadcastStage.class);
  private static final int REPLICA_FEED_CAPACITY = 1;

  private final List<Stage> replicas;
  private final MetricsPort metrics;

  BroadcastStage(List<Stage> replicas, MetricsPort metrics) {
    this.replicas = List.copyOf(replicas);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (this.replicas.isEmpty()) {
      throw new IllegalArgumentException("replicas must not be empty");
    }
  }

  /**
   * Returns the number of branches each item is delivered to.
   *
   * @return replica count
   */
  public int size() {
    return replicas.size();
  }

  @Override
  public void run(CancellationSignal cancel, StageContext context) {
    List<Feed> inputs = new ArrayList<>(replicas.size());
    for (int i = 0; i < replicas.size(); i++) {
      inputs.add(new Feed("broadcast-" + context.position() + "-" + i, REPLICA_FEED_CAPACITY));
    }
    ExecutorService executor =
        ExecutorFactories.newStagePool(replicas.size(), "relay-broadcast-" + context.position(), null);
    List<Future<?>> running = List.of();
    long delivered = 0;
    try {
      running = Replicas.startAll(
          executor, closingInputOnExit(inputs), cancel, i -> context.withInput(inputs.get(i)));
      metrics.observe("stage.broadcast.replicas", replicas.size());
      log.info("Broadcast stage {} started {} replicas", context.position(), replicas.size());
      delivered = fanOut(cancel, context, inputs);
    } finally {
      inputs.forEach(Feed::close);
      Replicas.joinAll(running, context);
      ExecutorFactories.shutdownAndAwait(executor);
    }
    log.info("Broadcast stage {} joined replicas after {} items", context.position(), delivered);
  }

  private long fanOut(CancellationSignal cancel, StageContext context, List<Feed> inputs) {
    long delivered = 0;
    try {
      while (true) {
        Optional<Item> next = context.input().receive(cancel);
        if (next.isEmpty()) {
          return delivered;
        }
        Item item = next.get();
        // Copies are taken before replica 0 owns the original, so nobody can be mutating it yet.
        for (int i = inputs.size() - 1; i >= 0; i--) {
          Feed input = inputs.get(i);
          if (input.isClosed()) {
            continue;
          }
          Item delivery = i == 0 ? item : item.copy();
          try {
            if (!input.send(cancel, delivery)) {
              log.debug("Broadcast stage {} cancelled while delivering to replica {}", context.position(), i);
              return delivered;
            }
          } catch (FeedClosedException ex) {
            log.warn("Broadcast stage {} replica {} stopped; skipping its deliveries", context.position(), i);
          }
        }
        delivered++;
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.debug("Broadcast stage {} interrupted", context.position());
      return delivered;
    }
  }

  /** Wraps each replica so that its private feed closes when it stops, whether it returned or crashed. */
  private List<Stage> closingInputOnExit(List<Feed> inputs) {
    List<Stage> guarded = new ArrayList<>(replicas.size());
    for (int i = 0; i < replicas.size(); i++) {
      Stage replica = replicas.get(i);
      Feed input = inputs.get(i);
      guarded.add((cancel, replicaContext) -> {
        try {
          replica.run(cancel, replicaContext);
        } finally {
          input.close();
        }
      });
    }
    return guarded;
  }

  @Override
  public String toString() {
    return "BroadcastStage[replicas=" + replicas.size() + "]";
  }
}
