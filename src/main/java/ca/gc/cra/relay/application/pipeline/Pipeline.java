package ca.gc.cra.relay.application.pipeline;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.application.flow.Feed;
import ca.gc.cra.relay.application.port.ErrorSink;
import ca.gc.cra.relay.application.port.ItemSink;
import ca.gc.cra.relay.application.port.ItemSource;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.StageContext;
import ca.gc.cra.relay.domain.item.Item;
import ca.gc.cra.relay.infrastructure.errors.InMemoryErrorSink;
import ca.gc.cra.relay.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Chains stages with feeds and drives items from an {@link ItemSource} through them into an {@link ItemSink}.
 *
 * <p>A run creates one feed per stage boundary, a source worker, one thread per stage and a sink worker. When a
 * stage returns, the feed it wrote to is closed so the next stage drains and exits. Failures reported by any stage,
 * the source or the sink are gathered; once every worker has finished, {@link #process} throws a
 * {@link PipelineException} carrying them. With {@link FailurePolicy#CANCEL} the first failure also cancels the
 * run.</p>
 *
 * <p>Instances are immutable and may be run repeatedly; stages are run one invocation at a time.</p>
 *
 * @since 0.1.0
 */
public final class Pipeline {
  private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

  /** Default capacity of the feeds between stages. */
  public static final int DEFAULT_FEED_CAPACITY = 16;

  private final List<Stage> stages;
  private final int feedCapacity;
  private final FailurePolicy failurePolicy;
  private final MetricsPort metrics;

  private Pipeline(Builder builder) {
    this.stages = List.copyOf(builder.stages);
    this.feedCapacity = builder.feedCapacity;
    this.failurePolicy = builder.failurePolicy;
    this.metrics = builder.metrics;
    if (stages.isEmpty()) {
      throw new IllegalArgumentException("Pipeline requires at least one stage");
    }
  }

  /**
   * Creates a pipeline with default settings.
   *
   * @param stages stages in processing order; {@link Stage#NO_OP} entries are skipped
   * @return pipeline
   * @throws IllegalArgumentException if no usable stage remains
   */
  public static Pipeline of(Stage... stages) {
    return builder().stages(stages).build();
  }

  /**
   * Returns a builder with default settings.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the effective stages in processing order.
   *
   * @return immutable stage list
   */
  public List<Stage> stages() {
    return stages;
  }

  /**
   * Runs every item of {@code source} through the stages into {@code sink}.
   *
   * <p>Returns normally when the source is exhausted and every item has drained, or when {@code cancel} fires and
   * every worker has stopped, provided no failure was reported.</p>
   *
   * @param cancel caller's cancellation signal; the pipeline never cancels it, only a child of it
   * @param source origin of items
   * @param sink terminal consumer; items it consumes are marked processed
   * @throws PipelineException if any stage, the source or the sink reported a failure
   */
  public void process(CancellationSignal cancel, ItemSource source, ItemSink sink) throws PipelineException {
    Objects.requireNonNull(cancel, "cancel");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sink, "sink");

    CancellationSignal run = cancel.newChild();
    InMemoryErrorSink collected = new InMemoryErrorSink(metrics);
    ErrorSink errors = failurePolicy == FailurePolicy.CANCEL ? cancelling(collected, run) : collected;

    int count = stages.size();
    List<Feed> feeds = new ArrayList<>(count + 1);
    for (int i = 0; i <= count; i++) {
      feeds.add(new Feed("pipeline-" + i, feedCapacity));
    }

    AtomicLong sourced = new AtomicLong();
    AtomicLong sunk = new AtomicLong();
    ExecutorService executor = ExecutorFactories.newStagePool(count + 2, "relay-pipeline", null);
    List<Future<?>> workers = new ArrayList<>(count + 2);
    MDC.put("pipeline", Integer.toHexString(System.identityHashCode(this)));
    try {
      log.info("Pipeline starting with {} stages (feedCapacity={}, failurePolicy={})",
          count, feedCapacity, failurePolicy);
      workers.add(executor.submit(() -> pumpSource(run, source, feeds.get(0), errors, sourced)));
      for (int i = 0; i < count; i++) {
        StageContext context = new StageContext(feeds.get(i), feeds.get(i + 1), errors, i);
        Stage stage = stages.get(i);
        workers.add(executor.submit(() -> runStage(run, stage, context)));
      }
      workers.add(executor.submit(() -> drainSink(run, sink, feeds.get(count), errors, sunk)));
      awaitWorkers(workers, errors);
    } finally {
      ExecutorFactories.shutdownAndAwait(executor);
      boolean cancelled = cancel.isCancelled() || run.isCancelled();
      run.cancel();
      MDC.remove("pipeline");
      log.info("Pipeline finished: {} items sourced, {} items sunk, cancelled={}",
          sourced.get(), sunk.get(), cancelled);
    }

    List<Throwable> failures = collected.snapshot();
    if (!failures.isEmpty()) {
      throw new PipelineException(failures);
    }
  }

  private ErrorSink cancelling(ErrorSink delegate, CancellationSignal run) {
    return error -> {
      delegate.append(error);
      if (run.cancel()) {
        log.warn("Cancelling pipeline after failure: {}", error.getMessage());
      }
    };
  }

  private void pumpSource(
      CancellationSignal run, ItemSource source, Feed output, ErrorSink errors, AtomicLong sourced) {
    try {
      while (!run.isCancelled()) {
        Optional<Item> next;
        try {
          next = source.next(run);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          break;
        } catch (Exception ex) {
          log.warn("Item source failed: {}", ex.getMessage());
          errors.append(new StageException(StageException.SOURCE_POSITION, ex));
          break;
        }
        if (next == null || next.isEmpty()) {
          break;
        }
        if (!output.send(run, next.get())) {
          break;
        }
        sourced.incrementAndGet();
        metrics.increment("pipeline.items.sourced");
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } finally {
      output.close();
    }
  }

  private void runStage(CancellationSignal run, Stage stage, StageContext context) {
    MDC.put("stage", Integer.toString(context.position()));
    try {
      stage.run(run, context);
      if (!run.isCancelled() && !isExhausted(context.input())) {
        // Nothing drains this input any more; upstream would block on it.
        log.error("Stage {} ({}) returned before its input was exhausted; cancelling pipeline",
            context.position(), stage);
        context.errors().append(new StageException(context.position(),
            new IllegalStateException("stage returned before its input was exhausted")));
        run.cancel();
      }
    } catch (RuntimeException ex) {
      // The crashed stage no longer drains its input; upstream would block without cancellation.
      log.error("Stage {} ({}) crashed; cancelling pipeline", context.position(), stage, ex);
      context.errors().append(new StageException(context.position(), ex));
      run.cancel();
    } finally {
      context.output().close();
      MDC.remove("stage");
    }
  }

  private static boolean isExhausted(Feed input) {
    return input.isClosed() && input.size() == 0;
  }

  private void drainSink(
      CancellationSignal run, ItemSink sink, Feed input, ErrorSink errors, AtomicLong sunk) {
    int position = stages.size();
    try {
      while (true) {
        Optional<Item> next = input.receive(run);
        if (next.isEmpty()) {
          return;
        }
        Item item = next.get();
        try {
          sink.consume(run, item);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          return;
        } catch (Exception ex) {
          log.warn("Item sink failed: {}", ex.getMessage());
          errors.append(new StageException(position, ex));
          continue;
        }
        try {
          item.markProcessed();
        } catch (RuntimeException ex) {
          log.warn("Item acknowledgement failed: {}", ex.getMessage());
          errors.append(new StageException(position, ex));
          continue;
        }
        sunk.incrementAndGet();
        metrics.increment("pipeline.items.sunk");
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  private void awaitWorkers(List<Future<?>> workers, ErrorSink errors) {
    boolean interrupted = false;
    for (Future<?> worker : workers) {
      while (true) {
        try {
          worker.get();
          break;
        } catch (InterruptedException ie) {
          interrupted = true;
        } catch (ExecutionException ex) {
          log.error("Pipeline worker crashed", ex.getCause());
          errors.append(ex.getCause());
          break;
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  /** Reaction of the driver to the first reported failure. */
  public enum FailurePolicy {
    /** Keep processing; failed items are dropped and reported at the end of the run. */
    CONTINUE,
    /** Cancel the run on the first failure; remaining work stops at its next blocking point. */
    CANCEL;

    /**
     * Parses a policy name, ignoring case and surrounding whitespace.
     *
     * @param raw policy name ({@code continue} or {@code cancel})
     * @return parsed policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FailurePolicy from(String raw) {
      if (raw == null || raw.isBlank()) {
        return CONTINUE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "continue" -> CONTINUE;
        case "cancel" -> CANCEL;
        default -> throw new IllegalArgumentException("Unknown failure policy: " + raw);
      };
    }
  }

  /** Collects stages and settings for a {@link Pipeline}. */
  public static final class Builder {
    private final List<Stage> stages = new ArrayList<>();
    private int feedCapacity = DEFAULT_FEED_CAPACITY;
    private FailurePolicy failurePolicy = FailurePolicy.CONTINUE;
    private MetricsPort metrics = MetricsPort.NO_OP;

    private Builder() {}

    /**
     * Appends stages in processing order; {@link Stage#NO_OP} entries are skipped.
     *
     * @param additions stages to append
     * @return this builder
     */
    public Builder stages(Stage... additions) {
      for (Stage stage : additions) {
        addStage(stage);
      }
      return this;
    }

    /**
     * Appends one stage; {@link Stage#NO_OP} is skipped.
     *
     * @param stage stage to append
     * @return this builder
     */
    public Builder addStage(Stage stage) {
      Objects.requireNonNull(stage, "stage");
      if (stage == Stage.NO_OP) {
        log.warn("Skipping no-op stage at position {}", stages.size());
        return this;
      }
      stages.add(stage);
      return this;
    }

    /**
     * Sets the capacity of the feeds between stages.
     *
     * @param capacity buffered items per feed; must be positive
     * @return this builder
     */
    public Builder feedCapacity(int capacity) {
      if (capacity <= 0) {
        throw new IllegalArgumentException("feedCapacity must be positive");
      }
      this.feedCapacity = capacity;
      return this;
    }

    /**
     * Sets the reaction to reported failures.
     *
     * @param policy failure policy
     * @return this builder
     */
    public Builder failurePolicy(FailurePolicy policy) {
      this.failurePolicy = Objects.requireNonNull(policy, "policy");
      return this;
    }

    /**
     * Sets the metrics sink for driver counters.
     *
     * @param port metrics sink
     * @return this builder
     */
    public Builder metrics(MetricsPort port) {
      this.metrics = Objects.requireNonNull(port, "metrics");
      return this;
    }

    /**
     * Builds the pipeline.
     *
     * @return immutable pipeline
     * @throws IllegalArgumentException if no usable stage was added
     */
    public Pipeline build() {
      return new Pipeline(this);
    }
  }
}
