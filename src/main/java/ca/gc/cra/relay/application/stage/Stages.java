package ca.gc.cra.relay.application.stage;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.Transform;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Factory for the RELAY stage implementations.
 * <p><strong>Role:</strong> Entry point used by callers and {@link ca.gc.cra.relay.config.PipelineConfig} to turn
 * {@link Transform}s into {@link Stage}s.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Wrap a transform into a sequential, fixed-pool, dynamic-pool or broadcast stage.</li>
 *   <li>Return {@link Stage#NO_OP} instead of throwing when worker counts or transform lists are unusable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; returned stages are safe to run from any thread, one run at a
 * time.</p>
 *
 * @since 0.1.0
 */
public final class Stages {
  private static final Logger log = LoggerFactory.getLogger(Stages.class);

  private Stages() {}

  /**
   * Wraps {@code transform} into a sequential stage.
   *
   * @param transform per-item logic
   * @return FIFO stage
   */
  public static Stage fifo(Transform transform) {
    return fifo(transform, MetricsPort.NO_OP);
  }

  /**
   * Wraps {@code transform} into a sequential stage reporting to {@code metrics}.
   *
   * @param transform per-item logic
   * @param metrics metrics sink
   * @return FIFO stage
   */
  public static Stage fifo(Transform transform, MetricsPort metrics) {
    return new FifoStage(transform, metrics);
  }

  /**
   * Builds a pool of {@code workers} FIFO replicas sharing input and output feeds.
   *
   * @param transform per-item logic shared by every replica; must be thread-safe
   * @param workers replica count
   * @return fixed pool stage, or {@link Stage#NO_OP} when {@code workers <= 0}
   */
  public static Stage fixedPool(Transform transform, int workers) {
    return fixedPool(transform, workers, MetricsPort.NO_OP);
  }

  /**
   * Builds a pool of {@code workers} FIFO replicas reporting to {@code metrics}.
   *
   * @param transform per-item logic shared by every replica; must be thread-safe
   * @param workers replica count
   * @param metrics metrics sink
   * @return fixed pool stage, or {@link Stage#NO_OP} when {@code workers <= 0}
   */
  public static Stage fixedPool(Transform transform, int workers, MetricsPort metrics) {
    Objects.requireNonNull(transform, "transform");
    if (workers <= 0) {
      log.warn("Fixed pool requested with {} workers; returning no-op stage", workers);
      return Stage.NO_OP;
    }
    List<Stage> replicas = new ArrayList<>(workers);
    for (int i = 0; i < workers; i++) {
      replicas.add(fifo(transform, metrics));
    }
    return new FixedPoolStage(replicas, metrics);
  }

  /**
   * Builds a stage running up to {@code max} transform invocations concurrently, one per item.
   *
   * @param transform per-item logic; must be thread-safe
   * @param max ceiling on concurrently running units
   * @return dynamic pool stage, or {@link Stage#NO_OP} when {@code max <= 0}
   */
  public static Stage dynamicPool(Transform transform, int max) {
    return dynamicPool(transform, max, MetricsPort.NO_OP);
  }

  /**
   * Builds a dynamic pool reporting to {@code metrics}.
   *
   * @param transform per-item logic; must be thread-safe
   * @param max ceiling on concurrently running units
   * @param metrics metrics sink
   * @return dynamic pool stage, or {@link Stage#NO_OP} when {@code max <= 0}
   */
  public static Stage dynamicPool(Transform transform, int max, MetricsPort metrics) {
    Objects.requireNonNull(transform, "transform");
    if (max <= 0) {
      log.warn("Dynamic pool requested with ceiling {}; returning no-op stage", max);
      return Stage.NO_OP;
    }
    return new DynamicPoolStage(transform, max, metrics);
  }

  /**
   * Builds a stage delivering every item to one FIFO replica per transform.
   *
   * @param transforms branch logic, one replica each; replica 0 receives the original item
   * @return broadcast stage, or {@link Stage#NO_OP} when no transform is given
   */
  public static Stage broadcast(Transform... transforms) {
    return broadcast(transforms == null ? List.of() : Arrays.asList(transforms), MetricsPort.NO_OP);
  }

  /**
   * Builds a broadcast stage reporting to {@code metrics}.
   *
   * @param transforms branch logic, one replica each; replica 0 receives the original item
   * @param metrics metrics sink
   * @return broadcast stage, or {@link Stage#NO_OP} when {@code transforms} is empty
   */
  public static Stage broadcast(List<? extends Transform> transforms, MetricsPort metrics) {
    if (transforms == null || transforms.isEmpty()) {
      log.warn("Broadcast requested without transforms; returning no-op stage");
      return Stage.NO_OP;
    }
    List<Stage> replicas = new ArrayList<>(transforms.size());
    for (Transform transform : transforms) {
      replicas.add(fifo(Objects.requireNonNull(transform, "transform"), metrics));
    }
    return new BroadcastStage(replicas, metrics);
  }
}
