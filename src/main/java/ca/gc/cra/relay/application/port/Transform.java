package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.domain.item.Item;
import java.util.Optional;

/**
 * <strong>What:</strong> Caller-supplied per-item processing logic invoked by a stage.
 * <p><strong>Why:</strong> Keeps business logic free of pipeline plumbing (feeds, permits, replicas).</p>
 * <p><strong>Role:</strong> Application port implemented by callers and wrapped by
 * {@link ca.gc.cra.relay.application.stage.Stages}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Transform one item, optionally producing an item for the next stage.</li>
 *   <li>Signal failure by throwing; the stage reports it and moves on.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Pools invoke the same instance from several threads at once; implementations
 * wrapped by a pool must be thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Transform {
  /**
   * Processes one item.
   *
   * @param cancel run-wide cancellation signal; long-running transforms should check it
   * @param item item owned by the caller's branch for the duration of the call
   * @return item to forward downstream, or empty when the item terminates here (for example a sink)
   * @throws Exception if processing fails; the item is dropped and the failure reported
   */
  Optional<Item> process(CancellationSignal cancel, Item item) throws Exception;
}
