package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.domain.item.Item;
import java.util.Optional;

/**
 * <strong>What:</strong> Origin of items entering a pipeline.
 * <p><strong>Thread-safety:</strong> Invoked from a single driver thread; need not be thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ItemSource {
  /**
   * Returns the next item.
   *
   * @param cancel run-wide cancellation signal
   * @return next item, or empty once the source is exhausted
   * @throws Exception if the source fails; the driver reports it and stops sourcing
   */
  Optional<Item> next(CancellationSignal cancel) throws Exception;
}
