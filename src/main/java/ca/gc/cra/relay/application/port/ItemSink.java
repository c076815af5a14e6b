package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.domain.item.Item;

/**
 * <strong>What:</strong> Terminal consumer of items leaving a pipeline.
 * <p><strong>Thread-safety:</strong> Invoked from a single driver thread; need not be thread-safe.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ItemSink {
  /**
   * Consumes one item emitted by the last stage.
   *
   * @param cancel run-wide cancellation signal
   * @param item item to consume
   * @throws Exception if consumption fails; the driver reports it and continues with the next item
   */
  void consume(CancellationSignal cancel, Item item) throws Exception;
}
