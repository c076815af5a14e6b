package ca.gc.cra.relay.domain.item;

/**
 * <strong>What:</strong> Unit of payload flowing between pipeline stages.
 * <p><strong>Why:</strong> Fan-out stages hand the same logical item to several branches; each branch must own
 * the payload it mutates.</p>
 * <p><strong>Role:</strong> Domain value implemented by callers (records, messages, documents).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Produce independent copies that another branch may mutate concurrently.</li>
 *   <li>Notify the item's origin once it reaches a terminal point without downstream emission.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Ownership moves along the pipeline; only the current owner touches the item,
 * so implementations need not be thread-safe. {@link #markProcessed()} may be invoked from any worker thread.</p>
 *
 * @since 0.1.0
 */
public interface Item {
  /**
   * Returns a deep copy of this item.
   *
   * <p>Mutating the copy must never be visible through this instance or any other copy.</p>
   *
   * @return independent copy of this item
   */
  Item copy();

  /**
   * Signals the origin of this item that processing terminated without a downstream emission.
   */
  void markProcessed();
}
