package ca.gc.cra.relay.application.flow;

/**
 * Thrown when an item is sent into a {@link Feed} that has already been closed.
 *
 * @since 0.1.0
 */
public final class FeedClosedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String feedName;

  /**
   * Creates the exception for the named feed.
   *
   * @param feedName label of the closed feed
   */
  public FeedClosedException(String feedName) {
    super("Feed " + feedName + " is closed");
    this.feedName = feedName;
  }

  /**
   * Returns the label of the feed that rejected the send.
   *
   * @return feed name
   */
  public String feedName() {
    return feedName;
  }
}
