package ca.gc.cra.relay.application.pipeline;

/**
 * Failure annotated with the pipeline position where it happened.
 *
 * <p>Position {@value #SOURCE_POSITION} denotes the item source; the position equal to the number of stages
 * denotes the item sink.</p>
 *
 * @since 0.1.0
 */
public final class StageException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** Position used for failures raised by the {@link ca.gc.cra.relay.application.port.ItemSource}. */
  public static final int SOURCE_POSITION = -1;

  private final int position;

  /**
   * Wraps {@code cause} with the stage position.
   *
   * @param position index of the stage that observed the failure
   * @param cause underlying failure
   */
  public StageException(int position, Throwable cause) {
    super("pipeline stage " + position + ": " + describe(cause), cause);
    this.position = position;
  }

  /**
   * Returns the index of the stage that observed the failure.
   *
   * @return stage position
   */
  public int position() {
    return position;
  }

  private static String describe(Throwable cause) {
    if (cause == null) {
      return "unknown failure";
    }
    String message = cause.getMessage();
    return message == null || message.isBlank() ? cause.getClass().getName() : message;
  }
}
