package ca.gc.cra.relay.application.pipeline;

import java.util.List;

/**
 * Raised by {@link Pipeline#process} when the run collected one or more failures.
 *
 * <p>The first failure is the cause; every failure, the first included, is attached as suppressed and available
 * through {@link #errors()}.</p>
 *
 * @since 0.1.0
 */
public final class PipelineException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient List<Throwable> errors;

  /**
   * Creates the exception from the collected failures.
   *
   * @param errors failures in the order they were reported; must not be empty
   */
  public PipelineException(List<Throwable> errors) {
    super(errors.size() + " error(s) occurred during pipeline run; first: " + errors.get(0).getMessage(),
        errors.get(0));
    this.errors = List.copyOf(errors);
    for (Throwable error : this.errors) {
      addSuppressed(error);
    }
  }

  /**
   * Returns every failure reported during the run.
   *
   * @return immutable list of failures
   */
  public List<Throwable> errors() {
    return errors;
  }
}
