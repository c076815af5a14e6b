package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.application.flow.CancellationSignal;

/**
 * <strong>What:</strong> Pluggable unit of pipeline execution.
 * <p><strong>Role:</strong> Application port implemented by the FIFO, fixed pool, dynamic pool and broadcast
 * stages; invoked by {@link ca.gc.cra.relay.application.pipeline.Pipeline}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Consume from {@link StageContext#input()} until it is closed and drained or cancellation is observed.</li>
 *   <li>Emit produced items to {@link StageContext#output()} and report failures to {@link StageContext#errors()}.</li>
 *   <li>Return only after every thread the stage started has finished.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A stage instance runs one invocation at a time; sequential invocations are
 * independent.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Stage {
  /**
   * Runs the stage to completion.
   *
   * @param cancel run-wide cancellation signal
   * @param context feeds, error sink and position supplied by the driver
   */
  void run(CancellationSignal cancel, StageContext context);

  /**
   * Degenerate stage returned for invalid construction parameters; returns immediately without touching its
   * feeds. {@link ca.gc.cra.relay.application.pipeline.Pipeline} treats it as absent.
   */
  Stage NO_OP = new Stage() {
    @Override
    public void run(CancellationSignal cancel, StageContext context) {}

    @Override
    public String toString() {
      return "Stage.NO_OP";
    }
  };
}
