package ca.gc.cra.relay.application.stage;

import ca.gc.cra.relay.application.pipeline.StageException;
import ca.gc.cra.relay.application.port.StageContext;
import org.slf4j.Logger;

/** Wraps failures with the stage position and hands them to the context's error sink. */
final class StageFailures {
  private StageFailures() {}

  static StageException report(Logger log, StageContext context, Throwable cause) {
    StageException failure =
        cause instanceof StageException staged ? staged : new StageException(context.position(), cause);
    log.warn("Stage {} reported failure: {}", context.position(), failure.getMessage());
    log.debug("Stage {} failure detail", context.position(), cause);
    context.errors().append(failure);
    return failure;
  }
}
