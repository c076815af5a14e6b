package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.application.flow.Feed;
import java.util.Objects;

/**
 * Feeds, error sink and position handed to a {@link Stage} for one invocation.
 *
 * @param input feed the stage consumes; possibly shared with sibling replicas
 * @param output feed the stage emits to; possibly shared with sibling replicas
 * @param errors sink collecting annotated failures
 * @param position index of the stage within the pipeline, used to annotate failures
 * @since 0.1.0
 */
public record StageContext(Feed input, Feed output, ErrorSink errors, int position) {
  /**
   * Validates the collaborators.
   *
   * @param input feed the stage consumes
   * @param output feed the stage emits to
   * @param errors sink collecting annotated failures
   * @param position index of the stage within the pipeline
   */
  public StageContext {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(output, "output");
    Objects.requireNonNull(errors, "errors");
  }

  /**
   * Returns a copy reading from another feed; used by broadcast to give each replica a private input.
   *
   * @param replacement input feed for the derived context
   * @return context sharing output, errors and position with this one
   */
  public StageContext withInput(Feed replacement) {
    return new StageContext(replacement, output, errors, position);
  }
}
