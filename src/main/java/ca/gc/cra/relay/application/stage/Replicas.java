package ca.gc.cra.relay.application.stage;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.StageContext;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/** Starts replica stages on an executor and joins them. */
final class Replicas {
  private static final Logger log = LoggerFactory.getLogger(Replicas.class);

  private Replicas() {}

  /**
   * Submits every replica; replica {@code i} runs with {@code contexts.apply(i)}.
   */
  static List<Future<?>> startAll(
      ExecutorService executor,
      List<Stage> replicas,
      CancellationSignal cancel,
      IntFunction<StageContext> contexts) {
    List<Future<?>> running = new ArrayList<>(replicas.size());
    for (int i = 0; i < replicas.size(); i++) {
      Stage replica = replicas.get(i);
      StageContext replicaContext = contexts.apply(i);
      int replicaIndex = i;
      running.add(executor.submit(() -> {
        MDC.put("stage", Integer.toString(replicaContext.position()));
        MDC.put("replica", Integer.toString(replicaIndex));
        try {
          replica.run(cancel, replicaContext);
        } finally {
          MDC.remove("replica");
          MDC.remove("stage");
        }
      }));
    }
    return running;
  }

  /**
   * Waits for every replica to return. Crashed replicas are reported to the error sink; the wait is not
   * cancellable and survives interrupts, which are re-asserted on return.
   */
  static void joinAll(List<Future<?>> running, StageContext context) {
    boolean interrupted = false;
    for (Future<?> replica : running) {
      while (true) {
        try {
          replica.get();
          break;
        } catch (InterruptedException ie) {
          interrupted = true;
        } catch (ExecutionException ex) {
          log.error("Replica of stage {} crashed", context.position(), ex.getCause());
          StageFailures.report(log, context, ex.getCause());
          break;
        }
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
