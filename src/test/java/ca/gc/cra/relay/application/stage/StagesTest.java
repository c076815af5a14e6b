package ca.gc.cra.relay.application.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.Transform;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class StagesTest {
  private static final Transform IDENTITY = (cancel, item) -> Optional.of(item);

  @Test
  void unusableArgumentsAreLoggedAndYieldNoOp() {
    Logger logger = (Logger) LoggerFactory.getLogger(Stages.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      assertSame(Stage.NO_OP, Stages.fixedPool(IDENTITY, 0));
      assertSame(Stage.NO_OP, Stages.dynamicPool(IDENTITY, -2));
      assertSame(Stage.NO_OP, Stages.broadcast());
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    List<ILoggingEvent> events = appender.list;
    assertEquals(3, events.size());
    assertEquals(Level.WARN, events.get(0).getLevel());
    assertEquals("Fixed pool requested with 0 workers; returning no-op stage", events.get(0).getFormattedMessage());
    assertEquals("Dynamic pool requested with ceiling -2; returning no-op stage",
        events.get(1).getFormattedMessage());
    assertEquals("Broadcast requested without transforms; returning no-op stage", events.get(2).getFormattedMessage());
  }

  @Test
  void buildsStageKindsForUsableArguments() {
    assertInstanceOf(FifoStage.class, Stages.fifo(IDENTITY));
    assertEquals(4, assertInstanceOf(FixedPoolStage.class, Stages.fixedPool(IDENTITY, 4)).size());
    assertEquals(2, assertInstanceOf(DynamicPoolStage.class, Stages.dynamicPool(IDENTITY, 2)).permits().max());
    assertEquals(2, assertInstanceOf(BroadcastStage.class, Stages.broadcast(IDENTITY, IDENTITY)).size());
  }

  @Test
  void nullTransformsAreRejected() {
    assertThrows(NullPointerException.class, () -> Stages.fixedPool(null, 2));
    assertThrows(NullPointerException.class, () -> Stages.dynamicPool(null, 2));
    assertThrows(NullPointerException.class, () -> Stages.fifo(null));
  }
}
