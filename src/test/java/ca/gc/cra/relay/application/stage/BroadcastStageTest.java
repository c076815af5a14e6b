package ca.gc.cra.relay.application.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.application.flow.CancellationSignal;
import ca.gc.cra.relay.application.pipeline.StageException;
import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.application.port.Stage;
import ca.gc.cra.relay.application.port.Transform;
import ca.gc.cra.relay.domain.item.Item;
import ca.gc.cra.relay.testing.IntItem;
import ca.gc.cra.relay.testing.RecordingMetrics;
import ca.gc.cra.relay.testing.RejectingItem;
import ca.gc.cra.relay.testing.StageFixtures;
import ca.gc.cra.relay.testing.StageFixtures.Harness;
import ca.gc.cra.relay.testing.TaggedItem;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BroadcastStageTest {

  @Test
  void branchesMutateIndependentInstances() throws Exception {
    Transform increment = (cancel, item) -> {
      ((TaggedItem) item).increment();
      return Optional.of(item);
    };
    Transform tag = (cancel, item) -> {
      ((TaggedItem) item).tag("x");
      return Optional.of(item);
    };
    TaggedItem original = new TaggedItem(0, List.of());
    Harness harness = Harness.create(0).offer(original).closeInput();

    Stages.broadcast(increment, tag).run(new CancellationSignal(), harness.context());

    List<Item> output = harness.drainOutput();
    assertEquals(2, output.size());
    Set<String> rendered = output.stream().map(Object::toString).collect(Collectors.toSet());
    assertEquals(Set.of("TaggedItem[count=1, tags=[]]", "TaggedItem[count=0, tags=[x]]"), rendered);
    // The first branch owns the original instance.
    assertEquals(1, original.count());
    assertEquals(List.of(), original.tags());
    assertTrue(output.stream().anyMatch(item -> item == original));
  }

  @Test
  void firstBranchReceivesOriginalOthersReceiveCopies() throws Exception {
    Map<Integer, Item> seen = new ConcurrentHashMap<>();
    IntItem original = new IntItem(42);
    List<Transform> branches = IntStream.range(0, 3)
        .<Transform>mapToObj(index -> (cancel, item) -> {
          seen.put(index, item);
          return Optional.empty();
        })
        .toList();
    Harness harness = Harness.create(0).offer(original).closeInput();

    Stages.broadcast(branches, MetricsPort.NO_OP).run(new CancellationSignal(), harness.context());

    assertSame(original, seen.get(0));
    assertNotSame(original, seen.get(1));
    assertNotSame(original, seen.get(2));
    assertNotSame(seen.get(1), seen.get(2));
    assertEquals(42, ((IntItem) seen.get(2)).value());
  }

  @Test
  void everyItemReachesEveryBranch() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    AtomicInteger[] invocations = {new AtomicInteger(), new AtomicInteger(), new AtomicInteger()};
    List<Transform> branches = IntStream.range(0, 3)
        .<Transform>mapToObj(index -> (cancel, item) -> {
          invocations[index].incrementAndGet();
          return Optional.of(item);
        })
        .toList();
    IntItem[] items = IntStream.range(0, 10).mapToObj(IntItem::new).toArray(IntItem[]::new);
    Harness harness = Harness.create(1).offer(items).closeInput();

    Stages.broadcast(branches, metrics).run(new CancellationSignal(), harness.context());

    assertEquals(30, harness.drainOutput().size());
    for (AtomicInteger count : invocations) {
      assertEquals(10, count.get());
    }
    assertEquals(3L, metrics.observation("stage.broadcast.replicas"));
    assertEquals(30, metrics.counter("stage.fifo.processed"));
  }

  @Test
  void failingBranchDoesNotStarveTheOthers() throws Exception {
    Transform healthy = (cancel, item) -> Optional.of(item);
    Transform broken = (cancel, item) -> {
      throw new IllegalStateException("branch down");
    };
    IntItem[] items = IntStream.range(0, 5).mapToObj(IntItem::new).toArray(IntItem[]::new);
    Harness harness = Harness.create(3).offer(items).closeInput();

    Stages.broadcast(healthy, broken).run(new CancellationSignal(), harness.context());

    assertEquals(5, harness.drainOutput().size());
    assertEquals(5, harness.errors().snapshot().size());
  }

  @Test
  void emptyTransformListYieldsNoOpStage() {
    assertSame(Stage.NO_OP, Stages.broadcast());
    assertSame(Stage.NO_OP, Stages.broadcast(List.of(), MetricsPort.NO_OP));
  }

  @Test
  void cancellationStopsFanOutAndReplicas() throws Exception {
    Harness harness = Harness.create(5, 16, 1);
    harness.offer(new IntItem(1), new IntItem(2), new IntItem(3), new IntItem(4));
    CancellationSignal cancel = new CancellationSignal();
    Stage stage = Stages.broadcast((c, item) -> Optional.of(item), (c, item) -> Optional.of(item));
    CompletableFuture<Void> run = StageFixtures.runAsync(stage, cancel, harness.context());

    // Output holds a single item, so both replicas and the fan-out end up blocked.
    assertTrue(StageFixtures.eventually(Duration.ofSeconds(5), () -> harness.output().size() == 1));
    cancel.cancel();

    StageFixtures.await(run, Duration.ofSeconds(5));
    assertTrue(harness.errors().isEmpty());
    assertEquals(Set.of(), StageFixtures.awaitNoLiveThreads("relay-broadcast-5-", Duration.ofSeconds(2)));
  }

  @Test
  void failingAcknowledgementsInOneBranchDoNotStallTheOthers() throws Exception {
    Transform identity = (cancel, item) -> Optional.of(item);
    Transform terminal = (cancel, item) -> Optional.empty();
    RejectingItem[] items = IntStream.range(0, 5).mapToObj(RejectingItem::new).toArray(RejectingItem[]::new);
    Harness harness = Harness.create(3).offer(items).closeInput();

    CompletableFuture<Void> run =
        StageFixtures.runAsync(Stages.broadcast(identity, terminal), new CancellationSignal(), harness.context());
    StageFixtures.await(run, Duration.ofSeconds(5));

    assertEquals(5, harness.drainOutput().size());
    List<Throwable> errors = harness.errors().snapshot();
    assertEquals(5, errors.size());
    errors.forEach(error -> assertEquals(3, assertInstanceOf(StageException.class, error).position()));
    assertEquals(5, IntStream.range(0, 5).map(i -> items[i].attempts()).sum());
  }

  @Test
  void crashedReplicaStopsReceivingAndIsReported() throws Exception {
    Stage crashing = (cancel, context) -> {
      throw new IllegalStateException("replica blew up");
    };
    BroadcastStage stage =
        new BroadcastStage(List.of(crashing, Stages.fifo((cancel, item) -> Optional.of(item))), MetricsPort.NO_OP);
    Harness harness = Harness.create(1);
    harness.offer(IntStream.range(0, 20).mapToObj(IntItem::new).toArray(Item[]::new)).closeInput();

    CompletableFuture<Void> run = StageFixtures.runAsync(stage, new CancellationSignal(), harness.context());
    StageFixtures.await(run, Duration.ofSeconds(5));

    assertEquals(20, harness.drainOutput().size());
    List<Throwable> errors = harness.errors().snapshot();
    assertEquals(1, errors.size());
    assertEquals("pipeline stage 1: replica blew up", errors.get(0).getMessage());
  }
}
