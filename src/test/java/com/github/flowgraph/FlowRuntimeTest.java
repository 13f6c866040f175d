package com.github.flowgraph;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/**
 * Tests to maintain the sanity and correctness of the FlowRuntime.
 */
public class FlowRuntimeTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(FlowRuntimeTest.class.getSimpleName());

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final List<String> calls = new ArrayList<>();

  @Test
  public void testStateMachineFlow() {
    // 1. prep the graph: Idle <-> Run
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().flowName("Door")
        .state("Idle", "onIdle", "").state("Run", "onRun", "leaveRun")
        .transition(0, 1, "go", "").transition(1, 0, "stop", "ready").build();
    final FlowRuntime runtime = recordingRuntime(graph, "onIdle", "onRun", "leaveRun");

    // 2. nothing happens before start
    assertFalse(runtime.isStarted());
    assertFalse(runtime.emit("go"));
    assertEquals(-1, runtime.getCurrentState());
    assertNull(runtime.getCurrentStateName());
    assertTrue(calls.isEmpty());

    // 3. start enters state 0
    runtime.start();
    assertTrue(runtime.isStarted());
    assertEquals(0, runtime.getCurrentState());
    assertEquals(Arrays.asList("onIdle"), calls);

    // 4. Idle->Run with an empty guard; Idle has no exit action
    assertTrue(runtime.emit("go"));
    assertEquals("Run", runtime.getCurrentStateName());
    assertEquals(Arrays.asList("onIdle", "onRun"), calls);

    // 5. Run->Idle is guarded by "ready", which is absent
    assertFalse(runtime.emit("stop"));
    assertEquals(1, runtime.getCurrentState());
    assertEquals(2, calls.size());

    // 6. unmatched events have no effect at all
    assertFalse(runtime.emit("jump"));
    assertEquals(2, calls.size());

    // 7. satisfy the guard
    runtime.setBool("ready", true);
    assertTrue(runtime.emit("stop"));
    assertEquals(0, runtime.getCurrentState());
    assertEquals(Arrays.asList("onIdle", "onRun", "leaveRun", "onIdle"), calls);

    final RuntimeStatistics statistics = runtime.getStatistics();
    logger.info(statistics);
    assertEquals(4, statistics.getEventsEmitted());
    assertEquals(2, statistics.getTransitionsFired());
    assertEquals(2, statistics.getUnmatchedEvents());
    assertTrue(statistics.getAliveTimeMillis() >= 0L);
  }

  @Test
  public void testFirstSatisfiedTransitionWins() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().state("A", "", "")
        .state("B", "", "").state("C", "", "").transition(0, 5, "go", "")
        .transition(0, 1, "go", "false").transition(0, 2, "go", "hp >= 10")
        .transition(0, 1, "go", "").build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph).build();
    runtime.start();
    runtime.setNumber("hp", 10);
    assertTrue(runtime.emit("go"));
    assertEquals("C", runtime.getCurrentStateName());

    // from C there is no transition on go
    assertFalse(runtime.emit("go"));
    assertEquals(2, runtime.getCurrentState());
  }

  @Test
  public void testOutOfRangeTargetIsSkipped() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().state("A", "", "exitA")
        .state("B", "enterB", "").transition(0, 7, "go", "").transition(0, -1, "go", "")
        .transition(0, 1, "go", "").build();
    final FlowRuntime runtime = recordingRuntime(graph, "exitA", "enterB");
    runtime.start();
    assertTrue(runtime.emit("go"));
    assertEquals(Arrays.asList("exitA", "enterB"), calls);
  }

  @Test
  public void testSequencer() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder()
        .step("Warmup", 1.0, "warmStart", "", "warmEnd")
        .step("Work", 2.0, "workStart", "", "workEnd").build();
    final FlowRuntime runtime = recordingRuntime(graph, "warmStart", "warmEnd", "workStart",
        "workEnd");

    // 1. update before start is a no-op
    runtime.update(5.0);
    assertEquals(-1, runtime.getCurrentStep());
    assertTrue(calls.isEmpty());

    // 2. start runs the first step's start action
    runtime.start();
    assertEquals(0, runtime.getCurrentStep());
    assertEquals("Warmup", runtime.getCurrentStepName());
    assertEquals(Arrays.asList("warmStart"), calls);

    // 3. overshoot past the duration is dropped
    runtime.update(1.5);
    assertEquals(1, runtime.getCurrentStep());
    assertEquals(0.0, runtime.getStepTimer(), 0.0);
    assertEquals(Arrays.asList("warmStart", "warmEnd", "workStart"), calls);

    // 4. accumulate, then wrap around to step 0
    runtime.update(1.0);
    assertEquals(1, runtime.getCurrentStep());
    assertEquals(1.0, runtime.getStepTimer(), 1e-9);
    runtime.update(1.0);
    assertEquals(0, runtime.getCurrentStep());
    assertEquals(
        Arrays.asList("warmStart", "warmEnd", "workStart", "workEnd", "warmStart"), calls);

    assertEquals(3, runtime.getStatistics().getUpdates());
    assertEquals(2, runtime.getStatistics().getStepsCompleted());
  }

  @Test
  public void testZeroDurationStepAdvancesEveryUpdate() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().step("a", 0.0, "", "", "")
        .step("b", 0.0, "", "", "").build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph).build();
    runtime.start();
    runtime.update(0.0);
    assertEquals(1, runtime.getCurrentStep());
    runtime.update(0.0);
    assertEquals(0, runtime.getCurrentStep());
  }

  @Test
  public void testTimedActionReceivesDelta() {
    final List<Double> deltas = new ArrayList<>();
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder()
        .step("Only", 10.0, "begin", "tick", "").build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph)
        .timedAction("tick", deltas::add).timedAction("begin", deltas::add).build();
    runtime.start();
    runtime.update(0.25);
    runtime.update(0.5);
    assertEquals(Arrays.asList(0.0, 0.25, 0.5), deltas);
    assertEquals(0.75, runtime.getStepTimer(), 1e-9);
  }

  @Test
  public void testBothHalvesShareOneTick() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().state("Calm", "", "")
        .state("Alarm", "alarm", "").transition(0, 1, "panic", "heat > 3")
        .step("Heat", 1.0, "", "", "warm").build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph)
        .action("alarm", () -> calls.add("alarm")).build();
    runtime.registerAction("warm", () -> runtime.setNumber("heat", runtime.getNumber("heat") + 1));
    runtime.start();
    for (int i = 0; i < 3; i++) {
      runtime.update(1.0);
      assertFalse(runtime.emit("panic"));
    }
    runtime.update(1.0);
    assertEquals(4.0, runtime.getNumber("heat"), 0.0);
    assertTrue(runtime.emit("panic"));
    assertEquals(Collections.singletonList("alarm"), calls);
  }

  @Test
  public void testBuilderNullActionIsUnbound() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().state("Calm", "", "")
        .state("Alarm", "alarm", "alarm").transition(0, 1, "panic", "")
        .transition(1, 0, "calm", "").build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph)
        .action("alarm", () -> calls.add("alarm")).action("alarm", null).build();
    runtime.start();
    assertTrue(runtime.emit("panic"));
    assertTrue(runtime.emit("calm"));
    assertEquals(0, runtime.getCurrentState());
    assertTrue(calls.isEmpty());
  }

  @Test
  public void testEmitInput() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().state("Ground", "", "")
        .state("Air", "", "").transition(0, 1, "jump", "").transition(1, 0, "land", "")
        .trigger("jump", "SPACE").trigger("land", "SPACE").trigger("duck", "CTRL").build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph).build();
    runtime.start();
    // both triggers of SPACE run in order: jump then land
    assertEquals(2, runtime.emitInput("SPACE"));
    assertEquals("Ground", runtime.getCurrentStateName());
    assertEquals(0, runtime.emitInput("CTRL"));
    assertEquals(0, runtime.emitInput("ESC"));
  }

  @Test
  public void testUnboundAndRemovedCallbacks() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().state("A", "missing", "")
        .state("B", "enterB", "").transition(0, 1, "go", "gate").build();
    final FlowRuntime runtime = recordingRuntime(graph, "enterB");
    runtime.registerCondition("gate", () -> true);
    runtime.registerCondition("gate", null);
    runtime.registerAction("", () -> calls.add("never"));
    runtime.start();
    assertFalse(runtime.emit("go"));
    runtime.registerCondition("gate", () -> true);
    runtime.registerAction("enterB", null);
    assertTrue(runtime.emit("go"));
    assertTrue(calls.isEmpty());
  }

  @Test
  public void testVariables() {
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().build();
    runtime.setNumber("hp", 3);
    runtime.setString("hp", "full");
    assertEquals(0.0, runtime.getNumber("hp"), 0.0);
    assertEquals("full", runtime.getString("hp"));
    assertEquals(Value.string("full"), runtime.evaluate("hp"));
    assertTrue(runtime.removeVariable("hp"));
    assertFalse(runtime.removeVariable("hp"));
    assertEquals("", runtime.getString("hp"));
    assertFalse(runtime.getBool("nothing"));
    runtime.setBool("alive", true);
    assertTrue(runtime.resolveCondition("alive"));
    assertTrue(runtime.resolveCondition("alive && !dead"));
  }

  @Test
  public void testSnapshotCarriesCurrentValues() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().flowName("Snap")
        .state("A", "", "").variable(Variable.number("hp", 10))
        .variable(Variable.string("name", "Bob")).build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph).build();
    runtime.setNumber("hp", 4);
    runtime.setBool("extra", true);
    final FlowGraph snapshot = runtime.snapshot();
    assertEquals("Snap", snapshot.getFlowName());
    assertEquals(graph.getStates(), snapshot.getStates());
    assertEquals(Arrays.asList(Variable.number("hp", 4), Variable.string("name", "Bob"),
        Variable.bool("extra", true)), snapshot.getVariables());

    // an edited snapshot goes back in as a fresh, unstarted graph
    runtime.start();
    runtime.loadGraph(snapshot.toBuilder().state("B", "", "").transition(0, 1, "go", "hp < 5")
        .build());
    assertFalse(runtime.isStarted());
    assertEquals(4.0, runtime.getNumber("hp"), 0.0);
    runtime.start();
    assertTrue(runtime.emit("go"));
  }

  @Test
  public void testLoadFromFile() throws Exception {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().flowName("Loaded")
        .state("One", "", "").state("Two", "", "").transition(0, 1, "next", "")
        .variable(Variable.bool("armed", true)).build();
    final Path path = new File(folder.getRoot(), "loaded.flow").toPath();
    assertTrue(FlowGraphCodec.save(graph, path).isSuccessful());

    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().build();
    runtime.setNumber("stale", 1);
    runtime.start();
    final FlowIoResult result = runtime.loadFromFile(path);
    assertTrue(result.isSuccessful());
    assertEquals("Loaded", runtime.getFlowName());
    assertFalse(runtime.isStarted());
    assertEquals(-1, runtime.getCurrentState());
    assertEquals(0.0, runtime.getNumber("stale"), 0.0);
    assertTrue(runtime.getBool("armed"));
    runtime.start();
    assertTrue(runtime.emit("next"));
  }

  @Test
  public void testLoadFromMissingFileKeepsGraph() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().flowName("Kept")
        .state("A", "", "").build();
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph).build();
    runtime.start();
    final FlowIoResult result =
        runtime.loadFromFile(new File(folder.getRoot(), "absent.flow").toPath());
    assertFalse(result.isSuccessful());
    assertEquals(FlowGraphException.Code.IO_FAILURE, result.getError().getCode());
    assertEquals("Kept", runtime.getFlowName());
    assertEquals(0, runtime.getCurrentState());
  }

  @Test
  public void testEmptyRuntime() {
    final FlowRuntime runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().build();
    runtime.start();
    assertEquals(FlowGraph.DEFAULT_FLOW_NAME, runtime.getFlowName());
    assertFalse(runtime.emit("anything"));
    runtime.update(1.0);
    assertEquals(-1, runtime.getCurrentState());
    assertEquals(-1, runtime.getCurrentStep());
    assertNull(runtime.getCurrentStepName());
  }

  private FlowRuntime recordingRuntime(final FlowGraph graph, final String... actionNames) {
    final FlowRuntime.FlowRuntimeBuilder builder =
        FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph);
    for (final String name : actionNames) {
      builder.action(name, () -> calls.add(name));
    }
    return builder.build();
  }
}
