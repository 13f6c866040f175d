package com.github.flowgraph;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;

/**
 * Micro-benchmarks for the preview hot path: guard evaluation and ticking. Not part of the unit
 * test run; launch through the JMH runner.
 */
@org.openjdk.jmh.annotations.State(Scope.Thread)
public class FlowRuntimeBenchmark {
  private FlowRuntime runtime;
  private VariableStore variables;

  @Setup
  public void setUp() {
    final FlowGraph graph = FlowGraph.FlowGraphBuilder.newBuilder().flowName("Bench")
        .state("A", "", "").state("B", "", "").transition(0, 1, "flip", "hp > 0 && alive")
        .transition(1, 0, "flip", "!(hp > 0) || alive").step("S1", 0.5, "", "", "")
        .step("S2", 0.5, "", "", "").variable(Variable.number("hp", 3))
        .variable(Variable.bool("alive", true)).build();
    runtime = FlowRuntime.FlowRuntimeBuilder.newBuilder().graph(graph).build();
    runtime.start();
    variables = new VariableStore();
    variables.setNumber("hp", 3);
    variables.setString("name", "Bob");
  }

  @Benchmark
  public boolean testEmitWithExpressionGuard() {
    return runtime.emit("flip");
  }

  @Benchmark
  public void testUpdate() {
    runtime.update(0.016);
  }

  @Benchmark
  public Value testParseAndEvaluate() {
    return ExpressionParser.evaluate("hp >= 2 && name == \"Bob\" || !(hp < 0)", variables);
  }

  public static void main(String args[]) {
    final FlowRuntimeBenchmark benchmark = new FlowRuntimeBenchmark();
    benchmark.setUp();
    benchmark.testEmitWithExpressionGuard();
    benchmark.testUpdate();
    benchmark.testParseAndEvaluate();
  }
}
