package com.github.flowgraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads and writes the line-oriented flow file format (UTF-8, one record per line, fields
 * separated by {@code |}):
 * 
 * <pre>
 * FLOW|1|flowName
 * STATE|name|onEnter|onExit
 * TRANS|fromIndex|toIndex|eventName|condition
 * STEP|name|duration|onStart|onUpdate|onEnd
 * TRIGGER|eventName|inputKeyName
 * VAR|name|typeTag(0=Number,1=Bool,2=String)|value
 * </pre>
 * 
 * The format has no quoting, so the writer passes every free-text field through
 * {@link Sanitizers#field(String)}. The reader is forward tolerant: unknown record kinds and
 * short records are skipped and unparseable numbers read as 0 or false.
 */
public final class FlowGraphCodec {
  private static final Logger logger = LogManager.getLogger(FlowGraphCodec.class.getSimpleName());

  public static final int FORMAT_VERSION = 1;
  static final char SEPARATOR = '|';

  private FlowGraphCodec() {}

  public static String write(final FlowGraph graph) {
    final StringBuilder out = new StringBuilder();
    record(out, RecordKind.FLOW, Integer.toString(FORMAT_VERSION), field(graph.getFlowName()));
    for (State state : graph.getStates()) {
      record(out, RecordKind.STATE, field(state.getName()), field(state.getOnEnterAction()),
          field(state.getOnExitAction()));
    }
    for (Transition transition : graph.getTransitions()) {
      record(out, RecordKind.TRANS, Integer.toString(transition.getFromState()),
          Integer.toString(transition.getToState()), field(transition.getEventName()),
          field(transition.getCondition()));
    }
    for (Step step : graph.getSteps()) {
      record(out, RecordKind.STEP, field(step.getName()), Value.formatNumber(step.getDuration()),
          field(step.getOnStartAction()), field(step.getOnUpdateAction()),
          field(step.getOnEndAction()));
    }
    for (Trigger trigger : graph.getTriggers()) {
      record(out, RecordKind.TRIGGER, field(trigger.getEventName()),
          field(trigger.getInputKeyName()));
    }
    for (Variable variable : graph.getVariables()) {
      record(out, RecordKind.VAR, field(variable.getName()),
          Integer.toString(variable.getKind().getTag()), field(variable.getValue().toText()));
    }
    return out.toString();
  }

  /**
   * Parse flow file text. Never fails; text without a FLOW record gets the default flow name.
   */
  public static FlowGraph read(final String text) {
    final FlowGraph.FlowGraphBuilder builder = FlowGraph.FlowGraphBuilder.newBuilder();
    if (text == null) {
      return builder.build();
    }
    int skipped = 0;
    for (String line : text.split("\n", -1)) {
      if (line.endsWith("\r")) {
        line = line.substring(0, line.length() - 1);
      }
      if (line.isEmpty()) {
        continue;
      }
      final String[] fields = line.split("\\|", -1);
      final RecordKind kind = RecordKind.lookup(fields[0]);
      if (kind == null || fields.length < kind.getMinFields()) {
        skipped++;
        continue;
      }
      switch (kind) {
        case FLOW:
          builder.flowName(fields[2]);
          break;
        case STATE:
          builder.state(fields[1], fields[2], fields[3]);
          break;
        case TRANS:
          builder.transition(parseInt(fields[1]), parseInt(fields[2]), fields[3], fields[4]);
          break;
        case STEP:
          builder.step(fields[1], parseDouble(fields[2]), fields[3], fields[4], fields[5]);
          break;
        case TRIGGER:
          builder.trigger(fields[1], fields[2]);
          break;
        case VAR:
          builder.variable(parseVariable(fields[1], parseInt(fields[2]), fields[3]));
          break;
        default:
          skipped++;
          break;
      }
    }
    if (skipped > 0 && logger.isDebugEnabled()) {
      logger.debug(String.format("Skipped %d unknown or short records", skipped));
    }
    return builder.build();
  }

  /**
   * Write the graph to {@code path}, creating parent directories as needed.
   */
  public static FlowIoResult save(final FlowGraph graph, final Path path) {
    final Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      try {
        Files.createDirectories(parent);
      } catch (IOException problem) {
        final FlowGraphException error = new FlowGraphException(
            FlowGraphException.Code.DIRECTORY_CREATION_FAILURE,
            "Cannot create directory " + parent, problem);
        logger.error(error.getMessage(), problem);
        return FlowIoResult.failure(error, null);
      }
    }
    try {
      Files.write(path, write(graph).getBytes(StandardCharsets.UTF_8));
    } catch (IOException problem) {
      final FlowGraphException error = new FlowGraphException(FlowGraphException.Code.IO_FAILURE,
          "Cannot write flow file " + path, problem);
      logger.error(error.getMessage(), problem);
      return FlowIoResult.failure(error, null);
    }
    logger.info(String.format("Saved %s to %s", graph, path));
    return FlowIoResult.success("Saved " + path, Collections.singletonList(path));
  }

  /**
   * Read a flow file. On I/O failure the outcome carries the failed result and an empty graph.
   */
  public static LoadOutcome load(final Path path) {
    final String text;
    try {
      text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException problem) {
      final FlowGraphException error = new FlowGraphException(FlowGraphException.Code.IO_FAILURE,
          "Cannot read flow file " + path, problem);
      logger.error(error.getMessage(), problem);
      return new LoadOutcome(FlowGraph.empty(), FlowIoResult.failure(error, null));
    }
    final FlowGraph graph = read(text);
    logger.info(String.format("Loaded %s from %s", graph, path));
    return new LoadOutcome(graph, FlowIoResult.success("Loaded " + path, null));
  }

  static Variable parseVariable(final String name, final int tag, final String text) {
    final VariableKind kind = VariableKind.fromTag(tag);
    switch (kind) {
      case BOOL:
        return Variable.bool(name, "true".equals(text.trim()) || "1".equals(text.trim()));
      case STRING:
        return Variable.string(name, text);
      default:
        return Variable.number(name, parseDouble(text));
    }
  }

  static int parseInt(final String text) {
    try {
      return Integer.parseInt(text.trim());
    } catch (NumberFormatException notANumber) {
      return 0;
    }
  }

  static double parseDouble(final String text) {
    try {
      return Double.parseDouble(text.trim());
    } catch (NumberFormatException notANumber) {
      return 0.0;
    }
  }

  private static String field(final String text) {
    return Sanitizers.field(text);
  }

  private static void record(final StringBuilder out, final RecordKind kind,
      final String... fields) {
    out.append(kind.name());
    for (String field : fields) {
      out.append(SEPARATOR).append(field);
    }
    out.append('\n');
  }

  /**
   * Graph and I/O result of {@link FlowGraphCodec#load(Path)}.
   */
  public static final class LoadOutcome {
    private final FlowGraph graph;
    private final FlowIoResult result;

    LoadOutcome(final FlowGraph graph, final FlowIoResult result) {
      this.graph = graph;
      this.result = result;
    }

    public FlowGraph getGraph() {
      return graph;
    }

    public FlowIoResult getResult() {
      return result;
    }
  }
}
