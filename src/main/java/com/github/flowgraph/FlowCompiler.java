package com.github.flowgraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a flow graph into Java sources under the configured output directory.
 *
 * Compilation is not transactional: files are written one by one and a failure leaves the ones
 * already written in place. The returned {@link FlowIoResult} lists them either way. Graph
 * problems found by {@link GraphValidator} are logged as warnings and never stop compilation.
 */
public final class FlowCompiler {
  private static final Logger logger = LogManager.getLogger(FlowCompiler.class.getSimpleName());

  private final CompilerConfiguration config;

  public FlowCompiler(final CompilerConfiguration config) {
    this.config = config;
  }

  public FlowIoResult compile(final FlowGraph graph, final String moduleName) {
    final String flowName = graph.getFlowName();
    for (String finding : GraphValidator.validate(graph)) {
      logWarning(flowName, finding);
    }
    final List<Path> written = new ArrayList<>();
    final GeneratedModule module;
    try {
      module = JavaSourceGenerator.generate(graph, moduleName, config.getPackageName(),
          config.getWriteFlowData() ? config.getFlowDataExtension() : null);
    } catch (FlowGraphException problem) {
      logger.error(problem.getMessage(), problem);
      return FlowIoResult.failure(problem, written);
    }

    final Path sourceDirectory = config.getSourceDirectory();
    try {
      Files.createDirectories(sourceDirectory);
    } catch (IOException problem) {
      return failure(new FlowGraphException(FlowGraphException.Code.DIRECTORY_CREATION_FAILURE,
          "Cannot create directory " + sourceDirectory, problem), written);
    }
    for (Map.Entry<String, String> source : module.getSources().entrySet()) {
      final Path file = sourceDirectory.resolve(source.getKey());
      try {
        writeFile(file, source.getValue());
      } catch (IOException problem) {
        return failure(new FlowGraphException(FlowGraphException.Code.IO_FAILURE,
            "Cannot write " + file, problem), written);
      }
      written.add(file);
    }
    if (module.getFlowDataFileName() != null) {
      final Path file = config.getOutputDirectory().resolve(module.getFlowDataFileName());
      try {
        writeFile(file, module.getFlowData());
      } catch (IOException problem) {
        return failure(new FlowGraphException(FlowGraphException.Code.IO_FAILURE,
            "Cannot write " + file, problem), written);
      }
      written.add(file);
    }
    logInfo(flowName, String.format("Compiled module %s: %d files under %s",
        module.getFlowClassName(), written.size(), config.getOutputDirectory()));
    return FlowIoResult.success("Compiled " + module.qualify(module.getFlowClassName()), written);
  }

  private static void writeFile(final Path file, final String text) throws IOException {
    Files.write(file, text.getBytes(StandardCharsets.UTF_8));
  }

  private static FlowIoResult failure(final FlowGraphException error, final List<Path> written) {
    logger.error(error.getMessage(), error.getCause());
    return FlowIoResult.failure(error, written);
  }

  private static void logWarning(final String flowName, final String message) {
    logger.warn(new StringBuilder().append("[f:").append(flowName).append("] ").append(message)
        .toString());
  }

  private static void logInfo(final String flowName, final String message) {
    logger.info(new StringBuilder().append("[f:").append(flowName).append("] ").append(message)
        .toString());
  }
}
