package com.github.flowgraph;

import java.nio.file.Path;

import javax.lang.model.SourceVersion;

/**
 * This class encapsulates all the configuration parameters for the {@link FlowCompiler}. Use the
 * {@code CompilerConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. The output directory is the source root; generated classes land in the sub-directory that
 * mirrors {@link #getPackageName()}.<br>
 * 2. An empty package name puts the generated classes in the default package.<br>
 * 3. When {@link #getWriteFlowData()} is set, the graph's flow text is written next to the
 * sources as {@code <module>.<flowDataExtension>} in the output directory, for the generated
 * runtime's loadFromFile.<br>
 */
public final class CompilerConfiguration {
  public static final String DEFAULT_FLOW_DATA_EXTENSION = "flow";

  private final Path outputDirectory;
  private final String packageName;
  private final boolean writeFlowData;
  private final String flowDataExtension;

  public Path getOutputDirectory() {
    return outputDirectory;
  }

  public String getPackageName() {
    return packageName;
  }

  public boolean getWriteFlowData() {
    return writeFlowData;
  }

  public String getFlowDataExtension() {
    return flowDataExtension;
  }

  /**
   * Directory the generated sources are written to: the output directory plus the package path.
   */
  public Path getSourceDirectory() {
    Path directory = outputDirectory;
    if (!packageName.isEmpty()) {
      for (final String segment : packageName.split("\\.")) {
        directory = directory.resolve(segment);
      }
    }
    return directory;
  }

  public final static class CompilerConfigurationBuilder {
    private Path outputDirectory;
    private String packageName = "";
    private boolean writeFlowData = true;
    private String flowDataExtension = DEFAULT_FLOW_DATA_EXTENSION;

    public static CompilerConfigurationBuilder newBuilder() {
      return new CompilerConfigurationBuilder();
    }

    public CompilerConfigurationBuilder outputDirectory(final Path outputDirectory) {
      this.outputDirectory = outputDirectory;
      return this;
    }

    public CompilerConfigurationBuilder packageName(final String packageName) {
      this.packageName = packageName;
      return this;
    }

    public CompilerConfigurationBuilder writeFlowData(final boolean writeFlowData) {
      this.writeFlowData = writeFlowData;
      return this;
    }

    public CompilerConfigurationBuilder flowDataExtension(final String flowDataExtension) {
      this.flowDataExtension = flowDataExtension;
      return this;
    }

    public CompilerConfiguration build() throws FlowGraphException {
      final CompilerConfiguration config = new CompilerConfiguration(outputDirectory,
          packageName, writeFlowData, flowDataExtension);
      config.validate();
      return config;
    }

    private CompilerConfigurationBuilder() {}
  }

  private void validate() throws FlowGraphException {
    StringBuilder messages = new StringBuilder();
    if (outputDirectory == null) {
      messages.append("Output directory cannot be null. ");
    }
    if (!packageName.isEmpty() && !SourceVersion.isName(packageName)) {
      messages.append("Package name '").append(packageName)
          .append("' is not a valid Java package name. ");
    }
    if (writeFlowData) {
      if (flowDataExtension.isEmpty()) {
        messages.append("Flow data extension cannot be empty. ");
      } else if (!Sanitizers.identifier(flowDataExtension).equals(flowDataExtension)) {
        messages.append("Flow data extension '").append(flowDataExtension)
            .append("' must only contain letters, digits and underscores. ");
      }
    }
    if (messages.length() > 0) {
      throw new FlowGraphException(FlowGraphException.Code.INVALID_COMPILER_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "CompilerConfiguration [outputDirectory=" + outputDirectory + ", packageName="
        + packageName + ", writeFlowData=" + writeFlowData + ", flowDataExtension="
        + flowDataExtension + "]";
  }

  private CompilerConfiguration(final Path outputDirectory, final String packageName,
      final boolean writeFlowData, final String flowDataExtension) {
    this.outputDirectory = outputDirectory;
    this.packageName = packageName == null ? "" : packageName.trim();
    this.writeFlowData = writeFlowData;
    this.flowDataExtension = flowDataExtension == null ? "" : flowDataExtension.trim();
  }

}
