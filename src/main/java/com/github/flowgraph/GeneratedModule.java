package com.github.flowgraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.javaparser.ast.CompilationUnit;

/**
 * The Java sources generated for one flow graph, as JavaParser compilation units, plus the
 * optional flow data text for the generated runtime's loader.
 */
public final class GeneratedModule {
  private final String packageName;
  private final CompilationUnit runtimeUnit;
  private final CompilationUnit flowUnit;
  private final CompilationUnit triggersUnit;
  private final String runtimeClassName;
  private final String flowClassName;
  private final String triggersClassName;
  private final String flowDataFileName;
  private final String flowData;

  GeneratedModule(final String packageName, final String runtimeClassName,
      final CompilationUnit runtimeUnit, final String flowClassName,
      final CompilationUnit flowUnit, final String triggersClassName,
      final CompilationUnit triggersUnit, final String flowDataFileName, final String flowData) {
    this.packageName = packageName;
    this.runtimeClassName = runtimeClassName;
    this.runtimeUnit = runtimeUnit;
    this.flowClassName = flowClassName;
    this.flowUnit = flowUnit;
    this.triggersClassName = triggersClassName;
    this.triggersUnit = triggersUnit;
    this.flowDataFileName = flowDataFileName;
    this.flowData = flowData;
  }

  public String getPackageName() {
    return packageName;
  }

  public String getRuntimeClassName() {
    return runtimeClassName;
  }

  public String getFlowClassName() {
    return flowClassName;
  }

  public String getTriggersClassName() {
    return triggersClassName;
  }

  public CompilationUnit getRuntimeUnit() {
    return runtimeUnit;
  }

  public CompilationUnit getFlowUnit() {
    return flowUnit;
  }

  public CompilationUnit getTriggersUnit() {
    return triggersUnit;
  }

  /**
   * File name of the flow data, or null when the module was generated without one.
   */
  public String getFlowDataFileName() {
    return flowDataFileName;
  }

  public String getFlowData() {
    return flowData;
  }

  /**
   * Printed sources keyed by file name, in write order: runtime, flow, triggers.
   */
  public Map<String, String> getSources() {
    final Map<String, String> sources = new LinkedHashMap<>();
    sources.put(runtimeClassName + ".java", runtimeUnit.toString());
    sources.put(flowClassName + ".java", flowUnit.toString());
    sources.put(triggersClassName + ".java", triggersUnit.toString());
    return Collections.unmodifiableMap(sources);
  }

  /**
   * Binary name of a generated class, for loading it from a class loader.
   */
  public String qualify(final String className) {
    return packageName.isEmpty() ? className : packageName + "." + className;
  }

  @Override
  public String toString() {
    return "GeneratedModule [packageName=" + packageName + ", runtimeClassName="
        + runtimeClassName + ", flowClassName=" + flowClassName + ", triggersClassName="
        + triggersClassName + ", flowDataFileName=" + flowDataFileName + "]";
  }
}
