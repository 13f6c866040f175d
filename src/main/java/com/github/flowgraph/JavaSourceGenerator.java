package com.github.flowgraph;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.javaparser.ParseProblemException;
import com.github.javaparser.StaticJavaParser;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Modifier.Keyword;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.utils.StringEscapeUtils;

/**
 * Builds the Java module for a flow graph as JavaParser ASTs. A module named {@code demo} yields:
 * <ul>
 * <li>{@code DemoRuntime}: the runtime template, renamed. It carries the state machine, step
 * sequencer, expression engine, condition resolver and flow file loader, with the same semantics
 * as {@link FlowRuntimeImpl}.</li>
 * <li>{@code DemoFlow}: {@code build(runtime)} holding the graph as literal calls, empty
 * {@code registerActions}, {@code registerConditions} and {@code initVariables} extension points,
 * and {@code create()} which runs them in that order.</li>
 * <li>{@code DemoTriggers}: the input trigger table with {@code eventFor} and
 * {@code dispatch}.</li>
 * </ul>
 * Every string from the graph reaches the output through Java literal escaping, so names and
 * conditions are emitted verbatim. Only the module name is sanitized.
 */
public final class JavaSourceGenerator {
  private static final Logger logger =
      LogManager.getLogger(JavaSourceGenerator.class.getSimpleName());

  static final String TEMPLATE_RESOURCE = "FlowRuntime.java.template";
  static final String TEMPLATE_CLASS_NAME = "FlowRuntime";
  private static final String RUNTIME = "runtime";

  private JavaSourceGenerator() {}

  /**
   * @param flowDataExtension extension of the flow data file the generated loader reads, or null
   *        to generate the module without one
   */
  public static GeneratedModule generate(final FlowGraph graph, final String moduleName,
      final String packageName, final String flowDataExtension) throws FlowGraphException {
    final String pkg = packageName == null ? "" : packageName;
    final String baseName = Sanitizers.className(moduleName);
    final String runtimeClassName = baseName + "Runtime";
    final String flowClassName = baseName + "Flow";
    final String triggersClassName = baseName + "Triggers";
    final String flowDataFileName =
        flowDataExtension == null ? null : Sanitizers.identifier(moduleName) + "." + flowDataExtension;

    final CompilationUnit runtimeUnit = runtimeUnit(pkg, runtimeClassName);
    final CompilationUnit flowUnit =
        flowUnit(graph, pkg, flowClassName, runtimeClassName, flowDataFileName);
    final CompilationUnit triggersUnit =
        triggersUnit(graph, pkg, triggersClassName, runtimeClassName);
    final String flowData = flowDataFileName == null ? null : FlowGraphCodec.write(graph);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Generated module %s for flow %s: %d states, %d steps", baseName,
          graph.getFlowName(), graph.getStates().size(), graph.getSteps().size()));
    }
    return new GeneratedModule(pkg, runtimeClassName, runtimeUnit, flowClassName, flowUnit,
        triggersClassName, triggersUnit, flowDataFileName, flowData);
  }

  static CompilationUnit runtimeUnit(final String packageName, final String className)
      throws FlowGraphException {
    final CompilationUnit unit;
    try {
      unit = StaticJavaParser.parse(loadTemplate());
    } catch (ParseProblemException problem) {
      throw new FlowGraphException(FlowGraphException.Code.TEMPLATE_FAILURE, problem);
    }
    if (!unit.getClassByName(TEMPLATE_CLASS_NAME).isPresent()) {
      throw new FlowGraphException(FlowGraphException.Code.TEMPLATE_FAILURE,
          "Runtime template does not declare class " + TEMPLATE_CLASS_NAME);
    }
    setPackage(unit, packageName);
    for (ClassOrInterfaceDeclaration declaration : unit
        .findAll(ClassOrInterfaceDeclaration.class)) {
      if (declaration.getNameAsString().equals(TEMPLATE_CLASS_NAME)) {
        declaration.setName(className);
      }
    }
    for (ClassOrInterfaceType type : unit.findAll(ClassOrInterfaceType.class)) {
      if (type.getNameAsString().equals(TEMPLATE_CLASS_NAME)) {
        type.setName(className);
      }
    }
    for (NameExpr name : unit.findAll(NameExpr.class)) {
      if (name.getNameAsString().equals(TEMPLATE_CLASS_NAME)) {
        name.setName(className);
      }
    }
    return unit;
  }

  static CompilationUnit flowUnit(final FlowGraph graph, final String packageName,
      final String className, final String runtimeClassName, final String flowDataFileName) {
    final CompilationUnit unit = newUnit(packageName);
    if (flowDataFileName != null) {
      unit.addImport("java.nio.file.Path");
    }
    final ClassOrInterfaceDeclaration clazz = unit.addClass(className, Keyword.PUBLIC,
        Keyword.FINAL);
    clazz.setJavadocComment("Graph of flow {@code " + commentSafe(graph.getFlowName())
        + "} for {@link " + runtimeClassName + "}.");
    clazz.addFieldWithInitializer(String.class, "FLOW_NAME", stringLiteral(graph.getFlowName()),
        Keyword.PUBLIC, Keyword.STATIC, Keyword.FINAL);
    if (flowDataFileName != null) {
      clazz.addFieldWithInitializer(String.class, "FLOW_DATA_FILE",
          stringLiteral(flowDataFileName), Keyword.PUBLIC, Keyword.STATIC, Keyword.FINAL);
    }
    clazz.addConstructor(Keyword.PRIVATE);

    final MethodDeclaration build = clazz.addMethod("build", Keyword.PUBLIC, Keyword.STATIC);
    build.addParameter(runtimeClassName, RUNTIME);
    build.setJavadocComment(
        "Replace the runtime's graph and variables with this flow. Callbacks stay registered.");
    final BlockStmt body = new BlockStmt();
    build.setBody(body);
    body.addStatement(call("clear"));
    body.addStatement(call("setFlowName", stringLiteral(graph.getFlowName())));
    for (State state : graph.getStates()) {
      body.addStatement(call("addState", stringLiteral(state.getName()),
          stringLiteral(state.getOnEnterAction()), stringLiteral(state.getOnExitAction())));
    }
    for (Transition transition : graph.getTransitions()) {
      body.addStatement(call("addTransition", intLiteral(transition.getFromState()),
          intLiteral(transition.getToState()), stringLiteral(transition.getEventName()),
          stringLiteral(transition.getCondition())));
    }
    for (Step step : graph.getSteps()) {
      body.addStatement(call("addStep", stringLiteral(step.getName()),
          numberLiteral(step.getDuration()), stringLiteral(step.getOnStartAction()),
          stringLiteral(step.getOnUpdateAction()), stringLiteral(step.getOnEndAction())));
    }
    for (Trigger trigger : graph.getTriggers()) {
      body.addStatement(call("addTrigger", stringLiteral(trigger.getEventName()),
          stringLiteral(trigger.getInputKeyName())));
    }
    for (Variable variable : graph.getVariables()) {
      final Value value = variable.getValue();
      switch (variable.getKind()) {
        case BOOL:
          body.addStatement(call("setBool", stringLiteral(variable.getName()),
              new BooleanLiteralExpr(value.toBool())));
          break;
        case STRING:
          body.addStatement(call("setString", stringLiteral(variable.getName()),
              stringLiteral(value.toText())));
          break;
        default:
          body.addStatement(call("setNumber", stringLiteral(variable.getName()),
              numberLiteral(value.toNumber())));
          break;
      }
    }

    final MethodDeclaration registerActions = extensionPoint(clazz, "registerActions",
        runtimeClassName);
    registerActions.setJavadocComment("Bind host actions with registerAction or registerTimedAction."
        + namesNote("Actions referenced by the graph", referencedActions(graph)));
    final MethodDeclaration registerConditions = extensionPoint(clazz, "registerConditions",
        runtimeClassName);
    registerConditions.setJavadocComment("Bind host guards with registerCondition."
        + namesNote("Named guards referenced by the graph", namedConditions(graph)));
    final MethodDeclaration initVariables = extensionPoint(clazz, "initVariables",
        runtimeClassName);
    initVariables.setJavadocComment("Adjust variables after the graph's initial values are set.");

    final MethodDeclaration create = clazz.addMethod("create", Keyword.PUBLIC, Keyword.STATIC);
    create.setType(runtimeClassName);
    create.setJavadocComment("New runtime with this flow built and every extension point applied.");
    create.setBody(StaticJavaParser.parseBlock("{ " + runtimeClassName + " " + RUNTIME + " = new "
        + runtimeClassName + "(); build(runtime); registerActions(runtime);"
        + " registerConditions(runtime); initVariables(runtime); return runtime; }"));

    if (flowDataFileName != null) {
      final MethodDeclaration reload = clazz.addMethod("reload", Keyword.PUBLIC, Keyword.STATIC);
      reload.setType("boolean");
      reload.addParameter(runtimeClassName, RUNTIME);
      reload.addParameter("Path", "directory");
      reload.setJavadocComment("Replace the graph with the FLOW_DATA_FILE found in directory."
          + " Returns false, leaving the runtime untouched, when it cannot be read.");
      reload.setBody(StaticJavaParser.parseBlock("{ if (!runtime.loadFromFile("
          + "directory.resolve(FLOW_DATA_FILE))) { return false; } initVariables(runtime);"
          + " return true; }"));
    }
    return unit;
  }

  static CompilationUnit triggersUnit(final FlowGraph graph, final String packageName,
      final String className, final String runtimeClassName) {
    final CompilationUnit unit = newUnit(packageName);
    final ClassOrInterfaceDeclaration clazz = unit.addClass(className, Keyword.PUBLIC,
        Keyword.FINAL);
    clazz.setJavadocComment("Input trigger table of flow {@code "
        + commentSafe(graph.getFlowName()) + "}: pairs of event name and input key.");
    final NodeList<Expression> rows = new NodeList<>();
    for (Trigger trigger : graph.getTriggers()) {
      rows.add(new ArrayInitializerExpr(NodeList.nodeList(
          stringLiteral(trigger.getEventName()), stringLiteral(trigger.getInputKeyName()))));
    }
    clazz.addFieldWithInitializer("String[][]", "TRIGGERS", new ArrayInitializerExpr(rows),
        Keyword.PRIVATE, Keyword.STATIC, Keyword.FINAL);
    clazz.addConstructor(Keyword.PRIVATE);

    final MethodDeclaration eventFor = clazz.addMethod("eventFor", Keyword.PUBLIC,
        Keyword.STATIC);
    eventFor.setType(String.class);
    eventFor.addParameter(String.class, "inputKey");
    eventFor.setJavadocComment("First event bound to inputKey, or null.");
    eventFor.setBody(StaticJavaParser.parseBlock("{ for (String[] trigger : TRIGGERS) {"
        + " if (trigger[1].equals(inputKey)) { return trigger[0]; } } return null; }"));

    final MethodDeclaration dispatch = clazz.addMethod("dispatch", Keyword.PUBLIC,
        Keyword.STATIC);
    dispatch.setType("int");
    dispatch.addParameter(runtimeClassName, RUNTIME);
    dispatch.addParameter(String.class, "inputKey");
    dispatch.setJavadocComment("Emit every event bound to inputKey, in table order."
        + " Returns the number of transitions fired.");
    dispatch.setBody(StaticJavaParser.parseBlock("{ int fired = 0;"
        + " for (String[] trigger : TRIGGERS) {"
        + " if (trigger[1].equals(inputKey) && runtime.emit(trigger[0])) { fired++; } }"
        + " return fired; }"));

    final MethodDeclaration size = clazz.addMethod("size", Keyword.PUBLIC, Keyword.STATIC);
    size.setType("int");
    size.setBody(StaticJavaParser.parseBlock("{ return TRIGGERS.length; }"));
    return unit;
  }

  private static MethodDeclaration extensionPoint(final ClassOrInterfaceDeclaration clazz,
      final String name, final String runtimeClassName) {
    final MethodDeclaration method = clazz.addMethod(name, Keyword.PUBLIC, Keyword.STATIC);
    method.addParameter(runtimeClassName, RUNTIME);
    method.setBody(new BlockStmt());
    return method;
  }

  static Set<String> referencedActions(final FlowGraph graph) {
    final Set<String> names = new LinkedHashSet<>();
    for (State state : graph.getStates()) {
      addName(names, state.getOnEnterAction());
      addName(names, state.getOnExitAction());
    }
    for (Step step : graph.getSteps()) {
      addName(names, step.getOnStartAction());
      addName(names, step.getOnUpdateAction());
      addName(names, step.getOnEndAction());
    }
    return names;
  }

  static Set<String> namedConditions(final FlowGraph graph) {
    final Set<String> names = new LinkedHashSet<>();
    for (Transition transition : graph.getTransitions()) {
      final String condition = transition.getCondition();
      if (!"true".equals(condition) && !"false".equals(condition)
          && !ConditionResolver.isExpression(condition)) {
        addName(names, condition);
      }
    }
    return names;
  }

  private static void addName(final Set<String> names, final String name) {
    if (name != null && !name.isEmpty()) {
      names.add(name);
    }
  }

  private static String namesNote(final String title, final Set<String> names) {
    if (names.isEmpty()) {
      return "";
    }
    final StringBuilder note = new StringBuilder("\n<p>\n").append(title).append(':');
    for (String name : names) {
      note.append(" {@code ").append(commentSafe(name)).append('}');
    }
    return note.toString();
  }

  /**
   * Keeps graph text from closing the comment or forming unicode escapes.
   */
  static String commentSafe(final String text) {
    return text.replace("\\", "\\\\").replace("*/", "*&#47;");
  }

  private static CompilationUnit newUnit(final String packageName) {
    final CompilationUnit unit = new CompilationUnit();
    setPackage(unit, packageName);
    return unit;
  }

  private static void setPackage(final CompilationUnit unit, final String packageName) {
    if (packageName.isEmpty()) {
      unit.removePackageDeclaration();
    } else {
      unit.setPackageDeclaration(packageName);
    }
  }

  private static MethodCallExpr call(final String method, final Expression... arguments) {
    return new MethodCallExpr(new NameExpr(RUNTIME), method, NodeList.nodeList(arguments));
  }

  static Expression stringLiteral(final String text) {
    return new StringLiteralExpr(StringEscapeUtils.escapeJava(text == null ? "" : text));
  }

  static Expression intLiteral(final int value) {
    if (value < 0) {
      return new UnaryExpr(new IntegerLiteralExpr(Long.toString(-(long) value)),
          UnaryExpr.Operator.MINUS);
    }
    return new IntegerLiteralExpr(Integer.toString(value));
  }

  static Expression numberLiteral(final double value) {
    if (Double.isNaN(value)) {
      return new FieldAccessExpr(new NameExpr("Double"), "NaN");
    }
    if (Double.isInfinite(value)) {
      return new FieldAccessExpr(new NameExpr("Double"),
          value > 0 ? "POSITIVE_INFINITY" : "NEGATIVE_INFINITY");
    }
    final DoubleLiteralExpr literal = new DoubleLiteralExpr(Double.toString(Math.abs(value)));
    if (Double.doubleToRawLongBits(value) < 0) {
      return new UnaryExpr(literal, UnaryExpr.Operator.MINUS);
    }
    return literal;
  }

  private static String loadTemplate() throws FlowGraphException {
    final InputStream in = JavaSourceGenerator.class.getResourceAsStream(TEMPLATE_RESOURCE);
    if (in == null) {
      throw new FlowGraphException(FlowGraphException.Code.TEMPLATE_FAILURE,
          "Runtime template " + TEMPLATE_RESOURCE + " is not on the classpath");
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      return reader.lines().collect(Collectors.joining("\n", "", "\n"));
    } catch (IOException | UncheckedIOException e) {
      throw new FlowGraphException(FlowGraphException.Code.TEMPLATE_FAILURE, e);
    }
  }
}
