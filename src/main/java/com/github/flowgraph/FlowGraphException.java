package com.github.flowgraph;

/**
 * Unified single exception that's thrown and handled by the flow tooling. The code enum
 * encapsulates the various error conditions; stack traces, where available, are kept as the
 * cause.
 * 
 * Note that the runtime, the expression engine and the codec's parser never throw this: they
 * degrade silently. It only surfaces from configuration and code generation, and is otherwise
 * carried inside a {@link FlowIoResult}.
 */
public final class FlowGraphException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FlowGraphException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FlowGraphException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public FlowGraphException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    IO_FAILURE("Failed to read or write a flow file. Check exception stacktrace for details."),
    // 2.
    DIRECTORY_CREATION_FAILURE("Failed to create the output directory"),
    // 3.
    INVALID_COMPILER_CONFIG("Compiler configuration is invalid"),
    // 4.
    TEMPLATE_FAILURE("Failed to load or parse the runtime source template");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
