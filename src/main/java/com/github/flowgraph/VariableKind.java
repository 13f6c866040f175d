package com.github.flowgraph;

/**
 * The three variable types of a flow graph. The tag is the on-disk type marker of a VAR record.
 */
public enum VariableKind {
  NUMBER(0), BOOL(1), STRING(2);

  private final int tag;

  private VariableKind(final int tag) {
    this.tag = tag;
  }

  public int getTag() {
    return tag;
  }

  /**
   * Unknown tags fall back to NUMBER, the loader never rejects a record for its type marker.
   */
  public static VariableKind fromTag(final int tag) {
    for (VariableKind kind : values()) {
      if (kind.tag == tag) {
        return kind;
      }
    }
    return NUMBER;
  }
}
