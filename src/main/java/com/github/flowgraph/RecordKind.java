package com.github.flowgraph;

/**
 * Record kinds of the flow file format with the minimum number of {@code |}-separated fields
 * (kind included) each needs. Shorter records are skipped, extra trailing fields are ignored.
 */
enum RecordKind {
  FLOW(3), STATE(4), TRANS(5), STEP(6), TRIGGER(3), VAR(4);

  private final int minFields;

  private RecordKind(final int minFields) {
    this.minFields = minFields;
  }

  int getMinFields() {
    return minFields;
  }

  static RecordKind lookup(final String tag) {
    for (RecordKind kind : values()) {
      if (kind.name().equals(tag)) {
        return kind;
      }
    }
    return null;
  }
}
