package com.github.flowgraph;

/**
 * Total text transforms shared by the codec and the compiler. Both are idempotent:
 * {@code f(f(x)).equals(f(x))} for every input, null included.
 */
public final class Sanitizers {
  public static final String IDENTIFIER_FALLBACK = "Flow";

  private Sanitizers() {}

  /**
   * Keeps {@code [A-Za-z0-9_]}, turns spaces into underscores and drops everything else. An empty
   * result becomes {@value #IDENTIFIER_FALLBACK}; a leading digit gets a
   * {@value #IDENTIFIER_FALLBACK}{@code _} prefix.
   */
  public static String identifier(final String text) {
    final StringBuilder out = new StringBuilder();
    if (text != null) {
      for (int i = 0; i < text.length(); i++) {
        final char c = text.charAt(i);
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
            || c == '_') {
          out.append(c);
        } else if (c == ' ') {
          out.append('_');
        }
      }
    }
    if (out.length() == 0) {
      return IDENTIFIER_FALLBACK;
    }
    if (out.charAt(0) >= '0' && out.charAt(0) <= '9') {
      out.insert(0, IDENTIFIER_FALLBACK + "_");
    }
    return out.toString();
  }

  /**
   * Replaces the record delimiter and line/tab control characters with underscores. Lossy: the
   * flow file format has no escaping.
   */
  public static String field(final String text) {
    if (text == null) {
      return "";
    }
    final StringBuilder out = new StringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '|' || c == '\n' || c == '\r' || c == '\t') {
        out.append('_');
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }

  /**
   * {@link #identifier(String)} with an upper-cased first letter, for generated class names.
   */
  public static String className(final String text) {
    final String identifier = identifier(text);
    return Character.toUpperCase(identifier.charAt(0)) + identifier.substring(1);
  }
}
