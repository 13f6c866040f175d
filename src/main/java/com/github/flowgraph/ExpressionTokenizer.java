package com.github.flowgraph;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits condition source text into tokens. Never fails: a character that starts no known token
 * is emitted as a single-character operator token and left for the parser to degrade on.
 */
final class ExpressionTokenizer {
  private static final String[] twoCharOperators = {"&&", "||", "==", "!=", ">=", "<="};

  private ExpressionTokenizer() {}

  static List<ExpressionToken> tokenize(final String source) {
    final List<ExpressionToken> tokens = new ArrayList<>();
    final String text = source == null ? "" : source;
    final int length = text.length();
    int pos = 0;
    while (pos < length) {
      final char c = text.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos++;
        continue;
      }
      if (isIdentifierStart(c)) {
        int end = pos + 1;
        while (end < length && isIdentifierPart(text.charAt(end))) {
          end++;
        }
        tokens.add(new ExpressionToken(ExpressionToken.Type.IDENTIFIER, text.substring(pos, end),
            0.0));
        pos = end;
        continue;
      }
      if (isDigit(c) || (c == '.' && pos + 1 < length && isDigit(text.charAt(pos + 1)))) {
        int end = pos;
        boolean seenDot = false;
        while (end < length) {
          final char d = text.charAt(end);
          if (isDigit(d)) {
            end++;
          } else if (d == '.' && !seenDot) {
            seenDot = true;
            end++;
          } else {
            break;
          }
        }
        final String literal = text.substring(pos, end);
        tokens.add(new ExpressionToken(ExpressionToken.Type.NUMBER, literal, parseNumber(literal)));
        pos = end;
        continue;
      }
      if (c == '"') {
        int close = text.indexOf('"', pos + 1);
        final String content;
        if (close < 0) {
          content = text.substring(pos + 1);
          close = length - 1;
        } else {
          content = text.substring(pos + 1, close);
        }
        tokens.add(new ExpressionToken(ExpressionToken.Type.STRING, content, 0.0));
        pos = close + 1;
        continue;
      }
      String operator = null;
      if (pos + 1 < length) {
        final String pair = text.substring(pos, pos + 2);
        for (String candidate : twoCharOperators) {
          if (candidate.equals(pair)) {
            operator = candidate;
            break;
          }
        }
      }
      if (operator == null) {
        operator = String.valueOf(c);
      }
      tokens.add(new ExpressionToken(ExpressionToken.Type.OPERATOR, operator, 0.0));
      pos += operator.length();
    }
    return tokens;
  }

  private static double parseNumber(final String literal) {
    try {
      return Double.parseDouble(literal);
    } catch (NumberFormatException notANumber) {
      return 0.0;
    }
  }

  private static boolean isDigit(final char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isIdentifierStart(final char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentifierPart(final char c) {
    return isIdentifierStart(c) || isDigit(c);
  }
}
