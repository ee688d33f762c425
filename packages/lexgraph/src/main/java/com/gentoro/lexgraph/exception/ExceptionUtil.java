package com.gentoro.lexgraph.exception;

import java.util.Map;

/** Formatting of failures for the error line and the debug log. */
public final class ExceptionUtil {
  private static final int FRAMES = 8;

  private ExceptionUtil() {}

  /**
   * One line for standard error: the message, then the code and context of a {@link
   * LexGraphException}, e.g. {@code ArangoDB rejected a batch [LOADER_ERROR batch=3]}.
   */
  public static String describe(Throwable t) {
    if (t == null) return "";
    StringBuilder sb = new StringBuilder(messageOf(t));
    if (t instanceof LexGraphException ex) {
      sb.append(" [").append(ex.getCode());
      for (Map.Entry<String, Object> entry : ex.getContext().entrySet()) {
        if (entry.getValue() != null) {
          sb.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
        }
      }
      sb.append(']');
    }
    return sb.toString();
  }

  /** Innermost cause of the chain, or {@code t} itself. */
  public static Throwable rootCause(Throwable t) {
    Throwable current = t;
    while (current != null && current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current;
  }

  /**
   * The top frames of {@code t}, followed by the type, message and top frames of its root cause
   * when that is a different throwable. One frame per line.
   */
  public static String formatCompactStackTrace(Throwable t) {
    if (t == null) return "";
    StringBuilder sb = new StringBuilder();
    appendFrames(sb, t);
    Throwable root = rootCause(t);
    if (root != t) {
      sb.append("caused by ")
          .append(root.getClass().getName())
          .append(": ")
          .append(messageOf(root))
          .append('\n');
      appendFrames(sb, root);
    }
    return sb.toString();
  }

  private static void appendFrames(StringBuilder sb, Throwable t) {
    StackTraceElement[] frames = t.getStackTrace();
    int limit = Math.min(frames.length, FRAMES);
    for (int i = 0; i < limit; i++) {
      sb.append("  at ").append(frames[i]).append('\n');
    }
    if (frames.length > limit) {
      sb.append("  ... ").append(frames.length - limit).append(" more\n");
    }
  }

  private static String messageOf(Throwable t) {
    String message = t.getMessage();
    return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
  }
}
