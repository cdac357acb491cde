package com.gentoro.npcmemory.exception;

import java.util.function.Function;

/** Helpers for reporting and wrapping failures on error paths. */
public final class ExceptionUtil {
  static final int DEFAULT_MAX_FRAMES = 10;

  private ExceptionUtil() {}

  /**
   * One-line stack trace, {@code class.method (File:line) > ...}, for log lines where a full trace
   * would be noise. {@code maxFrames <= 0} keeps every frame.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] frames = t.getStackTrace();
    if (frames == null || frames.length == 0) return "";

    int limit = maxFrames <= 0 ? frames.length : Math.min(frames.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement frame = frames[i];
      if (i > 0) sb.append(" > ");
      sb.append(frame.getClassName()).append('.').append(frame.getMethodName()).append(" (");
      sb.append(frame.getFileName() == null ? "Unknown Source" : frame.getFileName());
      if (frame.getLineNumber() >= 0) {
        sb.append(':').append(frame.getLineNumber());
      }
      sb.append(')');
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, DEFAULT_MAX_FRAMES);
  }

  /**
   * Returns {@code t} unchanged when it already is an {@link NpcMemoryException}, otherwise the
   * exception built by {@code wrapper}. Callers throw the result.
   */
  public static NpcMemoryException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ? extends NpcMemoryException> wrapper) {
    if (t instanceof NpcMemoryException ex) {
      return ex;
    }
    return wrapper.apply(t);
  }
}
