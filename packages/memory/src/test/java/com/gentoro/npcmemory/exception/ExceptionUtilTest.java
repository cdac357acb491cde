package com.gentoro.npcmemory.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void compactStackTraceJoinsFramesOnOneLine() {
    IllegalStateException e = new IllegalStateException("boom");
    e.setStackTrace(
        new StackTraceElement[] {
          new StackTraceElement("a.Store", "put", "Store.java", 12),
          new StackTraceElement("a.Engine", "run", null, -1),
          new StackTraceElement("a.Main", "main", "Main.java", 3)
        });

    assertEquals(
        "a.Store.put (Store.java:12) > a.Engine.run (Unknown Source)",
        ExceptionUtil.formatCompactStackTrace(e, 2));
    assertEquals(3, ExceptionUtil.formatCompactStackTrace(e, 0).split(" > ").length);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }

  @Test
  void defaultFrameLimitApplies() {
    StackTraceElement[] frames = new StackTraceElement[25];
    for (int i = 0; i < frames.length; i++) {
      frames[i] = new StackTraceElement("C", "m" + i, "C.java", i);
    }
    RuntimeException e = new RuntimeException();
    e.setStackTrace(frames);

    assertEquals(
        ExceptionUtil.DEFAULT_MAX_FRAMES,
        ExceptionUtil.formatCompactStackTrace(e).split(" > ").length);
  }

  @Test
  void memoryExceptionsPassThroughOthersAreWrapped() {
    ConfigException config = new ConfigException("bad");
    assertSame(
        config,
        ExceptionUtil.rethrowIfUnchecked(config, ex -> new SerializationException("x", ex)));

    IllegalStateException foreign = new IllegalStateException("io");
    NpcMemoryException wrapped =
        ExceptionUtil.rethrowIfUnchecked(foreign, ex -> new SerializationException("wrapped", ex));
    assertInstanceOf(SerializationException.class, wrapped);
    assertSame(foreign, wrapped.getCause());
  }

  @Test
  void contextIsImmutableAndToStringIsInformative() {
    MutationAuthorityException ex =
        new MutationAuthorityException("nope", Map.of("owner", "a", "actor", "b"));

    assertEquals(NpcMemoryErrorCode.PERMISSION_DENIED, ex.getCode());
    assertThrows(UnsupportedOperationException.class, () -> ex.getContext().put("x", 1));
    assertTrue(ex.toString().startsWith("MutationAuthorityException{code=PERMISSION_DENIED"));
  }
}
