package com.gentoro.npcmemory.memory;

/** Time source for entry timestamps. Tests plug in a fixed or stepping clock. */
@FunctionalInterface
public interface Clock {
  /** Current time in ticks (milliseconds since the Unix epoch for {@link SystemClock}). */
  long nowTicks();
}
