package com.gentoro.npcmemory.memory;

/** Clock that only moves when told to. */
public final class ManualClock implements Clock {
  private long now;

  public ManualClock(long start) {
    this.now = start;
  }

  @Override
  public long nowTicks() {
    return now;
  }

  public void advance(long ticks) {
    now += ticks;
  }
}
