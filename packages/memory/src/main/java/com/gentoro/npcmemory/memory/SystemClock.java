package com.gentoro.npcmemory.memory;

public final class SystemClock implements Clock {
  @Override
  public long nowTicks() {
    return System.currentTimeMillis();
  }
}
