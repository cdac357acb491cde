package com.gentoro.npcmemory.memory;

/** Reproducible ids "prefix-1", "prefix-2", ... for replay and tests. */
public final class SequentialIdGenerator implements IdGenerator {
  private final String prefix;
  private long next = 1;

  public SequentialIdGenerator(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public String generateId() {
    return prefix + "-" + next++;
  }
}
