package com.gentoro.npcmemory.memory;

/**
 * Authority level of a memory type. A higher level means the entry may only be changed by a more
 * trusted {@link MutationSource}.
 */
public enum MemoryAuthority {
  /** Designer-defined truths, e.g. "The king's name is Arthur". */
  CANONICAL(100),
  /** Mutable game state changed by validated game events, e.g. "The door is open". */
  WORLD_STATE(75),
  /** Conversation and event history; appended, decays over time. */
  EPISODIC(50),
  /** NPC opinions and beliefs; may be wrong and may be contradicted. */
  BELIEF(25);

  private final int level;

  MemoryAuthority(int level) {
    this.level = level;
  }

  public int level() {
    return level;
  }
}
