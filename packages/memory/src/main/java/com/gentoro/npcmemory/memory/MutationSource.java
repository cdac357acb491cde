package com.gentoro.npcmemory.memory;

/** Origin of a mutation request. Recorded on every entry the store touches. */
public enum MutationSource {
  DESIGNER(100),
  GAME_SYSTEM(75),
  /** LLM output that passed the validation gate. */
  VALIDATED_OUTPUT(50),
  /** Unvalidated LLM output. */
  LLM_SUGGESTION(25);

  private final int level;

  MutationSource(int level) {
    this.level = level;
  }

  public int level() {
    return level;
  }

  /** True when this source is trusted enough to change memory of the given authority. */
  public boolean canMutate(MemoryAuthority authority) {
    return authority != null && level >= authority.level();
  }
}
