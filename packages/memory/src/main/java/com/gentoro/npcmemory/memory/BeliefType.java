package com.gentoro.npcmemory.memory;

public enum BeliefType {
  /** Opinion about a person or entity. */
  OPINION,
  RELATIONSHIP,
  /** Belief about a fact; may be wrong. */
  BELIEF,
  ASSUMPTION,
  PREFERENCE
}
