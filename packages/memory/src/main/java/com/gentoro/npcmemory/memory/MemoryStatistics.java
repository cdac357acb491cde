package com.gentoro.npcmemory.memory;

public final class MemoryStatistics {
  private final int canonicalFactCount;
  private final int worldStateCount;
  private final int episodicMemoryCount;
  private final int activeEpisodicCount;
  private final int beliefCount;
  private final int activeBeliefCount;
  private final int relationshipCount;

  MemoryStatistics(
      int canonicalFactCount,
      int worldStateCount,
      int episodicMemoryCount,
      int activeEpisodicCount,
      int beliefCount,
      int activeBeliefCount,
      int relationshipCount) {
    this.canonicalFactCount = canonicalFactCount;
    this.worldStateCount = worldStateCount;
    this.episodicMemoryCount = episodicMemoryCount;
    this.activeEpisodicCount = activeEpisodicCount;
    this.beliefCount = beliefCount;
    this.activeBeliefCount = activeBeliefCount;
    this.relationshipCount = relationshipCount;
  }

  public int getCanonicalFactCount() {
    return canonicalFactCount;
  }

  public int getWorldStateCount() {
    return worldStateCount;
  }

  public int getEpisodicMemoryCount() {
    return episodicMemoryCount;
  }

  public int getActiveEpisodicCount() {
    return activeEpisodicCount;
  }

  public int getBeliefCount() {
    return beliefCount;
  }

  /** Beliefs that are not contradicted. */
  public int getActiveBeliefCount() {
    return activeBeliefCount;
  }

  public int getRelationshipCount() {
    return relationshipCount;
  }

  @Override
  public String toString() {
    return "Memory Stats: %d facts, %d state, %d/%d episodes, %d/%d beliefs, %d relationships"
        .formatted(
            canonicalFactCount,
            worldStateCount,
            activeEpisodicCount,
            episodicMemoryCount,
            activeBeliefCount,
            beliefCount,
            relationshipCount);
  }
}
