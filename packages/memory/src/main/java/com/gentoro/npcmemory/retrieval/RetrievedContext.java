package com.gentoro.npcmemory.retrieval;

import com.gentoro.npcmemory.snapshot.StateSnapshotBuilder;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one retrieval: prompt-ready text per memory category, in ranked order.
 *
 * <p>Two results compare equal iff every category holds the same strings in the same order, which
 * is what determinism checks rely on.
 */
public final class RetrievedContext {
  private static final RetrievedContext EMPTY =
      new RetrievedContext(List.of(), List.of(), List.of(), List.of());

  private final List<String> canonicalFacts;
  private final List<Map.Entry<String, String>> worldStateEntries;
  private final List<String> worldState;
  private final List<String> episodicMemories;
  private final List<String> beliefs;

  public RetrievedContext(
      List<String> canonicalFacts,
      List<Map.Entry<String, String>> worldStateEntries,
      List<String> episodicMemories,
      List<String> beliefs) {
    this.canonicalFacts = List.copyOf(canonicalFacts);
    this.worldStateEntries =
        worldStateEntries.stream().map(e -> Map.entry(e.getKey(), e.getValue())).toList();
    this.worldState =
        this.worldStateEntries.stream().map(e -> e.getKey() + ": " + e.getValue()).toList();
    this.episodicMemories = List.copyOf(episodicMemories);
    this.beliefs = List.copyOf(beliefs);
  }

  public static RetrievedContext empty() {
    return EMPTY;
  }

  public List<String> getCanonicalFacts() {
    return canonicalFacts;
  }

  /** World state rendered as "key: value". */
  public List<String> getWorldState() {
    return worldState;
  }

  /** World state as ordered key/value pairs. */
  public List<Map.Entry<String, String>> getWorldStateEntries() {
    return worldStateEntries;
  }

  public List<String> getEpisodicMemories() {
    return episodicMemories;
  }

  /** Belief summaries; contradicted ones carry an "[Uncertain] " prefix. */
  public List<String> getBeliefs() {
    return beliefs;
  }

  public int getTotalCount() {
    return canonicalFacts.size() + worldState.size() + episodicMemories.size() + beliefs.size();
  }

  public boolean hasContent() {
    return getTotalCount() > 0;
  }

  /** Copy every category into {@code builder}; returns the same builder for chaining. */
  public StateSnapshotBuilder applyTo(StateSnapshotBuilder builder) {
    Objects.requireNonNull(builder, "builder");
    return builder
        .withCanonicalFacts(canonicalFacts)
        .withWorldState(worldState)
        .withEpisodicMemories(episodicMemories)
        .withBeliefs(beliefs);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RetrievedContext that)) return false;
    return canonicalFacts.equals(that.canonicalFacts)
        && worldStateEntries.equals(that.worldStateEntries)
        && episodicMemories.equals(that.episodicMemories)
        && beliefs.equals(that.beliefs);
  }

  @Override
  public int hashCode() {
    return Objects.hash(canonicalFacts, worldStateEntries, episodicMemories, beliefs);
  }

  @Override
  public String toString() {
    return "RetrievedContext[%d facts, %d state, %d memories, %d beliefs]"
        .formatted(
            canonicalFacts.size(), worldState.size(), episodicMemories.size(), beliefs.size());
  }
}
