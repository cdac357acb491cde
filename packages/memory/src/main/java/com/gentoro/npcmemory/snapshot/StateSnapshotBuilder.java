package com.gentoro.npcmemory.snapshot;

import com.gentoro.npcmemory.memory.Clock;
import com.gentoro.npcmemory.memory.SystemClock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assembles a {@link StateSnapshot}. Memory slices are usually filled by {@code
 * RetrievedContext.applyTo(builder)}; the {@code with*} list methods append, so several sources
 * can contribute to one category.
 */
public final class StateSnapshotBuilder {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  InteractionContext context;
  ConstraintSet constraints = new ConstraintSet();
  final List<String> canonicalFacts = new ArrayList<>();
  final List<String> worldState = new ArrayList<>();
  final List<String> episodicMemories = new ArrayList<>();
  final List<String> beliefs = new ArrayList<>();
  final List<String> dialogueHistory = new ArrayList<>();
  String systemPrompt = "";
  String playerInput;
  int attemptNumber = 0;
  int maxAttempts = DEFAULT_MAX_ATTEMPTS;
  final Map<String, String> metadata = new LinkedHashMap<>();
  Long snapshotTimeTicks;
  Clock clock = new SystemClock();

  public StateSnapshotBuilder withContext(InteractionContext context) {
    this.context = context;
    return this;
  }

  public StateSnapshotBuilder withConstraints(ConstraintSet constraints) {
    this.constraints = constraints == null ? new ConstraintSet() : constraints.copy();
    return this;
  }

  public StateSnapshotBuilder withCanonicalFacts(Collection<String> facts) {
    appendAll(canonicalFacts, facts);
    return this;
  }

  public StateSnapshotBuilder withWorldState(Collection<String> state) {
    appendAll(worldState, state);
    return this;
  }

  public StateSnapshotBuilder withEpisodicMemories(Collection<String> memories) {
    appendAll(episodicMemories, memories);
    return this;
  }

  public StateSnapshotBuilder withBeliefs(Collection<String> beliefs) {
    appendAll(this.beliefs, beliefs);
    return this;
  }

  public StateSnapshotBuilder withDialogueHistory(Collection<String> history) {
    appendAll(dialogueHistory, history);
    return this;
  }

  public StateSnapshotBuilder withSystemPrompt(String systemPrompt) {
    this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
    return this;
  }

  /** When never set, the context's player input is used. */
  public StateSnapshotBuilder withPlayerInput(String playerInput) {
    this.playerInput = playerInput;
    return this;
  }

  /** Zero-based attempt counter. */
  public StateSnapshotBuilder withAttemptNumber(int attemptNumber) {
    this.attemptNumber = attemptNumber;
    return this;
  }

  public StateSnapshotBuilder withMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public StateSnapshotBuilder withMetadata(String key, String value) {
    metadata.put(Objects.requireNonNull(key, "key"), value);
    return this;
  }

  /** Creation time of the snapshot; defaults to the builder's clock at {@link #build()}. */
  public StateSnapshotBuilder withSnapshotTimeTicks(long snapshotTimeTicks) {
    this.snapshotTimeTicks = snapshotTimeTicks;
    return this;
  }

  /** Clock read at {@link #build()} when no explicit snapshot time was given. */
  public StateSnapshotBuilder withClock(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    return this;
  }

  public StateSnapshot build() {
    return new StateSnapshot(this);
  }

  private static void appendAll(List<String> target, Collection<String> source) {
    if (source == null) return;
    for (String s : source) {
      if (s != null) target.add(s);
    }
  }
}
