package com.gentoro.npcmemory.snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable bundle of everything a prompt builder needs for one generation attempt: interaction
 * context, constraints, memory slices and session metadata.
 *
 * <p>Every snapshot gets its own random id, including those produced by {@link #forRetry()}.
 */
public final class StateSnapshot {
  private final String snapshotId;
  private final long createdAtTicks;
  private final InteractionContext context;
  private final ConstraintSet constraints;
  private final List<String> canonicalFacts;
  private final List<String> worldState;
  private final List<String> episodicMemories;
  private final List<String> beliefs;
  private final List<String> dialogueHistory;
  private final String systemPrompt;
  private final String playerInput;
  private final int attemptNumber;
  private final int maxAttempts;
  private final Map<String, String> metadata;

  StateSnapshot(StateSnapshotBuilder b) {
    this.snapshotId = UUID.randomUUID().toString();
    this.createdAtTicks = b.snapshotTimeTicks != null ? b.snapshotTimeTicks : b.clock.nowTicks();
    this.context = b.context != null ? b.context : InteractionContext.builder().build();
    this.constraints = b.constraints.copy();
    this.canonicalFacts = List.copyOf(b.canonicalFacts);
    this.worldState = List.copyOf(b.worldState);
    this.episodicMemories = List.copyOf(b.episodicMemories);
    this.beliefs = List.copyOf(b.beliefs);
    this.dialogueHistory = List.copyOf(b.dialogueHistory);
    this.systemPrompt = b.systemPrompt;
    this.playerInput = b.playerInput != null ? b.playerInput : this.context.getPlayerInput();
    this.attemptNumber = b.attemptNumber;
    this.maxAttempts = b.maxAttempts;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
  }

  public String getSnapshotId() {
    return snapshotId;
  }

  public long getCreatedAtTicks() {
    return createdAtTicks;
  }

  public InteractionContext getContext() {
    return context;
  }

  /** A copy; the snapshot's own set cannot be changed. */
  public ConstraintSet getConstraints() {
    return constraints.copy();
  }

  public List<String> getCanonicalFacts() {
    return canonicalFacts;
  }

  public List<String> getWorldState() {
    return worldState;
  }

  public List<String> getEpisodicMemories() {
    return episodicMemories;
  }

  public List<String> getBeliefs() {
    return beliefs;
  }

  public List<String> getDialogueHistory() {
    return dialogueHistory;
  }

  public String getSystemPrompt() {
    return systemPrompt;
  }

  public String getPlayerInput() {
    return playerInput;
  }

  public int getAttemptNumber() {
    return attemptNumber;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  /** Facts, world state, episodic memories and beliefs; dialogue history is not counted. */
  public int getTotalMemoryCount() {
    return canonicalFacts.size() + worldState.size() + episodicMemories.size() + beliefs.size();
  }

  public boolean canRetry() {
    return attemptNumber < maxAttempts;
  }

  public StateSnapshot forRetry() {
    return forRetry(null);
  }

  /**
   * Next attempt: same content, attempt number plus one, constraints extended with {@code
   * additionalConstraints}, fresh id.
   */
  public StateSnapshot forRetry(ConstraintSet additionalConstraints) {
    StateSnapshotBuilder next =
        new StateSnapshotBuilder()
            .withContext(context)
            .withConstraints(constraints.merge(additionalConstraints))
            .withCanonicalFacts(canonicalFacts)
            .withWorldState(worldState)
            .withEpisodicMemories(episodicMemories)
            .withBeliefs(beliefs)
            .withDialogueHistory(dialogueHistory)
            .withSystemPrompt(systemPrompt)
            .withPlayerInput(playerInput)
            .withAttemptNumber(attemptNumber + 1)
            .withMaxAttempts(maxAttempts)
            .withSnapshotTimeTicks(createdAtTicks);
    metadata.forEach(next::withMetadata);
    return next.build();
  }

  /** Memory lines with category prefixes; beliefs are already phrased and go in verbatim. */
  public List<String> getAllMemoryForPrompt() {
    List<String> lines = new ArrayList<>(getTotalMemoryCount());
    canonicalFacts.forEach(f -> lines.add("[Fact] " + f));
    worldState.forEach(s -> lines.add("[State] " + s));
    episodicMemories.forEach(m -> lines.add("[Memory] " + m));
    lines.addAll(beliefs);
    return Collections.unmodifiableList(lines);
  }

  @Override
  public String toString() {
    return "StateSnapshot[%s, Attempt %d/%d, %d memories, %d constraints]"
        .formatted(
            snapshotId.substring(0, 8),
            attemptNumber + 1,
            maxAttempts,
            getTotalMemoryCount(),
            constraints.size());
  }
}
