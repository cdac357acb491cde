package com.gentoro.npcmemory.snapshot;

import java.util.List;
import java.util.Objects;

/** Why and where an NPC interaction started. Immutable; build with {@link #builder()}. */
public final class InteractionContext {
  private final TriggerReason triggerReason;
  private final String npcId;
  private final String triggerId;
  private final String playerInput;
  private final String triggerPrompt;
  private final double gameTime;
  private final String sceneName;
  private final int interactionCount;
  private final List<String> tags;

  private InteractionContext(Builder b) {
    this.triggerReason = b.triggerReason;
    this.npcId = b.npcId;
    this.triggerId = b.triggerId;
    this.playerInput = b.playerInput;
    this.triggerPrompt = b.triggerPrompt;
    this.gameTime = b.gameTime;
    this.sceneName = b.sceneName;
    this.interactionCount = b.interactionCount;
    this.tags = List.copyOf(b.tags);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static InteractionContext fromPlayerUtterance(String npcId, String playerInput) {
    return fromPlayerUtterance(npcId, playerInput, 0.0);
  }

  public static InteractionContext fromPlayerUtterance(
      String npcId, String playerInput, double gameTime) {
    return builder()
        .triggerReason(TriggerReason.PLAYER_UTTERANCE)
        .npcId(npcId)
        .playerInput(playerInput)
        .gameTime(gameTime)
        .build();
  }

  public static InteractionContext fromZoneTrigger(
      String npcId, String triggerId, String triggerPrompt) {
    return fromZoneTrigger(npcId, triggerId, triggerPrompt, 0.0);
  }

  public static InteractionContext fromZoneTrigger(
      String npcId, String triggerId, String triggerPrompt, double gameTime) {
    return builder()
        .triggerReason(TriggerReason.ZONE_TRIGGER)
        .npcId(npcId)
        .triggerId(triggerId)
        .triggerPrompt(triggerPrompt)
        .gameTime(gameTime)
        .build();
  }

  public TriggerReason getTriggerReason() {
    return triggerReason;
  }

  public String getNpcId() {
    return npcId;
  }

  public String getTriggerId() {
    return triggerId;
  }

  public String getPlayerInput() {
    return playerInput;
  }

  public String getTriggerPrompt() {
    return triggerPrompt;
  }

  /** In-game time in game-defined units. */
  public double getGameTime() {
    return gameTime;
  }

  public String getSceneName() {
    return sceneName;
  }

  public int getInteractionCount() {
    return interactionCount;
  }

  public List<String> getTags() {
    return tags;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof InteractionContext that)) return false;
    return Double.compare(gameTime, that.gameTime) == 0
        && interactionCount == that.interactionCount
        && triggerReason == that.triggerReason
        && Objects.equals(npcId, that.npcId)
        && Objects.equals(triggerId, that.triggerId)
        && Objects.equals(playerInput, that.playerInput)
        && Objects.equals(triggerPrompt, that.triggerPrompt)
        && Objects.equals(sceneName, that.sceneName)
        && tags.equals(that.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        triggerReason,
        npcId,
        triggerId,
        playerInput,
        triggerPrompt,
        gameTime,
        sceneName,
        interactionCount,
        tags);
  }

  @Override
  public String toString() {
    return "[InteractionContext] Trigger=%s, NPC=%s, TriggerId=%s"
        .formatted(triggerReason, npcId, triggerId);
  }

  public static final class Builder {
    private TriggerReason triggerReason = TriggerReason.PLAYER_UTTERANCE;
    private String npcId;
    private String triggerId;
    private String playerInput;
    private String triggerPrompt;
    private double gameTime;
    private String sceneName;
    private int interactionCount;
    private List<String> tags = List.of();

    private Builder() {}

    public Builder triggerReason(TriggerReason triggerReason) {
      this.triggerReason = Objects.requireNonNull(triggerReason, "triggerReason");
      return this;
    }

    public Builder npcId(String npcId) {
      this.npcId = npcId;
      return this;
    }

    public Builder triggerId(String triggerId) {
      this.triggerId = triggerId;
      return this;
    }

    public Builder playerInput(String playerInput) {
      this.playerInput = playerInput;
      return this;
    }

    public Builder triggerPrompt(String triggerPrompt) {
      this.triggerPrompt = triggerPrompt;
      return this;
    }

    public Builder gameTime(double gameTime) {
      this.gameTime = gameTime;
      return this;
    }

    public Builder sceneName(String sceneName) {
      this.sceneName = sceneName;
      return this;
    }

    public Builder interactionCount(int interactionCount) {
      this.interactionCount = interactionCount;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags = tags == null ? List.of() : tags;
      return this;
    }

    public InteractionContext build() {
      return new InteractionContext(this);
    }
  }
}
