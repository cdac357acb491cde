package com.gentoro.npcmemory.memory;

import java.util.Objects;

/**
 * Record of something that happened, e.g. "Player gave me a gift".
 *
 * <p>Significance is fixed at creation. Strength starts at 1.0 and only moves through the store's
 * decay and reinforcement operations, always staying within [0, 1]. Entries whose strength reached
 * zero are inactive but are never deleted by decay.
 */
public final class EpisodicMemoryEntry extends MemoryEntry {
  public static final double DEFAULT_SIGNIFICANCE = 0.5;
  public static final double DEFAULT_STRENGTH = 1.0;

  private final String description;
  private final EpisodeType episodeType;
  private final String participant;
  private final double significance;
  private double strength;

  private EpisodicMemoryEntry(Builder b) {
    super(b.id, b.createdAtTicks, b.source);
    this.description = b.description;
    this.episodeType = b.episodeType;
    this.participant = b.participant;
    this.significance = checkedRange("significance", b.significance, 0.0, 1.0);
    this.strength = checkedRange("strength", b.strength, 0.0, 1.0);
  }

  private EpisodicMemoryEntry(EpisodicMemoryEntry other) {
    super(other);
    this.description = other.description;
    this.episodeType = other.episodeType;
    this.participant = other.participant;
    this.significance = other.significance;
    this.strength = other.strength;
  }

  public static Builder builder(String description) {
    return new Builder(description);
  }

  /** Dialogue line, stored as "speaker: text". */
  public static EpisodicMemoryEntry fromDialogue(String speaker, String text) {
    return fromDialogue(speaker, text, DEFAULT_SIGNIFICANCE);
  }

  public static EpisodicMemoryEntry fromDialogue(String speaker, String text, double significance) {
    Objects.requireNonNull(speaker, "speaker");
    Objects.requireNonNull(text, "text");
    return builder(speaker + ": " + text)
        .episodeType(EpisodeType.DIALOGUE)
        .participant(speaker)
        .significance(significance)
        .build();
  }

  public static EpisodicMemoryEntry fromObservation(String observation) {
    return fromObservation(observation, 0.3);
  }

  public static EpisodicMemoryEntry fromObservation(String observation, double significance) {
    return builder(observation)
        .episodeType(EpisodeType.OBSERVATION)
        .significance(significance)
        .build();
  }

  public static EpisodicMemoryEntry fromLearnedInfo(String info, String source) {
    return fromLearnedInfo(info, source, 0.6);
  }

  public static EpisodicMemoryEntry fromLearnedInfo(
      String info, String source, double significance) {
    return builder(info)
        .episodeType(EpisodeType.LEARNED_INFO)
        .participant(source)
        .significance(significance)
        .build();
  }

  public String getDescription() {
    return description;
  }

  public EpisodeType getEpisodeType() {
    return episodeType;
  }

  /** Who was involved, e.g. "Player"; may be null. */
  public String getParticipant() {
    return participant;
  }

  public double getSignificance() {
    return significance;
  }

  public double getStrength() {
    return strength;
  }

  public boolean isActive() {
    return strength > 0.0;
  }

  @Override
  public MemoryAuthority getAuthority() {
    return MemoryAuthority.EPISODIC;
  }

  @Override
  public String getContent() {
    return description;
  }

  @Override
  public EpisodicMemoryEntry copy() {
    return new EpisodicMemoryEntry(this);
  }

  void decay(double step) {
    strength = Math.max(0.0, strength - step);
  }

  void reinforce(double amount) {
    strength = Math.min(1.0, strength + amount);
  }

  public static final class Builder {
    private final String description;
    private String id;
    private EpisodeType episodeType = EpisodeType.DIALOGUE;
    private String participant;
    private double significance = DEFAULT_SIGNIFICANCE;
    private double strength = DEFAULT_STRENGTH;
    private long createdAtTicks = NO_TIMESTAMP;
    private MutationSource source = MutationSource.VALIDATED_OUTPUT;

    private Builder(String description) {
      this.description = Objects.requireNonNull(description, "description");
    }

    /** Explicit id; when omitted the store generates one. */
    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder episodeType(EpisodeType episodeType) {
      this.episodeType = Objects.requireNonNull(episodeType, "episodeType");
      return this;
    }

    public Builder participant(String participant) {
      this.participant = participant;
      return this;
    }

    public Builder significance(double significance) {
      this.significance = significance;
      return this;
    }

    public Builder strength(double strength) {
      this.strength = strength;
      return this;
    }

    /** Explicit creation time; when omitted the store uses its clock. */
    public Builder createdAtTicks(long createdAtTicks) {
      this.createdAtTicks = createdAtTicks;
      return this;
    }

    public Builder source(MutationSource source) {
      this.source = Objects.requireNonNull(source, "source");
      return this;
    }

    public EpisodicMemoryEntry build() {
      return new EpisodicMemoryEntry(this);
    }
  }
}
