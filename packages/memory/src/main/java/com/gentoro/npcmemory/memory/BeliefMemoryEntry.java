package com.gentoro.npcmemory.memory;

import java.util.Objects;

/**
 * Subjective, confidence weighted claim held by an NPC, e.g. "I believe the treasure is in the
 * cave".
 *
 * <p>Stored confidence is authoritative. Contradiction never lowers it; ranking code applies the
 * penalty through {@link #getEffectiveConfidence(double)} instead.
 */
public final class BeliefMemoryEntry extends MemoryEntry {
  public static final double DEFAULT_CONFIDENCE = 0.5;
  public static final double DEFAULT_CONTRADICTION_PENALTY = 0.5;

  private final String subject;
  private final String content;
  private final BeliefType beliefType;
  private final double sentiment;
  private final double confidence;
  private final String evidence;
  private boolean contradicted;
  private String contradictionReason;

  private BeliefMemoryEntry(Builder b) {
    super(b.id, b.createdAtTicks, b.source);
    this.subject = b.subject;
    this.content = b.content;
    this.beliefType = b.beliefType;
    this.sentiment = checkedRange("sentiment", b.sentiment, -1.0, 1.0);
    this.confidence = checkedRange("confidence", b.confidence, 0.0, 1.0);
    this.evidence = b.evidence;
    this.contradicted = b.contradictionReason != null;
    this.contradictionReason = b.contradictionReason;
  }

  private BeliefMemoryEntry(BeliefMemoryEntry other) {
    super(other);
    this.subject = other.subject;
    this.content = other.content;
    this.beliefType = other.beliefType;
    this.sentiment = other.sentiment;
    this.confidence = other.confidence;
    this.evidence = other.evidence;
    this.contradicted = other.contradicted;
    this.contradictionReason = other.contradictionReason;
  }

  public static Builder builder(String subject, String content) {
    return new Builder(subject, content);
  }

  public static BeliefMemoryEntry opinion(
      String subject, String opinion, double sentiment, double confidence) {
    return builder(subject, opinion)
        .beliefType(BeliefType.OPINION)
        .sentiment(sentiment)
        .confidence(confidence)
        .build();
  }

  public static BeliefMemoryEntry belief(String subject, String belief, double confidence) {
    return builder(subject, belief).beliefType(BeliefType.BELIEF).confidence(confidence).build();
  }

  public static BeliefMemoryEntry relationship(
      String subject, String relationship, double sentiment) {
    return builder(subject, relationship)
        .beliefType(BeliefType.RELATIONSHIP)
        .sentiment(sentiment)
        .confidence(0.7)
        .build();
  }

  public String getSubject() {
    return subject;
  }

  /** The raw claim without the confidence prefix used by {@link #getSummary()}. */
  public String getBeliefContent() {
    return content;
  }

  public BeliefType getBeliefType() {
    return beliefType;
  }

  public double getSentiment() {
    return sentiment;
  }

  public double getConfidence() {
    return confidence;
  }

  public String getEvidence() {
    return evidence;
  }

  public boolean isContradicted() {
    return contradicted;
  }

  public String getContradictionReason() {
    return contradictionReason;
  }

  /** Confidence with the default contradiction penalty applied. */
  public double getEffectiveConfidence() {
    return getEffectiveConfidence(DEFAULT_CONTRADICTION_PENALTY);
  }

  public double getEffectiveConfidence(double contradictionPenalty) {
    return contradicted ? confidence * contradictionPenalty : confidence;
  }

  /**
   * Flag this belief as contradicted by higher-authority information. Confidence is left as is.
   * Called on the handle returned by {@link AuthoritativeMemoryStore#getBelief(String)} this
   * changes the stored belief.
   */
  public void markContradicted(String reason) {
    this.contradicted = true;
    this.contradictionReason = reason == null ? "" : reason;
  }

  /** First-person statement hedged by stored confidence. */
  public String getSummary() {
    String prefix;
    if (confidence >= 0.8) {
      prefix = "I know that";
    } else if (confidence >= 0.5) {
      prefix = "I believe that";
    } else if (confidence >= 0.3) {
      prefix = "I think that";
    } else {
      prefix = "I'm not sure, but";
    }
    return prefix + " " + content;
  }

  @Override
  public MemoryAuthority getAuthority() {
    return MemoryAuthority.BELIEF;
  }

  @Override
  public String getContent() {
    return content;
  }

  @Override
  public BeliefMemoryEntry copy() {
    return new BeliefMemoryEntry(this);
  }

  public static final class Builder {
    private final String subject;
    private final String content;
    private String id;
    private BeliefType beliefType = BeliefType.OPINION;
    private double sentiment;
    private double confidence = DEFAULT_CONFIDENCE;
    private String evidence;
    private String contradictionReason;
    private long createdAtTicks = NO_TIMESTAMP;
    private MutationSource source = MutationSource.VALIDATED_OUTPUT;

    private Builder(String subject, String content) {
      this.subject = Objects.requireNonNull(subject, "subject");
      this.content = Objects.requireNonNull(content, "content");
    }

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder beliefType(BeliefType beliefType) {
      this.beliefType = Objects.requireNonNull(beliefType, "beliefType");
      return this;
    }

    public Builder sentiment(double sentiment) {
      this.sentiment = sentiment;
      return this;
    }

    public Builder confidence(double confidence) {
      this.confidence = confidence;
      return this;
    }

    public Builder evidence(String evidence) {
      this.evidence = evidence;
      return this;
    }

    /** Build the belief already contradicted, e.g. when restoring persisted state. */
    public Builder contradicted(String reason) {
      this.contradictionReason = Objects.requireNonNull(reason, "reason");
      return this;
    }

    public Builder createdAtTicks(long createdAtTicks) {
      this.createdAtTicks = createdAtTicks;
      return this;
    }

    public Builder source(MutationSource source) {
      this.source = Objects.requireNonNull(source, "source");
      return this;
    }

    public BeliefMemoryEntry build() {
      return new BeliefMemoryEntry(this);
    }
  }
}
