package com.gentoro.npcmemory.retrieval;

import org.apache.commons.configuration2.Configuration;

/**
 * Options for {@link ContextRetrievalEngine}.
 *
 * <p>Setters are fluent and never reject a value: NaN weights and thresholds are stored as 0.
 * Limits {@code <= 0} mean "unlimited" for canonical facts and world state, and "nothing" for
 * episodic memories and beliefs.
 */
public final class ContextRetrievalConfig {
  private static final String PREFIX = "memory.retrieval.";

  private int maxCanonicalFacts = 0;
  private int maxWorldState = 0;
  private int maxEpisodicMemories = 10;
  private int maxBeliefs = 10;
  private double minEpisodicStrength = 0.1;
  private double minBeliefConfidence = 0.5;
  private boolean includeContradictedBeliefs = false;
  private double relevanceWeight = 0.4;
  private double recencyWeight = 0.4;
  private double significanceWeight = 0.2;
  private double contradictionPenalty = 0.5;
  private double topicMatchBoost = 0.3;
  private double maxRelevance = 1.0;
  private int minKeywordLength = 4;

  public static ContextRetrievalConfig defaults() {
    return new ContextRetrievalConfig();
  }

  /**
   * Read {@code memory.retrieval.*} keys; absent keys keep their defaults.
   *
   * <pre>
   * memory:
   *   retrieval:
   *     max-episodic-memories: 5
   *     relevance-weight: 0.6
   * </pre>
   */
  public static ContextRetrievalConfig fromConfiguration(Configuration cfg) {
    ContextRetrievalConfig c = defaults();
    if (cfg == null) return c;
    return c.setMaxCanonicalFacts(cfg.getInt(PREFIX + "max-canonical-facts", c.maxCanonicalFacts))
        .setMaxWorldState(cfg.getInt(PREFIX + "max-world-state", c.maxWorldState))
        .setMaxEpisodicMemories(cfg.getInt(PREFIX + "max-episodic-memories", c.maxEpisodicMemories))
        .setMaxBeliefs(cfg.getInt(PREFIX + "max-beliefs", c.maxBeliefs))
        .setMinEpisodicStrength(
            cfg.getDouble(PREFIX + "min-episodic-strength", c.minEpisodicStrength))
        .setMinBeliefConfidence(
            cfg.getDouble(PREFIX + "min-belief-confidence", c.minBeliefConfidence))
        .setIncludeContradictedBeliefs(
            cfg.getBoolean(PREFIX + "include-contradicted-beliefs", c.includeContradictedBeliefs))
        .setRelevanceWeight(cfg.getDouble(PREFIX + "relevance-weight", c.relevanceWeight))
        .setRecencyWeight(cfg.getDouble(PREFIX + "recency-weight", c.recencyWeight))
        .setSignificanceWeight(cfg.getDouble(PREFIX + "significance-weight", c.significanceWeight))
        .setContradictionPenalty(
            cfg.getDouble(PREFIX + "contradiction-penalty", c.contradictionPenalty))
        .setTopicMatchBoost(cfg.getDouble(PREFIX + "topic-match-boost", c.topicMatchBoost))
        .setMaxRelevance(cfg.getDouble(PREFIX + "max-relevance", c.maxRelevance))
        .setMinKeywordLength(cfg.getInt(PREFIX + "min-keyword-length", c.minKeywordLength));
  }

  public ContextRetrievalConfig copy() {
    ContextRetrievalConfig c = new ContextRetrievalConfig();
    c.maxCanonicalFacts = maxCanonicalFacts;
    c.maxWorldState = maxWorldState;
    c.maxEpisodicMemories = maxEpisodicMemories;
    c.maxBeliefs = maxBeliefs;
    c.minEpisodicStrength = minEpisodicStrength;
    c.minBeliefConfidence = minBeliefConfidence;
    c.includeContradictedBeliefs = includeContradictedBeliefs;
    c.relevanceWeight = relevanceWeight;
    c.recencyWeight = recencyWeight;
    c.significanceWeight = significanceWeight;
    c.contradictionPenalty = contradictionPenalty;
    c.topicMatchBoost = topicMatchBoost;
    c.maxRelevance = maxRelevance;
    c.minKeywordLength = minKeywordLength;
    return c;
  }

  private static double orZero(double value) {
    return Double.isNaN(value) ? 0.0 : value;
  }

  public int getMaxCanonicalFacts() {
    return maxCanonicalFacts;
  }

  public ContextRetrievalConfig setMaxCanonicalFacts(int maxCanonicalFacts) {
    this.maxCanonicalFacts = maxCanonicalFacts;
    return this;
  }

  public int getMaxWorldState() {
    return maxWorldState;
  }

  public ContextRetrievalConfig setMaxWorldState(int maxWorldState) {
    this.maxWorldState = maxWorldState;
    return this;
  }

  public int getMaxEpisodicMemories() {
    return maxEpisodicMemories;
  }

  public ContextRetrievalConfig setMaxEpisodicMemories(int maxEpisodicMemories) {
    this.maxEpisodicMemories = maxEpisodicMemories;
    return this;
  }

  public int getMaxBeliefs() {
    return maxBeliefs;
  }

  public ContextRetrievalConfig setMaxBeliefs(int maxBeliefs) {
    this.maxBeliefs = maxBeliefs;
    return this;
  }

  public double getMinEpisodicStrength() {
    return minEpisodicStrength;
  }

  public ContextRetrievalConfig setMinEpisodicStrength(double minEpisodicStrength) {
    this.minEpisodicStrength = orZero(minEpisodicStrength);
    return this;
  }

  public double getMinBeliefConfidence() {
    return minBeliefConfidence;
  }

  /** Inclusive: a belief exactly at the threshold is kept. */
  public ContextRetrievalConfig setMinBeliefConfidence(double minBeliefConfidence) {
    this.minBeliefConfidence = orZero(minBeliefConfidence);
    return this;
  }

  public boolean isIncludeContradictedBeliefs() {
    return includeContradictedBeliefs;
  }

  public ContextRetrievalConfig setIncludeContradictedBeliefs(boolean includeContradictedBeliefs) {
    this.includeContradictedBeliefs = includeContradictedBeliefs;
    return this;
  }

  public double getRelevanceWeight() {
    return relevanceWeight;
  }

  public ContextRetrievalConfig setRelevanceWeight(double relevanceWeight) {
    this.relevanceWeight = orZero(relevanceWeight);
    return this;
  }

  public double getRecencyWeight() {
    return recencyWeight;
  }

  public ContextRetrievalConfig setRecencyWeight(double recencyWeight) {
    this.recencyWeight = orZero(recencyWeight);
    return this;
  }

  public double getSignificanceWeight() {
    return significanceWeight;
  }

  public ContextRetrievalConfig setSignificanceWeight(double significanceWeight) {
    this.significanceWeight = orZero(significanceWeight);
    return this;
  }

  public double getContradictionPenalty() {
    return contradictionPenalty;
  }

  /** Multiplier applied to a contradicted belief's confidence when it is scored. */
  public ContextRetrievalConfig setContradictionPenalty(double contradictionPenalty) {
    this.contradictionPenalty = orZero(contradictionPenalty);
    return this;
  }

  public double getTopicMatchBoost() {
    return topicMatchBoost;
  }

  public ContextRetrievalConfig setTopicMatchBoost(double topicMatchBoost) {
    this.topicMatchBoost = orZero(topicMatchBoost);
    return this;
  }

  public double getMaxRelevance() {
    return maxRelevance;
  }

  public ContextRetrievalConfig setMaxRelevance(double maxRelevance) {
    this.maxRelevance = orZero(maxRelevance);
    return this;
  }

  public int getMinKeywordLength() {
    return minKeywordLength;
  }

  public ContextRetrievalConfig setMinKeywordLength(int minKeywordLength) {
    this.minKeywordLength = minKeywordLength;
    return this;
  }

  @Override
  public String toString() {
    return ("ContextRetrievalConfig{facts=%d, state=%d, episodic=%d, beliefs=%d,"
            + " weights=%s/%s/%s, minStrength=%s, minConfidence=%s, contradicted=%s}")
        .formatted(
            maxCanonicalFacts,
            maxWorldState,
            maxEpisodicMemories,
            maxBeliefs,
            relevanceWeight,
            recencyWeight,
            significanceWeight,
            minEpisodicStrength,
            minBeliefConfidence,
            includeContradictedBeliefs);
  }
}
