package com.gentoro.npcmemory.retrieval;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Keyword overlap relevance with a flat boost for topic hits.
 *
 * <p>Text is lower cased with {@link Locale#ROOT} and split on spaces and the punctuation {@code .
 * , ! ?}. Only words of at least {@code minKeywordLength} characters count. The keyword part is the
 * share of distinct query words that also occur in the candidate text.
 */
public final class RelevanceScorer {
  private static final Pattern WORD_SEPARATORS = Pattern.compile("[ .,!?]+");

  private final int minKeywordLength;
  private final double topicMatchBoost;
  private final double maxRelevance;

  public RelevanceScorer(int minKeywordLength, double topicMatchBoost, double maxRelevance) {
    this.minKeywordLength = minKeywordLength;
    this.topicMatchBoost = topicMatchBoost;
    this.maxRelevance = maxRelevance;
  }

  public static RelevanceScorer from(ContextRetrievalConfig config) {
    return new RelevanceScorer(
        config.getMinKeywordLength(), config.getTopicMatchBoost(), config.getMaxRelevance());
  }

  /** Distinct keywords of {@code text}, sorted so iteration order is stable. */
  public Set<String> extractKeywords(String text) {
    Set<String> keywords = new TreeSet<>();
    if (text == null || text.isEmpty()) return keywords;
    for (String word : WORD_SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
      if (!word.isEmpty() && word.length() >= minKeywordLength) {
        keywords.add(word);
      }
    }
    return keywords;
  }

  /**
   * Lower case, trim and drop blank topics. Returns an empty list for {@code null}; order is kept.
   */
  public static List<String> normalizeTopics(Collection<String> topics) {
    if (topics == null) return List.of();
    return topics.stream()
        .filter(Objects::nonNull)
        .map(t -> t.trim().toLowerCase(Locale.ROOT))
        .filter(t -> !t.isEmpty())
        .distinct()
        .toList();
  }

  /**
   * Relevance of {@code text} in [0, maxRelevance] (or below 0 if the boost is negative).
   *
   * @param queryKeywords result of {@link #extractKeywords(String)} on the query
   * @param normalizedTopics result of {@link #normalizeTopics(Collection)}
   */
  public double score(String text, Set<String> queryKeywords, List<String> normalizedTopics) {
    if (text == null || text.isEmpty()) return 0.0;
    double score = 0.0;

    if (!queryKeywords.isEmpty()) {
      Set<String> contentKeywords = extractKeywords(text);
      int overlap = 0;
      for (String keyword : queryKeywords) {
        if (contentKeywords.contains(keyword)) overlap++;
      }
      score = (double) overlap / queryKeywords.size();
    }

    if (matchesAnyTopic(text, normalizedTopics)) {
      score += topicMatchBoost;
    }
    return Math.min(score, maxRelevance);
  }

  /** Case-insensitive containment of any topic in {@code text}. */
  public static boolean matchesAnyTopic(String text, List<String> normalizedTopics) {
    if (text == null || normalizedTopics.isEmpty()) return false;
    String lower = text.toLowerCase(Locale.ROOT);
    for (String topic : normalizedTopics) {
      if (lower.contains(topic)) return true;
    }
    return false;
  }
}
