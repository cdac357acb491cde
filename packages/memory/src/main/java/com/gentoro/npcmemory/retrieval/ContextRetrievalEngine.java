package com.gentoro.npcmemory.retrieval;

import com.gentoro.npcmemory.logging.LoggingService;
import com.gentoro.npcmemory.memory.AuthoritativeMemoryStore;
import com.gentoro.npcmemory.memory.BeliefMemoryEntry;
import com.gentoro.npcmemory.memory.CanonicalFact;
import com.gentoro.npcmemory.memory.EpisodicMemoryEntry;
import com.gentoro.npcmemory.memory.MemoryEntry;
import com.gentoro.npcmemory.memory.MemoryKey;
import com.gentoro.npcmemory.memory.WorldStateEntry;
import com.gentoro.npcmemory.retrieval.trace.NoOpRetrievalTraceSink;
import com.gentoro.npcmemory.retrieval.trace.RetrievalTrace;
import com.gentoro.npcmemory.retrieval.trace.RetrievalTraceSink;
import com.gentoro.npcmemory.snapshot.StateSnapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Selects and orders the memories an NPC should see for one dialogue turn.
 *
 * <p>The result is a pure function of store contents, configuration, query and topics. Nothing
 * here depends on hash iteration order, the wall clock or the default locale, so retrieving twice
 * from an unchanged store yields equal {@link RetrievedContext} values.
 *
 * <ul>
 *   <li>Canonical facts and world state: entries matching a topic first, then the rest. Facts are
 *       ordered by lower cased id, then exact id, and world state by lower cased key (all ordinal),
 *       with sequence number last, so insertion order never shows through.
 *   <li>Episodic memories: {@code relevanceWeight * relevance + recencyWeight * strength +
 *       significanceWeight * significance}.
 *   <li>Beliefs: {@code 0.6 * relevance + 0.4 * effectiveConfidence}.
 * </ul>
 *
 * Ranked categories break ties by {@link ScoredItem#rankingOrder()}.
 */
public class ContextRetrievalEngine {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(ContextRetrievalEngine.class);

  static final double BELIEF_RELEVANCE_WEIGHT = 0.6;
  static final double BELIEF_CONFIDENCE_WEIGHT = 0.4;

  private static final Comparator<CanonicalFact> FACT_ORDER =
      Comparator.comparing((CanonicalFact f) -> MemoryKey.normalize(f.getId()))
          .thenComparing(CanonicalFact::getId)
          .thenComparingLong(MemoryEntry::getSequenceNumber);
  private static final Comparator<WorldStateEntry> WORLD_STATE_ORDER =
      Comparator.comparing((WorldStateEntry w) -> MemoryKey.normalize(w.getKey()))
          .thenComparingLong(MemoryEntry::getSequenceNumber);

  private final AuthoritativeMemoryStore store;
  private final ContextRetrievalConfig config;
  private final RelevanceScorer scorer;
  private final RetrievalTraceSink traceSink;

  public ContextRetrievalEngine(AuthoritativeMemoryStore store) {
    this(store, ContextRetrievalConfig.defaults());
  }

  public ContextRetrievalEngine(AuthoritativeMemoryStore store, ContextRetrievalConfig config) {
    this(store, config, NoOpRetrievalTraceSink.INSTANCE);
  }

  /** The configuration is copied; later changes to {@code config} do not affect this engine. */
  public ContextRetrievalEngine(
      AuthoritativeMemoryStore store, ContextRetrievalConfig config, RetrievalTraceSink traceSink) {
    this.store = Objects.requireNonNull(store, "store");
    this.config = config == null ? ContextRetrievalConfig.defaults() : config.copy();
    this.scorer = RelevanceScorer.from(this.config);
    this.traceSink = traceSink == null ? NoOpRetrievalTraceSink.INSTANCE : traceSink;
  }

  public ContextRetrievalConfig getConfig() {
    return config.copy();
  }

  public RetrievedContext retrieveContext(String query) {
    return retrieveContext(query, List.of());
  }

  /** Retrieve for the player input carried by {@code snapshot}. */
  public RetrievedContext retrieveContext(StateSnapshot snapshot, Collection<String> topics) {
    Objects.requireNonNull(snapshot, "snapshot");
    return retrieveContext(snapshot.getPlayerInput(), topics);
  }

  /**
   * @param query free text, usually the player's utterance; null is treated as empty
   * @param topics optional topic hints; null and blank entries are ignored
   */
  public RetrievedContext retrieveContext(String query, Collection<String> topics) {
    List<String> normalizedTopics = RelevanceScorer.normalizeTopics(topics);
    Set<String> queryKeywords = scorer.extractKeywords(query);

    List<CanonicalFact> facts =
        topicsFirst(
            store.getCanonicalFacts(), FACT_ORDER, f -> factMatches(f, normalizedTopics));
    List<String> factLines =
        limit(facts, config.getMaxCanonicalFacts()).stream().map(CanonicalFact::getContent).toList();

    List<WorldStateEntry> state =
        topicsFirst(
            store.getAllWorldState(),
            WORLD_STATE_ORDER,
            w -> RelevanceScorer.matchesAnyTopic(w.getKey(), normalizedTopics)
                || RelevanceScorer.matchesAnyTopic(w.getContent(), normalizedTopics));
    List<Map.Entry<String, String>> stateEntries =
        limit(state, config.getMaxWorldState()).stream()
            .map(w -> Map.entry(w.getKey(), w.getValue()))
            .toList();

    List<ScoredItem<EpisodicMemoryEntry>> episodicCandidates =
        scoreEpisodic(queryKeywords, normalizedTopics);
    List<ScoredItem<EpisodicMemoryEntry>> episodic =
        top(episodicCandidates, config.getMaxEpisodicMemories());

    List<ScoredItem<BeliefMemoryEntry>> beliefCandidates =
        scoreBeliefs(queryKeywords, normalizedTopics);
    List<ScoredItem<BeliefMemoryEntry>> beliefs = top(beliefCandidates, config.getMaxBeliefs());

    RetrievedContext context =
        new RetrievedContext(
            factLines,
            stateEntries,
            episodic.stream().map(s -> s.item().getContent()).toList(),
            beliefs.stream().map(s -> beliefLine(s.item())).toList());

    log.debug("Retrieved {} for query '{}' (topics={})", context, query, normalizedTopics);
    traceSink.retrievalCompleted(
        new RetrievalTrace(
            query,
            normalizedTopics,
            Map.of(
                "canonicalFacts", facts.size(),
                "worldState", state.size(),
                "episodic", episodicCandidates.size(),
                "beliefs", beliefCandidates.size()),
            Map.of(
                "canonicalFacts", factLines.size(),
                "worldState", stateEntries.size(),
                "episodic", episodic.size(),
                "beliefs", beliefs.size()),
            traced(episodic),
            traced(beliefs)));
    return context;
  }

  private List<ScoredItem<EpisodicMemoryEntry>> scoreEpisodic(
      Set<String> queryKeywords, List<String> topics) {
    List<ScoredItem<EpisodicMemoryEntry>> scored = new ArrayList<>();
    for (EpisodicMemoryEntry memory :
        store.getActiveEpisodicMemories(config.getMinEpisodicStrength())) {
      double relevance = scorer.score(memory.getContent(), queryKeywords, topics);
      double score =
          config.getRelevanceWeight() * relevance
              + config.getRecencyWeight() * memory.getStrength()
              + config.getSignificanceWeight() * memory.getSignificance();
      scored.add(new ScoredItem<>(memory, score));
    }
    return scored;
  }

  private List<ScoredItem<BeliefMemoryEntry>> scoreBeliefs(
      Set<String> queryKeywords, List<String> topics) {
    List<ScoredItem<BeliefMemoryEntry>> scored = new ArrayList<>();
    for (BeliefMemoryEntry belief : store.getAllBeliefs()) {
      if (belief.isContradicted() && !config.isIncludeContradictedBeliefs()) continue;
      if (belief.getConfidence() < config.getMinBeliefConfidence()) continue;

      double relevance = scorer.score(belief.getBeliefContent(), queryKeywords, topics);
      double score =
          BELIEF_RELEVANCE_WEIGHT * relevance
              + BELIEF_CONFIDENCE_WEIGHT
                  * belief.getEffectiveConfidence(config.getContradictionPenalty());
      scored.add(new ScoredItem<>(belief, score));
    }
    return scored;
  }

  private static boolean factMatches(CanonicalFact fact, List<String> topics) {
    if (RelevanceScorer.matchesAnyTopic(fact.getContent(), topics)) return true;
    if (fact.getDomain() == null) return false;
    String domain = MemoryKey.normalize(fact.getDomain());
    return topics.contains(domain);
  }

  private static String beliefLine(BeliefMemoryEntry belief) {
    return belief.isContradicted() ? "[Uncertain] " + belief.getSummary() : belief.getSummary();
  }

  /** Topic matches first, then the rest; both groups sorted by {@code order}. */
  private static <T extends MemoryEntry> List<T> topicsFirst(
      List<T> entries, Comparator<T> order, Predicate<T> matches) {
    List<T> ordered = new ArrayList<>(entries.size());
    List<T> rest = new ArrayList<>();
    for (T entry : entries.stream().sorted(order).toList()) {
      if (matches.test(entry)) {
        ordered.add(entry);
      } else {
        rest.add(entry);
      }
    }
    ordered.addAll(rest);
    return ordered;
  }

  /** Unlimited when {@code max <= 0}. */
  private static <T> List<T> limit(List<T> items, int max) {
    return max > 0 && items.size() > max ? items.subList(0, max) : items;
  }

  /** Sort by ranking order and keep {@code max}; nothing when {@code max <= 0}. */
  private static <T extends MemoryEntry> List<ScoredItem<T>> top(
      List<ScoredItem<T>> items, int max) {
    if (max <= 0) return List.of();
    return items.stream().sorted(ScoredItem.<T>rankingOrder()).limit(max).toList();
  }

  private static <T extends MemoryEntry> List<RetrievalTrace.Scored> traced(
      List<ScoredItem<T>> items) {
    return items.stream()
        .map(
            s ->
                new RetrievalTrace.Scored(
                    s.item().getId(), s.item().getSequenceNumber(), s.score()))
        .toList();
  }
}
