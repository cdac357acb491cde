package com.gentoro.npcmemory.retrieval;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.npcmemory.memory.AuthoritativeMemoryStore;
import com.gentoro.npcmemory.memory.BeliefMemoryEntry;
import com.gentoro.npcmemory.memory.EpisodicMemoryEntry;
import com.gentoro.npcmemory.memory.ManualClock;
import com.gentoro.npcmemory.memory.MutationSource;
import com.gentoro.npcmemory.memory.SequentialIdGenerator;
import com.gentoro.npcmemory.snapshot.InteractionContext;
import com.gentoro.npcmemory.snapshot.StateSnapshot;
import com.gentoro.npcmemory.snapshot.StateSnapshotBuilder;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContextRetrievalEngine")
class ContextRetrievalEngineTest {

  private ManualClock clock;
  private AuthoritativeMemoryStore store;

  @BeforeEach
  void setUp() {
    clock = new ManualClock(5_000L);
    store = new AuthoritativeMemoryStore(clock, new SequentialIdGenerator("m"));
  }

  @Test
  @DisplayName("Equal significance with only significance weighted keeps insertion order")
  void significanceOnlyKeepsInsertionOrder() {
    for (int i = 1; i <= 5; i++) {
      store.addEpisodicMemory(
          EpisodicMemoryEntry.builder("Memory " + i).significance(0.5).build(),
          MutationSource.VALIDATED_OUTPUT);
    }
    ContextRetrievalConfig config =
        ContextRetrievalConfig.defaults()
            .setSignificanceWeight(1.0)
            .setRecencyWeight(0)
            .setRelevanceWeight(0)
            .setMaxEpisodicMemories(5);
    ContextRetrievalEngine engine = new ContextRetrievalEngine(store, config);

    RetrievedContext first = engine.retrieveContext("unrelated");
    assertEquals(
        List.of("Memory 1", "Memory 2", "Memory 3", "Memory 4", "Memory 5"),
        first.getEpisodicMemories());
    for (int i = 0; i < 10; i++) {
      assertEquals(first, engine.retrieveContext("unrelated"));
    }
  }

  @Test
  @DisplayName("Topic filter matches world state keys ignoring case")
  void worldStateTopicIsCaseInsensitive() {
    store.setWorldState("weather", "rain", MutationSource.GAME_SYSTEM);
    store.setWorldState("Door", "open", MutationSource.GAME_SYSTEM);

    RetrievedContext context =
        new ContextRetrievalEngine(store, ContextRetrievalConfig.defaults().setMaxWorldState(1))
            .retrieveContext("", List.of("door"));

    assertEquals(List.of("Door: open"), context.getWorldState());
    assertEquals(List.of(Map.entry("Door", "open")), context.getWorldStateEntries());
  }

  @Test
  @DisplayName("A contradicted 0.9 belief ranks below an uncontradicted 0.5 belief")
  void contradictedBeliefRanksBelow() {
    store.setBelief("strong", BeliefMemoryEntry.belief("player", "player is a hero", 0.9), null);
    store.getBelief("strong").orElseThrow().markContradicted("Saw the player steal");
    store.setBelief("plain", BeliefMemoryEntry.belief("player", "player is a trader", 0.5), null);

    ContextRetrievalEngine engine =
        new ContextRetrievalEngine(
            store, ContextRetrievalConfig.defaults().setIncludeContradictedBeliefs(true));
    RetrievedContext context = engine.retrieveContext("", List.of());

    assertEquals(
        List.of("I believe that player is a trader", "[Uncertain] I know that player is a hero"),
        context.getBeliefs());
    assertEquals(0.9, store.getBelief("strong").orElseThrow().getConfidence());
  }

  @Test
  void contradictedBeliefsExcludedByDefault() {
    store.setBelief("b", BeliefMemoryEntry.belief("player", "player is a hero", 0.9), null);
    store.getBelief("b").orElseThrow().markContradicted("no");

    assertTrue(new ContextRetrievalEngine(store).retrieveContext("hero").getBeliefs().isEmpty());
  }

  @Test
  @DisplayName("Belief exactly at the confidence threshold is kept, just below is dropped")
  void confidenceThresholdIsInclusive() {
    store.setBelief("at", BeliefMemoryEntry.belief("x", "at threshold", 0.5), null);
    store.setBelief("below", BeliefMemoryEntry.belief("x", "below threshold", 0.4999), null);

    RetrievedContext context = new ContextRetrievalEngine(store).retrieveContext(null);

    assertEquals(List.of("I believe that at threshold"), context.getBeliefs());
  }

  @Test
  void contradictedBeliefUsesStoredConfidenceForThreshold() {
    store.setBelief("b", BeliefMemoryEntry.belief("x", "penalised but kept", 0.6), null);
    store.getBelief("b").orElseThrow().markContradicted("r");

    ContextRetrievalConfig config =
        ContextRetrievalConfig.defaults().setIncludeContradictedBeliefs(true);
    assertEquals(1, new ContextRetrievalEngine(store, config).retrieveContext("").getBeliefs().size());
  }

  @Test
  void weakEpisodicMemoriesAreFiltered() {
    store.addEpisodicMemory(EpisodicMemoryEntry.builder("faded").strength(0.05).build(), null);
    store.addEpisodicMemory(EpisodicMemoryEntry.builder("edge").strength(0.1).build(), null);

    assertEquals(
        List.of("edge"), new ContextRetrievalEngine(store).retrieveContext("").getEpisodicMemories());
  }

  @Test
  @DisplayName("Keyword overlap lifts the matching memory to the top")
  void relevanceRanksMatchingMemoryFirst() {
    store.addDialogue("Player", "The weather today is lovely");
    store.addDialogue("Player", "Where is the dragon hiding?");
    store.addDialogue("Player", "I bought bread");

    RetrievedContext context =
        new ContextRetrievalEngine(store).retrieveContext("Tell me about the dragon");

    assertEquals("Player: Where is the dragon hiding?", context.getEpisodicMemories().get(0));
  }

  @Test
  void factsMatchingTopicComeFirstThenTruncate() {
    store.addCanonicalFact("f1", "Gold is heavy", "economy");
    store.addCanonicalFact("f2", "The king is Arthur", "lore");
    store.addCanonicalFact("f3", "Dragons breathe fire", "creatures");
    store.addCanonicalFact("f4", "Dragons hoard gold", "Lore");

    ContextRetrievalEngine engine =
        new ContextRetrievalEngine(store, ContextRetrievalConfig.defaults().setMaxCanonicalFacts(3));

    assertEquals(
        List.of("The king is Arthur", "Dragons hoard gold", "Gold is heavy"),
        engine.retrieveContext("", List.of("LORE")).getCanonicalFacts());
    assertEquals(
        List.of("Gold is heavy", "The king is Arthur", "Dragons breathe fire"),
        engine.retrieveContext("", null).getCanonicalFacts());
  }

  @Test
  @DisplayName("Facts order by id and world state by key within the topic groups")
  void factsAndWorldStateOrderByIdAndKey() {
    store.addCanonicalFact("gamma", "Gold is heavy", "economy");
    store.addCanonicalFact("Alpha", "The king is Arthur", "lore");
    store.addCanonicalFact("beta", "Dragons hoard gold", "lore");
    store.setWorldState("weather", "rain", null);
    store.setWorldState("Gate", "closed", null);
    store.setWorldState("door", "open", null);

    ContextRetrievalEngine engine = new ContextRetrievalEngine(store);

    assertEquals(
        List.of("The king is Arthur", "Dragons hoard gold", "Gold is heavy"),
        engine.retrieveContext("").getCanonicalFacts());
    assertEquals(
        List.of("door: open", "Gate: closed", "weather: rain"),
        engine.retrieveContext("").getWorldState());
    assertEquals(
        List.of("weather: rain", "door: open", "Gate: closed"),
        engine.retrieveContext("", List.of("rain")).getWorldState());
  }

  @Test
  void zeroLimitsMeanUnlimitedFactsButNoMemories() {
    for (int i = 0; i < 4; i++) {
      store.addCanonicalFact("f" + i, "fact " + i, null);
      store.addDialogue("P", "line " + i);
    }
    store.setBelief("b", BeliefMemoryEntry.belief("x", "y", 0.9), null);

    ContextRetrievalConfig config =
        ContextRetrievalConfig.defaults()
            .setMaxCanonicalFacts(0)
            .setMaxEpisodicMemories(0)
            .setMaxBeliefs(-1);
    RetrievedContext context = new ContextRetrievalEngine(store, config).retrieveContext("line");

    assertEquals(4, context.getCanonicalFacts().size());
    assertTrue(context.getEpisodicMemories().isEmpty());
    assertTrue(context.getBeliefs().isEmpty());
    assertEquals(4, context.getTotalCount());
  }

  @Test
  void emptyStoreYieldsEmptyContext() {
    RetrievedContext context =
        new ContextRetrievalEngine(store).retrieveContext((String) null, null);
    assertFalse(context.hasContent());
    assertEquals(RetrievedContext.empty(), context);
  }

  @Test
  void configIsCopiedAtConstruction() {
    ContextRetrievalConfig config = ContextRetrievalConfig.defaults().setMaxEpisodicMemories(1);
    ContextRetrievalEngine engine = new ContextRetrievalEngine(store, config);
    config.setMaxEpisodicMemories(50);

    assertEquals(1, engine.getConfig().getMaxEpisodicMemories());
  }

  @Test
  @DisplayName("Retrieved context folds into a snapshot and retrieval can start from a snapshot")
  void foldsIntoSnapshot() {
    store.addCanonicalFact("f", "The king is Arthur", null);
    store.setWorldState("door", "open", null);
    store.addDialogue("Player", "Tell me about the king");
    store.setBelief("b", BeliefMemoryEntry.belief("king", "the king is fair", 0.8), null);
    ContextRetrievalEngine engine = new ContextRetrievalEngine(store);

    StateSnapshot seed =
        new StateSnapshotBuilder()
            .withContext(InteractionContext.fromPlayerUtterance("npc-1", "Who is the king?"))
            .build();
    RetrievedContext context = engine.retrieveContext(seed, List.of("king"));
    StateSnapshot snapshot = context.applyTo(new StateSnapshotBuilder()).build();

    assertEquals(4, snapshot.getTotalMemoryCount());
    assertEquals(
        List.of(
            "[Fact] The king is Arthur",
            "[State] door: open",
            "[Memory] Player: Tell me about the king",
            "I know that the king is fair"),
        snapshot.getAllMemoryForPrompt());
  }
}
