package com.gentoro.npcmemory.retrieval;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.npcmemory.memory.AuthoritativeMemoryStore;
import com.gentoro.npcmemory.memory.BeliefMemoryEntry;
import com.gentoro.npcmemory.memory.EpisodicMemoryEntry;
import com.gentoro.npcmemory.memory.ManualClock;
import com.gentoro.npcmemory.memory.MutationSource;
import com.gentoro.npcmemory.memory.SequentialIdGenerator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Ranking must not depend on insertion order, float noise, locale or map iteration. */
class RetrievalDeterminismTest {
  private final Locale originalLocale = Locale.getDefault();

  @AfterEach
  void restoreLocale() {
    Locale.setDefault(originalLocale);
  }

  private static List<EpisodicMemoryEntry> fixtureMemories() {
    List<EpisodicMemoryEntry> entries = new ArrayList<>();
    String[] texts = {
      "The dragon attacked the village",
      "Player bought a sword",
      "Merchant told me about the dragon cave",
      "It rained all day",
      "Player asked about the king",
      "A stranger mentioned treasure near the cave",
      "Guard captain complained about taxes",
      "Player helped me carry water"
    };
    for (int i = 0; i < texts.length; i++) {
      entries.add(
          EpisodicMemoryEntry.builder(texts[i])
              .id("ep-" + (char) ('a' + i))
              .significance((i % 3) * 0.25)
              .strength(1.0 - (i % 4) * 0.2)
              .createdAtTicks(100L + (i % 2))
              .build());
    }
    return entries;
  }

  private static List<BeliefMemoryEntry> fixtureBeliefs() {
    return List.of(
        BeliefMemoryEntry.belief("dragon", "the dragon lives in the cave", 0.7),
        BeliefMemoryEntry.belief("king", "the king is generous", 0.6),
        BeliefMemoryEntry.belief("player", "the player is brave", 0.6),
        BeliefMemoryEntry.opinion("merchant", "merchants overcharge", -0.4, 0.8));
  }

  private static RetrievedContext retrieveShuffled(long seed) {
    AuthoritativeMemoryStore store =
        new AuthoritativeMemoryStore(new ManualClock(0L), new SequentialIdGenerator("x"));
    List<EpisodicMemoryEntry> memories = new ArrayList<>(fixtureMemories());
    List<BeliefMemoryEntry> beliefs = new ArrayList<>(fixtureBeliefs());
    Random random = new Random(seed);
    Collections.shuffle(memories, random);
    Collections.shuffle(beliefs, random);

    memories.forEach(m -> store.addEpisodicMemory(m, MutationSource.VALIDATED_OUTPUT));
    for (BeliefMemoryEntry belief : beliefs) {
      store.setBelief("belief-" + belief.getSubject(), belief, MutationSource.VALIDATED_OUTPUT);
    }
    return new ContextRetrievalEngine(
            store, ContextRetrievalConfig.defaults().setMaxEpisodicMemories(6).setMaxBeliefs(3))
        .retrieveContext("What do you know about the dragon cave?", List.of("dragon"));
  }

  @Test
  @DisplayName("Shuffled insertion orders produce identical results")
  void shuffledInsertionOrderIsIrrelevant() {
    RetrievedContext reference = retrieveShuffled(1L);
    for (long seed = 2; seed <= 25; seed++) {
      assertEquals(reference, retrieveShuffled(seed), "seed " + seed);
    }
    assertEquals(6, reference.getEpisodicMemories().size());
    assertEquals(3, reference.getBeliefs().size());
  }

  private static RetrievedContext retrieveShuffledFactsAndState(long seed) {
    AuthoritativeMemoryStore store =
        new AuthoritativeMemoryStore(new ManualClock(0L), new SequentialIdGenerator("w"));
    List<String> factIds = new ArrayList<>(List.of("a", "b", "c", "D", "e"));
    List<String> stateKeys = new ArrayList<>(List.of("door", "Gate", "weather", "market"));
    Random random = new Random(seed);
    Collections.shuffle(factIds, random);
    Collections.shuffle(stateKeys, random);

    for (String id : factIds) {
      store.addCanonicalFact(id, "fact " + id, id.equals("c") ? "dragon" : "lore");
    }
    for (String key : stateKeys) {
      store.setWorldState(key, "v", MutationSource.GAME_SYSTEM);
    }
    return new ContextRetrievalEngine(
            store, ContextRetrievalConfig.defaults().setMaxCanonicalFacts(4).setMaxWorldState(3))
        .retrieveContext("", List.of("dragon", "gate"));
  }

  @Test
  @DisplayName("Facts and world state do not depend on insertion order")
  void shuffledFactsAndWorldStateAreIrrelevant() {
    RetrievedContext reference = retrieveShuffledFactsAndState(1L);
    for (long seed = 2; seed <= 25; seed++) {
      assertEquals(reference, retrieveShuffledFactsAndState(seed), "seed " + seed);
    }
    assertEquals(List.of("fact c", "fact a", "fact b", "fact D"), reference.getCanonicalFacts());
    assertEquals(List.of("Gate: v", "door: v", "market: v"), reference.getWorldState());
  }

  @RepeatedTest(20)
  @DisplayName("Scores differing by 1e-9 sort the same way every time")
  void nearEqualScoresAreStable() {
    AuthoritativeMemoryStore store =
        new AuthoritativeMemoryStore(new ManualClock(0L), new SequentialIdGenerator("n"));
    store.addEpisodicMemory(
        EpisodicMemoryEntry.builder("lower").id("a").significance(0.5).createdAtTicks(1L).build(),
        null);
    store.addEpisodicMemory(
        EpisodicMemoryEntry.builder("higher")
            .id("b")
            .significance(0.5 + 1e-9)
            .createdAtTicks(1L)
            .build(),
        null);
    ContextRetrievalEngine engine =
        new ContextRetrievalEngine(
            store,
            ContextRetrievalConfig.defaults()
                .setSignificanceWeight(1)
                .setRecencyWeight(0)
                .setRelevanceWeight(0));

    assertEquals(List.of("higher", "lower"), engine.retrieveContext("").getEpisodicMemories());
  }

  @Test
  @DisplayName("Identical id, score and timestamp fall back to sequence number")
  void sequenceNumberBreaksFinalTie() {
    AuthoritativeMemoryStore store =
        new AuthoritativeMemoryStore(new ManualClock(0L), new SequentialIdGenerator("s"));
    for (String text : List.of("first", "second", "third")) {
      store.addEpisodicMemory(
          EpisodicMemoryEntry.builder(text).id("same").createdAtTicks(7L).build(), null);
    }

    assertEquals(
        List.of("first", "second", "third"),
        new ContextRetrievalEngine(store).retrieveContext("").getEpisodicMemories());
  }

  @ParameterizedTest
  @ValueSource(strings = {"en-US", "tr-TR", "sv-SE", "de-DE", "ja-JP"})
  @DisplayName("Non-ASCII ids sort ordinally regardless of default locale")
  void nonAsciiIdsSortOrdinally(String languageTag) {
    Locale.setDefault(Locale.forLanguageTag(languageTag));
    AuthoritativeMemoryStore store =
        new AuthoritativeMemoryStore(new ManualClock(0L), new SequentialIdGenerator("l"));
    for (String id : List.of("ö-entry", "z-entry", "o-entry", "Ä-entry", "a-entry", "İ-entry")) {
      store.addEpisodicMemory(
          EpisodicMemoryEntry.builder(id).id(id).createdAtTicks(3L).build(), null);
    }

    assertEquals(
        List.of("a-entry", "o-entry", "z-entry", "Ä-entry", "ö-entry", "İ-entry"),
        new ContextRetrievalEngine(store).retrieveContext("").getEpisodicMemories());
  }

  @Test
  @DisplayName("All weights zero sorts by newest, then id, then sequence")
  void allZeroWeightsUseTieBreakChain() {
    AuthoritativeMemoryStore store =
        new AuthoritativeMemoryStore(new ManualClock(0L), new SequentialIdGenerator("z"));
    store.addEpisodicMemory(
        EpisodicMemoryEntry.builder("old-b").id("b").createdAtTicks(10L).build(), null);
    store.addEpisodicMemory(
        EpisodicMemoryEntry.builder("new-c").id("c").createdAtTicks(20L).build(), null);
    store.addEpisodicMemory(
        EpisodicMemoryEntry.builder("old-a").id("a").createdAtTicks(10L).build(), null);
    store.addEpisodicMemory(
        EpisodicMemoryEntry.builder("old-a-again").id("a").createdAtTicks(10L).build(), null);

    ContextRetrievalConfig config =
        ContextRetrievalConfig.defaults()
            .setRelevanceWeight(0)
            .setRecencyWeight(0)
            .setSignificanceWeight(0);
    ContextRetrievalEngine engine = new ContextRetrievalEngine(store, config);

    List<String> expected = List.of("new-c", "old-a", "old-a-again", "old-b");
    for (int i = 0; i < 5; i++) {
      assertEquals(expected, engine.retrieveContext("anything at all").getEpisodicMemories());
    }
  }

  @Test
  void nanWeightsAreTreatedAsZero() {
    ContextRetrievalConfig config =
        ContextRetrievalConfig.defaults().setRelevanceWeight(Double.NaN).setMinBeliefConfidence(Double.NaN);
    assertEquals(0.0, config.getRelevanceWeight());
    assertEquals(0.0, config.getMinBeliefConfidence());
  }
}
