package com.gentoro.npcmemory.memory;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.npcmemory.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class MemoryEntryTest {

  @Test
  @DisplayName("Dialogue factory stores 'speaker: text' with the speaker as participant")
  void dialogueFactory() {
    EpisodicMemoryEntry entry = EpisodicMemoryEntry.fromDialogue("Player", "Hello there");

    assertEquals("Player: Hello there", entry.getDescription());
    assertEquals("Player", entry.getParticipant());
    assertEquals(EpisodeType.DIALOGUE, entry.getEpisodeType());
    assertEquals(0.5, entry.getSignificance());
    assertEquals(1.0, entry.getStrength());
    assertFalse(entry.hasCreatedAtTicks());
    assertEquals(MemoryEntry.UNASSIGNED_SEQUENCE, entry.getSequenceNumber());
  }

  @Test
  void observationAndLearnedInfoDefaults() {
    assertEquals(0.3, EpisodicMemoryEntry.fromObservation("A crow lands").getSignificance());
    EpisodicMemoryEntry learned = EpisodicMemoryEntry.fromLearnedInfo("Bridge is out", "Guard");
    assertEquals(0.6, learned.getSignificance());
    assertEquals(EpisodeType.LEARNED_INFO, learned.getEpisodeType());
    assertEquals("Guard", learned.getParticipant());
  }

  @Test
  @DisplayName("Out of range values are clamped")
  void clampsOutOfRange() {
    EpisodicMemoryEntry entry =
        EpisodicMemoryEntry.builder("x").significance(1.7).strength(-0.2).build();
    assertEquals(1.0, entry.getSignificance());
    assertEquals(0.0, entry.getStrength());
    assertFalse(entry.isActive());

    BeliefMemoryEntry belief =
        BeliefMemoryEntry.builder("s", "c").confidence(2.0).sentiment(-3.0).build();
    assertEquals(1.0, belief.getConfidence());
    assertEquals(-1.0, belief.getSentiment());
  }

  @Test
  @DisplayName("NaN and infinite scores are rejected")
  void rejectsNonFinite() {
    assertThrows(
        ValidationException.class,
        () -> EpisodicMemoryEntry.builder("x").significance(Double.NaN).build());
    assertThrows(
        ValidationException.class,
        () -> BeliefMemoryEntry.builder("s", "c").confidence(Double.POSITIVE_INFINITY).build());
  }

  @ParameterizedTest
  @CsvSource({
    "0.9, I know that",
    "0.8, I know that",
    "0.5, I believe that",
    "0.3, I think that",
    "0.29, 'I''m not sure, but'"
  })
  void summaryPrefixFollowsConfidence(double confidence, String prefix) {
    BeliefMemoryEntry belief = BeliefMemoryEntry.belief("king", "the king is wise", confidence);
    assertEquals(prefix + " the king is wise", belief.getSummary());
  }

  @Test
  @DisplayName("Contradiction halves effective confidence but leaves stored confidence alone")
  void contradictionPenaltyIsApplied() {
    BeliefMemoryEntry belief = BeliefMemoryEntry.belief("player", "player is honest", 0.9);
    belief.markContradicted("caught lying");

    assertTrue(belief.isContradicted());
    assertEquals("caught lying", belief.getContradictionReason());
    assertEquals(0.9, belief.getConfidence());
    assertEquals(0.45, belief.getEffectiveConfidence(), 1e-12);
    assertEquals(0.225, belief.getEffectiveConfidence(0.25), 1e-12);
  }

  @Test
  void relationshipBeliefDefaultsToSevenTenthsConfidence() {
    BeliefMemoryEntry belief = BeliefMemoryEntry.relationship("player", "friend", 0.8);
    assertEquals(BeliefType.RELATIONSHIP, belief.getBeliefType());
    assertEquals(0.7, belief.getConfidence());
    assertEquals(0.8, belief.getSentiment());
  }

  @Test
  void worldStateContentIsKeyColonValue() {
    assertEquals("door: open", new WorldStateEntry("door", "open").getContent());
  }

  @Test
  void authorityLevelsAndMutationSources() {
    assertTrue(MutationSource.DESIGNER.canMutate(MemoryAuthority.CANONICAL));
    assertFalse(MutationSource.GAME_SYSTEM.canMutate(MemoryAuthority.CANONICAL));
    assertTrue(MutationSource.GAME_SYSTEM.canMutate(MemoryAuthority.WORLD_STATE));
    assertTrue(MutationSource.VALIDATED_OUTPUT.canMutate(MemoryAuthority.EPISODIC));
    assertFalse(MutationSource.LLM_SUGGESTION.canMutate(MemoryAuthority.EPISODIC));
    assertTrue(MutationSource.LLM_SUGGESTION.canMutate(MemoryAuthority.BELIEF));
  }
}
