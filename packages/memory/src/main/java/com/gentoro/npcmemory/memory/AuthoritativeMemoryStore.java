package com.gentoro.npcmemory.memory;

import com.gentoro.npcmemory.exception.DuplicateIdException;
import com.gentoro.npcmemory.exception.ValidationException;
import com.gentoro.npcmemory.logging.LoggingService;
import com.gentoro.npcmemory.utility.StringUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sole writer of NPC memory state: canonical facts, world state, episodic memories, beliefs and
 * relationships.
 *
 * <p>Every stored entry receives a timestamp from the injected {@link Clock} (unless the caller
 * supplied one) and a sequence number from a per-instance monotonic counter. Sequence numbers are
 * never reused; after bulk loading persisted entries through the {@code restore*} methods the
 * caller must invoke {@link #recalculateNextSequenceNumber()}.
 *
 * <p>Accessors return detached copies ordered by sequence number, never live references, with one
 * exception: {@link #getBelief(String)} returns the stored belief so that {@link
 * BeliefMemoryEntry#markContradicted(String)} takes effect.
 *
 * <p>Not thread-safe. One store belongs to one NPC session; callers serialize access.
 */
public class AuthoritativeMemoryStore {
  private static final org.slf4j.Logger log =
      LoggingService.getLogger(AuthoritativeMemoryStore.class);

  private static final Comparator<MemoryEntry> BY_SEQUENCE =
      Comparator.comparingLong(MemoryEntry::getSequenceNumber)
          .thenComparing(MemoryEntry::getId, Comparator.nullsFirst(Comparator.naturalOrder()));

  private final Map<String, CanonicalFact> canonicalFacts = new HashMap<>();
  private final Map<MemoryKey, WorldStateEntry> worldState = new HashMap<>();
  private final List<EpisodicMemoryEntry> episodicMemories = new ArrayList<>();
  private final Map<MemoryKey, BeliefMemoryEntry> beliefs = new HashMap<>();
  private final Map<RelationshipKey, RelationshipEntry> relationships = new HashMap<>();

  private final Clock clock;
  private final IdGenerator idGenerator;
  private final MemoryStoreSettings settings;

  private long nextSequenceNumber = 1;

  public AuthoritativeMemoryStore() {
    this(new SystemClock(), new RandomIdGenerator(), MemoryStoreSettings.defaults());
  }

  public AuthoritativeMemoryStore(Clock clock, IdGenerator idGenerator) {
    this(clock, idGenerator, MemoryStoreSettings.defaults());
  }

  public AuthoritativeMemoryStore(
      Clock clock, IdGenerator idGenerator, MemoryStoreSettings settings) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
    this.settings = settings == null ? MemoryStoreSettings.defaults() : settings;
  }

  public MemoryStoreSettings getSettings() {
    return settings;
  }

  // ---------------------------------------------------------------------------------------------
  // Canonical facts
  // ---------------------------------------------------------------------------------------------

  /**
   * Add an immutable fact.
   *
   * @throws DuplicateIdException if a fact with the same id already exists
   */
  public CanonicalFact addCanonicalFact(String id, String content, String domain) {
    Objects.requireNonNull(id, "id");
    if (canonicalFacts.containsKey(id)) {
      throw new DuplicateIdException("Canonical fact", id);
    }
    CanonicalFact fact = new CanonicalFact(id, content, domain);
    fact.assignCreatedAtTicks(clock.nowTicks());
    fact.assignSequenceNumber(nextSequenceNumber++);
    canonicalFacts.put(id, fact);
    log.debug("Added canonical fact {} (seq={})", id, fact.getSequenceNumber());
    return fact.copy();
  }

  public boolean removeCanonicalFact(String id) {
    boolean removed = id != null && canonicalFacts.remove(id) != null;
    if (removed) log.debug("Removed canonical fact {}", id);
    return removed;
  }

  public Optional<CanonicalFact> getCanonicalFact(String id) {
    return Optional.ofNullable(id == null ? null : canonicalFacts.get(id)).map(CanonicalFact::copy);
  }

  public boolean isCanonicalFact(String id) {
    return id != null && canonicalFacts.containsKey(id);
  }

  public List<CanonicalFact> getCanonicalFacts() {
    return snapshot(canonicalFacts.values());
  }

  /** Facts whose domain equals {@code domain} ignoring case. */
  public List<CanonicalFact> getCanonicalFacts(String domain) {
    if (domain == null) return getCanonicalFacts();
    return snapshot(
        canonicalFacts.values().stream()
            .filter(f -> f.getDomain() != null && MemoryKey.matches(f.getDomain(), domain))
            .toList());
  }

  /**
   * Detect a statement that negates a canonical fact, e.g. "the king is not Arthur" against "The
   * king is Arthur". Facts are checked in sequence order; the first hit is returned.
   */
  public Optional<CanonicalFact> contradictsCanonicalFact(String statement) {
    if (statement == null || statement.isBlank()) return Optional.empty();
    String lowerStatement = statement.toLowerCase(Locale.ROOT);
    for (CanonicalFact fact : sorted(canonicalFacts.values())) {
      String lowerFact = fact.getContent().toLowerCase(Locale.ROOT);
      if (lowerFact.isBlank()) continue;
      if (lowerStatement.contains("not " + lowerFact)
          || lowerStatement.contains("isn't " + lowerFact)
          || lowerStatement.contains("never " + lowerFact)
          || lowerStatement.contains(lowerFact + " is not")
          || lowerStatement.contains(lowerFact + " isn't")) {
        return Optional.of(fact.copy());
      }
      if (lowerFact.contains(" is ")
          && (lowerStatement.equals(lowerFact.replace(" is ", " is not "))
              || lowerStatement.equals(lowerFact.replace(" is ", " isn't ")))) {
        return Optional.of(fact.copy());
      }
    }
    return Optional.empty();
  }

  // ---------------------------------------------------------------------------------------------
  // World state
  // ---------------------------------------------------------------------------------------------

  /** Upsert by case-insensitive key. Last writer wins; the source is kept for audit. */
  public WorldStateEntry setWorldState(String key, String value, MutationSource source) {
    MemoryKey memoryKey = MemoryKey.of(key);
    MutationSource effectiveSource = source == null ? MutationSource.GAME_SYSTEM : source;
    long now = clock.nowTicks();

    WorldStateEntry existing = worldState.get(memoryKey);
    if (existing != null) {
      existing.overwrite(value, effectiveSource, now);
      log.debug(
          "Updated world state {} = '{}' by {}",
          existing.getKey(),
          StringUtility.truncate(value, 80),
          effectiveSource);
      return existing.copy();
    }

    WorldStateEntry entry = new WorldStateEntry(key, value);
    entry.assignId(idGenerator.generateId());
    entry.assignSource(effectiveSource);
    entry.assignCreatedAtTicks(now);
    entry.assignModifiedAtTicks(now);
    entry.assignSequenceNumber(nextSequenceNumber++);
    worldState.put(memoryKey, entry);
    log.debug(
        "Added world state {} = '{}' (seq={})",
        key,
        StringUtility.truncate(value, 80),
        entry.getSequenceNumber());
    return entry.copy();
  }

  public Optional<WorldStateEntry> getWorldState(String key) {
    if (key == null) return Optional.empty();
    return Optional.ofNullable(worldState.get(MemoryKey.of(key))).map(WorldStateEntry::copy);
  }

  public boolean removeWorldState(String key) {
    return key != null && worldState.remove(MemoryKey.of(key)) != null;
  }

  public List<WorldStateEntry> getAllWorldState() {
    return snapshot(worldState.values());
  }

  // ---------------------------------------------------------------------------------------------
  // Episodic memory
  // ---------------------------------------------------------------------------------------------

  /**
   * Append an episodic memory. A caller supplied id and creation time are kept; otherwise the id
   * generator and the clock fill them in. The stored entry always gets a fresh sequence number.
   * Ids are not required to be unique.
   */
  public EpisodicMemoryEntry addEpisodicMemory(EpisodicMemoryEntry entry, MutationSource source) {
    Objects.requireNonNull(entry, "entry");
    EpisodicMemoryEntry stored = entry.copy();
    if (stored.getId() == null || stored.getId().isEmpty()) {
      stored.assignId(idGenerator.generateId());
    }
    if (!stored.hasCreatedAtTicks()) {
      stored.assignCreatedAtTicks(clock.nowTicks());
    }
    if (source != null) {
      stored.assignSource(source);
    }
    stored.assignSequenceNumber(nextSequenceNumber++);
    episodicMemories.add(stored);
    log.debug(
        "Added episodic memory '{}' (id={}, seq={})",
        StringUtility.truncate(stored.getDescription(), 80),
        stored.getId(),
        stored.getSequenceNumber());
    return stored.copy();
  }

  public EpisodicMemoryEntry addDialogue(String speaker, String text) {
    return addDialogue(
        speaker, text, EpisodicMemoryEntry.DEFAULT_SIGNIFICANCE, MutationSource.VALIDATED_OUTPUT);
  }

  public EpisodicMemoryEntry addDialogue(
      String speaker, String text, double significance, MutationSource source) {
    return addEpisodicMemory(EpisodicMemoryEntry.fromDialogue(speaker, text, significance), source);
  }

  /**
   * Reduce the strength of every active episodic memory by the configured decay step, clamped at
   * zero. Entries are never removed.
   */
  public void applyEpisodicDecay() {
    double step = settings.episodicDecayRate();
    int touched = 0;
    for (EpisodicMemoryEntry memory : episodicMemories) {
      if (memory.isActive()) {
        memory.decay(step);
        touched++;
      }
    }
    log.trace("Applied episodic decay step {} to {} memories", step, touched);
  }

  /** Raise the strength of every episodic memory with the given id; false if none matched. */
  public boolean reinforceEpisodicMemory(String id, double amount) {
    if (id == null || Double.isNaN(amount) || amount <= 0) return false;
    boolean found = false;
    for (EpisodicMemoryEntry memory : episodicMemories) {
      if (id.equals(memory.getId())) {
        memory.reinforce(amount);
        found = true;
      }
    }
    return found;
  }

  public List<EpisodicMemoryEntry> getEpisodicMemories() {
    return snapshot(episodicMemories);
  }

  /** Memories with strength above zero. */
  public List<EpisodicMemoryEntry> getActiveEpisodicMemories() {
    return snapshot(episodicMemories.stream().filter(EpisodicMemoryEntry::isActive).toList());
  }

  /** Active memories whose strength is at least {@code minStrength}. */
  public List<EpisodicMemoryEntry> getActiveEpisodicMemories(double minStrength) {
    return snapshot(
        episodicMemories.stream()
            .filter(m -> m.isActive() && m.getStrength() >= minStrength)
            .toList());
  }

  /** Most recent active memories first; equal timestamps fall back to later insertion first. */
  public List<EpisodicMemoryEntry> getRecentMemories(int count) {
    if (count <= 0) return List.of();
    return episodicMemories.stream()
        .filter(EpisodicMemoryEntry::isActive)
        .sorted(
            Comparator.comparingLong(EpisodicMemoryEntry::getCreatedAtTicks)
                .thenComparingLong(EpisodicMemoryEntry::getSequenceNumber)
                .reversed())
        .limit(count)
        .map(EpisodicMemoryEntry::copy)
        .toList();
  }

  // ---------------------------------------------------------------------------------------------
  // Beliefs
  // ---------------------------------------------------------------------------------------------

  /**
   * Upsert a belief under {@code id} (case-insensitive). The stored entry always takes the next
   * sequence number, also when it replaces an existing belief. A belief whose content negates a
   * canonical fact is stored already contradicted.
   *
   * @return the stored belief handle
   */
  public BeliefMemoryEntry setBelief(String id, BeliefMemoryEntry entry, MutationSource source) {
    MemoryKey key = MemoryKey.of(id);
    Objects.requireNonNull(entry, "entry");

    BeliefMemoryEntry stored = entry.copy();
    stored.assignId(id);
    if (source != null) {
      stored.assignSource(source);
    }
    if (!stored.hasCreatedAtTicks()) {
      stored.assignCreatedAtTicks(clock.nowTicks());
    }

    stored.assignSequenceNumber(nextSequenceNumber++);

    if (!stored.isContradicted()) {
      contradictsCanonicalFact(stored.getBeliefContent())
          .ifPresent(
              fact -> {
                stored.markContradicted("Contradicts canonical fact: " + fact.getContent());
                log.debug(
                    "Belief {} contradicts canonical fact {}; stored as contradicted",
                    id,
                    fact.getId());
              });
    }

    beliefs.put(key, stored);
    log.debug(
        "Set belief {} = '{}' (seq={})",
        id,
        StringUtility.truncate(stored.getBeliefContent(), 80),
        stored.getSequenceNumber());
    return stored;
  }

  /** The stored belief itself, so that {@code markContradicted} updates the store. */
  public Optional<BeliefMemoryEntry> getBelief(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(beliefs.get(MemoryKey.of(id)));
  }

  public boolean removeBelief(String id) {
    return id != null && beliefs.remove(MemoryKey.of(id)) != null;
  }

  public List<BeliefMemoryEntry> getBeliefsAbout(String subject) {
    if (subject == null) return List.of();
    return snapshot(
        beliefs.values().stream().filter(b -> MemoryKey.matches(b.getSubject(), subject)).toList());
  }

  /** Beliefs that have not been contradicted. */
  public List<BeliefMemoryEntry> getActiveBeliefs() {
    return snapshot(beliefs.values().stream().filter(b -> !b.isContradicted()).toList());
  }

  public List<BeliefMemoryEntry> getAllBeliefs() {
    return snapshot(beliefs.values());
  }

  // ---------------------------------------------------------------------------------------------
  // Relationships
  // ---------------------------------------------------------------------------------------------

  /**
   * Create or replace a relationship on behalf of {@code actingNpcId}.
   *
   * @throws com.gentoro.npcmemory.exception.MutationAuthorityException if the acting NPC is not the
   *     relationship owner
   */
  public RelationshipEntry setRelationship(String actingNpcId, RelationshipEntry entry) {
    Objects.requireNonNull(entry, "entry");
    RelationshipAuthority.requireOwner(entry.getOwnerNpcId(), actingNpcId);
    relationships.put(RelationshipKey.of(entry.getOwnerNpcId(), entry.getTargetId()), entry);
    log.debug("Set relationship {}", entry);
    return entry;
  }

  /**
   * Remove a relationship on behalf of {@code actingNpcId}; false if it did not exist.
   *
   * @throws com.gentoro.npcmemory.exception.MutationAuthorityException if the acting NPC is not the
   *     relationship owner
   */
  public boolean removeRelationship(String actingNpcId, String ownerNpcId, String targetId) {
    Objects.requireNonNull(ownerNpcId, "ownerNpcId");
    Objects.requireNonNull(targetId, "targetId");
    RelationshipAuthority.requireOwner(ownerNpcId, actingNpcId);
    return relationships.remove(RelationshipKey.of(ownerNpcId, targetId)) != null;
  }

  public Optional<RelationshipEntry> getRelationship(String ownerNpcId, String targetId) {
    if (ownerNpcId == null || targetId == null) return Optional.empty();
    return Optional.ofNullable(relationships.get(RelationshipKey.of(ownerNpcId, targetId)));
  }

  /** Relationships owned by {@code ownerNpcId}, ordered by target. */
  public List<RelationshipEntry> getRelationships(String ownerNpcId) {
    if (ownerNpcId == null) return List.of();
    return relationships.entrySet().stream()
        .filter(e -> e.getKey().owner().equals(MemoryKey.of(ownerNpcId)))
        .sorted(Map.Entry.comparingByKey())
        .map(Map.Entry::getValue)
        .toList();
  }

  public List<RelationshipEntry> getAllRelationships() {
    return relationships.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .map(Map.Entry::getValue)
        .toList();
  }

  // ---------------------------------------------------------------------------------------------
  // Authority, sequencing and restore
  // ---------------------------------------------------------------------------------------------

  /** Whether {@code source} may change memory of {@code authority}. Advisory only. */
  public boolean validateMutation(MemoryAuthority authority, MutationSource source) {
    return source != null && source.canMutate(authority);
  }

  public long getNextSequenceNumber() {
    return nextSequenceNumber;
  }

  /** Reset the counter to one past the highest sequence number currently held. */
  public void recalculateNextSequenceNumber() {
    long max = 0;
    for (CanonicalFact fact : canonicalFacts.values()) max = Math.max(max, fact.getSequenceNumber());
    for (WorldStateEntry entry : worldState.values()) max = Math.max(max, entry.getSequenceNumber());
    for (EpisodicMemoryEntry m : episodicMemories) max = Math.max(max, m.getSequenceNumber());
    for (BeliefMemoryEntry belief : beliefs.values()) max = Math.max(max, belief.getSequenceNumber());
    nextSequenceNumber = max + 1;
    log.debug("Recalculated next sequence number: {}", nextSequenceNumber);
  }

  /** Insert a persisted fact verbatim, keeping its timestamp and sequence number. */
  public void restoreCanonicalFact(CanonicalFact fact, long sequenceNumber) {
    Objects.requireNonNull(fact, "fact");
    if (canonicalFacts.containsKey(fact.getId())) {
      throw new DuplicateIdException("Canonical fact", fact.getId());
    }
    CanonicalFact stored = fact.copy();
    stampRestored(stored, sequenceNumber);
    canonicalFacts.put(stored.getId(), stored);
  }

  public void restoreWorldState(WorldStateEntry entry, long sequenceNumber) {
    Objects.requireNonNull(entry, "entry");
    WorldStateEntry stored = entry.copy();
    if (stored.getId() == null) stored.assignId(idGenerator.generateId());
    stampRestored(stored, sequenceNumber);
    worldState.put(MemoryKey.of(stored.getKey()), stored);
  }

  public void restoreEpisodicMemory(EpisodicMemoryEntry entry, long sequenceNumber) {
    Objects.requireNonNull(entry, "entry");
    EpisodicMemoryEntry stored = entry.copy();
    if (stored.getId() == null || stored.getId().isEmpty()) {
      throw new ValidationException("Restored episodic memory must carry an id");
    }
    stampRestored(stored, sequenceNumber);
    episodicMemories.add(stored);
  }

  public void restoreBelief(String id, BeliefMemoryEntry entry, long sequenceNumber) {
    MemoryKey key = MemoryKey.of(id);
    Objects.requireNonNull(entry, "entry");
    BeliefMemoryEntry stored = entry.copy();
    stored.assignId(id);
    stampRestored(stored, sequenceNumber);
    beliefs.put(key, stored);
  }

  private void stampRestored(MemoryEntry entry, long sequenceNumber) {
    if (sequenceNumber <= MemoryEntry.UNASSIGNED_SEQUENCE) {
      throw new ValidationException(
          "Restored entry %s needs a positive sequence number".formatted(entry.getId()));
    }
    if (!entry.hasCreatedAtTicks()) {
      throw new ValidationException(
          "Restored entry %s needs its original creation time".formatted(entry.getId()));
    }
    entry.assignSequenceNumber(sequenceNumber);
  }

  /** Drop all memory and restart sequencing at 1. */
  public void clear() {
    canonicalFacts.clear();
    worldState.clear();
    episodicMemories.clear();
    beliefs.clear();
    relationships.clear();
    nextSequenceNumber = 1;
    log.debug("All memories cleared");
  }

  // ---------------------------------------------------------------------------------------------
  // Reporting
  // ---------------------------------------------------------------------------------------------

  public MemoryStatistics getStatistics() {
    return new MemoryStatistics(
        canonicalFacts.size(),
        worldState.size(),
        episodicMemories.size(),
        (int) episodicMemories.stream().filter(EpisodicMemoryEntry::isActive).count(),
        beliefs.size(),
        (int) beliefs.values().stream().filter(b -> !b.isContradicted()).count(),
        relationships.size());
  }

  /**
   * Flat prompt rendering of everything held: facts, state, the {@code maxEpisodic} most recent
   * memories, then beliefs (contradicted ones only when requested, tagged "[Uncertain]").
   */
  public List<String> getAllMemoriesForPrompt(int maxEpisodic, boolean includeContradicted) {
    List<String> lines = new ArrayList<>();
    for (CanonicalFact fact : sorted(canonicalFacts.values())) {
      lines.add("[Fact] " + fact.getContent());
    }
    for (WorldStateEntry entry : sorted(worldState.values())) {
      lines.add("[State] " + entry.getContent());
    }
    for (EpisodicMemoryEntry memory : getRecentMemories(maxEpisodic)) {
      lines.add("[Memory] " + memory.getContent());
    }
    for (BeliefMemoryEntry belief : sorted(beliefs.values())) {
      if (belief.isContradicted()) {
        if (includeContradicted) lines.add("[Uncertain] " + belief.getSummary());
      } else {
        lines.add(belief.getSummary());
      }
    }
    return Collections.unmodifiableList(lines);
  }

  /**
   * SHA-256 over a canonical rendering of all entries in sequence order. Two stores that hold the
   * same entries with the same provenance hash identically.
   */
  public String computeStateHash() {
    StringBuilder sb = new StringBuilder();
    sb.append("NextSequenceNumber:").append(nextSequenceNumber).append('\n');
    for (CanonicalFact f : sorted(canonicalFacts.values())) {
      line(sb, "F|%s|%s|%s|%d|%d",
          f.getId(), f.getContent(), f.getDomain() == null ? "" : f.getDomain(),
          f.getCreatedAtTicks(), f.getSequenceNumber());
    }
    for (WorldStateEntry w : sorted(worldState.values())) {
      line(sb, "W|%s|%s|%s|%d|%d",
          w.getKey(), w.getValue(), w.getSource(), w.getCreatedAtTicks(), w.getSequenceNumber());
    }
    for (EpisodicMemoryEntry e : sorted(episodicMemories)) {
      line(sb, "E|%s|%s|%.6f|%.6f|%d|%d",
          e.getId(), e.getDescription(), e.getSignificance(), e.getStrength(),
          e.getCreatedAtTicks(), e.getSequenceNumber());
    }
    for (BeliefMemoryEntry b : sorted(beliefs.values())) {
      line(sb, "B|%s|%s|%.6f|%b|%d|%d",
          b.getId(), b.getBeliefContent(), b.getConfidence(), b.isContradicted(),
          b.getCreatedAtTicks(), b.getSequenceNumber());
    }
    for (RelationshipEntry r : getAllRelationships()) {
      line(sb, "R|%s|%s|%s", r.getOwnerNpcId(), r.getTargetId(), r.getRelationshipLabel());
    }
    return StringUtility.sha256Hex(sb.toString());
  }

  private static void line(StringBuilder sb, String format, Object... args) {
    sb.append(String.format(Locale.ROOT, format, args)).append('\n');
  }

  @SuppressWarnings("unchecked")
  private static <T extends MemoryEntry> List<T> snapshot(Collection<T> entries) {
    return entries.stream().sorted(BY_SEQUENCE).map(e -> (T) e.copy()).toList();
  }

  private static <T extends MemoryEntry> List<T> sorted(Collection<T> entries) {
    return entries.stream().sorted(BY_SEQUENCE).toList();
  }

  private record RelationshipKey(MemoryKey owner, MemoryKey target)
      implements Comparable<RelationshipKey> {
    static RelationshipKey of(String owner, String target) {
      return new RelationshipKey(MemoryKey.of(owner), MemoryKey.of(target));
    }

    @Override
    public int compareTo(RelationshipKey o) {
      int c = owner.compareTo(o.owner);
      return c != 0 ? c : target.compareTo(o.target);
    }
  }
}
