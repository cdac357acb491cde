package com.gentoro.npcmemory.retrieval;

import com.gentoro.npcmemory.memory.MemoryEntry;
import java.util.Comparator;

/** A candidate memory together with the score it was ranked by. */
public record ScoredItem<T extends MemoryEntry>(T item, double score) {

  /**
   * Total order used for ranked categories: score descending, then newer first, then id
   * ascending (ordinal), then sequence number ascending. Scores compare with {@link
   * Double#compare}, so values that differ only in the last bits are still ordered.
   */
  public static <T extends MemoryEntry> Comparator<ScoredItem<T>> rankingOrder() {
    return (a, b) -> {
      int c = Double.compare(b.score, a.score);
      if (c != 0) return c;
      c = Long.compare(b.item.getCreatedAtTicks(), a.item.getCreatedAtTicks());
      if (c != 0) return c;
      c = compareIds(a.item.getId(), b.item.getId());
      if (c != 0) return c;
      return Long.compare(a.item.getSequenceNumber(), b.item.getSequenceNumber());
    };
  }

  private static int compareIds(String a, String b) {
    if (a == null) return b == null ? 0 : -1;
    if (b == null) return 1;
    return a.compareTo(b);
  }
}
