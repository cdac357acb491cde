package com.gentoro.npcmemory.retrieval.trace;

import java.util.List;
import java.util.Map;

/**
 * What one retrieval considered and selected.
 *
 * @param query raw query, may be null
 * @param topics normalized topics
 * @param candidates per category, how many entries passed filtering
 * @param selected per category, how many entries made it into the result
 * @param episodic selected episodic memories with their scores, in ranked order
 * @param beliefs selected beliefs with their scores, in ranked order
 */
public record RetrievalTrace(
    String query,
    List<String> topics,
    Map<String, Integer> candidates,
    Map<String, Integer> selected,
    List<Scored> episodic,
    List<Scored> beliefs) {

  public RetrievalTrace {
    topics = List.copyOf(topics);
    candidates = Map.copyOf(candidates);
    selected = Map.copyOf(selected);
    episodic = List.copyOf(episodic);
    beliefs = List.copyOf(beliefs);
  }

  public record Scored(String id, long sequenceNumber, double score) {}
}
