package com.gentoro.npcmemory.retrieval.trace;

import com.gentoro.npcmemory.logging.LoggingService;
import com.gentoro.npcmemory.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes each retrieval as one JSON line at DEBUG, tagged {@code [memory.retrieval]}.
 *
 * <pre>
 * {
 *   "query": "Tell me about the dragon",
 *   "topics": ["dragon"],
 *   "candidates": {"beliefs": 2, "canonicalFacts": 4, "episodic": 7, "worldState": 3},
 *   "selected": {"beliefs": 2, "canonicalFacts": 4, "episodic": 5, "worldState": 3},
 *   "episodic": [{"id": "a1b2c3d4", "seq": 12, "score": 0.71}],
 *   "beliefs": [...],
 *   "protocolVersion": 1
 * }
 * </pre>
 *
 * Serialization is skipped entirely when DEBUG is off for the logger.
 */
public class LoggingRetrievalTraceSink implements RetrievalTraceSink {
  private static final int PROTOCOL_VERSION = 1;

  private final org.slf4j.Logger log;

  public LoggingRetrievalTraceSink() {
    this(LoggingService.getLogger(LoggingRetrievalTraceSink.class));
  }

  public LoggingRetrievalTraceSink(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void retrievalCompleted(RetrievalTrace trace) {
    if (trace == null || !log.isDebugEnabled()) return;
    log.debug("[memory.retrieval] {}", JacksonUtility.toJson(createPayload(trace)));
  }

  /** Build the payload map. Protected so tests can inspect it without a logger. */
  protected Map<String, Object> createPayload(RetrievalTrace trace) {
    Map<String, Object> payload = new LinkedHashMap<>();
    if (trace.query() != null) payload.put("query", trace.query());
    payload.put("topics", trace.topics());
    payload.put("candidates", trace.candidates());
    payload.put("selected", trace.selected());
    payload.put("episodic", scored(trace.episodic()));
    payload.put("beliefs", scored(trace.beliefs()));
    payload.put("protocolVersion", PROTOCOL_VERSION);
    return payload;
  }

  private static List<Map<String, Object>> scored(List<RetrievalTrace.Scored> items) {
    return items.stream()
        .map(
            s -> {
              Map<String, Object> m = new LinkedHashMap<>();
              m.put("id", s.id());
              m.put("seq", s.sequenceNumber());
              m.put("score", s.score());
              return m;
            })
        .toList();
  }
}
