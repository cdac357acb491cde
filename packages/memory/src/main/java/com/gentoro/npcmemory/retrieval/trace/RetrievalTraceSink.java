package com.gentoro.npcmemory.retrieval.trace;

/**
 * Receives one {@link RetrievalTrace} per completed retrieval.
 *
 * <p>Decouples {@code ContextRetrievalEngine} from whatever records ranking decisions (logs, test
 * probes, a debugging overlay). Implementations are called synchronously on the retrieving thread
 * and must not throw.
 */
public interface RetrievalTraceSink {

  void retrievalCompleted(RetrievalTrace trace);
}
