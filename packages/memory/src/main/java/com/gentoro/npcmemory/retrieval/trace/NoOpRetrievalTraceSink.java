package com.gentoro.npcmemory.retrieval.trace;

/** Used when tracing is disabled. */
public class NoOpRetrievalTraceSink implements RetrievalTraceSink {
  public static final NoOpRetrievalTraceSink INSTANCE = new NoOpRetrievalTraceSink();

  @Override
  public void retrievalCompleted(RetrievalTrace trace) {}
}
