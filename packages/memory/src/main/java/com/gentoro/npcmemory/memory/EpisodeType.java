package com.gentoro.npcmemory.memory;

public enum EpisodeType {
  DIALOGUE,
  OBSERVATION,
  THOUGHT,
  EVENT,
  LEARNED_INFO
}
