package com.gentoro.npcmemory.snapshot;

public enum ConstraintSeverity {
  SOFT,
  HARD,
  CRITICAL
}
