package com.gentoro.npcmemory.snapshot;

public enum ConstraintType {
  /** Something the NPC must not say or do. */
  PROHIBITION,
  /** Something the NPC must say or do. */
  REQUIREMENT,
  /** Something the NPC is explicitly allowed to do. */
  PERMISSION
}
