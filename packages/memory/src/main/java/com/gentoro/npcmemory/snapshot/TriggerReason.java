package com.gentoro.npcmemory.snapshot;

/** What caused the NPC to speak. */
public enum TriggerReason {
  PLAYER_UTTERANCE,
  ZONE_TRIGGER,
  TIME_TRIGGER,
  QUEST_TRIGGER,
  NPC_INTERACTION,
  WORLD_EVENT,
  CUSTOM
}
