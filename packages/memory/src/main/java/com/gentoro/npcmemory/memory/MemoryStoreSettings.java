package com.gentoro.npcmemory.memory;

import org.apache.commons.configuration2.Configuration;

/** Tunables of {@link AuthoritativeMemoryStore}. */
public final class MemoryStoreSettings {
  public static final double DEFAULT_EPISODIC_DECAY_RATE = 0.05;

  private final double episodicDecayRate;

  public MemoryStoreSettings(double episodicDecayRate) {
    this.episodicDecayRate =
        Double.isNaN(episodicDecayRate) ? 0.0 : Math.max(0.0, episodicDecayRate);
  }

  public static MemoryStoreSettings defaults() {
    return new MemoryStoreSettings(DEFAULT_EPISODIC_DECAY_RATE);
  }

  /** Reads {@code memory.store.episodic-decay-rate}. */
  public static MemoryStoreSettings fromConfiguration(Configuration cfg) {
    if (cfg == null) return defaults();
    return new MemoryStoreSettings(
        cfg.getDouble("memory.store.episodic-decay-rate", DEFAULT_EPISODIC_DECAY_RATE));
  }

  /** Strength removed from every active episodic memory per decay call. */
  public double episodicDecayRate() {
    return episodicDecayRate;
  }
}
