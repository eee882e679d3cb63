package com.cactisynth.render;

/** Mono samples with their sample rate. */
public record AudioClip(double[] samples, int sampleRate) {

  public AudioClip {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive");
    }
  }
}
