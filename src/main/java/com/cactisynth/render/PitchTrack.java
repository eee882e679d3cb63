package com.cactisynth.render;

/**
 * Pitch estimated over time.
 *
 * @param timestamps analysis times in seconds
 * @param frequencies estimated pitch in Hz at each timestamp
 */
public record PitchTrack(double[] timestamps, double[] frequencies) {

  public PitchTrack {
    if (timestamps.length != frequencies.length) {
      throw new IllegalArgumentException(
          "Timestamps and frequencies must have the same length: "
              + timestamps.length
              + " != "
              + frequencies.length);
    }
  }

  public int size() {
    return timestamps.length;
  }
}
