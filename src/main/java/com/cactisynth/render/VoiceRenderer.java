package com.cactisynth.render;

/**
 * Pitch analysis and resynthesis, provided by an external DSP library.
 *
 * <p>This project only defines the contract; an implementation wraps a neural pitch tracker and a
 * vocoder. Implementations report failures as {@link VoiceRenderException}.
 */
public interface VoiceRenderer {

  /**
   * Estimate the pitch of a sample.
   *
   * @param samples mono audio samples
   * @param sampleRate sample rate in Hz
   * @return pitch over time
   */
  PitchTrack estimatePitch(double[] samples, int sampleRate);

  /**
   * Resynthesize a sample at a new pitch.
   *
   * @param samples mono audio samples
   * @param sampleRate sample rate in Hz
   * @param timestamps analysis times from {@link #estimatePitch}
   * @param frequencies estimated pitch from {@link #estimatePitch}
   * @param targetPitch target pitch in Hz
   * @param speedRatio playback speed of the consonant part, 1.0 is unchanged
   * @param formantShift formant shift in semitones, 0.0 is unchanged
   * @return the resynthesized samples at the same sample rate
   */
  double[] resynthesize(
      double[] samples,
      int sampleRate,
      double[] timestamps,
      double[] frequencies,
      double targetPitch,
      double speedRatio,
      double formantShift);
}
