package com.cactisynth.model;

import java.util.Objects;

/**
 * A single sung syllable.
 *
 * <p>Lengths and start points are in ticks. All numeric fields must be non-negative; the compact
 * constructor validates them field by field and reports the first violation.
 *
 * @param length duration in ticks
 * @param lyric the sung text, also the alias looked up in the voicebank
 * @param noteNum pitch index (60 = middle C)
 * @param preUtterance lead-in offset
 * @param velocity consonant speed, 100 is unchanged
 * @param intensity loudness
 * @param modulation pitch-bend depth
 * @param startPoint absolute tick offset in the song
 */
public record Note(
    int length,
    String lyric,
    int noteNum,
    int preUtterance,
    int velocity,
    int intensity,
    int modulation,
    int startPoint) {

  public static final int DEFAULT_VELOCITY = 100;

  public Note {
    Objects.requireNonNull(lyric, "lyric");
    requireNonNegative("length", length);
    requireNonNegative("noteNum", noteNum);
    requireNonNegative("preUtterance", preUtterance);
    requireNonNegative("velocity", velocity);
    requireNonNegative("intensity", intensity);
    requireNonNegative("modulation", modulation);
    requireNonNegative("startPoint", startPoint);
  }

  /** A note with default pre-utterance, velocity, intensity, modulation and start point. */
  public static Note of(int length, String lyric, int noteNum) {
    return new Note(length, lyric, noteNum, 0, DEFAULT_VELOCITY, 0, 0, 0);
  }

  public Note withStartPoint(int startPoint) {
    return new Note(
        length, lyric, noteNum, preUtterance, velocity, intensity, modulation, startPoint);
  }

  private static void requireNonNegative(String field, int value) {
    if (value < 0) {
      throw new InvalidNoteException(field, value);
    }
  }
}
