package com.cactisynth.render;

import com.cactisynth.model.Note;
import com.cactisynth.voicebank.ResolvedSample;

/**
 * A note matched to the voicebank sample that will sing it.
 *
 * @param noteIndex position of the note in the project
 * @param note the note
 * @param sample the OTO entry and sample file for the note's lyric
 * @param targetPitch pitch in Hz for the note number
 * @param speedRatio consonant speed derived from velocity
 */
public record NotePlan(
    int noteIndex, Note note, ResolvedSample sample, double targetPitch, double speedRatio) {}
