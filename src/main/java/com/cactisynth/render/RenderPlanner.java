package com.cactisynth.render;

import com.cactisynth.model.Note;
import com.cactisynth.model.Project;
import com.cactisynth.voicebank.ResolvedSample;
import com.cactisynth.voicebank.VoiceBank;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Matches project notes to voicebank samples.
 *
 * <p>A note's lyric is looked up as an OTO alias. Rests are skipped, as are lyrics the voicebank
 * has no sample for (with a warning). Note numbers follow MIDI, so 69 is A4 at 440 Hz. Velocity
 * 100 keeps the consonant speed, every further 100 doubles it.
 */
@Component
public class RenderPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(RenderPlanner.class);

  private static final Set<String> RESTS = Set.of("", "R", "r");

  public List<NotePlan> plan(Project project, VoiceBank voiceBank) {
    List<NotePlan> plans = new ArrayList<>();
    List<Note> notes = project.getNotes();
    for (int i = 0; i < notes.size(); i++) {
      Note note = notes.get(i);
      if (RESTS.contains(note.lyric())) {
        continue;
      }
      Optional<ResolvedSample> sample = voiceBank.resolveAlias(note.lyric());
      if (sample.isEmpty()) {
        LOGGER.warn(
            "No sample for lyric '{}' (note {}) in voicebank {}",
            note.lyric(),
            i,
            voiceBank.getName());
        continue;
      }
      plans.add(
          new NotePlan(
              i, note, sample.get(), frequencyOf(note.noteNum()), speedRatioOf(note.velocity())));
    }
    LOGGER.info("Planned {} of {} notes for rendering", plans.size(), notes.size());
    return plans;
  }

  static double frequencyOf(int noteNum) {
    return 440.0 * Math.pow(2.0, (noteNum - 69) / 12.0);
  }

  static double speedRatioOf(int velocity) {
    return Math.pow(2.0, (velocity - 100) / 100.0);
  }
}
