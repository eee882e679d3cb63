package com.cactisynth.render;

import com.cactisynth.model.Project;
import com.cactisynth.voicebank.VoiceBank;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a project with a voicebank. This is what a front end calls to start rendering.
 *
 * <p>Notes are rendered one after another in project order: decode the sample, estimate its
 * pitch, then resynthesize it at the note's pitch. The first failure stops the render.
 *
 * <p>Not a Spring bean: the sample decoder and the renderer come from outside this project, so
 * whoever provides them constructs the service.
 */
public class RenderService {

  private static final Logger LOGGER = LoggerFactory.getLogger(RenderService.class);

  private final RenderPlanner planner;
  private final SampleSource sampleSource;
  private final VoiceRenderer voiceRenderer;

  public RenderService(
      RenderPlanner planner, SampleSource sampleSource, VoiceRenderer voiceRenderer) {
    this.planner = planner;
    this.sampleSource = sampleSource;
    this.voiceRenderer = voiceRenderer;
  }

  /**
   * Render every singable note of {@code project}.
   *
   * @throws VoiceRenderException if a sample cannot be decoded or the renderer fails
   */
  public List<RenderedNote> render(Project project, VoiceBank voiceBank) {
    List<NotePlan> plans = planner.plan(project, voiceBank);
    List<RenderedNote> rendered = new ArrayList<>(plans.size());
    long started = System.currentTimeMillis();

    for (NotePlan plan : plans) {
      rendered.add(renderNote(plan));
    }

    LOGGER.info(
        "Rendered project {}: notes={}, elapsed={}ms",
        project.getName(),
        rendered.size(),
        System.currentTimeMillis() - started);
    return rendered;
  }

  private RenderedNote renderNote(NotePlan plan) {
    try {
      AudioClip clip = sampleSource.read(plan.sample().samplePath());
      PitchTrack pitch = voiceRenderer.estimatePitch(clip.samples(), clip.sampleRate());
      double[] samples =
          voiceRenderer.resynthesize(
              clip.samples(),
              clip.sampleRate(),
              pitch.timestamps(),
              pitch.frequencies(),
              plan.targetPitch(),
              plan.speedRatio(),
              0.0);
      LOGGER.debug(
          "Rendered note {}: lyric={}, sample={}, target={}Hz",
          plan.noteIndex(),
          plan.note().lyric(),
          plan.sample().samplePath(),
          plan.targetPitch());
      return new RenderedNote(plan, samples, clip.sampleRate());
    } catch (VoiceRenderException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new VoiceRenderException(
          String.format(
              "Rendering failed for note %d (%s): %s",
              plan.noteIndex(), plan.sample().samplePath(), e.getMessage()),
          e);
    }
  }
}
