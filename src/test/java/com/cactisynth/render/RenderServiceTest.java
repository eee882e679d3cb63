package com.cactisynth.render;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.cactisynth.model.Note;
import com.cactisynth.model.Project;
import com.cactisynth.oto.OtoEntry;
import com.cactisynth.voicebank.ResolvedSample;
import com.cactisynth.voicebank.VoiceBank;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RenderServiceTest {

  @Mock private RenderPlanner planner;
  @Mock private SampleSource sampleSource;
  @Mock private VoiceRenderer voiceRenderer;
  @Mock private VoiceBank voiceBank;

  private RenderService service;
  private Project project;
  private NotePlan plan;

  @BeforeEach
  void setUp() {
    service = new RenderService(planner, sampleSource, voiceRenderer);
    project = new Project().addNote(Note.of(480, "あ", 69));
    plan =
        new NotePlan(
            0,
            project.getNotes().get(0),
            new ResolvedSample("Teto", OtoEntry.of("a.wav", "あ"), Path.of("/vb/a.wav")),
            440.0,
            1.0);
  }

  @Test
  void render_shouldEstimateThenResynthesizeEachNote() {
    double[] samples = {0.1, 0.2, 0.3};
    double[] timestamps = {0.0, 0.01};
    double[] frequencies = {220.0, 221.0};
    double[] output = {0.5, 0.6};
    when(planner.plan(project, voiceBank)).thenReturn(List.of(plan));
    when(sampleSource.read(Path.of("/vb/a.wav"))).thenReturn(new AudioClip(samples, 44100));
    when(voiceRenderer.estimatePitch(samples, 44100))
        .thenReturn(new PitchTrack(timestamps, frequencies));
    when(voiceRenderer.resynthesize(samples, 44100, timestamps, frequencies, 440.0, 1.0, 0.0))
        .thenReturn(output);

    List<RenderedNote> rendered = service.render(project, voiceBank);

    assertThat(rendered).hasSize(1);
    assertThat(rendered.get(0).plan()).isSameAs(plan);
    assertThat(rendered.get(0).samples()).containsExactly(0.5, 0.6);
    assertThat(rendered.get(0).sampleRate()).isEqualTo(44100);
  }

  @Test
  void render_shouldWrapCollaboratorFailures() {
    double[] samples = {0.1};
    when(planner.plan(project, voiceBank)).thenReturn(List.of(plan));
    when(sampleSource.read(any(Path.class))).thenReturn(new AudioClip(samples, 44100));
    when(voiceRenderer.estimatePitch(samples, 44100))
        .thenThrow(new ArithmeticException("silent sample"));

    assertThatThrownBy(() -> service.render(project, voiceBank))
        .isInstanceOf(VoiceRenderException.class)
        .hasMessageContaining("note 0")
        .hasMessageContaining("silent sample")
        .hasCauseInstanceOf(ArithmeticException.class);
  }

  @Test
  void render_shouldPassThroughSampleDecodingFailures() {
    when(planner.plan(project, voiceBank)).thenReturn(List.of(plan));
    when(sampleSource.read(any(Path.class)))
        .thenThrow(new VoiceRenderException("cannot decode a.wav"));

    assertThatThrownBy(() -> service.render(project, voiceBank))
        .isInstanceOf(VoiceRenderException.class)
        .hasMessage("cannot decode a.wav");
    verify(voiceRenderer, never())
        .resynthesize(any(), anyInt(), any(), any(), anyDouble(), anyDouble(), eq(0.0));
  }

  @Test
  void render_shouldReturnEmptyWhenNothingIsPlanned() {
    when(planner.plan(project, voiceBank)).thenReturn(List.of());

    assertThat(service.render(project, voiceBank)).isEmpty();
  }
}
