package com.cactisynth.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ProjectTest {

  private static Note note(String lyric, int startPoint) {
    return Note.of(480, lyric, 60).withStartPoint(startPoint);
  }

  @Test
  void newProject_shouldHaveDefaults() {
    Project project = new Project();

    assertThat(project.getVersion()).isEmpty();
    assertThat(project.getTempo()).isEqualTo(120.0);
    assertThat(project.getTracks()).isEqualTo(1);
    assertThat(project.getName()).isEqualTo("Untitled");
    assertThat(project.getVoiceDir().toString()).isEmpty();
    assertThat(project.getTools()).isEmpty();
    assertThat(project.isEmpty()).isTrue();
  }

  @Test
  void addNote_shouldKeepNotesSortedForAnyInsertionOrder() {
    Random random = new Random(42);
    for (int round = 0; round < 50; round++) {
      List<Note> notes = new ArrayList<>();
      for (int i = 0; i < 20; i++) {
        notes.add(note("n" + i, random.nextInt(10) * 120));
      }
      Collections.shuffle(notes, random);

      Project project = new Project();
      int split = random.nextInt(notes.size());
      project.addNotes(notes.subList(0, split));
      notes.subList(split, notes.size()).forEach(project::addNote);

      assertThat(project.getNotes())
          .hasSize(20)
          .isSortedAccordingTo(Comparator.comparingInt(Note::startPoint));
    }
  }

  @Test
  void addNote_shouldInsertAtFrontWhenAtOrBeforeFirst() {
    Project project = new Project().addNote(note("b", 480), note("c", 960));

    project.addNote(note("a", 0));
    project.addNote(note("tie-first", 0));

    assertThat(project.getNotes())
        .extracting(Note::lyric)
        .containsExactly("tie-first", "a", "b", "c");
  }

  @Test
  void addNote_shouldAppendWhenAtOrAfterLast() {
    Project project = new Project().addNote(note("a", 0), note("b", 480));

    project.addNote(note("tie-last", 480));
    project.addNote(note("after", 960));

    assertThat(project.getNotes())
        .extracting(Note::lyric)
        .containsExactly("a", "b", "tie-last", "after");
  }

  @Test
  void addNote_shouldPlaceInteriorTieAfterEqualRun() {
    Project project =
        new Project().addNote(note("a", 0), note("b1", 480), note("b2", 480), note("c", 960));

    project.addNote(note("b3", 480));

    assertThat(project.getNotes())
        .extracting(Note::lyric)
        .containsExactly("a", "b1", "b2", "b3", "c");
  }

  @Test
  void addNote_shouldInsertBeforeFirstGreaterStartPoint() {
    Project project = new Project().addNote(note("a", 0), note("c", 960));

    project.addNote(note("b", 480));

    assertThat(project.getNotes()).extracting(Note::lyric).containsExactly("a", "b", "c");
  }

  @Test
  void addNote_shouldResortAfterDescendingSort() {
    Project project = new Project().addNote(note("a", 0), note("c", 960));
    project.sortNotes(true);

    project.addNote(note("b", 480));

    assertThat(project.getNotes()).extracting(Note::lyric).containsExactly("a", "b", "c");
  }

  @Test
  void removeNoteByIndex_shouldRemoveNote() {
    Project project = new Project().addNote(note("a", 0), note("b", 480));

    project.removeNoteByIndex(0);

    assertThat(project.getNotes()).extracting(Note::lyric).containsExactly("b");
  }

  @Test
  void removeNoteByIndex_shouldRejectOutOfRangeAndLeaveProjectUnchanged() {
    Project project = new Project().addNote(note("a", 0), note("b", 480));

    assertThatThrownBy(() -> project.removeNoteByIndex(2))
        .isInstanceOf(NoteIndexOutOfRangeException.class)
        .hasMessageContaining("2");
    assertThatThrownBy(() -> project.removeNoteByIndex(-1))
        .isInstanceOf(NoteIndexOutOfRangeException.class);

    assertThat(project.getNotes()).extracting(Note::lyric).containsExactly("a", "b");
  }

  @Test
  void getNote_shouldReturnEmptyWhenOutOfRange() {
    Project project = new Project().addNote(note("a", 0));

    assertThat(project.getNote(0)).contains(note("a", 0));
    assertThat(project.getNote(1)).isEmpty();
    assertThat(project.getNote(-1)).isEmpty();
  }

  @Test
  void sortNotes_shouldBeStableInBothDirections() {
    Project project = new Project();
    project.replaceNotes(
        List.of(note("x1", 480), note("y", 0), note("x2", 480), note("z", 960)));

    assertThat(project.getNotes())
        .extracting(Note::lyric)
        .containsExactly("y", "x1", "x2", "z");

    project.sortNotes(true);

    assertThat(project.getNotes())
        .extracting(Note::lyric)
        .containsExactly("z", "x1", "x2", "y");
  }

  @Test
  void getNotes_shouldBeUnmodifiable() {
    Project project = new Project().addNote(note("a", 0));

    assertThatThrownBy(() -> project.getNotes().add(note("b", 10)))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void setTempo_shouldRejectNonPositive() {
    assertThatThrownBy(() -> new Project().setTempo(0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Tempo");
  }
}
