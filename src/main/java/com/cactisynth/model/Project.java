package com.cactisynth.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A song project: scalar settings, tool/mode/flag lists and an ordered sequence of notes.
 *
 * <p>Notes are kept in ascending start point order by every mutating operation except an explicit
 * descending {@link #sortNotes(boolean)}. The project owns its notes; callers only ever see an
 * unmodifiable view.
 */
public class Project {

  public static final double DEFAULT_TEMPO = 120.0;
  public static final int DEFAULT_TRACKS = 1;
  public static final String DEFAULT_NAME = "Untitled";

  private static final Comparator<Note> BY_START_POINT = Comparator.comparingInt(Note::startPoint);

  private String version = "";
  private double tempo = DEFAULT_TEMPO;
  private int tracks = DEFAULT_TRACKS;
  private String name = DEFAULT_NAME;
  private Path voiceDir = Path.of("");
  private Path outFile = Path.of("");
  private Path cacheDir = Path.of("");

  private final List<String> tools = new ArrayList<>();
  private final List<String> modes = new ArrayList<>();
  private final List<String> flags = new ArrayList<>();
  private final List<Note> notes = new ArrayList<>();

  public Project() {}

  public Project(String name, double tempo) {
    setName(name);
    setTempo(tempo);
  }

  /**
   * Add notes, keeping the sequence ordered by start point.
   *
   * <p>Existing notes are re-sorted ascending first, then each note is inserted at the index given
   * by {@link #insertionIndex(int)}.
   *
   * @param newNotes notes to insert, in any order
   * @return this project
   */
  public Project addNote(Note... newNotes) {
    return addNotes(List.of(newNotes));
  }

  public Project addNotes(List<Note> newNotes) {
    sortNotes(false);
    for (Note note : newNotes) {
      Objects.requireNonNull(note, "note");
      notes.add(insertionIndex(note.startPoint()), note);
    }
    return this;
  }

  /**
   * Replace all notes, sorted ascending by start point. Unlike {@link #addNotes(List)} this keeps
   * the given order of notes that share a start point.
   */
  public Project replaceNotes(List<Note> newNotes) {
    newNotes.forEach(note -> Objects.requireNonNull(note, "note"));
    notes.clear();
    notes.addAll(newNotes);
    return sortNotes(false);
  }

  /**
   * Index at which a note starting at {@code startPoint} is inserted.
   *
   * <p>At or before the first start point goes to the front, at or after the last goes to the end,
   * anything else goes before the first strictly greater start point. A tie with an interior value
   * therefore lands after the run of equal start points, while a tie with the first value lands
   * before it.
   */
  int insertionIndex(int startPoint) {
    if (notes.isEmpty() || startPoint <= notes.get(0).startPoint()) {
      return 0;
    }
    if (startPoint >= notes.get(notes.size() - 1).startPoint()) {
      return notes.size();
    }
    for (int i = 0; i < notes.size(); i++) {
      if (notes.get(i).startPoint() > startPoint) {
        return i;
      }
    }
    return notes.size();
  }

  /**
   * Remove the note at a position.
   *
   * @throws NoteIndexOutOfRangeException if there is no note at {@code index}
   */
  public Project removeNoteByIndex(int index) {
    if (index < 0 || index >= notes.size()) {
      throw new NoteIndexOutOfRangeException(index, notes.size());
    }
    notes.remove(index);
    return this;
  }

  /** The note at a position, or empty if the index is out of range. */
  public Optional<Note> getNote(int index) {
    if (index < 0 || index >= notes.size()) {
      return Optional.empty();
    }
    return Optional.of(notes.get(index));
  }

  /** Stable sort by start point; notes with equal start points keep their relative order. */
  public Project sortNotes(boolean descending) {
    notes.sort(descending ? BY_START_POINT.reversed() : BY_START_POINT);
    return this;
  }

  public boolean isEmpty() {
    return notes.isEmpty();
  }

  public int noteCount() {
    return notes.size();
  }

  public List<Note> getNotes() {
    return Collections.unmodifiableList(notes);
  }

  public String getVersion() {
    return version;
  }

  public void setVersion(String version) {
    this.version = Objects.requireNonNull(version, "version");
  }

  public double getTempo() {
    return tempo;
  }

  public void setTempo(double tempo) {
    if (!(tempo > 0)) {
      throw new IllegalArgumentException("Tempo must be positive but was " + tempo);
    }
    this.tempo = tempo;
  }

  public int getTracks() {
    return tracks;
  }

  public void setTracks(int tracks) {
    if (tracks < 0) {
      throw new IllegalArgumentException("Tracks cannot be negative");
    }
    this.tracks = tracks;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public Path getVoiceDir() {
    return voiceDir;
  }

  public void setVoiceDir(Path voiceDir) {
    this.voiceDir = Objects.requireNonNull(voiceDir, "voiceDir");
  }

  public Path getOutFile() {
    return outFile;
  }

  public void setOutFile(Path outFile) {
    this.outFile = Objects.requireNonNull(outFile, "outFile");
  }

  public Path getCacheDir() {
    return cacheDir;
  }

  public void setCacheDir(Path cacheDir) {
    this.cacheDir = Objects.requireNonNull(cacheDir, "cacheDir");
  }

  public List<String> getTools() {
    return Collections.unmodifiableList(tools);
  }

  public void addTool(String tool) {
    tools.add(Objects.requireNonNull(tool, "tool"));
  }

  public List<String> getModes() {
    return Collections.unmodifiableList(modes);
  }

  public void addMode(String mode) {
    modes.add(Objects.requireNonNull(mode, "mode"));
  }

  public List<String> getFlags() {
    return Collections.unmodifiableList(flags);
  }

  public void addFlag(String flag) {
    flags.add(Objects.requireNonNull(flag, "flag"));
  }

  @Override
  public String toString() {
    return String.format(
        "Project[name=%s, version=%s, tempo=%s, tracks=%d, notes=%d]",
        name, version, tempo, tracks, notes.size());
  }
}
