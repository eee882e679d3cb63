package com.cactisynth.persistence;

import com.cactisynth.model.Note;
import com.cactisynth.model.Project;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON payload of a project container.
 *
 * <p>Paths are stored as plain strings so a project saved on one machine loads on another.
 */
public record ProjectSnapshot(
    String version,
    double tempo,
    int tracks,
    String name,
    String voiceDir,
    String outFile,
    String cacheDir,
    List<String> tools,
    List<String> modes,
    List<String> flags,
    List<Note> notes) {

  static ProjectSnapshot of(Project project) {
    return new ProjectSnapshot(
        project.getVersion(),
        project.getTempo(),
        project.getTracks(),
        project.getName(),
        project.getVoiceDir().toString(),
        project.getOutFile().toString(),
        project.getCacheDir().toString(),
        List.copyOf(project.getTools()),
        List.copyOf(project.getModes()),
        List.copyOf(project.getFlags()),
        List.copyOf(project.getNotes()));
  }

  Project toProject() {
    Project project = new Project();
    project.setVersion(version == null ? "" : version);
    project.setTempo(tempo);
    project.setTracks(tracks);
    project.setName(name == null ? Project.DEFAULT_NAME : name);
    project.setVoiceDir(Path.of(voiceDir == null ? "" : voiceDir));
    project.setOutFile(Path.of(outFile == null ? "" : outFile));
    project.setCacheDir(Path.of(cacheDir == null ? "" : cacheDir));
    withoutNulls("tools", tools).forEach(project::addTool);
    withoutNulls("modes", modes).forEach(project::addMode);
    withoutNulls("flags", flags).forEach(project::addFlag);
    project.replaceNotes(withoutNulls("notes", notes));
    return project;
  }

  private static <T> List<T> withoutNulls(String field, List<T> values) {
    if (values == null) {
      return List.of();
    }
    for (T value : values) {
      if (value == null) {
        throw new IllegalArgumentException("'" + field + "' contains a null entry");
      }
    }
    return values;
  }
}
