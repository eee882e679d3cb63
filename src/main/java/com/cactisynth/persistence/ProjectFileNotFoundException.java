package com.cactisynth.persistence;

import java.nio.file.Path;

/** Thrown when a project file to load does not exist or is not a regular file. */
public class ProjectFileNotFoundException extends ProjectStoreException {

  private final Path path;

  public ProjectFileNotFoundException(Path path) {
    super(path + " is not a file, or does not exist");
    this.path = path;
  }

  public Path getPath() {
    return path;
  }
}
