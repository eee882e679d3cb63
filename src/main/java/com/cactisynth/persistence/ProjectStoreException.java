package com.cactisynth.persistence;

import com.cactisynth.CactiSynthException;

/** Thrown when a project file cannot be written or read. */
public class ProjectStoreException extends CactiSynthException {

  public ProjectStoreException(String message) {
    super(message);
  }

  public ProjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
