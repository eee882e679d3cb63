package com.cactisynth.persistence;

import java.nio.file.Path;

/**
 * Thrown when a file exists but is not a readable project container.
 *
 * <p>No project is produced when this is thrown, not even a partial one.
 */
public class InvalidProjectFileException extends ProjectStoreException {

  /** What was wrong with the container. */
  public enum Reason {
    BAD_MAGIC,
    UNSUPPORTED_VERSION,
    WRONG_TYPE,
    TRUNCATED,
    CHECKSUM_MISMATCH,
    MALFORMED_PAYLOAD
  }

  private final Path path;
  private final Reason reason;

  public InvalidProjectFileException(Path path, Reason reason, String detail) {
    super(String.format("%s is not a valid project file (%s: %s)", path, reason, detail));
    this.path = path;
    this.reason = reason;
  }

  public InvalidProjectFileException(Path path, Reason reason, String detail, Throwable cause) {
    super(String.format("%s is not a valid project file (%s: %s)", path, reason, detail), cause);
    this.path = path;
    this.reason = reason;
  }

  public Path getPath() {
    return path;
  }

  public Reason getReason() {
    return reason;
  }
}
