package com.cactisynth.persistence;

import com.cactisynth.CactiSynthException;
import com.cactisynth.config.CactiSynthProperties;
import com.cactisynth.model.Project;
import com.cactisynth.persistence.InvalidProjectFileException.Reason;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;
import java.util.zip.CRC32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Saves and loads projects as a versioned binary container.
 *
 * <p>Container layout (big-endian):
 *
 * <pre>
 * magic        4 bytes   "OKMT"
 * version      u16       format version, currently 1
 * type         UTF       top-level type tag, "Project"
 * length       u32       payload length in bytes
 * payload      bytes     UTF-8 JSON of the project
 * checksum     u32       CRC32 of the payload
 * </pre>
 *
 * <p>A file is written to a temporary sibling first and moved into place, so readers never see a
 * half-written container. Loading checks every part of the header and the checksum before the
 * payload is decoded.
 */
@Component
public class ProjectStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProjectStore.class);

  static final byte[] MAGIC = "OKMT".getBytes(StandardCharsets.US_ASCII);
  static final int FORMAT_VERSION = 1;
  static final String PROJECT_TYPE = "Project";

  private final CactiSynthProperties properties;
  private final ObjectMapper objectMapper;
  private final String extension;
  private final Path outputDirectory;

  public ProjectStore(CactiSynthProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.extension = properties.projectExtension();
    this.outputDirectory = properties.outputDirectory();
  }

  /**
   * A store that saves to another default directory. This store is left unchanged.
   *
   * @param outputPath the new directory
   * @param mkdir create the directory (and parents) if it does not exist
   * @return a store using {@code outputPath} for {@link #save(Project)}
   * @throws IllegalArgumentException if {@code outputPath} is an existing file
   */
  public ProjectStore withOutputPath(Path outputPath, boolean mkdir) {
    Objects.requireNonNull(outputPath, "outputPath");
    if (Files.isRegularFile(outputPath)) {
      throw new IllegalArgumentException("Output path (" + outputPath + ") is not a directory");
    }
    if (mkdir) {
      try {
        Files.createDirectories(outputPath);
      } catch (IOException e) {
        throw new ProjectStoreException("Failed to create output directory " + outputPath, e);
      }
    }
    return new ProjectStore(properties.withOutputPath(outputPath), objectMapper);
  }

  public Path getOutputPath() {
    return outputDirectory;
  }

  /** Save to the output directory as {@code <project name><extension>}. */
  public Path save(Project project) {
    return save(project, outputDirectory, null);
  }

  /**
   * Save a project.
   *
   * @param project the project
   * @param directory target directory, created if missing
   * @param fileName file name, or null for {@code <project name><extension>}
   * @return the written file
   * @throws IllegalArgumentException if {@code directory} is an existing file
   * @throws ProjectStoreException if writing fails
   */
  public Path save(Project project, Path directory, String fileName) {
    Objects.requireNonNull(project, "project");
    Objects.requireNonNull(directory, "directory");
    if (Files.isRegularFile(directory)) {
      throw new IllegalArgumentException("Output path (" + directory + ") is not a directory");
    }
    String name = fileName != null ? fileName : project.getName() + extension;
    Path target = directory.resolve(name);

    byte[] container = encode(project);
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, ".project-", ".tmp");
      Files.write(temp, container);
      moveIntoPlace(temp, target);
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new ProjectStoreException("Failed to save project to " + target, e);
    }

    LOGGER.info(
        "Saved project to {}: notes={}, bytes={}", target, project.noteCount(), container.length);
    return target;
  }

  /**
   * Load a project container.
   *
   * @throws ProjectFileNotFoundException if {@code path} is not a regular file
   * @throws InvalidProjectFileException if the file is not a complete, well-formed project
   *     container
   */
  public Project load(Path path) {
    Objects.requireNonNull(path, "path");
    if (!Files.isRegularFile(path)) {
      throw new ProjectFileNotFoundException(path);
    }
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (IOException e) {
      throw new ProjectStoreException("Failed to read project file " + path, e);
    }

    Project project = decode(path, bytes);
    LOGGER.info(
        "Loaded project from {}: name={}, notes={}", path, project.getName(), project.noteCount());
    return project;
  }

  byte[] encode(Project project) {
    try {
      byte[] payload = objectMapper.writeValueAsBytes(ProjectSnapshot.of(project));
      CRC32 crc = new CRC32();
      crc.update(payload);

      ByteArrayOutputStream buffer = new ByteArrayOutputStream(payload.length + 32);
      try (DataOutputStream out = new DataOutputStream(buffer)) {
        out.write(MAGIC);
        out.writeShort(FORMAT_VERSION);
        out.writeUTF(PROJECT_TYPE);
        out.writeInt(payload.length);
        out.write(payload);
        out.writeInt((int) crc.getValue());
      }
      return buffer.toByteArray();
    } catch (IOException e) {
      throw new ProjectStoreException("Failed to encode project " + project.getName(), e);
    }
  }

  Project decode(Path path, byte[] bytes) {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
      byte[] magic = new byte[MAGIC.length];
      in.readFully(magic);
      if (!Arrays.equals(magic, MAGIC)) {
        throw new InvalidProjectFileException(path, Reason.BAD_MAGIC, "missing container header");
      }
      int version = in.readUnsignedShort();
      if (version != FORMAT_VERSION) {
        throw new InvalidProjectFileException(
            path,
            Reason.UNSUPPORTED_VERSION,
            "expected version " + FORMAT_VERSION + " but found " + version);
      }
      String type = in.readUTF();
      if (!PROJECT_TYPE.equals(type)) {
        throw new InvalidProjectFileException(
            path, Reason.WRONG_TYPE, "expected " + PROJECT_TYPE + " but found " + type);
      }
      int length = in.readInt();
      if (length < 0 || length > in.available()) {
        throw new InvalidProjectFileException(
            path,
            Reason.TRUNCATED,
            "payload declares " + length + " bytes but " + in.available() + " remain");
      }
      byte[] payload = new byte[length];
      in.readFully(payload);
      long expected = Integer.toUnsignedLong(in.readInt());

      CRC32 crc = new CRC32();
      crc.update(payload);
      if (crc.getValue() != expected) {
        throw new InvalidProjectFileException(
            path, Reason.CHECKSUM_MISMATCH, "payload checksum does not match");
      }
      ProjectSnapshot snapshot = objectMapper.readValue(payload, ProjectSnapshot.class);
      if (snapshot == null) {
        throw new InvalidProjectFileException(
            path, Reason.MALFORMED_PAYLOAD, "payload does not contain a project");
      }
      return snapshot.toProject();
    } catch (InvalidProjectFileException e) {
      throw e;
    } catch (EOFException e) {
      throw new InvalidProjectFileException(path, Reason.TRUNCATED, "unexpected end of file", e);
    } catch (IOException | CactiSynthException | IllegalArgumentException e) {
      throw new InvalidProjectFileException(path, Reason.MALFORMED_PAYLOAD, e.getMessage(), e);
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temporary file {}", temp, e);
    }
  }
}
