package com.cactisynth.oto;

import com.cactisynth.logging.ParseDiagnostics;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The entries of one oto.ini file, in file order.
 *
 * <p>The entry list is fixed at construction, so {@link #size()} always equals the number of
 * entries.
 */
public class OtoSetting {

  private static final Logger LOGGER = LoggerFactory.getLogger(OtoSetting.class);
  private static final ParseDiagnostics DIAGNOSTICS = new ParseDiagnostics(LOGGER);

  private final Path path;
  private final Charset charset;
  private final List<OtoEntry> entries;

  private OtoSetting(Path path, Charset charset, List<OtoEntry> entries) {
    this.path = Objects.requireNonNull(path, "path");
    this.charset = Objects.requireNonNull(charset, "charset");
    this.entries = List.copyOf(entries);
  }

  public static OtoSetting of(Path path, Charset charset, List<OtoEntry> entries) {
    return new OtoSetting(path, charset, entries);
  }

  /**
   * Load an oto.ini file. Blank lines are skipped; every other line becomes one entry.
   *
   * @throws OtoFileException if the file does not exist or cannot be read
   */
  public static OtoSetting load(Path path, Charset charset) {
    if (!Files.isRegularFile(path)) {
      throw new OtoFileException(path + " is not a file, or does not exist");
    }
    List<OtoEntry> entries = new ArrayList<>();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset))) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (!line.isBlank()) {
          entries.add(OtoEntry.fromLine(line));
        }
      }
    } catch (IOException e) {
      throw new OtoFileException("Failed to read OTO file " + path, e);
    }

    OtoSetting setting = new OtoSetting(path, charset, entries);
    DIAGNOSTICS.logOtoSetting("loaded", path, setting.size());
    return setting;
  }

  /** Write this setting back to its own path. */
  public void save() {
    save(path);
  }

  /**
   * Write one line per entry using the setting's encoding.
   *
   * @throws IllegalArgumentException if {@code target} is an existing directory
   * @throws OtoFileException if writing fails
   */
  public void save(Path target) {
    if (Files.isDirectory(target)) {
      throw new IllegalArgumentException(target + " is a directory");
    }
    try (BufferedWriter writer =
        new BufferedWriter(new OutputStreamWriter(Files.newOutputStream(target), charset))) {
      for (OtoEntry entry : entries) {
        writer.write(entry.toLine());
        writer.newLine();
      }
    } catch (IOException e) {
      throw new OtoFileException("Failed to write OTO file " + target, e);
    }
    DIAGNOSTICS.logOtoSetting("saved", target, size());
  }

  /**
   * Every entry whose field equals {@code value}, in file order.
   *
   * <p>Never empty: when nothing matches the result is a single {@link OtoEntry#DEFAULT}. Check
   * {@link OtoEntry#isDefault()} rather than emptiness.
   */
  public List<OtoEntry> findEntries(OtoField field, String value) {
    List<OtoEntry> matches = findMatches(field, value);
    return matches.isEmpty() ? List.of(OtoEntry.DEFAULT) : Collections.unmodifiableList(matches);
  }

  /** Same as {@link #findEntries(OtoField, String)} with the field given by name. */
  public List<OtoEntry> findEntries(String fieldName, String value) {
    return findEntries(OtoField.fromName(fieldName), value);
  }

  /** Every entry whose field equals {@code value}; empty when nothing matches. */
  public List<OtoEntry> findMatches(OtoField field, String value) {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(value, "value");
    List<OtoEntry> matches = new ArrayList<>();
    for (OtoEntry entry : entries) {
      if (field.matches(entry, value)) {
        matches.add(entry);
      }
    }
    return matches;
  }

  public Path getPath() {
    return path;
  }

  public Charset getCharset() {
    return charset;
  }

  public List<OtoEntry> getEntries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }
}
