package com.cactisynth.ust;

import com.cactisynth.config.CactiSynthProperties;
import com.cactisynth.logging.ParseDiagnostics;
import com.cactisynth.model.Note;
import com.cactisynth.model.Project;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses UTAU Sequence Text into a {@link Project}.
 *
 * <p>A UST file is a list of chunks. A line starting with '[' opens a chunk; every following line
 * up to the next header belongs to it. Three kinds of chunk are understood:
 *
 * <ul>
 *   <li>{@code [#VERSION]} - the first non-empty line is the version tag
 *   <li>{@code [#SETTING]} - Key=Value project settings; Tool*, Mode* and Flags* keys are also
 *       collected into ordered lists
 *   <li>{@code [#0000]} and other all-digit names - Key=Value fields of one note
 * </ul>
 *
 * <p>Anything else ({@code [#PREV]}, {@code [#TRACKEND]}, ...) is ignored. Bad values are replaced
 * with defaults and logged; only input with no recognizable chunk at all fails the parse.
 */
@Component
public class UstParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(UstParser.class);

  private final Charset charset;
  private final ParseDiagnostics diagnostics = new ParseDiagnostics(LOGGER);

  public UstParser(CactiSynthProperties properties) {
    this.charset = properties.charset();
  }

  /**
   * Read and parse a UST file using the configured text encoding.
   *
   * <p>Undecodable bytes are replaced rather than failing the read.
   *
   * @throws UstParseException if the file cannot be read or has no recognizable chunk
   */
  public Project parseFile(Path ustPath) {
    if (!Files.isRegularFile(ustPath)) {
      throw new UstParseException(ustPath + " is not a file, or does not exist");
    }
    LOGGER.info("Parsing UST file: {}", ustPath);
    try (InputStream in = Files.newInputStream(ustPath);
        Reader reader = new InputStreamReader(in, charset)) {
      StringWriter text = new StringWriter();
      reader.transferTo(text);
      return parse(text.toString());
    } catch (IOException e) {
      throw new UstParseException("Failed to read UST file " + ustPath, e);
    }
  }

  /**
   * Parse UST text.
   *
   * @param text the whole file content
   * @return the project, with notes inserted in start point order
   * @throws UstParseException if the text has no recognizable chunk
   */
  public Project parse(String text) {
    if (text == null) {
      throw new UstParseException("UST input is null");
    }
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }
    List<UstChunk> chunks = splitChunks(text);
    if (chunks.stream().noneMatch(UstChunk::isRecognized)) {
      throw new UstParseException(
          "No recognizable chunk found in UST input (" + chunks.size() + " chunks)");
    }

    Project project = new Project();
    List<Note> notes = new ArrayList<>();
    for (UstChunk chunk : chunks) {
      if (chunk.isVersion()) {
        project.setVersion(parseVersion(chunk));
      } else if (chunk.isSetting()) {
        applySetting(chunk, project);
      } else if (chunk.isNote()) {
        parseNote(chunk).ifPresent(notes::add);
      } else {
        LOGGER.debug("Ignoring UST chunk {}", chunk.header());
      }
    }
    project.addNotes(notes);

    LOGGER.info(
        "Parsed UST project: name={}, version={}, tempo={}, notes={}",
        project.getName(),
        project.getVersion(),
        project.getTempo(),
        project.noteCount());
    return project;
  }

  private List<UstChunk> splitChunks(String text) {
    List<UstChunk> chunks = new ArrayList<>();
    String header = null;
    List<String> body = new ArrayList<>();

    for (String line : text.lines().toList()) {
      if (line.startsWith("[")) {
        if (header != null) {
          chunks.add(new UstChunk(header, body));
        }
        header = line.strip();
        body = new ArrayList<>();
      } else if (header != null) {
        body.add(line.strip());
      } else if (!line.isBlank()) {
        diagnostics.logUstLineSkipped("", line.strip(), "a chunk header");
      }
    }
    if (header != null) {
      chunks.add(new UstChunk(header, body));
    }
    return chunks;
  }

  private String parseVersion(UstChunk chunk) {
    return chunk.lines().stream().filter(line -> !line.isEmpty()).findFirst().orElse("");
  }

  private void applySetting(UstChunk chunk, Project project) {
    for (String line : chunk.lines()) {
      if (line.isEmpty()) {
        continue;
      }
      Optional<Map.Entry<String, String>> pair = splitPair(line);
      if (pair.isEmpty()) {
        diagnostics.logUstLineSkipped(chunk.name(), line, "Key=Value");
        continue;
      }
      String key = pair.get().getKey();
      String value = pair.get().getValue();

      if (key.startsWith("Tool")) {
        project.addTool(value);
      } else if (key.startsWith("Mode")) {
        project.addMode(value);
      } else if (key.startsWith("Flags")) {
        project.addFlag(value);
      }
      applySettingField(chunk, project, key, value);
    }
  }

  private void applySettingField(UstChunk chunk, Project project, String key, String value) {
    switch (key) {
      case "Tempo":
        project.setTempo(parseTempo(chunk, value));
        break;
      case "Tracks":
        project.setTracks(parseNonNegativeInt(chunk, key, value, Project.DEFAULT_TRACKS));
        break;
      case "ProjectName":
        project.setName(value.isEmpty() ? Project.DEFAULT_NAME : value);
        break;
      case "VoiceDir":
        project.setVoiceDir(toPath(chunk, key, value));
        break;
      case "OutFile":
        project.setOutFile(toPath(chunk, key, value));
        break;
      case "CacheDir":
        project.setCacheDir(toPath(chunk, key, value));
        break;
      default:
        LOGGER.debug("Unmapped UST setting {}={}", key, value);
    }
  }

  private double parseTempo(UstChunk chunk, String value) {
    try {
      double tempo = Double.parseDouble(value.strip());
      if (Double.isFinite(tempo) && tempo > 0) {
        return tempo;
      }
    } catch (NumberFormatException e) {
      LOGGER.debug("Tempo '{}' is not a number", value);
    }
    diagnostics.logUstValueCoerced(chunk.name(), "Tempo", value, Project.DEFAULT_TEMPO);
    return Project.DEFAULT_TEMPO;
  }

  private Optional<Note> parseNote(UstChunk chunk) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (String line : chunk.lines()) {
      if (line.isEmpty()) {
        continue;
      }
      Optional<Map.Entry<String, String>> pair = splitPair(line);
      if (pair.isEmpty()) {
        diagnostics.logUstLineSkipped(chunk.name(), line, "Key=Value");
        continue;
      }
      fields.put(pair.get().getKey(), pair.get().getValue());
    }
    if (fields.isEmpty()) {
      LOGGER.debug("UST chunk {} is empty, no note created", chunk.header());
      return Optional.empty();
    }

    return Optional.of(
        new Note(
            parseNonNegativeInt(chunk, "Length", fields.get("Length"), 0),
            fields.getOrDefault("Lyric", ""),
            parseNonNegativeInt(chunk, "NoteNum", fields.get("NoteNum"), 0),
            parseNonNegativeInt(chunk, "PreUtterance", fields.get("PreUtterance"), 0),
            parseNonNegativeInt(chunk, "Velocity", fields.get("Velocity"), 0),
            parseNonNegativeInt(chunk, "Intensity", fields.get("Intensity"), 0),
            parseNonNegativeInt(chunk, "Modulation", fields.get("Modulation"), 0),
            parseNonNegativeInt(chunk, "StartPoint", fields.get("StartPoint"), 0)));
  }

  /**
   * Missing or empty values become {@code fallback} silently; anything else that is not a
   * non-negative number becomes {@code fallback} with a diagnostic. Decimals are truncated.
   */
  private int parseNonNegativeInt(UstChunk chunk, String key, String raw, int fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    String value = raw.strip();
    int parsed;
    try {
      parsed = Integer.parseInt(value);
    } catch (NumberFormatException e) {
      try {
        double decimal = Double.parseDouble(value);
        if (!Double.isFinite(decimal) || Math.abs(decimal) > Integer.MAX_VALUE) {
          diagnostics.logUstValueCoerced(chunk.name(), key, raw, fallback);
          return fallback;
        }
        parsed = (int) decimal;
      } catch (NumberFormatException notNumeric) {
        diagnostics.logUstValueCoerced(chunk.name(), key, raw, fallback);
        return fallback;
      }
    }
    if (parsed < 0) {
      diagnostics.logUstValueCoerced(chunk.name(), key, raw, fallback);
      return fallback;
    }
    return parsed;
  }

  private Path toPath(UstChunk chunk, String key, String value) {
    try {
      return Path.of(value);
    } catch (InvalidPathException e) {
      diagnostics.logUstValueCoerced(chunk.name(), key, value, "''");
      return Path.of("");
    }
  }

  private static Optional<Map.Entry<String, String>> splitPair(String line) {
    int separator = line.indexOf('=');
    if (separator < 0) {
      return Optional.empty();
    }
    return Optional.of(Map.entry(line.substring(0, separator), line.substring(separator + 1)));
  }
}
