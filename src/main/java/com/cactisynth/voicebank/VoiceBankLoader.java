package com.cactisynth.voicebank;

import com.cactisynth.config.CactiSynthProperties;
import com.cactisynth.logging.ParseDiagnostics;
import com.cactisynth.oto.OtoFileException;
import com.cactisynth.oto.OtoSetting;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Scans a voicebank directory into a {@link VoiceBank}.
 *
 * <p>Reads character.txt and readme.txt from the root, loads every oto.ini found at any depth and
 * counts sample files. Each oto.ini is keyed by the name of the directory containing it; when two
 * directories share a name the one visited later (in path order) wins.
 */
@Component
public class VoiceBankLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceBankLoader.class);

  static final String CHARACTER_FILE = "character.txt";
  static final String README_FILE = "readme.txt";
  static final String OTO_FILE = "oto.ini";

  private final Charset charset;
  private final String sampleExtension;
  private final ParseDiagnostics diagnostics = new ParseDiagnostics(LOGGER);

  public VoiceBankLoader(CactiSynthProperties properties) {
    this.charset = properties.charset();
    this.sampleExtension = properties.sampleExtension().toLowerCase(Locale.ROOT);
  }

  /**
   * Scan a voicebank.
   *
   * @param root the voicebank directory
   * @return the scanned voicebank
   * @throws VoiceBankNotFoundException if {@code root} is not a directory
   * @throws VoiceBankLoadException if the directory tree cannot be walked
   */
  public VoiceBank load(Path root) {
    if (!Files.isDirectory(root)) {
      throw new VoiceBankNotFoundException(root);
    }
    LOGGER.info("Scanning voicebank: {}", root);

    CharacterInfo character = readCharacter(root.resolve(CHARACTER_FILE));
    String readme = readText(root.resolve(README_FILE));

    List<Path> otoFiles = new ArrayList<>();
    int fileCount = 0;
    try (Stream<Path> paths = walk(root)) {
      for (Path path : paths.filter(Files::isRegularFile).sorted().toList()) {
        String fileName = path.getFileName().toString();
        if (fileName.equals(OTO_FILE)) {
          otoFiles.add(path);
        } else if (fileName.toLowerCase(Locale.ROOT).endsWith(sampleExtension)) {
          fileCount++;
        }
      }
    } catch (IOException e) {
      throw new VoiceBankLoadException("Failed to scan voicebank " + root, e);
    } catch (UncheckedIOException e) {
      // Files.walk reports errors met while iterating as unchecked
      throw new VoiceBankLoadException("Failed to scan voicebank " + root, e.getCause());
    }

    Map<String, OtoSetting> settings = new HashMap<>();
    for (Path otoFile : otoFiles) {
      String key = otoFile.toAbsolutePath().getParent().getFileName().toString();
      try {
        OtoSetting previous = settings.put(key, OtoSetting.load(otoFile, charset));
        if (previous != null) {
          LOGGER.warn(
              "Duplicate OTO directory name '{}': {} replaces {}", key, otoFile, previous.getPath());
        }
      } catch (OtoFileException e) {
        LOGGER.warn("Skipping unreadable OTO file {}: {}", otoFile, e.getMessage(), e);
      }
    }

    VoiceBank voiceBank = new VoiceBank(root, character, readme, settings, fileCount);
    diagnostics.logVoiceBankScanned(
        root, settings.size(), voiceBank.getOtoCount(), voiceBank.getFileCount());
    return voiceBank;
  }

  Stream<Path> walk(Path root) throws IOException {
    return Files.walk(root);
  }

  private CharacterInfo readCharacter(Path path) {
    if (!Files.isRegularFile(path)) {
      LOGGER.warn("No {} in voicebank, metadata left empty: {}", CHARACTER_FILE, path);
      return CharacterInfo.EMPTY;
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset))) {
      return CharacterInfo.parse(reader.lines().toList());
    } catch (IOException e) {
      throw new VoiceBankLoadException("Failed to read " + path, e);
    }
  }

  private String readText(Path path) {
    if (!Files.isRegularFile(path)) {
      LOGGER.debug("No {} in voicebank: {}", path.getFileName(), path);
      return "";
    }
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset))) {
      StringWriter text = new StringWriter();
      reader.transferTo(text);
      return text.toString();
    } catch (IOException e) {
      throw new VoiceBankLoadException("Failed to read " + path, e);
    }
  }
}
