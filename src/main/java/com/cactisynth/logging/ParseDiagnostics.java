package com.cactisynth.logging;

import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Structured logging for recovered parse problems and load summaries.
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so a log appender
 * can index them, and the message itself carries enough context to reproduce the problem.
 */
public class ParseDiagnostics {

  private final Logger logger;

  public ParseDiagnostics(Logger logger) {
    this.logger = logger;
  }

  /** An OTO line whose numeric group could not be parsed; all numeric fields became 0. */
  public void logOtoFallback(String line, String reason) {
    try {
      MDC.put("event_type", "oto_fallback");
      MDC.put("line", line);
      MDC.put("reason", reason);

      logger.warn(
          "Malformed OTO line '{}': {}; using offset=0.0, fixed=0.0, blank=0.0, preutter=0.0,"
              + " overlap=0.0",
          line,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** A UST value that was replaced by a default. */
  public void logUstValueCoerced(String chunk, String key, String found, Object substituted) {
    try {
      MDC.put("event_type", "ust_value_coerced");
      MDC.put("chunk", chunk);
      MDC.put("key", key);
      MDC.put("found", found);
      MDC.put("substituted", String.valueOf(substituted));

      logger.warn(
          "UST chunk [{}]: {}='{}' is not a valid value, using {}", chunk, key, found, substituted);
    } finally {
      clearEventFields();
    }
  }

  /** A UST line that could not be attributed to anything and was dropped. */
  public void logUstLineSkipped(String chunk, String line, String expected) {
    try {
      MDC.put("event_type", "ust_line_skipped");
      MDC.put("chunk", chunk);
      MDC.put("line", line);
      MDC.put("expected", expected);

      logger.warn("UST chunk [{}]: skipped line '{}', expected {}", chunk, line, expected);
    } finally {
      clearEventFields();
    }
  }

  /** An OTO file was read or written. */
  public void logOtoSetting(String action, Path path, int entries) {
    try {
      MDC.put("event_type", "oto_setting_" + action);
      MDC.put("path", String.valueOf(path));
      MDC.put("entries", String.valueOf(entries));

      logger.info("OTO setting {}: path={}, entries={}", action, path, entries);
    } finally {
      clearEventFields();
    }
  }

  /** A voicebank directory scan finished. */
  public void logVoiceBankScanned(Path root, int settings, int otoCount, int fileCount) {
    try {
      MDC.put("event_type", "voicebank_scanned");
      MDC.put("path", String.valueOf(root));
      MDC.put("settings", String.valueOf(settings));
      MDC.put("otoCount", String.valueOf(otoCount));
      MDC.put("fileCount", String.valueOf(fileCount));

      logger.info(
          "Voicebank scanned: root={}, settings={}, otoEntries={}, sampleFiles={}",
          root,
          settings,
          otoCount,
          fileCount);
    } finally {
      clearEventFields();
    }
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("line");
    MDC.remove("reason");
    MDC.remove("chunk");
    MDC.remove("key");
    MDC.remove("found");
    MDC.remove("substituted");
    MDC.remove("expected");
    MDC.remove("path");
    MDC.remove("entries");
    MDC.remove("settings");
    MDC.remove("otoCount");
    MDC.remove("fileCount");
  }
}
