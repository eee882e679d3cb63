package com.cactisynth.oto;

import com.cactisynth.logging.ParseDiagnostics;
import java.math.BigDecimal;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timing metadata for one voicebank sample, as written on one line of an oto.ini file.
 *
 * <p>Line format: {@code file=alias,offset,fixed,blank,preutter,overlap}. All times are in
 * milliseconds. An empty alias means "the file name without its extension".
 */
public record OtoEntry(
    String file,
    String alias,
    double offset,
    double fixed,
    double blank,
    double preutter,
    double overlap) {

  /** Returned by lookups that match nothing. */
  public static final OtoEntry DEFAULT = new OtoEntry("", "", 0.0, 0.0, 0.0, 0.0, 0.0);

  private static final Logger LOGGER = LoggerFactory.getLogger(OtoEntry.class);
  private static final ParseDiagnostics DIAGNOSTICS = new ParseDiagnostics(LOGGER);

  private static final Pattern NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");
  private static final int FIELD_COUNT = 6;

  public OtoEntry {
    Objects.requireNonNull(file, "file");
    if (alias == null || alias.isEmpty()) {
      alias = stem(file);
    }
  }

  /** Entry for {@code file} with an alias and all timings at 0. */
  public static OtoEntry of(String file, String alias) {
    return new OtoEntry(file, alias, 0.0, 0.0, 0.0, 0.0, 0.0);
  }

  /**
   * Parse one oto.ini line.
   *
   * <p>Missing or empty numeric fields are 0. If any numeric field is present but not a number,
   * the whole numeric group falls back to 0 and a diagnostic is logged; the line is kept.
   */
  public static OtoEntry fromLine(String line) {
    String trimmed = line.strip();
    int separator = trimmed.indexOf('=');
    if (separator < 0) {
      DIAGNOSTICS.logOtoFallback(trimmed, "no '=' between file name and fields");
      return new OtoEntry(trimmed, "", 0.0, 0.0, 0.0, 0.0, 0.0);
    }
    String file = trimmed.substring(0, separator);
    String[] fields = trimmed.substring(separator + 1).split(",", FIELD_COUNT);
    String alias = fields[0].strip();

    double[] values = new double[FIELD_COUNT - 1];
    for (int i = 1; i < fields.length; i++) {
      String field = fields[i].strip();
      if (field.isEmpty()) {
        continue;
      }
      if (!NUMBER.matcher(field).matches()) {
        DIAGNOSTICS.logOtoFallback(trimmed, "field " + i + " '" + field + "' is not a number");
        return new OtoEntry(file, alias, 0.0, 0.0, 0.0, 0.0, 0.0);
      }
      values[i - 1] = Double.parseDouble(field);
    }
    return new OtoEntry(file, alias, values[0], values[1], values[2], values[3], values[4]);
  }

  /** Render as an oto.ini line. Numbers are reformatted, so only values round-trip. */
  public String toLine() {
    return file
        + "="
        + alias
        + ","
        + format(offset)
        + ","
        + format(fixed)
        + ","
        + format(blank)
        + ","
        + format(preutter)
        + ","
        + format(overlap);
  }

  /** True for the lookup sentinel. */
  public boolean isDefault() {
    return equals(DEFAULT);
  }

  private static String format(double value) {
    return BigDecimal.valueOf(value).toPlainString();
  }

  private static String stem(String file) {
    String name = file;
    int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
    if (slash >= 0) {
      name = name.substring(slash + 1);
    }
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
