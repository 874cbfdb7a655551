package org.openrepo.oaipmh.domain;

import static org.openrepo.oaipmh.Constants.ISO_UTC_DATE_ONLY;
import static org.openrepo.oaipmh.Constants.ISO_UTC_DATE_TIME;

import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

import org.openrepo.oaipmh.exception.ValidationException;

/**
 * Datestamp precision supported by OAI-PMH: day or second.
 */
public enum Granularity {
  YYYY_MM_DD("YYYY-MM-DD", Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$"), ISO_UTC_DATE_ONLY),
  YYYY_MM_DD_THH_MM_SS_Z("YYYY-MM-DDThh:mm:ssZ", Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z$"),
    ISO_UTC_DATE_TIME);

  private final String value;
  private final Pattern pattern;
  private final DateTimeFormatter formatter;

  Granularity(String value, Pattern pattern, DateTimeFormatter formatter) {
    this.value = value;
    this.pattern = pattern;
    this.formatter = formatter;
  }

  public String value() {
    return value;
  }

  /**
   * Checks the lexical shape only; calendar validity is checked by {@link org.openrepo.oaipmh.domain.value.UtcDatetime}.
   */
  public boolean matches(String dateTime) {
    return dateTime != null && pattern.matcher(dateTime).matches();
  }

  public DateTimeFormatter getFormatter() {
    return formatter;
  }

  public static Granularity fromValue(String value) {
    for (Granularity granularity : values()) {
      if (granularity.value.equals(value)) {
        return granularity;
      }
    }
    throw ValidationException.invalidFormat("granularity", value);
  }

  @Override
  public String toString() {
    return value;
  }
}
