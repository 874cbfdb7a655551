package org.openrepo.oaipmh.domain.value;

import static org.openrepo.oaipmh.domain.Granularity.YYYY_MM_DD;
import static org.openrepo.oaipmh.domain.Granularity.YYYY_MM_DD_THH_MM_SS_Z;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import org.openrepo.oaipmh.domain.Granularity;
import org.openrepo.oaipmh.exception.ValidationException;

/**
 * UTC datestamp at a given {@link Granularity}: {@code YYYY-MM-DD} or {@code YYYY-MM-DDThh:mm:ssZ}.
 * The string must have the shape of the granularity and denote an existing calendar date and time.
 * Instances of the same granularity are ordered chronologically.
 */
public final class UtcDatetime implements Comparable<UtcDatetime> {

  private static final String FIELD = "datestamp";

  private final LocalDateTime dateTime;
  private final Granularity granularity;

  public UtcDatetime(String dateTime, Granularity granularity) {
    Objects.requireNonNull(granularity, "granularity");
    if (!granularity.matches(dateTime)) {
      throw ValidationException.invalidFormat(FIELD, dateTime);
    }
    try {
      this.dateTime = granularity == YYYY_MM_DD
        ? LocalDate.parse(dateTime, granularity.getFormatter()).atStartOfDay()
        : LocalDateTime.parse(dateTime, granularity.getFormatter());
    } catch (DateTimeParseException e) {
      throw ValidationException.invalidFormat(FIELD, dateTime);
    }
    this.granularity = granularity;
  }

  /**
   * Creates the datestamp with the granularity its shape denotes.
   *
   * @param dateTime date or date-time string
   * @return parsed datestamp
   * @throws ValidationException if the string has neither shape or is not a valid date
   */
  public static UtcDatetime parse(String dateTime) {
    return YYYY_MM_DD_THH_MM_SS_Z.matches(dateTime)
      ? new UtcDatetime(dateTime, YYYY_MM_DD_THH_MM_SS_Z)
      : new UtcDatetime(dateTime, YYYY_MM_DD);
  }

  public String getValue() {
    return granularity.getFormatter().format(dateTime);
  }

  public Granularity getGranularity() {
    return granularity;
  }

  /**
   * @return the datestamp as local date time in UTC, midnight for day granularity
   */
  public LocalDateTime toLocalDateTime() {
    return dateTime;
  }

  @Override
  public int compareTo(UtcDatetime other) {
    if (granularity != other.granularity) {
      throw new IllegalArgumentException("Datestamps of different granularity cannot be compared");
    }
    return dateTime.compareTo(other.dateTime);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof UtcDatetime)) {
      return false;
    }
    UtcDatetime that = (UtcDatetime) o;
    return granularity == that.granularity && dateTime.equals(that.dateTime);
  }

  @Override
  public int hashCode() {
    return Objects.hash(dateTime, granularity);
  }

  @Override
  public String toString() {
    return getValue();
  }
}
