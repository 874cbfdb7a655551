package org.openrepo.oaipmh.model;

import static org.openrepo.oaipmh.Constants.ISO_UTC_DATE_TIME;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

import javax.xml.bind.annotation.adapters.XmlAdapter;

/**
 * Writes instants as {@code YYYY-MM-DDThh:mm:ssZ}, the only form OAI-PMH allows for responseDate.
 */
public class InstantAdapter extends XmlAdapter<String, Instant> {

  @Override
  public Instant unmarshal(String value) {
    return value == null ? null : LocalDateTime.parse(value, ISO_UTC_DATE_TIME).toInstant(ZoneOffset.UTC);
  }

  @Override
  public String marshal(Instant value) {
    return value == null ? null
      : LocalDateTime.ofInstant(value.truncatedTo(ChronoUnit.SECONDS), ZoneOffset.UTC).format(ISO_UTC_DATE_TIME);
  }
}
