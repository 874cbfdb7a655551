package org.openrepo.oaipmh;

import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.openrepo.oaipmh.Constants.MAX_QUERY_LENGTH;
import static org.openrepo.oaipmh.Constants.REQUEST_TOO_LONG_ERROR;
import static org.openrepo.oaipmh.model.OaiPmhErrorCode.BAD_ARGUMENT;

import java.net.URLDecoder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.NameValuePair;
import org.apache.http.message.BasicNameValuePair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openrepo.oaipmh.exception.OaiPmhException;

import com.google.common.collect.ImmutableList;

/**
 * Tokenized OAI-PMH query string. Keeps every {@code key=value} pair in the order it was given, repeated keys
 * included, so that repetitions can be reported by the validation.
 */
public final class ParsedQuery {

  private static final Logger logger = LogManager.getLogger(ParsedQuery.class);

  private static final char PARAMETER_SEPARATOR = '&';
  private static final char NAME_VALUE_SEPARATOR = '=';

  private final List<NameValuePair> pairs;

  private ParsedQuery(List<NameValuePair> pairs) {
    this.pairs = pairs;
  }

  /**
   * Splits the raw query on '&amp;' and each token on its first '='. Keys and values are trimmed, then url-decoded;
   * blank tokens are skipped, a key without '=' gets an empty value and an empty key is kept as is.
   *
   * @param queryString raw query string, without the leading '?'
   * @return parsed query
   * @throws OaiPmhException with a single badArgument error if the raw query is longer than
   *                         {@link Constants#MAX_QUERY_LENGTH} characters; nothing is parsed in that case
   */
  public static ParsedQuery parse(String queryString) {
    String query = Objects.toString(queryString, "");
    if (query.length() > MAX_QUERY_LENGTH) {
      logger.warn("Request of {} characters rejected", query.length());
      throw new OaiPmhException(BAD_ARGUMENT, format(REQUEST_TOO_LONG_ERROR, MAX_QUERY_LENGTH));
    }
    List<NameValuePair> pairs = Arrays.stream(StringUtils.split(query, PARAMETER_SEPARATOR))
      .filter(StringUtils::isNotBlank)
      .map(ParsedQuery::toPair)
      .collect(ImmutableList.toImmutableList());
    logger.debug("Parsed query into {} argument(s)", pairs.size());
    return new ParsedQuery(pairs);
  }

  private static NameValuePair toPair(String token) {
    int separator = token.indexOf(NAME_VALUE_SEPARATOR);
    if (separator < 0) {
      return new BasicNameValuePair(decode(token.trim()), "");
    }
    return new BasicNameValuePair(decode(token.substring(0, separator).trim()),
      decode(token.substring(separator + 1).trim()));
  }

  private static String decode(String part) {
    try {
      return URLDecoder.decode(part, UTF_8);
    } catch (IllegalArgumentException e) {
      logger.debug("Malformed escape in '{}' is kept undecoded: {}", part, e.getMessage());
      return part;
    }
  }

  /**
   * @return values of every occurrence of the key, in query order; empty if the key is absent
   */
  public List<String> getValues(String key) {
    return pairs.stream()
      .filter(pair -> pair.getName().equals(key))
      .map(NameValuePair::getValue)
      .collect(Collectors.toList());
  }

  /**
   * @return value of the first occurrence of the key, {@code null} if the key is absent
   */
  public String getFirstValue(String key) {
    return pairs.stream()
      .filter(pair -> pair.getName().equals(key))
      .map(NameValuePair::getValue)
      .findFirst()
      .orElse(null);
  }

  /**
   * @return keys in query order, with repetitions
   */
  public List<String> getKeys() {
    return pairs.stream()
      .map(NameValuePair::getName)
      .collect(Collectors.toList());
  }

  public int countOccurrences(String key) {
    return (int) pairs.stream()
      .filter(pair -> pair.getName().equals(key))
      .count();
  }

  public boolean contains(String key) {
    return countOccurrences(key) > 0;
  }

  @Override
  public String toString() {
    return pairs.toString();
  }
}
