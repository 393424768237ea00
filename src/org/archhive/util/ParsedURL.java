/**
 * Copyright 2008 - CommonCrawl Foundation
 * 
 *    This program is free software: you can redistribute it and/or modify
 *    it under the terms of the GNU General Public License as published by
 *    the Free Software Foundation, either version 3 of the License, or
 *    (at your option) any later version.
 *
 *    This program is distributed in the hope that it will be useful,
 *    but WITHOUT ANY WARRANTY; without even the implied warranty of
 *    MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *    GNU General Public License for more details.
 *
 *    You should have received a copy of the GNU General Public License
 *    along with this program.  If not, see <http://www.gnu.org/licenses/>.
 *
 **/

package org.archhive.util;

import java.net.IDN;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSet;

/**
 * Strict decomposition of an absolute url into scheme, host, path, query and
 * fragment. http, https, ftp and file urls go through {@link java.net.URL};
 * every other scheme goes through {@link java.net.URI}, either as
 * scheme://authority/path or as an opaque scheme:content url.
 * 
 * A missing scheme, an unparseable remainder, or an http(s)/ftp/ws(s) url
 * whose host is empty or carries a character that is never legal in a host
 * name fails with {@link MalformedURLException}. Path and query text is kept
 * as written (no percent decoding).
 */
public class ParsedURL {

  /** schemes with a JDK protocol handler */
  static final ImmutableSet<String> HANDLER_SCHEMES = ImmutableSet.of("http",
      "https", "ftp", "file");

  /** schemes whose slashes after the colon are optional, https:host/path */
  static final ImmutableSet<String> SLASH_OPTIONAL_SCHEMES = ImmutableSet.of(
      "http", "https", "ftp", "ws", "wss");

  /** schemes whose paths are hierarchical and never empty */
  static final ImmutableSet<String> HIERARCHICAL_SCHEMES = ImmutableSet.of(
      "http", "https", "ftp", "file", "ws", "wss");

  /** schemes that require a non empty host */
  static final ImmutableSet<String> HOST_REQUIRED_SCHEMES = ImmutableSet.of(
      "http", "https", "ftp", "ws", "wss");

  private static final Pattern SCHEME_PREFIX = Pattern
      .compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*):");
  private static final Pattern LEADING_SLASHES = Pattern.compile("^[/\\\\]*");

  private static final CharMatcher EDGE_JUNK = CharMatcher.inRange('\u0000', ' ');
  private static final CharMatcher TAB_OR_NEWLINE = CharMatcher.anyOf("\t\n\r");
  private static final CharMatcher FORBIDDEN_HOST_CHARS = CharMatcher.anyOf(
      " #%/:<>?@[\\]^|").or(CharMatcher.javaIsoControl());
  /** characters java.net.URI refuses but a url parser escapes */
  private static final CharMatcher URI_ESCAPED_CHARS = CharMatcher
      .anyOf(" \"<>\\^`{|}");

  private final String scheme;
  private final String host;
  private final int port;
  private final String path;
  private final String query;
  private final String fragment;

  private ParsedURL(String scheme, String host, int port, String path,
      String query, String fragment) {
    this.scheme = scheme;
    this.host = host;
    this.port = port;
    this.path = path;
    this.query = query;
    this.fragment = fragment;
  }

  public static ParsedURL parse(String urlString) throws MalformedURLException {
    if (urlString == null) {
      throw new MalformedURLException("null url");
    }
    String cleaned = TAB_OR_NEWLINE.removeFrom(EDGE_JUNK.trimFrom(urlString));

    Matcher schemeMatcher = SCHEME_PREFIX.matcher(cleaned);
    if (!schemeMatcher.find()) {
      throw new MalformedURLException("URL:" + urlString + " has no scheme");
    }
    String scheme = schemeMatcher.group(1).toLowerCase(Locale.ROOT);

    if (SLASH_OPTIONAL_SCHEMES.contains(scheme)) {
      String rest = cleaned.substring(schemeMatcher.end());
      cleaned = scheme + "://" + LEADING_SLASHES.matcher(rest).replaceFirst("");
    }

    ParsedURL raw;
    if (HANDLER_SCHEMES.contains(scheme)) {
      raw = parseWithHandler(scheme, cleaned, urlString);
    } else {
      raw = parseGeneric(scheme, cleaned, urlString);
    }

    String host = raw.host;
    if (HOST_REQUIRED_SCHEMES.contains(scheme)) {
      if (host.length() == 0) {
        throw new MalformedURLException("URL:" + urlString + " has no host");
      }
      if (!isIPv6Literal(host) && FORBIDDEN_HOST_CHARS.matchesAnyOf(host)) {
        throw new MalformedURLException("URL:" + urlString
            + " has an invalid host:" + host);
      }
      host = toASCIIHost(host, urlString);
    }

    String path = raw.path;
    if (HIERARCHICAL_SCHEMES.contains(scheme)) {
      if (path.length() == 0) {
        path = "/";
      } else {
        path = URLPathNormalizer.removeDotSegments(path);
      }
    }

    String query = raw.query;
    if (query != null && query.length() == 0) {
      query = null;
    }
    return new ParsedURL(scheme, host, raw.port, path, query, raw.fragment);
  }

  private static ParsedURL parseWithHandler(String scheme, String cleaned,
      String urlString) throws MalformedURLException {
    URL url;
    try {
      url = new URL(cleaned);
    } catch (MalformedURLException e) {
      throw e;
    } catch (RuntimeException e) {
      // some handlers reject bad ports or hosts with unchecked exceptions
      MalformedURLException malformed = new MalformedURLException("URL:"
          + urlString + " is invalid");
      malformed.initCause(e);
      throw malformed;
    }
    return new ParsedURL(scheme, Strings.nullToEmpty(url.getHost()), url.getPort(),
        Strings.nullToEmpty(url.getPath()), url.getQuery(), url.getRef());
  }

  private static ParsedURL parseGeneric(String scheme, String cleaned,
      String urlString) throws MalformedURLException {
    URI uri;
    try {
      uri = new URI(escapeForURI(cleaned));
    } catch (URISyntaxException e) {
      MalformedURLException malformed = new MalformedURLException("URL:"
          + urlString + " is invalid");
      malformed.initCause(e);
      throw malformed;
    }

    if (uri.isOpaque()) {
      // mailto:someone@example.com?subject=x, sms:+123
      String content = uri.getRawSchemeSpecificPart();
      int queryPos = content.indexOf('?');
      if (queryPos == -1) {
        return new ParsedURL(scheme, "", -1, content, null,
            uri.getRawFragment());
      }
      return new ParsedURL(scheme, "", -1, content.substring(0, queryPos),
          content.substring(queryPos + 1), uri.getRawFragment());
    }
    return new ParsedURL(scheme, hostFromAuthority(uri.getRawAuthority()),
        uri.getPort(), Strings.nullToEmpty(uri.getRawPath()), uri.getRawQuery(),
        uri.getRawFragment());
  }

  /**
   * escape what java.net.URI rejects outright, including a '%' that does not
   * start an escape
   */
  static String escapeForURI(String text) {
    StringBuilder out = null;
    for (int i = 0; i < text.length(); ++i) {
      char c = text.charAt(i);
      boolean escape = URI_ESCAPED_CHARS.matches(c)
          || (c == '%' && !startsEscape(text, i));
      if (escape && out == null) {
        out = new StringBuilder(text.length() + 16);
        out.append(text, 0, i);
      }
      if (out != null) {
        if (escape) {
          out.append('%');
          out.append(Character.toUpperCase(Character.forDigit(c >> 4, 16)));
          out.append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
        } else {
          out.append(c);
        }
      }
    }
    return (out != null) ? out.toString() : text;
  }

  /**
   * host part of a raw authority: user info and port removed
   */
  static String hostFromAuthority(String authority) {
    if (authority == null) {
      return "";
    }
    String host = authority.substring(authority.lastIndexOf('@') + 1);
    if (host.startsWith("[")) {
      int closePos = host.indexOf(']');
      return (closePos != -1) ? host.substring(0, closePos + 1) : host;
    }
    int colonPos = host.lastIndexOf(':');
    if (colonPos != -1
        && CharMatcher.inRange('0', '9').matchesAllOf(host.substring(colonPos + 1))) {
      host = host.substring(0, colonPos);
    }
    return host;
  }

  /**
   * convert internationalized host names to their punycode form
   */
  static String toASCIIHost(String host, String urlString)
      throws MalformedURLException {
    if (CharMatcher.ascii().matchesAllOf(host)) {
      return host;
    }
    try {
      return IDN.toASCII(host);
    } catch (IllegalArgumentException e) {
      MalformedURLException malformed = new MalformedURLException("URL:"
          + urlString + " has an invalid host:" + host);
      malformed.initCause(e);
      throw malformed;
    }
  }

  private static boolean startsEscape(String text, int pos) {
    return pos + 2 < text.length() && isHex(text.charAt(pos + 1))
        && isHex(text.charAt(pos + 2));
  }

  private static boolean isHex(char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f')
        || (c >= 'A' && c <= 'F');
  }

  static boolean isIPv6Literal(String host) {
    return host.startsWith("[") && host.endsWith("]");
  }

  public String getScheme() {
    return scheme;
  }

  /** host name, case preserved, internationalized names in punycode */
  public String getHost() {
    return host;
  }

  /** port, or -1 if none was given */
  public int getPort() {
    return port;
  }

  public String getPath() {
    return path;
  }

  /** query without the leading '?', or null */
  public String getQuery() {
    return query;
  }

  /** fragment without the leading '#', or null */
  public String getFragment() {
    return fragment;
  }

  /**
   * lower case the host and strip exactly one leading www.
   */
  public static String cleanHostName(String host) {
    String cleaned = host.toLowerCase(Locale.ROOT);
    if (cleaned.startsWith("www.")) {
      cleaned = cleaned.substring(4);
    }
    return cleaned;
  }
}
