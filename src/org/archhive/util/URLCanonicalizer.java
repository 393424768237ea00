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

import java.net.MalformedURLException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Reduces a url to the canonical form used to decide whether two urls point
 * at the same content: lower case host without leading www., path, and a
 * query string filtered by the platform policy. An x.com host suffix is
 * folded into {@link CanonicalizationRules#getTwitterCanonicalDomain()}.
 * Scheme, port, user info and fragment never appear in the output.
 * 
 * Canonicalization runs in three tiers:
 * <ol>
 * <li>strict parse of the input ({@link #canonicalizeStrict})</li>
 * <li>if the input has no http(s):// prefix, strict parse of the input with
 * leading slashes dropped and https:// prepended ({@link #repairScheme})</li>
 * <li>string surgery on the host part only, no query filtering
 * ({@link #manualFallback})</li>
 * </ol>
 * 
 * Instances are immutable and safe to share between threads.
 */
public class URLCanonicalizer {

  private static final Log LOG = LogFactory.getLog(URLCanonicalizer.class);

  private static final Pattern HTTP_SCHEME_PREFIX = Pattern.compile(
      "^https?://", Pattern.CASE_INSENSITIVE);
  private static final Pattern LEADING_SLASHES = Pattern.compile("^/+");
  private static final Pattern LEADING_SCHEME_AND_SLASHES = Pattern.compile(
      "^(https?:)?/+", Pattern.CASE_INSENSITIVE);
  private static final Pattern LEADING_WWW = Pattern.compile("^www\\.",
      Pattern.CASE_INSENSITIVE);
  private static final Pattern HOST_TERMINATOR = Pattern.compile("[/?#]");

  private static URLCanonicalizer _defaultCanonicalizer;

  private final CanonicalizationRules rules;
  private final RuleSelector ruleSelector;

  public URLCanonicalizer(CanonicalizationRules rules) {
    this.rules = rules;
    this.ruleSelector = new RuleSelector(rules);
  }

  /**
   * @return canonicalizer bound to {@link CanonicalizationRules#getDefault()}
   */
  public static synchronized URLCanonicalizer getDefault() {
    if (_defaultCanonicalizer == null) {
      _defaultCanonicalizer = new URLCanonicalizer(
          CanonicalizationRules.getDefault());
    }
    return _defaultCanonicalizer;
  }

  /**
   * canonicalize a raw url string. never throws.
   * 
   * @return canonical form, or the empty string for null or empty input
   */
  public String canonicalize(String incomingURL) {
    if (incomingURL == null || incomingURL.length() == 0) {
      return "";
    }

    try {
      return canonicalizeStrict(incomingURL);
    } catch (MalformedURLException e) {
      LOG.debug("Strict parse failed for:" + incomingURL + " Reason:"
          + e.getMessage());
    }

    String fallbackInput = incomingURL;
    String repairedURL = repairScheme(incomingURL);
    if (repairedURL != null) {
      try {
        return canonicalizeStrict(repairedURL);
      } catch (MalformedURLException e) {
        LOG.debug("Repaired URL:" + repairedURL
            + " failed strict parse. Using manual fallback. Reason:"
            + e.getMessage());
      }
      fallbackInput = repairedURL;
    }
    return manualFallback(fallbackInput);
  }

  /**
   * first tier: parse and canonicalize, failing on anything the strict parser
   * rejects
   */
  public String canonicalizeStrict(String incomingURL)
      throws MalformedURLException {
    return canonicalizeParsed(ParsedURL.parse(incomingURL));
  }

  String canonicalizeParsed(ParsedURL urlObject) {
    String host = ParsedURL.cleanHostName(urlObject.getHost());
    Platform platform = ruleSelector.classify(host);
    if (platform == Platform.TWITTER) {
      host = foldTwitterDomain(host);
    }
    String query = canonicalQuery(platform, urlObject.getQuery());

    StringBuilder urlOut = new StringBuilder();
    urlOut.append(host);
    urlOut.append(urlObject.getPath());
    if (query.length() != 0) {
      urlOut.append("?");
      urlOut.append(query);
    }
    return urlOut.toString();
  }

  /**
   * swap a matched twitter domain suffix for the canonical one, keeping sub
   * domain labels: x.com becomes twitter.com, mobile.x.com becomes
   * mobile.twitter.com, help.twitter.com stays as is
   */
  String foldTwitterDomain(String host) {
    String canonical = rules.getTwitterCanonicalDomain();
    if (canonical == null) {
      return host;
    }
    for (String domain : rules.getTwitterDomains()) {
      if (domain.equals(canonical)) {
        continue;
      }
      if (host.equals(domain)) {
        return canonical;
      }
      if (host.endsWith("." + domain)) {
        return host.substring(0, host.length() - domain.length()) + canonical;
      }
    }
    return host;
  }

  /**
   * apply the platform policy to a raw query
   * 
   * @return filtered query without leading '?', possibly empty
   */
  String canonicalQuery(Platform platform, String query) {
    if (query == null) {
      return "";
    }
    QueryString queryString;
    switch (platform) {
    case TWITTER:
      // status id lives in the path
      return "";
    case YOUTUBE:
      queryString = QueryString.parse(query);
      queryString.retainOnly(rules.getYouTubeParameters());
      return queryString.toString();
    default:
      queryString = QueryString.parse(query);
      queryString.removeAll(rules.getTrackingParameters());
      return queryString.toString();
    }
  }

  /**
   * second tier input: drop leading slashes and prepend https://
   * 
   * @return repaired url, or null if the url already has an http(s):// prefix
   */
  public static String repairScheme(String incomingURL) {
    if (HTTP_SCHEME_PREFIX.matcher(incomingURL).find()) {
      return null;
    }
    return "https://" + LEADING_SLASHES.matcher(incomingURL).replaceFirst("");
  }

  /**
   * last tier: strip any scheme and leading slashes, clean up the host part
   * and append the rest verbatim. tracking parameters are NOT removed.
   */
  public static String manualFallback(String incomingURL) {
    String stripped = LEADING_SCHEME_AND_SLASHES.matcher(incomingURL)
        .replaceFirst("");

    Matcher terminator = HOST_TERMINATOR.matcher(stripped);
    if (!terminator.find()) {
      return cleanFallbackHost(stripped);
    }
    String host = stripped.substring(0, terminator.start());
    String rest = stripped.substring(terminator.start());
    return cleanFallbackHost(host) + rest;
  }

  private static String cleanFallbackHost(String host) {
    return LEADING_WWW.matcher(host).replaceFirst("").toLowerCase(Locale.ROOT);
  }

  public RuleSelector getRuleSelector() {
    return ruleSelector;
  }
}
