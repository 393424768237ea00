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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Closeables;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Immutable rule set driving url canonicalization: the platform domain
 * lists, the youtube parameter whitelist, the generic tracking parameter
 * denylist and the host matching mode.
 * 
 * Rules are read from a JSON document shaped like the bundled
 * {@value #DEFAULT_RULES_RESOURCE}:
 * 
 * <pre>
 * {
 *   "hostMatching" : "suffix",
 *   "twitter" : { "domains" : [ "twitter.com", "x.com" ],
 *                 "canonicalDomain" : "twitter.com" },
 *   "youtube" : { "domains" : [ "youtube.com" ], "hosts" : [ "youtu.be" ],
 *                 "retainParameters" : [ "v", "list" ] },
 *   "generic" : { "trackingParameters" : [ "utm_source", ... ] }
 * }
 * </pre>
 */
public class CanonicalizationRules {

  private static final Log LOG = LogFactory.getLog(CanonicalizationRules.class);

  public static final String DEFAULT_RULES_RESOURCE = "url-canonicalization-rules.json";

  private static final String KEY_HOST_MATCHING = "hostMatching";
  private static final String KEY_TWITTER = "twitter";
  private static final String KEY_YOUTUBE = "youtube";
  private static final String KEY_GENERIC = "generic";
  private static final String KEY_DOMAINS = "domains";
  private static final String KEY_HOSTS = "hosts";
  private static final String KEY_CANONICAL_DOMAIN = "canonicalDomain";
  private static final String KEY_RETAIN_PARAMETERS = "retainParameters";
  private static final String KEY_TRACKING_PARAMETERS = "trackingParameters";

  private final ImmutableList<String> twitterDomains;
  private final String twitterCanonicalDomain;
  private final ImmutableList<String> youtubeDomains;
  private final ImmutableList<String> youtubeHosts;
  private final ImmutableList<String> youtubeParameters;
  private final ImmutableSet<String> trackingParameters;
  private final HostMatching hostMatching;

  private CanonicalizationRules(ImmutableList<String> twitterDomains,
      String twitterCanonicalDomain, ImmutableList<String> youtubeDomains,
      ImmutableList<String> youtubeHosts, ImmutableList<String> youtubeParameters,
      ImmutableSet<String> trackingParameters, HostMatching hostMatching) {
    this.twitterDomains = twitterDomains;
    this.twitterCanonicalDomain = twitterCanonicalDomain;
    this.youtubeDomains = youtubeDomains;
    this.youtubeHosts = youtubeHosts;
    this.youtubeParameters = youtubeParameters;
    this.trackingParameters = trackingParameters;
    this.hostMatching = hostMatching;
  }

  /** lazily loaded bundled rules */
  private static CanonicalizationRules _defaultRules;

  /**
   * @return the rules shipped in {@value #DEFAULT_RULES_RESOURCE}
   * @throws IllegalStateException
   *           if the bundled resource is missing or malformed
   */
  public static synchronized CanonicalizationRules getDefault() {
    if (_defaultRules == null) {
      _defaultRules = loadBundledRules();
    }
    return _defaultRules;
  }

  /**
   * load a rules document. keys missing from the document keep their
   * default values.
   */
  public static CanonicalizationRules load(InputStream in) throws IOException {
    return parse(in, getDefault());
  }

  public static CanonicalizationRules load(File rulesFile) throws IOException {
    LOG.info("Loading url canonicalization rules from:" + rulesFile);
    InputStream in = new FileInputStream(rulesFile);
    try {
      return load(in);
    } finally {
      Closeables.closeQuietly(in);
    }
  }

  /**
   * @return a copy of these rules using the given host matching mode
   */
  public CanonicalizationRules withHostMatching(HostMatching mode) {
    if (mode == hostMatching) {
      return this;
    }
    return new CanonicalizationRules(twitterDomains, twitterCanonicalDomain,
        youtubeDomains, youtubeHosts, youtubeParameters, trackingParameters,
        mode);
  }

  private static CanonicalizationRules loadBundledRules() {
    InputStream in = CanonicalizationRules.class.getClassLoader()
        .getResourceAsStream(DEFAULT_RULES_RESOURCE);
    if (in == null) {
      LOG.error("Resource:" + DEFAULT_RULES_RESOURCE + " not found in classpath");
      throw new IllegalStateException("Missing url canonicalization rules:"
          + DEFAULT_RULES_RESOURCE);
    }
    try {
      return parse(in, null);
    } catch (IOException e) {
      LOG.error("Failed to read " + DEFAULT_RULES_RESOURCE, e);
      throw new IllegalStateException(e);
    } finally {
      Closeables.closeQuietly(in);
    }
  }

  private static CanonicalizationRules parse(InputStream in,
      CanonicalizationRules defaults) throws IOException {
    Reader reader = new InputStreamReader(in, Charsets.UTF_8);
    try {
      JsonElement root = JsonParser.parseReader(reader);
      if (!root.isJsonObject()) {
        throw new IOException("Rules document must be a JSON object");
      }
      return fromJSON(root.getAsJsonObject(), defaults);
    } catch (JsonParseException e) {
      throw new IOException("Malformed rules document:" + e.getMessage(), e);
    } catch (IllegalStateException e) {
      // gson type mismatch, i.e. a string where an array was expected
      throw new IOException("Malformed rules document:" + e.getMessage(), e);
    } catch (UnsupportedOperationException e) {
      // null where a string was expected
      throw new IOException("Malformed rules document:" + e.getMessage(), e);
    }
  }

  /**
   * build rules from a parsed document
   * 
   * @param defaults
   *          source of values for absent keys, or null if every key is
   *          required
   */
  static CanonicalizationRules fromJSON(JsonObject jsonObj,
      CanonicalizationRules defaults) throws IOException {

    HostMatching hostMatching = (defaults != null) ? defaults.hostMatching : null;
    JsonElement modeElement = jsonObj.get(KEY_HOST_MATCHING);
    if (modeElement != null) {
      try {
        hostMatching = HostMatching.fromName(modeElement.getAsString());
      } catch (IllegalArgumentException e) {
        throw new IOException(e.getMessage(), e);
      }
    } else if (hostMatching == null) {
      throw new IOException("Missing required key:" + KEY_HOST_MATCHING);
    }

    JsonObject twitter = section(jsonObj, KEY_TWITTER);
    JsonObject youtube = section(jsonObj, KEY_YOUTUBE);
    JsonObject generic = section(jsonObj, KEY_GENERIC);

    ImmutableList<String> twitterDomains = stringList(twitter, KEY_TWITTER,
        KEY_DOMAINS, (defaults != null) ? defaults.twitterDomains : null);
    String twitterCanonicalDomain = (defaults != null) ? defaults.twitterCanonicalDomain
        : null;
    if (twitter != null && twitter.has(KEY_CANONICAL_DOMAIN)) {
      JsonElement domainElement = twitter.get(KEY_CANONICAL_DOMAIN);
      twitterCanonicalDomain = domainElement.isJsonNull() ? null : domainElement
          .getAsString();
    }
    ImmutableList<String> youtubeDomains = stringList(youtube, KEY_YOUTUBE,
        KEY_DOMAINS, (defaults != null) ? defaults.youtubeDomains : null);
    ImmutableList<String> youtubeHosts = stringList(youtube, KEY_YOUTUBE,
        KEY_HOSTS, (defaults != null) ? defaults.youtubeHosts : null);
    ImmutableList<String> youtubeParameters = stringList(youtube, KEY_YOUTUBE,
        KEY_RETAIN_PARAMETERS, (defaults != null) ? defaults.youtubeParameters
            : null);
    ImmutableList<String> tracking = stringList(generic, KEY_GENERIC,
        KEY_TRACKING_PARAMETERS,
        (defaults != null) ? defaults.trackingParameters.asList() : null);

    return new CanonicalizationRules(twitterDomains, twitterCanonicalDomain,
        youtubeDomains, youtubeHosts, youtubeParameters,
        ImmutableSet.copyOf(tracking), hostMatching);
  }

  private static JsonObject section(JsonObject jsonObj, String name) {
    JsonElement element = jsonObj.get(name);
    if (element == null) {
      return null;
    }
    return element.getAsJsonObject();
  }

  private static ImmutableList<String> stringList(JsonObject section,
      String sectionName, String key, ImmutableList<String> defaultValue)
      throws IOException {
    JsonElement element = (section != null) ? section.get(key) : null;
    if (element == null) {
      if (defaultValue == null) {
        throw new IOException("Missing required key:" + sectionName + "." + key);
      }
      return defaultValue;
    }
    JsonArray array = element.getAsJsonArray();
    ImmutableList.Builder<String> builder = ImmutableList.builder();
    for (JsonElement item : array) {
      builder.add(item.getAsString());
    }
    return builder.build();
  }

  public ImmutableList<String> getTwitterDomains() {
    return twitterDomains;
  }

  /**
   * registrable domain the other twitter domains are folded into, keeping
   * any sub domain labels: mobile.x.com becomes mobile.twitter.com. null
   * leaves every host untouched.
   */
  public String getTwitterCanonicalDomain() {
    return twitterCanonicalDomain;
  }

  public ImmutableList<String> getYouTubeDomains() {
    return youtubeDomains;
  }

  /** hosts that only match exactly, i.e. youtu.be */
  public ImmutableList<String> getYouTubeHosts() {
    return youtubeHosts;
  }

  /** retained youtube parameters, in output order */
  public ImmutableList<String> getYouTubeParameters() {
    return youtubeParameters;
  }

  public ImmutableSet<String> getTrackingParameters() {
    return trackingParameters;
  }

  public HostMatching getHostMatching() {
    return hostMatching;
  }
}
