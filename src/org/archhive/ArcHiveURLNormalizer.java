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

package org.archhive;

import org.archhive.util.CanonicalizationRules;
import org.archhive.util.PlatformClassifier;
import org.archhive.util.URLCanonicalizer;

/**
 * Canonical url comparison for archived content verification.
 * 
 * Two urls that differ only in scheme, fragment, a leading www., host case
 * or tracking query parameters normalize to the same string. Twitter / X
 * urls lose their whole query, YouTube urls keep only the video and
 * playlist ids, everything else loses a fixed list of tracking parameters.
 * 
 * The static methods use the bundled rules. Create an instance to run with
 * rules loaded through {@link CanonicalizationRules#load}.
 */
public class ArcHiveURLNormalizer {

  private static ArcHiveURLNormalizer _defaultNormalizer;

  private final URLCanonicalizer canonicalizer;
  private final PlatformClassifier platformClassifier;

  public ArcHiveURLNormalizer(CanonicalizationRules rules) {
    this(new URLCanonicalizer(rules));
  }

  ArcHiveURLNormalizer(URLCanonicalizer canonicalizer) {
    this.canonicalizer = canonicalizer;
    this.platformClassifier = new PlatformClassifier(
        canonicalizer.getRuleSelector());
  }

  private static synchronized ArcHiveURLNormalizer getDefault() {
    if (_defaultNormalizer == null) {
      _defaultNormalizer = new ArcHiveURLNormalizer(
          URLCanonicalizer.getDefault());
    }
    return _defaultNormalizer;
  }

  /**
   * @return canonical form of url, "" for null or empty input
   */
  public static String normalizeUrl(String url) {
    return getDefault().normalize(url);
  }

  /**
   * @return true if both urls have the same canonical form
   */
  public static boolean urlsMatch(String url1, String url2) {
    return getDefault().matches(url1, url2);
  }

  /**
   * @return "twitter", "youtube" or "generic"
   */
  public static String getPlatform(String url) {
    return getDefault().platformOf(url);
  }

  public String normalize(String url) {
    return canonicalizer.canonicalize(url);
  }

  public boolean matches(String url1, String url2) {
    return normalize(url1).equals(normalize(url2));
  }

  public String platformOf(String url) {
    return platformClassifier.getPlatform(url).getLabel();
  }
}
