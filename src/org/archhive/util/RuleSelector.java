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

/**
 * Maps a cleaned host name to the {@link Platform} whose normalization policy
 * applies. This is the single classifier behind both url canonicalization
 * and the platform label api.
 * 
 * Rules are tested first match wins: twitter domains, then youtube domains,
 * then youtube exact hosts, else generic.
 */
public class RuleSelector {

  private final CanonicalizationRules rules;

  public RuleSelector(CanonicalizationRules rules) {
    this.rules = rules;
  }

  /**
   * @param hostName
   *          lower case host name with one leading www. removed
   */
  public Platform classify(String hostName) {
    if (hostName == null || hostName.length() == 0) {
      return Platform.GENERIC;
    }
    HostMatching mode = rules.getHostMatching();

    for (String domain : rules.getTwitterDomains()) {
      if (mode.matches(hostName, domain)) {
        return Platform.TWITTER;
      }
    }
    for (String domain : rules.getYouTubeDomains()) {
      if (mode.matches(hostName, domain)) {
        return Platform.YOUTUBE;
      }
    }
    for (String host : rules.getYouTubeHosts()) {
      if (mode == HostMatching.SUBSTRING) {
        if (DomainMatcher.contains(hostName, host)) {
          return Platform.YOUTUBE;
        }
      } else if (hostName.equals(host)) {
        return Platform.YOUTUBE;
      }
    }
    return Platform.GENERIC;
  }
}
