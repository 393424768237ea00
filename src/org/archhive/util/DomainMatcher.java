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
 * host name predicates used by the platform rules
 */
public class DomainMatcher {

  /**
   * test whether a host is the given domain or one of its sub domains
   * 
   * @param hostName
   *          lower case host name with any leading www. already removed
   * @param domain
   *          bare registrable domain, i.e. twitter.com
   * @return true if hostName equals domain or ends with "." + domain
   */
  public static boolean matches(String hostName, String domain) {
    if (hostName == null || domain == null) {
      return false;
    }
    // the dot keeps nottwitter.com from matching twitter.com
    return hostName.equals(domain) || hostName.endsWith("." + domain);
  }

  /**
   * loose containment check, kept for the substring host matching mode.
   * matches any host that merely contains the domain text.
   */
  public static boolean contains(String hostName, String domain) {
    if (hostName == null || domain == null) {
      return false;
    }
    return hostName.contains(domain);
  }
}
