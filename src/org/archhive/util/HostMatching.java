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
 * how a host name is tested against a platform domain
 */
public enum HostMatching {

  /** exact match or dot separated sub domain (see {@link DomainMatcher#matches}) */
  SUFFIX,

  /** plain substring containment (see {@link DomainMatcher#contains}) */
  SUBSTRING;

  public boolean matches(String hostName, String domain) {
    if (this == SUBSTRING) {
      return DomainMatcher.contains(hostName, domain);
    }
    return DomainMatcher.matches(hostName, domain);
  }

  public static HostMatching fromName(String name) {
    for (HostMatching mode : values()) {
      if (mode.name().equalsIgnoreCase(name)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown host matching mode:" + name);
  }
}
