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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/**
 * resolves dot segments in hierarchical url paths, i.e.
 * /aa/bb/../cc/./foo.html becomes /aa/cc/foo.html
 */
public class URLPathNormalizer {

  private static final Splitter SEGMENT_SPLITTER = Splitter.on('/');
  private static final Joiner SEGMENT_JOINER = Joiner.on('/');

  public static String removeDotSegments(String path) {
    // only absolute paths carry segments, and no dot (plain or escaped) means
    // nothing to do
    if (path == null || !path.startsWith("/")
        || (path.indexOf('.') == -1 && path.indexOf('%') == -1)) {
      return path;
    }

    List<String> segments = SEGMENT_SPLITTER.splitToList(path.substring(1));
    List<String> output = new ArrayList<String>(segments.size());
    boolean modified = false;

    for (int i = 0; i < segments.size(); ++i) {
      String segment = segments.get(i);
      boolean last = (i == segments.size() - 1);

      if (isSingleDot(segment)) {
        modified = true;
        if (last) {
          output.add("");
        }
      } else if (isDoubleDot(segment)) {
        modified = true;
        if (!output.isEmpty()) {
          output.remove(output.size() - 1);
        }
        if (last) {
          output.add("");
        }
      } else {
        output.add(segment);
      }
    }

    if (!modified) {
      return path;
    }
    return "/" + SEGMENT_JOINER.join(output);
  }

  static boolean isSingleDot(String segment) {
    return segment.equals(".") || segment.equalsIgnoreCase("%2e");
  }

  static boolean isDoubleDot(String segment) {
    if (segment.equals("..")) {
      return true;
    }
    String lower = segment.toLowerCase(Locale.ROOT);
    return lower.equals(".%2e") || lower.equals("%2e.") || lower.equals("%2e%2e");
  }
}
