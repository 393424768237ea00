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

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/**
 * Ordered list of query parameters that keeps each pair's original encoded
 * text. Names are matched after form decoding ('+' as space,
 * percent escapes resolved), case sensitively.
 */
public class QueryString {

  private static final Splitter PAIR_SPLITTER = Splitter.on('&').omitEmptyStrings();
  private static final Joiner PAIR_JOINER = Joiner.on('&');

  /**
   * a single name=value pair
   */
  public static class Parameter {

    private final String rawName;
    private final String rawValue;
    private final String name;
    private final String value;

    Parameter(String rawName, String rawValue) {
      this.rawName = rawName;
      this.rawValue = rawValue;
      this.name = formDecode(rawName);
      this.value = formDecode(rawValue);
    }

    /** decoded name */
    public String getName() {
      return name;
    }

    /** decoded value, empty if the pair had no '=' */
    public String getValue() {
      return value;
    }

    /** encoded text as it appeared in the url, always name=value */
    public String toQueryText() {
      return rawName + "=" + rawValue;
    }

    @Override
    public String toString() {
      return toQueryText();
    }
  }

  private final List<Parameter> parameters;

  private QueryString(List<Parameter> parameters) {
    this.parameters = parameters;
  }

  /**
   * @param query
   *          query text without the leading '?', may be null
   */
  public static QueryString parse(String query) {
    List<Parameter> parameters = new ArrayList<Parameter>();
    if (query != null) {
      for (String pair : PAIR_SPLITTER.split(query)) {
        int equalsPos = pair.indexOf('=');
        if (equalsPos == -1) {
          parameters.add(new Parameter(pair, ""));
        } else {
          parameters.add(new Parameter(pair.substring(0, equalsPos), pair
              .substring(equalsPos + 1)));
        }
      }
    }
    return new QueryString(parameters);
  }

  /**
   * drop every parameter whose decoded name is in the given collection
   */
  public void removeAll(Collection<String> names) {
    Iterator<Parameter> iterator = parameters.iterator();
    while (iterator.hasNext()) {
      if (names.contains(iterator.next().getName())) {
        iterator.remove();
      }
    }
  }

  /**
   * keep only the first non empty occurrence of each listed name, ordered as
   * listed
   */
  public void retainOnly(List<String> names) {
    List<Parameter> retained = new ArrayList<Parameter>(names.size());
    for (String name : names) {
      Parameter parameter = getFirst(name);
      if (parameter != null && parameter.getValue().length() != 0) {
        retained.add(parameter);
      }
    }
    parameters.clear();
    parameters.addAll(retained);
  }

  /**
   * @return first parameter with the given decoded name, or null
   */
  public Parameter getFirst(String name) {
    for (Parameter parameter : parameters) {
      if (parameter.getName().equals(name)) {
        return parameter;
      }
    }
    return null;
  }

  public boolean isEmpty() {
    return parameters.isEmpty();
  }

  /** encoded query text without leading '?', empty if no parameters remain */
  @Override
  public String toString() {
    List<String> pairs = new ArrayList<String>(parameters.size());
    for (Parameter parameter : parameters) {
      pairs.add(parameter.toQueryText());
    }
    return PAIR_JOINER.join(pairs);
  }

  /**
   * application/x-www-form-urlencoded decoding that never fails: malformed
   * escapes are kept literally
   */
  static String formDecode(String text) {
    if (text.indexOf('%') == -1 && text.indexOf('+') == -1) {
      return text;
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream(text.length());
    StringBuilder out = new StringBuilder(text.length());
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '%' && i + 2 < text.length() && isHex(text.charAt(i + 1))
          && isHex(text.charAt(i + 2))) {
        bytes.write((Character.digit(text.charAt(i + 1), 16) << 4)
            | Character.digit(text.charAt(i + 2), 16));
        i += 3;
        continue;
      }
      flush(bytes, out);
      out.append(c == '+' ? ' ' : c);
      ++i;
    }
    flush(bytes, out);
    return out.toString();
  }

  private static void flush(ByteArrayOutputStream bytes, StringBuilder out) {
    if (bytes.size() != 0) {
      out.append(new String(bytes.toByteArray(), Charsets.UTF_8));
      bytes.reset();
    }
  }

  private static boolean isHex(char c) {
    return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f')
        || (c >= 'A' && c <= 'F');
  }
}
