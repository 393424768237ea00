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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Reports which platform a raw url belongs to. Shares {@link RuleSelector}
 * with {@link URLCanonicalizer}, so the label always names the policy the
 * canonicalizer applies to a parseable url. Urls that fail the strict parse
 * are reported as {@link Platform#GENERIC}; no scheme repair is attempted.
 */
public class PlatformClassifier {

  private static final Log LOG = LogFactory.getLog(PlatformClassifier.class);

  private final RuleSelector ruleSelector;

  public PlatformClassifier(RuleSelector ruleSelector) {
    this.ruleSelector = ruleSelector;
  }

  public PlatformClassifier(CanonicalizationRules rules) {
    this(new RuleSelector(rules));
  }

  public Platform getPlatform(String incomingURL) {
    if (incomingURL == null || incomingURL.length() == 0) {
      return Platform.GENERIC;
    }
    ParsedURL urlObject;
    try {
      urlObject = ParsedURL.parse(incomingURL);
    } catch (MalformedURLException e) {
      LOG.debug("Unparseable URL:" + incomingURL + " classified as generic");
      return Platform.GENERIC;
    }
    return ruleSelector.classify(ParsedURL.cleanHostName(urlObject.getHost()));
  }
}
