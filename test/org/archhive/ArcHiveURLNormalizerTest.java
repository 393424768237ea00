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
import org.archhive.util.HostMatching;
import org.junit.Assert;
import org.junit.Test;

public class ArcHiveURLNormalizerTest {

  @Test
  public void testNormalizeUrl() {
    Assert.assertEquals("twitter.com/user/status/123", ArcHiveURLNormalizer
        .normalizeUrl("https://twitter.com/user/status/123?s=20&utm_source=x"));
    Assert.assertEquals("youtube.com/watch?v=abc123&list=PL1",
        ArcHiveURLNormalizer
            .normalizeUrl("https://www.youtube.com/watch?t=30&list=PL1&v=abc123"));
    Assert.assertEquals("example.com/page?id=5", ArcHiveURLNormalizer
        .normalizeUrl("https://example.com/page?id=5&utm_source=fb&ref=home"));
    Assert.assertEquals("example.com/Path",
        ArcHiveURLNormalizer.normalizeUrl("https://WWW.Example.com/Path"));
    Assert.assertEquals("example.com/x?id=1",
        ArcHiveURLNormalizer.normalizeUrl("https://example.com/x?id=1#section"));
    Assert.assertEquals("", ArcHiveURLNormalizer.normalizeUrl(""));
    Assert.assertEquals("", ArcHiveURLNormalizer.normalizeUrl(null));
  }

  @Test
  public void testUrlsMatch() {
    Assert.assertTrue(ArcHiveURLNormalizer.urlsMatch(
        "https://x.com/a/status/1?s=20", "https://twitter.com/a/status/1"));
    Assert.assertTrue(ArcHiveURLNormalizer.urlsMatch(
        "example.com/page?utm_source=x", "http://www.example.com/page#top"));
    Assert.assertTrue(ArcHiveURLNormalizer.urlsMatch(
        "https://youtu.be/abc?t=10", "https://youtu.be/abc"));
    Assert.assertTrue(ArcHiveURLNormalizer.urlsMatch(null, ""));
    Assert.assertTrue(ArcHiveURLNormalizer.urlsMatch(
        "https://mobile.x.com/a/status/1", "https://mobile.twitter.com/a/status/1"));

    Assert.assertFalse(ArcHiveURLNormalizer.urlsMatch(
        "https://example.com/page?id=5", "https://example.com/page?id=6"));
    Assert.assertFalse(ArcHiveURLNormalizer.urlsMatch(
        "https://www.youtube.com/watch?v=a", "https://www.youtube.com/watch?v=b"));
    Assert.assertFalse(ArcHiveURLNormalizer.urlsMatch(
        "https://example.com/Page", "https://example.com/page"));
    Assert.assertFalse(ArcHiveURLNormalizer.urlsMatch(
        "https://help.twitter.com/en/x", "https://twitter.com/en/x"));
    Assert.assertFalse(ArcHiveURLNormalizer.urlsMatch(
        "https://developer.x.com/en/x", "https://twitter.com/en/x"));
  }

  @Test
  public void testGetPlatform() {
    Assert.assertEquals("youtube",
        ArcHiveURLNormalizer.getPlatform("https://youtu.be/abc"));
    Assert.assertEquals("twitter",
        ArcHiveURLNormalizer.getPlatform("https://mobile.twitter.com/a"));
    Assert.assertEquals("generic",
        ArcHiveURLNormalizer.getPlatform("https://example.com/"));
    Assert.assertEquals("generic", ArcHiveURLNormalizer.getPlatform("::::"));
    Assert.assertEquals("youtube",
        ArcHiveURLNormalizer.getPlatform("https:youtu.be/abc"));
    Assert.assertEquals("generic",
        ArcHiveURLNormalizer.getPlatform("ipfs://twitter/path"));
    Assert.assertEquals("generic", ArcHiveURLNormalizer.getPlatform(null));
  }

  @Test
  public void testInstanceWithCustomRules() {
    ArcHiveURLNormalizer loose = new ArcHiveURLNormalizer(CanonicalizationRules
        .getDefault().withHostMatching(HostMatching.SUBSTRING));
    Assert.assertEquals("twitter",
        loose.platformOf("https://eviltwitter.com.attacker.net/"));
    // twitter policy drops the query, the host is not an x.com suffix so it stays
    Assert.assertEquals("eviltwitter.com.attacker.net/x",
        loose.normalize("https://eviltwitter.com.attacker.net/x?id=1"));
    Assert.assertEquals("generic",
        new ArcHiveURLNormalizer(CanonicalizationRules.getDefault())
            .platformOf("https://eviltwitter.com.attacker.net/"));
  }
}
