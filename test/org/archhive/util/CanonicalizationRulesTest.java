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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.junit.Assert;
import org.junit.Test;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;

public class CanonicalizationRulesTest {

  private static CanonicalizationRules loadString(String document)
      throws IOException {
    return CanonicalizationRules.load(new ByteArrayInputStream(document
        .getBytes(Charsets.UTF_8)));
  }

  @Test
  public void testBundledDefaults() {
    CanonicalizationRules rules = CanonicalizationRules.getDefault();
    Assert.assertEquals(HostMatching.SUFFIX, rules.getHostMatching());
    Assert.assertEquals(ImmutableList.of("twitter.com", "x.com"),
        rules.getTwitterDomains());
    Assert.assertEquals("twitter.com", rules.getTwitterCanonicalDomain());
    Assert.assertEquals(ImmutableList.of("youtube.com"), rules.getYouTubeDomains());
    Assert.assertEquals(ImmutableList.of("youtu.be"), rules.getYouTubeHosts());
    Assert.assertEquals(ImmutableList.of("v", "list"),
        rules.getYouTubeParameters());
  }

  @Test
  public void testBundledTrackingList() {
    ImmutableList<String> expected = ImmutableList.of("utm_source",
        "utm_medium", "utm_campaign", "utm_content", "utm_term", "utm_id",
        "utm_source_platform", "utm_creative_format", "utm_marketing_tactic",
        "_ga", "_gl", "gclid", "gclsrc", "fbclid", "fb_action_ids",
        "fb_action_types", "fb_source", "fb_ref", "msclkid", "igshid", "ref",
        "ref_src", "ref_url", "source", "mc_cid", "mc_eid", "campaign_id",
        "ad_id", "adset_id", "ad_name", "adset_name", "campaign_name", "share",
        "shared");
    Assert.assertEquals(expected,
        CanonicalizationRules.getDefault().getTrackingParameters().asList());
  }

  @Test
  public void testDefaultIsShared() {
    Assert.assertSame(CanonicalizationRules.getDefault(),
        CanonicalizationRules.getDefault());
  }

  @Test
  public void testPartialDocumentKeepsDefaults() throws IOException {
    CanonicalizationRules rules = loadString("{ \"hostMatching\" : \"SUBSTRING\" }");
    Assert.assertEquals(HostMatching.SUBSTRING, rules.getHostMatching());
    Assert.assertEquals(CanonicalizationRules.getDefault().getTrackingParameters(),
        rules.getTrackingParameters());
    Assert.assertEquals("twitter.com", rules.getTwitterCanonicalDomain());
  }

  @Test
  public void testLoadFixture() throws IOException {
    InputStream in = getClass().getClassLoader().getResourceAsStream(
        "substring-matching-rules.json");
    Assert.assertNotNull(in);
    CanonicalizationRules rules;
    try {
      rules = CanonicalizationRules.load(in);
    } finally {
      in.close();
    }
    Assert.assertEquals(HostMatching.SUBSTRING, rules.getHostMatching());
    Assert.assertEquals(ImmutableList.of("sessionid", "utm_source"), rules
        .getTrackingParameters().asList());
    Assert.assertEquals(ImmutableList.of("v", "list"),
        rules.getYouTubeParameters());

    URLCanonicalizer canonicalizer = new URLCanonicalizer(rules);
    Assert.assertEquals("example.com/a?ref=b",
        canonicalizer.canonicalize("https://example.com/a?sessionid=1&ref=b"));
  }

  @Test
  public void testWithHostMatching() {
    CanonicalizationRules rules = CanonicalizationRules.getDefault();
    Assert.assertSame(rules, rules.withHostMatching(HostMatching.SUFFIX));
    CanonicalizationRules loose = rules.withHostMatching(HostMatching.SUBSTRING);
    Assert.assertEquals(HostMatching.SUBSTRING, loose.getHostMatching());
    Assert.assertEquals(rules.getTrackingParameters(),
        loose.getTrackingParameters());
  }

  @Test(expected = IOException.class)
  public void testMalformedJSON() throws IOException {
    loadString("{ not json");
  }

  @Test(expected = IOException.class)
  public void testDocumentMustBeAnObject() throws IOException {
    loadString("[ \"utm_source\" ]");
  }

  @Test(expected = IOException.class)
  public void testUnknownHostMatchingMode() throws IOException {
    loadString("{ \"hostMatching\" : \"sideways\" }");
  }

  @Test(expected = IOException.class)
  public void testWrongValueType() throws IOException {
    loadString("{ \"twitter\" : { \"domains\" : { \"a\" : 1 } } }");
  }
}
