package com.bluecollar.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class UrlUtilsTest {

  @Test
  void testStripsLeadingWww() {
    assertEquals("tmz.com", UrlUtils.extractSource("https://www.tmz.com/2024/01/01/story"));
  }

  @Test
  void testKeepsOtherSubdomains() {
    assertEquals("news.bbc.co.uk", UrlUtils.extractSource("http://news.bbc.co.uk/article?id=1"));
  }

  @Test
  void testLowerCasesHost() {
    assertEquals("example.com", UrlUtils.extractSource("https://WWW.Example.COM/path"));
  }

  @Test
  void testUnparseableOrRelativeIsUnknown() {
    assertEquals(UrlUtils.UNKNOWN_SOURCE, UrlUtils.extractSource("not a url"));
    assertEquals(UrlUtils.UNKNOWN_SOURCE, UrlUtils.extractSource("/relative/path"));
    assertEquals(UrlUtils.UNKNOWN_SOURCE, UrlUtils.extractSource("mailto:someone@example.com"));
    assertEquals(UrlUtils.UNKNOWN_SOURCE, UrlUtils.extractSource(""));
    assertEquals(UrlUtils.UNKNOWN_SOURCE, UrlUtils.extractSource(null));
  }
}
