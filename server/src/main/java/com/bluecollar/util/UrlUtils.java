package com.bluecollar.util;

import com.google.common.base.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import javax.annotation.Nonnull;

/** Helpers for article links. */
public final class UrlUtils {

  public static final String UNKNOWN_SOURCE = "unknown-source";

  private static final String WWW_PREFIX = "www.";

  private UrlUtils() {
    // Utility class, no instances
  }

  /**
   * Derives the feed source from an article link: its host name, lower-cased, without a leading
   * {@code www.}. Returns {@link #UNKNOWN_SOURCE} for anything that is not an absolute URL with a
   * host.
   */
  @Nonnull
  public static String extractSource(String url) {
    if (Strings.isNullOrEmpty(url)) {
      return UNKNOWN_SOURCE;
    }
    String host;
    try {
      URI uri = new URI(url.trim());
      if (!uri.isAbsolute()) {
        return UNKNOWN_SOURCE;
      }
      host = uri.getHost();
    } catch (URISyntaxException e) {
      return UNKNOWN_SOURCE;
    }
    if (Strings.isNullOrEmpty(host)) {
      return UNKNOWN_SOURCE;
    }
    host = host.toLowerCase(Locale.ROOT);
    if (host.startsWith(WWW_PREFIX) && host.length() > WWW_PREFIX.length()) {
      host = host.substring(WWW_PREFIX.length());
    }
    return host;
  }
}
