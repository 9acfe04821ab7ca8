package com.tariffmonitor.monitor.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class DocumentUrlUtils {
  public static final String FALLBACK_DOCUMENT_NAME = "unknown.pdf";

  private DocumentUrlUtils() {}

  /**
   * Resolves {@code href} against {@code baseUrl} and drops query string and fragment, so the
   * same document linked with tracking parameters maps to one url.
   */
  public static String resolveAndClean(String baseUrl, String href) {
    if (href == null || href.isBlank()) {
      return null;
    }
    try {
      URI resolved = baseUrl == null || baseUrl.isBlank()
          ? new URI(href.trim())
          : new URI(baseUrl.trim()).resolve(href.trim().replace(" ", "%20"));
      return clean(resolved);
    } catch (URISyntaxException | IllegalArgumentException e) {
      return null;
    }
  }

  public static boolean isHttpUrl(String url) {
    if (url == null) {
      return false;
    }
    String lower = url.trim().toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }

  /** Last path segment of the url, or {@value #FALLBACK_DOCUMENT_NAME} when there is none. */
  public static String documentName(String url) {
    if (url == null || url.isBlank()) {
      return FALLBACK_DOCUMENT_NAME;
    }
    String path;
    try {
      path = new URI(url.trim()).getPath();
    } catch (URISyntaxException e) {
      path = url.trim();
    }
    if (path == null || path.isBlank()) {
      return FALLBACK_DOCUMENT_NAME;
    }
    int slash = path.lastIndexOf('/');
    String name = slash >= 0 ? path.substring(slash + 1) : path;
    return name.isBlank() ? FALLBACK_DOCUMENT_NAME : name;
  }

  private static String clean(URI uri) {
    if (uri.getScheme() == null || uri.getHost() == null) {
      return null;
    }
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      return null;
    }
    StringBuilder out = new StringBuilder()
        .append(scheme)
        .append("://")
        .append(uri.getRawAuthority());
    String path = uri.getRawPath();
    if (path != null) {
      out.append(path);
    }
    return out.toString();
  }
}
