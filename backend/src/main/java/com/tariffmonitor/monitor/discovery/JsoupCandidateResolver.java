package com.tariffmonitor.monitor.discovery;

import com.tariffmonitor.config.MonitorProperties;
import com.tariffmonitor.monitor.model.CandidateLink;
import com.tariffmonitor.monitor.util.DocumentUrlUtils;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collects PDF links from a source page. Relative links are resolved against the page, query
 * strings and fragments are dropped, and the first occurrence of each url wins.
 */
@Service
public class JsoupCandidateResolver implements CandidateResolver {
    private static final Logger log = LoggerFactory.getLogger(JsoupCandidateResolver.class);
    private static final int MAX_CONTEXT_CHARS = 200;

    private final MonitorProperties properties;

    public JsoupCandidateResolver(MonitorProperties properties) {
        this.properties = properties;
    }

    @Override
    public List<CandidateLink> resolveCandidates(String sourcePageUrl) throws CandidateResolutionException {
        if (!DocumentUrlUtils.isHttpUrl(sourcePageUrl)) {
            throw new CandidateResolutionException("Source url is not an http(s) url: " + sourcePageUrl);
        }
        Document page;
        try {
            page = Jsoup.connect(sourcePageUrl)
                .userAgent(properties.getUserAgent())
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.5")
                .timeout(properties.getFetch().getPageTimeoutSeconds() * 1000)
                .get();
        } catch (HttpStatusException e) {
            throw new CandidateResolutionException(
                "HTTP status " + e.getStatusCode() + " from " + sourcePageUrl, e);
        } catch (IOException e) {
            throw new CandidateResolutionException("Failed to load " + sourcePageUrl + ": " + e.getMessage(), e);
        }

        Map<String, CandidateLink> candidates = new LinkedHashMap<>();
        for (Element anchor : page.select("a[href]")) {
            String href = anchor.attr("href");
            if (!href.toLowerCase(Locale.ROOT).contains(".pdf")) {
                continue;
            }
            String url = DocumentUrlUtils.resolveAndClean(page.location(), href);
            if (url == null || candidates.containsKey(url)) {
                continue;
            }
            candidates.put(url, new CandidateLink(url, anchor.text().trim(), contextOf(anchor)));
        }
        log.info("Found {} PDF link(s) on {}", candidates.size(), sourcePageUrl);
        return new ArrayList<>(candidates.values());
    }

    private String contextOf(Element anchor) {
        Element parent = anchor.parent();
        if (parent == null) {
            return null;
        }
        String text = parent.text().trim();
        if (text.length() > MAX_CONTEXT_CHARS) {
            text = text.substring(0, MAX_CONTEXT_CHARS);
        }
        return text.isEmpty() ? null : text;
    }
}
