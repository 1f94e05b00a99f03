package com.delta.siteextract.crawl.discovery;

import com.delta.siteextract.crawl.model.CrawlSettings;
import com.delta.siteextract.crawl.util.UrlNormalizer;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Decides whether a normalized link may become a crawl task for the site rooted at
 * {@code siteRoot}. A site whose start page redirects to another origin is rooted at both.
 */
public final class LinkFilter {
    private final List<String> siteRoots;
    private final boolean followExternalLinks;
    private final List<Pattern> includePatterns;
    private final List<Pattern> excludePatterns;
    private final PageTypeRules rules;

    public LinkFilter(String siteRoot, CrawlSettings settings, PageTypeRules rules) {
        this(
            List.of(siteRoot),
            settings.followExternalLinks(),
            settings.compiledIncludePatterns(),
            settings.compiledExcludePatterns(),
            rules
        );
    }

    private LinkFilter(
        List<String> siteRoots,
        boolean followExternalLinks,
        List<Pattern> includePatterns,
        List<Pattern> excludePatterns,
        PageTypeRules rules
    ) {
        this.siteRoots = List.copyOf(siteRoots);
        this.followExternalLinks = followExternalLinks;
        this.includePatterns = includePatterns;
        this.excludePatterns = excludePatterns;
        this.rules = rules;
    }

    /** Same filter, also treating {@code url}'s origin as part of the site. */
    public LinkFilter withSiteRoot(String url) {
        if (url == null || isInternal(url)) {
            return this;
        }
        List<String> roots = new ArrayList<>(siteRoots);
        roots.add(url);
        return new LinkFilter(roots, followExternalLinks, includePatterns, excludePatterns, rules);
    }

    public boolean isInternal(String url) {
        for (String root : siteRoots) {
            if (UrlNormalizer.isSameOrigin(root, url)) {
                return true;
            }
        }
        return false;
    }

    public boolean accepts(String url) {
        if (url == null) {
            return false;
        }
        if (!followExternalLinks && !isInternal(url)) {
            return false;
        }
        if (UrlNormalizer.isAsset(url)) {
            return false;
        }
        URI uri = UrlNormalizer.safeUri(url);
        if (uri != null && rules.isIgnoredPath(uri.getPath())) {
            return false;
        }
        for (Pattern exclude : excludePatterns) {
            if (exclude.matcher(url).find()) {
                return false;
            }
        }
        if (includePatterns.isEmpty()) {
            return true;
        }
        for (Pattern include : includePatterns) {
            if (include.matcher(url).find()) {
                return true;
            }
        }
        return false;
    }
}
