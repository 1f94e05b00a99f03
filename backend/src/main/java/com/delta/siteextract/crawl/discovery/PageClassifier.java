package com.delta.siteextract.crawl.discovery;

import com.delta.siteextract.crawl.model.Classification;
import com.delta.siteextract.crawl.model.PageType;
import com.delta.siteextract.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class PageClassifier {
    private static final int MAX_KEYWORD_HITS = 3;

    private final PageTypeRules rules;

    public PageClassifier(PageTypeRules rules) {
        this.rules = rules;
    }

    public Classification classify(String url, String html, LinkFilter filter, Set<String> known, int maxLinks) {
        Document document = Jsoup.parse(html == null ? "" : html, url);
        return classify(url, document, filter, known, maxLinks);
    }

    /**
     * Assigns a page type and collects the outbound links worth crawling.
     *
     * @param known    URLs already visited or queued for this site; never returned again
     * @param maxLinks cap on returned links, taken in document order
     */
    public Classification classify(String url, Document document, LinkFilter filter, Set<String> known, int maxLinks) {
        PageType type = classifyType(url, document);
        Set<String> accepted = new LinkedHashSet<>();
        int dropped = 0;
        for (Element anchor : document.select("a[href], area[href]")) {
            String link = UrlNormalizer.resolve(url, anchor.attr("href"));
            if (link == null || accepted.contains(link)) {
                continue;
            }
            if (known.contains(link) || !filter.accepts(link)) {
                continue;
            }
            if (accepted.size() >= maxLinks) {
                dropped++;
                continue;
            }
            accepted.add(link);
        }
        return new Classification(type, new ArrayList<>(accepted), dropped);
    }

    public PageType classifyType(String url, Document document) {
        URI uri = UrlNormalizer.safeUri(url);
        String path = uri == null || uri.getPath() == null ? "/" : uri.getPath();
        PageType byPath = rules.matchPath(path);
        if (byPath != null) {
            return byPath;
        }
        return document == null ? PageType.OTHER : classifyByContent(document);
    }

    PageType classifyByContent(Document document) {
        String text = document.body() == null ? "" : document.body().text().toLowerCase(Locale.ROOT);
        PageType best = PageType.OTHER;
        int bestScore = 0;
        for (Map.Entry<PageType, PageTypeRules.ContentCues> entry : rules.contentCues().entrySet()) {
            PageTypeRules.ContentCues cues = entry.getValue();
            int score = scoreHeadings(document, cues.headings())
                + scoreClasses(document, cues.classes())
                + scoreKeywords(text, cues.keywords());
            if (score > bestScore) {
                bestScore = score;
                best = entry.getKey();
            }
        }
        return best;
    }

    private int scoreHeadings(Document document, List<String> keywords) {
        int score = 0;
        for (Element heading : document.select("h1, h2, h3, h4, h5, h6")) {
            String headingText = heading.text().toLowerCase(Locale.ROOT);
            int weight = switch (heading.normalName()) {
                case "h1" -> 3;
                case "h2", "h3" -> 2;
                default -> 1;
            };
            for (String keyword : keywords) {
                if (headingText.contains(keyword)) {
                    score += weight;
                }
            }
        }
        return score;
    }

    private int scoreClasses(Document document, List<String> keywords) {
        int score = 0;
        for (Element element : document.select("[class]")) {
            String classText = element.className().toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (classText.contains(keyword)) {
                    score++;
                }
            }
        }
        return score;
    }

    private int scoreKeywords(String text, List<String> keywords) {
        int score = 0;
        for (String keyword : keywords) {
            int count = 0;
            int from = text.indexOf(keyword);
            while (from >= 0 && count < MAX_KEYWORD_HITS) {
                count++;
                from = text.indexOf(keyword, from + keyword.length());
            }
            score += count;
        }
        return score;
    }
}
