package fun.fengwk.smh.core.service.parser;

import fun.fengwk.smh.core.service.enrich.EnrichmentProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Readability style main text extraction on top of jsoup.
 *
 * <p>Pipeline: drop non-content nodes, strip page chrome, pick the best scoring main container,
 * render it as one line per block. Documents that fail the precision checks yield {@code null}.
 *
 * @author fengwk
 */
@Component
public class HtmlMainContentExtractor implements ContentExtractor {

    private static final int MIN_MAIN_TEXT_LENGTH = 120;

    private static final double MAX_LINK_DENSITY = 0.6D;

    private static final int LOGIN_WALL_MAX_TEXT_LENGTH = 400;

    private static final String NON_CONTENT_SELECTOR = String.join(", ",
        "script", "style", "noscript", "template", "head", "meta", "link",
        "iframe", "object", "embed", "svg", "canvas",
        "img", "picture", "video", "audio", "source", "figure",
        "input", "button", "select", "textarea", "label"
    );

    private static final List<String> BOILERPLATE_SELECTORS = List.of(
        "header",
        "footer",
        "nav",
        "aside",
        "[role=navigation]",
        "[role=banner]",
        "[role=contentinfo]",
        "#header",
        "#footer",
        "#sidebar",
        ".navbar",
        ".sidebar",
        ".menu",
        ".navigation",
        ".breadcrumbs",
        ".breadcrumb",
        ".modal",
        ".popup",
        ".overlay",
        ".ad",
        ".ads",
        ".advert",
        ".advertisement",
        ".social",
        ".social-links",
        ".share",
        ".cookie",
        "#cookie",
        ".cookie-banner",
        ".newsletter",
        ".related",
        "#comments",
        ".comments",
        ".comment-list",
        "#respond",
        ".comment-respond",
        "#disqus_thread",
        ".headerlink",
        ".mw-editsection",
        "#toc",
        ".toc"
    );

    private static final String MAIN_MARKER_SELECTOR = "main, article, [role=main], #main, #content";

    private static final List<String> MAIN_CANDIDATE_SELECTORS = List.of(
        "main",
        "article",
        "[role=main]",
        "#main",
        "#main-content",
        "#content",
        ".main-content",
        ".content",
        ".article",
        ".article-body",
        ".article-content",
        ".post-content",
        ".entry-content",
        "#mw-content-text",
        ".mw-parser-output"
    );

    private static final Set<String> BLOCK_TAGS = Set.of(
        "address", "article", "blockquote", "dd", "div", "dl", "dt", "figcaption", "h1", "h2", "h3", "h4",
        "h5", "h6", "hr", "li", "main", "ol", "p", "section", "table", "tbody", "td", "th", "thead", "tr", "ul"
    );

    private static final DomainRule WIKIPEDIA_RULE = new DomainRule(
        "wikipedia.org",
        List.of("#mw-content-text", ".mw-parser-output"),
        List.of(
            ".shortdescription",
            ".hatnote",
            ".ambox",
            ".metadata",
            ".infobox",
            "#mw-navigation",
            ".vector-page-toolbar",
            ".mw-jump-link",
            "sup.reference",
            ".reflist",
            ".mw-references-wrap",
            ".navbox",
            ".vertical-navbox",
            ".catlinks",
            ".mw-authority-control",
            ".printfooter"
        )
    );

    private static final DomainRule PYTHON_DOCS_RULE = new DomainRule(
        "docs.python.org",
        List.of("div[role=main]", ".body"),
        List.of(".sphinxsidebar", ".related", ".copybutton")
    );

    private static final List<DomainRule> DOMAIN_RULES = List.of(
        WIKIPEDIA_RULE,
        PYTHON_DOCS_RULE
    );

    private final EnrichmentProperties properties;

    public HtmlMainContentExtractor(EnrichmentProperties properties) {
        this.properties = properties;
    }

    @Override
    public String extract(String html, String url) {
        if (!StringUtils.hasText(html)) {
            return null;
        }
        Document document = Jsoup.parse(html, StringUtils.hasText(url) ? url : "");
        Element body = document.body();
        boolean hasPasswordField = document.selectFirst("input[type=password]") != null;

        document.select(NON_CONTENT_SELECTOR).remove();
        DomainRule domainRule = resolveDomainRule(url);
        removeBoilerplate(document, domainRule);

        Element mainElement = selectMainContentElement(document, body, domainRule);
        String text = renderText(mainElement);
        if (text.length() < Math.max(1, properties.getMinTextLength())) {
            return null;
        }
        if (linkDensity(mainElement) > MAX_LINK_DENSITY) {
            return null;
        }
        if (hasPasswordField && text.length() < LOGIN_WALL_MAX_TEXT_LENGTH) {
            return null;
        }
        return text;
    }

    private void removeBoilerplate(Document document, DomainRule domainRule) {
        for (String selector : BOILERPLATE_SELECTORS) {
            for (Element element : document.select(selector)) {
                // keep wrappers that enclose the main content
                if (element.selectFirst(MAIN_MARKER_SELECTOR) == null) {
                    element.remove();
                }
            }
        }
        if (domainRule != null) {
            for (String selector : domainRule.stripSelectors()) {
                document.select(selector).remove();
            }
        }
    }

    private Element selectMainContentElement(Document document, Element body, DomainRule domainRule) {
        Set<Element> candidates = new LinkedHashSet<>();
        if (domainRule != null) {
            for (String selector : domainRule.preferredMainSelectors()) {
                candidates.addAll(document.select(selector));
            }
        }
        for (String selector : MAIN_CANDIDATE_SELECTORS) {
            candidates.addAll(document.select(selector));
        }
        if (candidates.isEmpty()) {
            candidates.addAll(document.select("section, div"));
        }

        Element best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Element candidate : candidates) {
            double score = score(candidate, domainRule);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best == null) {
            return body;
        }

        int bodyTextLength = textLength(body);
        int minimumTextLength = Math.min(MIN_MAIN_TEXT_LENGTH, Math.max(40, bodyTextLength / 8));
        return textLength(best) < minimumTextLength ? body : best;
    }

    private double score(Element candidate, DomainRule domainRule) {
        int textLength = textLength(candidate);
        if (textLength == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        int paragraphCount = candidate.select("p, pre, blockquote, li, h1, h2, h3").size();
        double score = textLength * (1D - Math.min(0.95D, linkDensity(candidate)));
        score += Math.min(60, paragraphCount) * 15D;

        String marker = containerMarker(candidate);
        if ("main".equals(candidate.normalName()) || "article".equals(candidate.normalName())) {
            score += 150D;
        } else if (containsAny(marker, "article-body", "article-content", "post-content", "entry-content", "mw-content-text")) {
            score += 200D;
        } else if (containsAny(marker, "main", "content", "article", "post")) {
            score += 100D;
        }
        if (domainRule != null && matchesAny(candidate, domainRule.preferredMainSelectors())) {
            score += 250D;
        }
        if (containsAny(marker, "nav", "menu", "sidebar", "footer", "comment", "related", "banner", "login", "cookie")) {
            score *= 0.3D;
        }
        return score;
    }

    private String renderText(Element root) {
        StringBuilder builder = new StringBuilder(1024);
        NodeTraversor.filter(new NodeFilter() {

            @Override
            public FilterResult head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    builder.append(textNode.text());
                } else if (node instanceof Element element) {
                    String tag = element.normalName();
                    if ("br".equals(tag)) {
                        builder.append('\n');
                    } else if ("pre".equals(tag)) {
                        builder.append('\n').append(element.wholeText()).append('\n');
                        return FilterResult.SKIP_CHILDREN;
                    } else if (BLOCK_TAGS.contains(tag)) {
                        builder.append('\n');
                    }
                }
                return FilterResult.CONTINUE;
            }

            @Override
            public FilterResult tail(Node node, int depth) {
                if (node instanceof Element element && BLOCK_TAGS.contains(element.normalName())) {
                    builder.append('\n');
                }
                return FilterResult.CONTINUE;
            }

        }, root);

        List<String> lines = new ArrayList<>();
        for (String line : builder.toString().split("\n")) {
            String normalized = line.replace('\u00A0', ' ').replaceAll("[ \\t]+", " ").strip();
            if (!normalized.isEmpty()) {
                lines.add(normalized);
            }
        }
        return String.join("\n", lines);
    }

    private double linkDensity(Element element) {
        int textLength = textLength(element);
        if (textLength == 0) {
            return 0D;
        }
        int linkTextLength = 0;
        for (Element link : element.select("a")) {
            linkTextLength += textLength(link);
        }
        return linkTextLength / (double) textLength;
    }

    private DomainRule resolveDomainRule(String url) {
        if (!StringUtils.hasText(url)) {
            return null;
        }
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException ex) {
            return null;
        }
        if (host == null) {
            return null;
        }
        host = host.toLowerCase(Locale.ROOT);
        for (DomainRule domainRule : DOMAIN_RULES) {
            if (host.equals(domainRule.hostSuffix()) || host.endsWith("." + domainRule.hostSuffix())) {
                return domainRule;
            }
        }
        return null;
    }

    private static boolean matchesAny(Element element, List<String> selectors) {
        for (String selector : selectors) {
            if (element.is(selector)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(String marker, String... tokens) {
        for (String token : tokens) {
            if (marker.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static String containerMarker(Element element) {
        return (element.attr("role") + " " + element.id() + " " + element.className()).toLowerCase(Locale.ROOT);
    }

    private static int textLength(Element element) {
        return element.text().length();
    }

    private record DomainRule(String hostSuffix, List<String> preferredMainSelectors, List<String> stripSelectors) {

    }

}
