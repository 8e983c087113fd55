package com.acme.corna.posts;

import com.acme.corna.config.LinkProperties;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Cleaner;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Cleans user supplied post markup down to a small formatting vocabulary. Images may only
 * point at files served by this API.
 */
@Component
public class HtmlSanitizer {
    private static final Safelist SAFELIST = new Safelist()
            .addTags("a", "b", "br", "center", "div", "em", "font",
                    "h1", "h2", "h3", "h4", "h5", "h6", "header",
                    "i", "img", "li", "ol", "p", "small", "span", "strong", "u", "ul")
            .addAttributes("a", "href")
            .addAttributes("font", "face", "size")
            .addAttributes("img", "src", "alt")
            .addProtocols("a", "href", "http", "https")
            .addProtocols("img", "src", "http", "https");

    private final LinkProperties links;

    public HtmlSanitizer(LinkProperties links) {
        this.links = links;
    }

    public String sanitize(String html) {
        if (html == null) return null;
        Document dirty = Jsoup.parseBodyFragment(html);
        Document clean = new Cleaner(SAFELIST).clean(dirty);
        for (Element img : clean.select("img")) {
            if (!isLocal(img.attr("src"))) {
                img.remove();
            }
        }
        clean.outputSettings().prettyPrint(false);
        return clean.body().html();
    }

    /** Same scheme, host and port as the API base, and a path beneath its path. */
    boolean isLocal(String src) {
        URI base = URI.create(links.apiBaseUrl());
        URI uri;
        try {
            uri = new URI(src);
        } catch (URISyntaxException e) {
            return false;
        }
        if (uri.getScheme() == null || uri.getHost() == null) return false;
        String basePath = base.getPath() == null ? "" : base.getPath().replaceAll("/+$", "");
        String path = uri.getPath() == null ? "" : uri.getPath();
        return uri.getScheme().equalsIgnoreCase(base.getScheme())
                && uri.getHost().equalsIgnoreCase(base.getHost())
                && port(uri) == port(base)
                && path.startsWith(basePath + "/");
    }

    private static int port(URI uri) {
        if (uri.getPort() != -1) return uri.getPort();
        return "https".equalsIgnoreCase(uri.getScheme()) ? 443 : 80;
    }
}
