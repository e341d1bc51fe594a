package com.gateflow.core.page;

import com.gateflow.core.model.PageContent;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts title, visible text and form controls from an HTML document.
 */
public final class PageContentParser {

    /** Input types that are not user-editable fields. */
    private static final Set<String> NON_FIELD_TYPES = Set.of("hidden", "submit", "button", "reset", "image");

    private PageContentParser() {}

    public static PageContent parse(String url, String html) {
        Document doc = Jsoup.parse(html, url);
        List<PageContent.InputField> fields = new ArrayList<>();
        for (Element element : doc.select("input, select, textarea")) {
            String tag = element.tagName();
            String type = "input".equals(tag) ? element.attr("type").toLowerCase(Locale.ROOT) : tag;
            if ("input".equals(tag) && type.isEmpty()) {
                type = "text";
            }
            if (NON_FIELD_TYPES.contains(type)) {
                continue;
            }
            fields.add(new PageContent.InputField(tag, type, element.attr("name"), element.id()));
        }

        doc.select("script, style, noscript").remove();
        String text = doc.body() != null ? doc.body().text() : "";
        return new PageContent(url, true, doc.title(), text, fields);
    }
}
