package it.autograph.service;

import java.util.Locale;

import it.autograph.asn1.Asn1Element;
import it.autograph.asn1.ContentFormatter;

/**
 * Display form of one decoded element.
 */
public record ElementDescription(
    int depth,
    int offset,
    int headerLength,
    int contentLength,
    boolean constructed,
    String tagName,
    String content
) {

    public static ElementDescription of(Asn1Element element) {
        return new ElementDescription(
            element.depth(),
            element.offset(),
            element.headerLength(),
            element.contentLength(),
            element.constructed(),
            ContentFormatter.tagName(element),
            ContentFormatter.format(element)
        );
    }

    public String toLine() {
        String line = String.format(Locale.ROOT, "%8s%s %s %s %s: %s",
            offset + ":",
            "d=" + depth,
            "hl=" + headerLength,
            "l=" + contentLength,
            constructed ? "cons" : "prim",
            tagName);
        if (!content.isEmpty()) {
            line += "  " + content;
        }
        return line;
    }
}
