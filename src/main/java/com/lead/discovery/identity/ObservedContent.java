package com.lead.discovery.identity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One opaque payload handed over by the content source: page text, cookies seen on
 * the page and structured behavioral events.
 *
 * @param siteUrl page the content came from, may be null
 * @param text    visible page text, may be empty
 * @param cookies cookie name to value, in the order the source reported them
 * @param events  structured events; nested maps and lists are walked
 */
public record ObservedContent(
        String siteUrl,
        String text,
        Map<String, String> cookies,
        List<Map<String, Object>> events
) {
    public ObservedContent {
        text = text != null ? text : "";
        cookies = cookies != null ? new LinkedHashMap<>(cookies) : Map.of();
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static ObservedContent ofText(String siteUrl, String text) {
        return new ObservedContent(siteUrl, text, Map.of(), List.of());
    }
}
