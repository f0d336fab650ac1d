package com.lorekeeper.core.search;

/**
 * One web search hit.
 */
public record SearchResult(String title, String snippet, String url) {

    public String render() {
        return "- " + title + (url == null || url.isBlank() ? "" : " (" + url + ")") + "\n  " + snippet;
    }
}
