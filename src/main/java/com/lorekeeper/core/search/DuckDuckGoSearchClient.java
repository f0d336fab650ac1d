package com.lorekeeper.core.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lorekeeper.core.error.SearchFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link WebSearchClient} backed by the DuckDuckGo instant-answer JSON API.
 * <p>
 * The abstract (when present) comes first, followed by related topics. Topic groups are
 * flattened in order.
 */
@Service
public class DuckDuckGoSearchClient implements WebSearchClient {

    private static final Logger log = LoggerFactory.getLogger(DuckDuckGoSearchClient.class);

    private final SearchProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Autowired
    public DuckDuckGoSearchClient(SearchProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    DuckDuckGoSearchClient(SearchProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public List<SearchResult> search(String query, int maxResults) {
        if (!properties.isEnabled()) {
            throw new SearchFailureException("Web search is disabled");
        }
        int limit = maxResults > 0 ? maxResults : properties.getMaxResults();
        String url = properties.getBaseUrl() + "?q=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                + "&format=json&no_html=1&skip_disambig=1";
        var request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", "application/json")
                .header("User-Agent", "lorekeeper")
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .GET()
                .build();
        try {
            long start = System.currentTimeMillis();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new SearchFailureException("Search returned HTTP " + response.statusCode() + " for '" + query + "'");
            }
            List<SearchResult> results = parse(response.body(), limit);
            log.info("Web search '{}' -> {} result(s) in {}ms", query, results.size(),
                    System.currentTimeMillis() - start);
            return results;
        } catch (IOException e) {
            throw new SearchFailureException("Search request failed for '" + query + "': " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchFailureException("Search interrupted for '" + query + "'", e);
        }
    }

    List<SearchResult> parse(String body, int limit) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new SearchFailureException("Unreadable search response: " + e.getMessage(), e);
        }
        List<SearchResult> results = new ArrayList<>();
        String abstractText = root.path("AbstractText").asText("");
        if (!abstractText.isBlank()) {
            String heading = root.path("Heading").asText("");
            results.add(new SearchResult(heading.isBlank() ? "Summary" : heading, abstractText,
                    root.path("AbstractURL").asText("")));
        }
        collectTopics(root.path("RelatedTopics"), results, limit);
        return results.size() > limit ? List.copyOf(results.subList(0, limit)) : results;
    }

    private void collectTopics(JsonNode topics, List<SearchResult> sink, int limit) {
        for (JsonNode topic : topics) {
            if (sink.size() >= limit) {
                return;
            }
            if (topic.has("Topics")) {
                collectTopics(topic.get("Topics"), sink, limit);
                continue;
            }
            String text = topic.path("Text").asText("");
            if (text.isBlank()) {
                continue;
            }
            int dash = text.indexOf(" - ");
            String title = dash > 0 ? text.substring(0, dash) : text;
            sink.add(new SearchResult(title, text, topic.path("FirstURL").asText("")));
        }
    }
}
