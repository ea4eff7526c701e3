package com.air.series;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches series mboxes from a Patchwork instance.
 *
 * <p>Looks the series up through the REST API ({@code /api/series/<id>/})
 * and downloads the {@code mbox} link it advertises.
 */
public class PatchworkSeriesSource implements SeriesSource {

    private static final Logger log = LoggerFactory.getLogger(PatchworkSeriesSource.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public PatchworkSeriesSource(String baseUrl, ObjectMapper objectMapper) {
        this(baseUrl, HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), objectMapper);
    }

    PatchworkSeriesSource(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String fetchMbox(long seriesId) throws IOException {
        String apiUrl = baseUrl + "/api/series/" + seriesId + "/";
        log.info("Fetching Patchwork series {} from {}", seriesId, apiUrl);

        JsonNode series = objectMapper.readTree(get(apiUrl));
        String mboxUrl = series.path("mbox").asText("");
        if (mboxUrl.isBlank()) {
            throw new IOException("Series " + seriesId + " has no mbox link");
        }
        String mbox = get(mboxUrl);
        if (mbox.isBlank()) {
            throw new IOException("Series " + seriesId + " mbox is empty");
        }
        return mbox;
    }

    private String get(String url) throws IOException {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new IOException("GET " + url + " returned HTTP " + response.statusCode());
            }
            return response.body();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + url, e);
        }
    }
}
