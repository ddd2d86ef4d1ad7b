package io.floorsheet.data;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * GETs {@code <base>?pg=N&date=yyyy/MM/dd} with browser-like headers. Page 1 is requested without pg.
 * Anything but a 200 is an {@link IOException}; there are no retries.
 */
final class HttpFloorsheetClient implements FloorsheetClient {
    static final DateTimeFormatter URL_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private final HttpClient http;
    private final URI baseUrl;
    private final Duration timeout;

    HttpFloorsheetClient(URI baseUrl, Duration timeout) {
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String fetchPage(int page, Optional<LocalDate> date) throws IOException, InterruptedException {
        HttpRequest req = HttpRequest.newBuilder(pageUri(page, date))
                .timeout(timeout)
                .header("User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/91.0.4472.124 Safari/537.36")
                .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8")
                .header("Accept-Language", "en-US,en;q=0.5")
                .header("Upgrade-Insecure-Requests", "1")
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (resp.statusCode() != 200) {
            throw new IOException("Floorsheet page " + page + " returned HTTP " + resp.statusCode());
        }
        String body = resp.body();
        if (body == null || body.isBlank()) {
            throw new IOException("Floorsheet page " + page + " was empty");
        }
        return body;
    }

    URI pageUri(int page, Optional<LocalDate> date) {
        List<String> params = new ArrayList<>(2);
        if (page > 1) params.add("pg=" + page);
        date.ifPresent(d -> params.add("date=" + URLEncoder.encode(URL_DATE.format(d), StandardCharsets.UTF_8)));
        if (params.isEmpty()) return baseUrl;
        String base = baseUrl.toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + String.join("&", params));
    }
}
