package io.pricelake.financial.fetch;

import io.pricelake.error.TransientIoException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class HttpYahooClient implements YahooClient {
    private static final int ATTEMPTS = 3;

    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpYahooClient(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder().connectTimeout(requestTimeout).build();
    }

    @Override
    public String fetch(String ticker, long period1, long period2, String interval) throws IOException, InterruptedException {
        String url = String.format(
                "https://query1.finance.yahoo.com/v8/finance/chart/%s?interval=%s&period1=%d&period2=%d",
                URLEncoder.encode(ticker, StandardCharsets.UTF_8),
                URLEncoder.encode(interval, StandardCharsets.UTF_8),
                period1, period2);
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .header("User-Agent", "Mozilla/5.0")
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> resp = null;
        for (int attempt = 1; attempt <= ATTEMPTS; attempt++) {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() == 200) return resp.body();
            if (attempt < ATTEMPTS) Thread.sleep(250L * attempt);
        }
        throw new TransientIoException("Yahoo fetch failed for " + ticker + ": HTTP " + resp.statusCode());
    }
}
