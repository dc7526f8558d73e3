package io.organise.workbench.input;

import io.organise.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Downloads CSV exports over HTTP, following redirects, retrying I/O failures and non-200
 * responses as the retry policy allows.
 */
public class HttpSheetsClient implements SheetsClient {
    private static final Logger log = LoggerFactory.getLogger(HttpSheetsClient.class);

    private final HttpClient http;
    private final Duration timeout;
    private final RetryPolicy retry;

    public HttpSheetsClient(Duration timeout, RetryPolicy retry) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout, retry);
    }

    HttpSheetsClient(HttpClient http, Duration timeout, RetryPolicy retry) {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.retry = Objects.requireNonNull(retry, "retry");
    }

    @Override
    public InputStream download(URI exportUrl) throws IOException {
        HttpRequest req = HttpRequest.newBuilder(exportUrl)
                .timeout(timeout)
                .header("Accept", "text/csv")
                .GET()
                .build();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                HttpResponse<InputStream> resp = http.send(req, HttpResponse.BodyHandlers.ofInputStream());
                if (resp.statusCode() == 200) return resp.body();
                resp.body().close();
                throw new IOException("Failed to fetch Google Sheets data: HTTP " + resp.statusCode()
                        + ". Make sure the sheet is shared as 'Anyone with the link can view'");
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                InterruptedIOException e = new InterruptedIOException("Interrupted while downloading " + exportUrl);
                e.initCause(ie);
                throw e;
            } catch (IOException e) {
                if (!retry.shouldRetry(attempt, e)) throw e;
                long backoff = retry.backoffMillis(attempt);
                log.warn("Download attempt {} of {} failed ({}), retrying in {} ms", attempt, exportUrl, e.getMessage(), backoff);
                sleep(backoff);
            }
        }
    }

    private static void sleep(long millis) throws InterruptedIOException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            InterruptedIOException e = new InterruptedIOException("Interrupted while waiting to retry");
            e.initCause(ie);
            throw e;
        }
    }
}
