package io.organise.workbench.input;

import com.sun.net.httpserver.HttpServer;
import io.organise.retry.ExponentialBackoffRetryPolicy;
import io.organise.retry.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HttpSheetsClientTest {
    private HttpServer server;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile int failFirst = 0;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/export", exchange -> {
            int n = calls.incrementAndGet();
            byte[] body = "a,b\n1,2\n".getBytes(StandardCharsets.UTF_8);
            int status = n <= failFirst ? 503 : 200;
            exchange.sendResponseHeaders(status, status == 200 ? body.length : -1);
            if (status == 200) {
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(body);
                }
            }
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private URI url() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/export");
    }

    @Test
    void downloadsBody() throws IOException {
        HttpSheetsClient client = new HttpSheetsClient(Duration.ofSeconds(5), RetryPolicy.none());
        try (InputStream in = client.download(url())) {
            assertEquals("a,b\n1,2\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        assertEquals(1, calls.get());
    }

    @Test
    void retriesNon200Responses() throws IOException {
        failFirst = 2;
        HttpSheetsClient client = new HttpSheetsClient(Duration.ofSeconds(5), new ExponentialBackoffRetryPolicy(3, 1, 5));
        try (InputStream in = client.download(url())) {
            assertTrue(new String(in.readAllBytes(), StandardCharsets.UTF_8).startsWith("a,b"));
        }
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpWhenAttemptsRunOut() {
        failFirst = 10;
        HttpSheetsClient client = new HttpSheetsClient(Duration.ofSeconds(5), new ExponentialBackoffRetryPolicy(2, 1, 5));
        IOException e = assertThrows(IOException.class, () -> client.download(url()));
        assertTrue(e.getMessage().contains("503"));
        assertEquals(2, calls.get());
    }

    @Test
    void sheetsInputConvertsTheLinkBeforeDownloading() throws IOException {
        URI[] requested = new URI[1];
        SheetsTableInput input = new SheetsTableInput("https://docs.google.com/spreadsheets/d/abc123/edit",
                exportUrl -> {
                    requested[0] = exportUrl;
                    return InputStream.nullInputStream();
                });
        input.open().close();
        assertEquals(URI.create("https://docs.google.com/spreadsheets/d/abc123/export?format=csv"), requested[0]);
    }
}
