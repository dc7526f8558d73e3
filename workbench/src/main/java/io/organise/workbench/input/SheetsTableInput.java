package io.organise.workbench.input;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Objects;

/**
 * A shared Google Sheets document, downloaded as CSV. The URL is checked when the input is built.
 */
public class SheetsTableInput implements TableInput {
    private final String sheetUrl;
    private final URI exportUrl;
    private final SheetsClient client;

    public SheetsTableInput(String sheetUrl, SheetsClient client) {
        this.sheetUrl = Objects.requireNonNull(sheetUrl, "sheetUrl");
        this.exportUrl = URI.create(GoogleSheetsUrls.toCsvExportUrl(sheetUrl));
        this.client = Objects.requireNonNull(client, "client");
    }

    public URI exportUrl() { return exportUrl; }

    @Override
    public InputStream open() throws IOException {
        return client.download(exportUrl);
    }

    @Override
    public String describe() { return sheetUrl; }
}
