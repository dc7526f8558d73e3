package io.organise.workbench.input;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

/**
 * Turns a Google Sheets share or edit link into its CSV export link.
 */
public final class GoogleSheetsUrls {
    private static final String HOST = "docs.google.com";
    private static final String MARKER = "/spreadsheets/d/";
    private static final Pattern ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]+");

    private GoogleSheetsUrls() {}

    /**
     * @throws IllegalArgumentException when the link is not a Google Sheets document link
     */
    public static String toCsvExportUrl(String url) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("Google Sheets URL is empty");
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }
        if (uri.getHost() == null || !HOST.equalsIgnoreCase(uri.getHost())) {
            throw new IllegalArgumentException("Not a Google Sheets URL (expected host " + HOST + "): " + url);
        }
        return "https://" + HOST + MARKER + sheetId(uri, url) + "/export?format=csv";
    }

    static String sheetId(URI uri, String original) {
        String path = uri.getPath() == null ? "" : uri.getPath();
        int at = path.indexOf(MARKER);
        if (at < 0) {
            throw new IllegalArgumentException("URL does not contain " + MARKER + "{id}: " + original);
        }
        String rest = path.substring(at + MARKER.length());
        int slash = rest.indexOf('/');
        String id = slash < 0 ? rest : rest.substring(0, slash);
        if (id.equals("edit") || !ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Invalid spreadsheet id '" + id + "' in " + original);
        }
        return id;
    }
}
