package io.organise.workbench.input;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

@FunctionalInterface
public interface SheetsClient {
    /** Body of a successful CSV export; the caller closes it. */
    InputStream download(URI exportUrl) throws IOException;
}
