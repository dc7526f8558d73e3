package io.organise.workbench.input;

import java.io.IOException;
import java.io.InputStream;

/**
 * Where the table to process comes from. Opened once per run; the caller closes the stream.
 */
public interface TableInput {
    InputStream open() throws IOException;

    /** Short label for logs and run summaries. */
    String describe();
}
