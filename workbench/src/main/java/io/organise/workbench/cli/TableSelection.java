package io.organise.workbench.cli;

import io.organise.workbench.input.FileTableInput;
import io.organise.workbench.input.SheetsClient;
import io.organise.workbench.input.SheetsTableInput;
import io.organise.workbench.input.TableInput;
import picocli.CommandLine;

import java.nio.file.Path;

/** Exactly one of a local file or a sheet link, as given on the command line. */
final class TableSelection {
    private final Path file;
    private final String url;

    private TableSelection(Path file, String url) {
        this.file = file;
        this.url = url;
    }

    static TableSelection of(CommandLine cmd, Path file, String url) {
        if (file != null && url != null) {
            throw new CommandLine.ParameterException(cmd, "Specify either a file path or --url, not both");
        }
        if (file == null && url == null) {
            throw new CommandLine.ParameterException(cmd, "No input provided. Pass a file path or use --url with a Google Sheets link");
        }
        return new TableSelection(file, url);
    }

    boolean isFile() { return file != null; }

    /** @throws IllegalArgumentException for a link that is not a Google Sheets document */
    TableInput open(SheetsClient client) {
        return isFile() ? new FileTableInput(file) : new SheetsTableInput(url, client);
    }
}
