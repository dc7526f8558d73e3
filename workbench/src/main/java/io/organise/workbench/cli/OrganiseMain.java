package io.organise.workbench.cli;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;
import io.organise.config.OrganiseConfig;
import io.organise.workbench.input.FileTableInput;
import io.organise.workbench.input.GoogleSheetsUrls;
import io.organise.workbench.input.SheetsClient;
import io.organise.workbench.input.TableInput;
import io.organise.workbench.items.ItemGenerationStats;
import io.organise.workbench.modify.FieldModelMappings;
import io.organise.workbench.process.ActiveModifiers;
import io.organise.workbench.process.ModifierRegistry;
import io.organise.workbench.process.OptionalModifiers;
import io.organise.workbench.process.ProcessingStats;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Prepares repository ingest sheets: derives parent ids and file paths, then optionally
 * summarises the result into an items table.
 */
@CommandLine.Command(name = "organise", mixinStandardHelpOptions = true, version = "organise 0.3.0",
        subcommands = GenerateItemsCommand.class,
        description = "Process and organise repository ingest CSV files")
public final class OrganiseMain implements Callable<Integer> {
    static final int EXIT_FAILURE = 1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "Path to the input CSV file")
    Path input;

    @CommandLine.Option(names = "--url", paramLabel = "URL", description = "Google Sheets URL, converted to its CSV export link")
    String url;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output CSV file (default: INPUT-modified.csv, or sheets-output-modified.csv for --url)")
    Path output;

    @CommandLine.Option(names = "--output-dir", paramLabel = "DIR", description = "Directory for processed and generated files")
    Path outputDir;

    @CommandLine.Option(names = "--only-run", split = ",", paramLabel = "MODIFIER", description = "Run only these modifiers (parent-id, file-extension)")
    List<String> onlyRun = new ArrayList<>();

    @CommandLine.Option(names = "--ignore-run", split = ",", paramLabel = "MODIFIER", description = "Skip these modifiers; wins over --only-run")
    List<String> ignoreRun = new ArrayList<>();

    @CommandLine.Option(names = "--enable", split = ",", paramLabel = "MODIFIER", description = "Also run optional modifiers (access-identifier, field-description, field-model)")
    List<String> enable = new ArrayList<>();

    @CommandLine.Option(names = "--field-model-config", paramLabel = "FILE", description = "Properties file with field_model mappings")
    Path fieldModelConfig;

    @CommandLine.Option(names = "--sanitize-text", description = "Replace non-breaking spaces and repair Windows-1252 mojibake in every cell")
    boolean sanitizeText;

    @CommandLine.Option(names = "--stats", description = "Show detailed processing statistics")
    boolean stats;

    @CommandLine.Option(names = "--full", description = "Also generate the items table from the processed output")
    boolean full;

    @CommandLine.Option(names = {"-n", "--node"}, paramLabel = "NODE", description = "Node identifier for field_member_of (with --full)")
    String node;

    @CommandLine.Option(names = "--items-output", paramLabel = "FILE", description = "Items table location (with --full; default: OUTPUT-items.csv)")
    Path itemsOutput;

    public static void main(String[] args) {
        int code = commandLine().execute(args);
        System.exit(code);
    }

    static CommandLine commandLine() {
        return new CommandLine(new OrganiseMain())
                .setExecutionExceptionHandler((e, cmd, parsed) -> {
                    Throwable cause = e instanceof ProvisionException && e.getCause() != null ? e.getCause() : e;
                    cmd.getErr().println("Error: " + cause.getMessage());
                    return EXIT_FAILURE;
                });
    }

    @Override
    public Integer call() throws Exception {
        CommandLine cmd = spec.commandLine();
        TableSelection selection = TableSelection.of(cmd, input, url);
        if (!full && (node != null || itemsOutput != null)) {
            throw new CommandLine.ParameterException(cmd, "--node and --items-output require --full");
        }
        Optional<Path> dir = Optional.ofNullable(outputDir);
        Injector injector = injector(Optional.ofNullable(fieldModelConfig));
        PrintWriter out = cmd.getOut();

        ActiveModifiers active = selectModifiers(cmd, injector);
        Path target = OutputPaths.resolve(Optional.ofNullable(output),
                selection.isFile() ? OutputPaths.modifiedFor(input) : Path.of(OutputPaths.SHEETS_OUTPUT), dir);
        TableInput table = selection.open(injector.getInstance(SheetsClient.class));

        if (selection.isFile()) {
            out.println("Processing file: " + input);
        } else {
            out.println("Processing Google Sheets URL: " + url);
            out.println("CSV export URL: " + GoogleSheetsUrls.toCsvExportUrl(url));
        }
        if (!active.isEmpty()) {
            out.println("Applying modifiers: " + String.join(", ", active.names()));
        } else if (!sanitizeText) {
            out.println("WARNING: No modifiers will be applied - file will be copied without changes");
        }
        if (sanitizeText) {
            out.println("Sanitizing text in every cell");
        }

        WorkbenchRunner runner = injector.getInstance(WorkbenchRunner.class);
        ProcessingStats result = runner.process(table, target, active, sanitizeText);
        printProcessingSummary(out, result, target, stats);

        if (full) {
            Path items = OutputPaths.resolve(Optional.ofNullable(itemsOutput), OutputPaths.itemsFor(target), dir);
            out.println("Generating items from: " + target);
            ItemGenerationStats itemStats = runner.generateItems(new FileTableInput(target), items, Optional.ofNullable(node));
            printItemsSummary(out, itemStats, items);
        }
        out.flush();
        return 0;
    }

    private ActiveModifiers selectModifiers(CommandLine cmd, Injector injector) throws IOException {
        try {
            ModifierRegistry registry = OptionalModifiers.enable(ModifierRegistry.defaults(), enable,
                    () -> injector.getInstance(FieldModelMappings.class));
            return registry.select(onlyRun, ignoreRun);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(cmd, e.getMessage(), e);
        }
    }

    static Injector injector(Optional<Path> fieldModelConfig) {
        return Guice.createInjector(new WorkbenchModule(OrganiseConfig.fromEnv(), fieldModelConfig));
    }

    static void printProcessingSummary(PrintWriter out, ProcessingStats s, Path target, boolean detailed) {
        out.println("Processing complete!");
        out.println("Processed " + s.totalRows() + " rows");
        out.println("Modified " + s.cellsModified() + " cells");
        if (s.validationFailures() > 0) {
            out.println("WARNING: " + s.validationFailures() + " validation failures");
        }
        out.println("Output written to: " + target);
        if (detailed) {
            out.println();
            out.println("Detailed Statistics:");
            out.println("- Total rows processed: " + s.totalRows());
            out.println("- Cells modified: " + s.cellsModified());
            out.println("- Validation failures: " + s.validationFailures());
            out.println("- Columns processed: " + s.columnsProcessed().size());
            if (!s.columnsProcessed().isEmpty()) {
                out.println("  Columns: " + String.join(", ", s.columnsProcessed()));
            }
        }
    }

    static void printItemsSummary(PrintWriter out, ItemGenerationStats s, Path target) {
        out.println("Items file generated successfully!");
        out.println("  - Unique parent IDs: " + s.uniqueParents());
        out.println("  - Total items processed: " + s.totalItems());
        out.println("  - Output written to: " + target);
        if (s.skippedRows() > 0) {
            out.println("  - Skipped " + s.skippedRows() + " rows with empty parent_id");
        }
    }
}
