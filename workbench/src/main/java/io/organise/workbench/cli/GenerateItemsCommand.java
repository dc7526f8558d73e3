package io.organise.workbench.cli;

import com.google.inject.Injector;
import io.organise.workbench.input.SheetsClient;
import io.organise.workbench.items.ItemGenerationStats;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "generate-items", mixinStandardHelpOptions = true,
        description = "Generate the items table from a processed CSV file")
public final class GenerateItemsCommand implements Callable<Integer> {
    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "INPUT", description = "Processed CSV file")
    Path input;

    @CommandLine.Option(names = "--url", paramLabel = "URL", description = "Google Sheets URL to read the table from")
    String url;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Items CSV file (default: items.csv)")
    Path output;

    @CommandLine.Option(names = "--output-dir", paramLabel = "DIR", description = "Directory for the generated file")
    Path outputDir;

    @CommandLine.Option(names = {"-n", "--node"}, paramLabel = "NODE", description = "Node identifier for field_member_of")
    String node;

    @Override
    public Integer call() throws Exception {
        CommandLine cmd = spec.commandLine();
        TableSelection selection = TableSelection.of(cmd, input, url);
        Injector injector = OrganiseMain.injector(Optional.empty());
        PrintWriter out = cmd.getOut();

        Path target = OutputPaths.resolve(Optional.ofNullable(output), Path.of(OutputPaths.ITEMS_OUTPUT), Optional.ofNullable(outputDir));
        out.println(selection.isFile() ? "Generating items from: " + input : "Generating items from Google Sheets URL: " + url);
        ItemGenerationStats stats = injector.getInstance(WorkbenchRunner.class)
                .generateItems(selection.open(injector.getInstance(SheetsClient.class)), target, Optional.ofNullable(node));
        OrganiseMain.printItemsSummary(out, stats, target);
        out.flush();
        return 0;
    }
}
