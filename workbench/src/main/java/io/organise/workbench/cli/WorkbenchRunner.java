package io.organise.workbench.cli;

import com.google.inject.Inject;
import io.organise.csv.CsvRecordSink;
import io.organise.csv.CsvRecordSource;
import io.organise.workbench.input.FileTableInput;
import io.organise.workbench.input.TableInput;
import io.organise.workbench.items.ItemGenerationStats;
import io.organise.workbench.items.ItemsAggregator;
import io.organise.workbench.process.ActiveModifiers;
import io.organise.workbench.process.ModifierPipeline;
import io.organise.workbench.process.ProcessingStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Opens inputs and outputs for the two commands and drives the streaming passes over them.
 */
public class WorkbenchRunner {
    private static final Logger log = LoggerFactory.getLogger(WorkbenchRunner.class);

    private final ModifierPipeline pipeline;
    private final ItemsAggregator aggregator;

    @Inject
    public WorkbenchRunner(ModifierPipeline pipeline, ItemsAggregator aggregator) {
        this.pipeline = pipeline;
        this.aggregator = aggregator;
    }

    public ProcessingStats process(TableInput input, Path output, ActiveModifiers active) throws IOException {
        return process(input, output, active, false);
    }

    public ProcessingStats process(TableInput input, Path output, ActiveModifiers active, boolean sanitizeText) throws IOException {
        log.debug("Processing {} into {}", input.describe(), output);
        try (InputStream in = input.open();
             CsvRecordSource source = CsvRecordSource.open(in)) {
            requireDistinct(input, output);
            try (CsvRecordSink sink = CsvRecordSink.create(output, source.header())) {
                return pipeline.run(active, source, sink, sanitizeText);
            }
        }
    }

    public ItemGenerationStats generateItems(TableInput input, Path output, Optional<String> node) throws IOException {
        log.debug("Generating items from {} into {}", input.describe(), output);
        try (InputStream in = input.open();
             CsvRecordSource source = CsvRecordSource.open(in)) {
            ItemsAggregator.requireColumns(source.header());
            requireDistinct(input, output);
            try (CsvRecordSink sink = CsvRecordSink.create(output, ItemsAggregator.SUMMARY_HEADER)) {
                return aggregator.aggregate(source, sink, node);
            }
        }
    }

    private static void requireDistinct(TableInput input, Path output) throws IOException {
        if (input instanceof FileTableInput file
                && Files.exists(output) && Files.isSameFile(file.file(), output)) {
            throw new IOException("Output " + output + " would overwrite the input");
        }
    }
}
