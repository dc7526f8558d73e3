package io.organise.workbench.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.organise.config.OrganiseConfig;
import io.organise.retry.ExponentialBackoffRetryPolicy;
import io.organise.workbench.input.HttpSheetsClient;
import io.organise.workbench.input.SheetsClient;
import io.organise.workbench.modify.FieldModelMappings;
import io.organise.workbench.process.ModifierPipeline;
import io.organise.workbench.report.DiagnosticSink;
import io.organise.workbench.report.LoggingDiagnosticSink;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/** Guice wiring for one command invocation. */
public class WorkbenchModule extends AbstractModule {
    private final OrganiseConfig config;
    private final Optional<Path> fieldModelConfig;

    public WorkbenchModule(OrganiseConfig config, Optional<Path> fieldModelConfig) {
        this.config = config;
        this.fieldModelConfig = fieldModelConfig;
    }

    @Override
    protected void configure() {
        bind(OrganiseConfig.class).toInstance(config);
        bind(DiagnosticSink.class).to(LoggingDiagnosticSink.class);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton SheetsClient sheetsClient() {
        long backoff = Math.max(1, config.httpBackoffMillis());
        return new HttpSheetsClient(Duration.ofSeconds(config.httpTimeoutSeconds()),
                new ExponentialBackoffRetryPolicy(config.httpAttempts(), backoff, backoff * 8));
    }

    @Provides @Singleton FieldModelMappings fieldModelMappings() throws IOException {
        return fieldModelConfig.isPresent() ? FieldModelMappings.load(fieldModelConfig.get()) : FieldModelMappings.defaults();
    }

    @Provides ModifierPipeline modifierPipeline(DiagnosticSink diagnostics, MetricRegistry registry) {
        return new ModifierPipeline(diagnostics, config.validationLogLimit(), registry);
    }
}
