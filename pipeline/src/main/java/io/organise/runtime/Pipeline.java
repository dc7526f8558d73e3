package io.organise.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.organise.core.Record;
import io.organise.core.Sink;
import io.organise.core.Source;
import io.organise.core.Transform;
import io.organise.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-source -> single-transform -> single-sink pipeline driven on the calling thread.
 * One record is fully read, transformed and written before the next is polled, so output order
 * equals input order and memory stays proportional to one record.
 * Any failure aborts the run; whatever the sink already wrote must be treated as incomplete.
 */
public class Pipeline<I, O> {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    Pipeline(Source<I> source, Transform<I, O> transform, Sink<O> sink, Metrics metrics) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        Objects.requireNonNull(metrics);
        this.sourceTimer = metrics.timer("pipeline.source.time");
        this.transformTimer = metrics.timer("pipeline.transform.time");
        this.sinkTimer = metrics.timer("pipeline.sink.time");
        this.inMeter = metrics.meter("pipeline.input.rate");
        this.outMeter = metrics.meter("pipeline.output.rate");
        this.errorMeter = metrics.meter("pipeline.error.rate");
    }

    /**
     * Drain the source through the transform into the sink, then flush the sink.
     * Neither the source nor the sink is closed; they belong to the caller.
     *
     * @return number of records written
     */
    public long run() throws IOException {
        long written = 0;
        try {
            while (true) {
                Optional<Record<I>> next;
                try (Timer.Context ignored = sourceTimer.time()) {
                    next = source.poll();
                }
                if (next.isEmpty()) {
                    if (source.isFinished()) break;
                    throw new IllegalStateException("Source returned no record before finishing; synchronous pipelines need blocking sources");
                }
                inMeter.mark();
                Record<O> out;
                try (Timer.Context ignored = transformTimer.time()) {
                    out = Objects.requireNonNull(transform.apply(next.get()), "transform output");
                }
                try (Timer.Context ignored = sinkTimer.time()) {
                    sink.accept(out);
                }
                outMeter.mark();
                written++;
            }
            sink.flush();
        } catch (IOException | RuntimeException e) {
            errorMeter.mark();
            log.debug("Pipeline aborted after {} records", written, e);
            throw e;
        }
        log.debug("Pipeline finished: {} records", written);
        return written;
    }
}
