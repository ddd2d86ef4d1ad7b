package io.floorsheet.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.floorsheet.core.BatchSink;
import io.floorsheet.core.Record;
import io.floorsheet.core.Sink;
import io.floorsheet.core.Source;
import io.floorsheet.core.Transform;
import io.floorsheet.error.DeadLetterSink;
import io.floorsheet.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single-threaded source -> transform -> sink run over a finite source.
 * <p>
 * The source is drained on the calling thread, every input goes through the transform once and the
 * outputs are handed to the sink in seq/subSeq order after the source finishes. A {@link BatchSink}
 * receives the whole batch in one call. A failing transform sends its input to the dead-letter sink
 * and the run continues with the next input; a failing sink ends the run with its exception.
 */
public class BatchPipeline<I, O> {
    private static final Logger log = LoggerFactory.getLogger(BatchPipeline.class);

    private final Source<I> source;
    private final Transform<I, O> transform;
    private final Sink<O> sink;
    private final DeadLetterSink<I> deadLetters;

    private final Timer sourceTimer;
    private final Timer transformTimer;
    private final Timer sinkTimer;
    private final Meter inMeter;
    private final Meter outMeter;
    private final Meter errorMeter;

    BatchPipeline(Source<I> source, Transform<I, O> transform, Sink<O> sink, Metrics metrics, DeadLetterSink<I> deadLetters) {
        this.source = Objects.requireNonNull(source);
        this.transform = Objects.requireNonNull(transform);
        this.sink = Objects.requireNonNull(sink);
        this.deadLetters = Objects.requireNonNull(deadLetters);
        this.sourceTimer = metrics.timer("pipeline.source.time");
        this.transformTimer = metrics.timer("pipeline.transform.time");
        this.sinkTimer = metrics.timer("pipeline.sink.time");
        this.inMeter = metrics.meter("pipeline.input.rate");
        this.outMeter = metrics.meter("pipeline.output.rate");
        this.errorMeter = metrics.meter("pipeline.error.rate");
    }

    /**
     * Drains the source and delivers the outputs.
     *
     * @return counts of inputs read, outputs delivered and inputs that failed in the transform
     * @throws Exception whatever the sink throws
     */
    public Summary run() throws Exception {
        List<Record<O>> outputs = new ArrayList<>();
        long inputs = 0;
        long failures = 0;
        try {
            while (true) {
                Optional<Record<I>> next;
                try (Timer.Context ignored = sourceTimer.time()) {
                    next = source.poll();
                }
                if (next.isEmpty()) {
                    if (source.isFinished()) break;
                    continue;
                }
                inMeter.mark();
                inputs++;
                Record<I> in = next.get();
                try (Timer.Context ignored = transformTimer.time()) {
                    List<Record<O>> out = transform.apply(in);
                    if (out != null) outputs.addAll(out);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw ie;
                } catch (Exception e) {
                    errorMeter.mark();
                    failures++;
                    log.warn("Transform failed for seq={}: {}", in.seq(), e.toString());
                    deadLetters.acceptFailure("transform", in, e.toString());
                }
            }
        } finally {
            source.close();
        }

        Collections.sort(outputs);
        try (Timer.Context ignored = sinkTimer.time()) {
            if (sink instanceof BatchSink<O> batch) {
                batch.acceptBatch(outputs);
            } else {
                for (Record<O> r : outputs) sink.accept(r);
            }
        } finally {
            sink.close();
        }
        outMeter.mark(outputs.size());
        return new Summary(inputs, outputs.size(), failures);
    }

    public record Summary(long inputs, long outputs, long failures) {}
}
