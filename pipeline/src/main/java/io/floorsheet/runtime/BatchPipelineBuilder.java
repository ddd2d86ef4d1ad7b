package io.floorsheet.runtime;

import com.codahale.metrics.MetricRegistry;
import io.floorsheet.core.Sink;
import io.floorsheet.core.Source;
import io.floorsheet.core.Transform;
import io.floorsheet.error.DeadLetterSink;
import io.floorsheet.metrics.Metrics;

import java.util.Objects;

public class BatchPipelineBuilder<I, O> {
    private Source<I> source;
    private Transform<I, O> transform;
    private Sink<O> sink;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private DeadLetterSink<I> deadLetters = DeadLetterSink.discarding();

    public BatchPipelineBuilder<I, O> source(Source<I> s) { this.source = s; return this; }
    public BatchPipelineBuilder<I, O> transform(Transform<I, O> t) { this.transform = t; return this; }
    public BatchPipelineBuilder<I, O> sink(Sink<O> s) { this.sink = s; return this; }
    public BatchPipelineBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public BatchPipelineBuilder<I, O> deadLetters(DeadLetterSink<I> d) { this.deadLetters = d; return this; }

    public BatchPipeline<I, O> build() {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(transform, "transform");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(metricRegistry, "metrics");
        Objects.requireNonNull(deadLetters, "deadLetters");
        return new BatchPipeline<>(source, transform, sink, new Metrics(metricRegistry), deadLetters);
    }
}
