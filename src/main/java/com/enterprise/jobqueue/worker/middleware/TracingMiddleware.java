package com.enterprise.jobqueue.worker.middleware;

import com.enterprise.jobqueue.core.Task;
import com.enterprise.jobqueue.core.TaskHandler;
import com.enterprise.jobqueue.worker.TaskMiddleware;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Wraps every attempt in a consumer span named "task:{type}"
 */
public class TracingMiddleware implements TaskMiddleware {
    
    public static final String INSTRUMENTATION_NAME = "com.enterprise.jobqueue.worker";
    
    static final AttributeKey<String> TASK_ID = AttributeKey.stringKey("task.id");
    static final AttributeKey<String> TASK_TYPE = AttributeKey.stringKey("task.type");
    static final AttributeKey<String> TASK_QUEUE = AttributeKey.stringKey("task.queue");
    static final AttributeKey<Long> TASK_RETRY_COUNT = AttributeKey.longKey("task.retry_count");
    
    private final Tracer tracer;
    
    public TracingMiddleware(Tracer tracer) {
        this.tracer = tracer;
    }
    
    public TracingMiddleware(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_NAME));
    }
    
    @Override
    public TaskHandler apply(TaskHandler next) {
        return (context, payload) -> {
            Task task = context.getTask();
            Span span = tracer.spanBuilder("task:" + task.getType())
                .setSpanKind(SpanKind.CONSUMER)
                .setAttribute(TASK_ID, task.getId())
                .setAttribute(TASK_TYPE, task.getType())
                .setAttribute(TASK_QUEUE, task.getQueue())
                .setAttribute(TASK_RETRY_COUNT, (long) task.getRetryCount())
                .startSpan();
            try (Scope ignored = span.makeCurrent()) {
                next.handle(context, payload);
                span.setStatus(StatusCode.OK);
            } catch (Exception e) {
                span.recordException(e);
                span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
                throw e;
            } finally {
                span.end();
            }
        };
    }
}
