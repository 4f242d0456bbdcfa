package com.p14n.pollevent.telemetry;

import java.util.function.Supplier;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Runs monitor operations inside trace spans.
 */
public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        /**
         * Executes an action within a new span, recording any exception on it.
         *
         * @param <T>      Return type of the action
         * @param tracer   Tracer to create spans
         * @param spanName Name of the span to create
         * @param action   Action to execute within the span
         * @return Result of the action execution
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName,
                        Supplier<T> action) {
                return processWithTelemetry(tracer, spanName, Attributes.empty(), action);
        }

        /**
         * Executes an action within a new span carrying the given attributes.
         *
         * @param <T>        Return type of the action
         * @param tracer     Tracer to create spans
         * @param spanName   Name of the span to create
         * @param attributes Attributes set on the span
         * @param action     Action to execute within the span
         * @return Result of the action execution
         */
        public static <T> T processWithTelemetry(Tracer tracer, String spanName, Attributes attributes,
                        Supplier<T> action) {
                Span span = tracer.spanBuilder(spanName)
                                .setAllAttributes(attributes)
                                .startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
