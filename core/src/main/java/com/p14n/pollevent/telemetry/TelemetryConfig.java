package com.p14n.pollevent.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;

public interface TelemetryConfig {
    Meter getMeter();

    Tracer getTracer();

    OpenTelemetry getOpenTelemetry();

    /**
     * Wraps an already configured OpenTelemetry instance.
     *
     * @param ot            the instance, {@link OpenTelemetry#noop()} in tests
     * @param scopeName     instrumentation scope name
     * @return a config handing out a meter and tracer for the scope
     */
    static TelemetryConfig of(OpenTelemetry ot, String scopeName) {
        Meter meter = ot.getMeter(scopeName);
        Tracer tracer = ot.getTracer(scopeName);
        return new TelemetryConfig() {
            @Override
            public Meter getMeter() {
                return meter;
            }

            @Override
            public Tracer getTracer() {
                return tracer;
            }

            @Override
            public OpenTelemetry getOpenTelemetry() {
                return ot;
            }
        };
    }
}
