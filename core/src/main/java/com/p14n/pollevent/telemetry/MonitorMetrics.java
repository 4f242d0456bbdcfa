package com.p14n.pollevent.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * OpenTelemetry instruments for the event monitoring pipeline.
 *
 * <ul>
 * <li>events_emitted: change events produced by polling, per change group</li>
 * <li>events_persisted: events committed to the store</li>
 * <li>events_dropped: events lost to overflow, eviction or isolation, per reason</li>
 * <li>poll_failures: failed or timed out remote reads, per change group</li>
 * <li>flush_failures: failed flushes, per failure kind</li>
 * <li>active_change_groups: groups currently registered</li>
 * </ul>
 */
public class MonitorMetrics {

        private static final AttributeKey<String> GROUP = AttributeKey.stringKey("change_group");
        private static final AttributeKey<String> REASON = AttributeKey.stringKey("reason");
        private static final AttributeKey<String> KIND = AttributeKey.stringKey("kind");

        private final LongCounter emitted;
        private final LongCounter persisted;
        private final LongCounter dropped;
        private final LongCounter pollFailures;
        private final LongCounter flushFailures;
        private final LongUpDownCounter activeGroups;

        public MonitorMetrics(Meter meter) {
                emitted = meter.counterBuilder("events_emitted")
                                .setDescription("Number of change events produced by polling")
                                .build();

                persisted = meter.counterBuilder("events_persisted")
                                .setDescription("Number of change events committed to the store")
                                .build();

                dropped = meter.counterBuilder("events_dropped")
                                .setDescription("Number of change events discarded before persistence")
                                .build();

                pollFailures = meter.counterBuilder("poll_failures")
                                .setDescription("Number of failed or timed out remote reads")
                                .build();

                flushFailures = meter.counterBuilder("flush_failures")
                                .setDescription("Number of failed buffer flushes")
                                .build();

                activeGroups = meter.upDownCounterBuilder("active_change_groups")
                                .setDescription("Number of registered change groups")
                                .build();
        }

        public void recordEmitted(String changeGroupId, long count) {
                if (count > 0) {
                        emitted.add(count, Attributes.of(GROUP, changeGroupId));
                }
        }

        public void recordPersisted(long count) {
                if (count > 0) {
                        persisted.add(count);
                }
        }

        /**
         * @param reason one of overflow, eviction, isolation, integrity
         * @param count  number of events dropped
         */
        public void recordDropped(String reason, long count) {
                if (count > 0) {
                        dropped.add(count, Attributes.of(REASON, reason));
                }
        }

        public void recordPollFailure(String changeGroupId) {
                pollFailures.add(1, Attributes.of(GROUP, changeGroupId));
        }

        public void recordFlushFailure(String kind) {
                flushFailures.add(1, Attributes.of(KIND, kind));
        }

        public void recordGroupCreated() {
                activeGroups.add(1);
        }

        public void recordGroupDestroyed() {
                activeGroups.add(-1);
        }
}
