package com.p14n.pollevent.query;

import java.util.List;

/**
 * Filters and paging for {@link QueryService#query(EventQuery)}. Unset fields
 * do not filter.
 *
 * @param startTime     inclusive lower bound on event time (epoch millis)
 * @param endTime       exclusive upper bound on event time (epoch millis)
 * @param changeGroupId only events of this group
 * @param controls      only events whose control path or control name matches one of these
 * @param components    only events of these components
 * @param limit         page size, {@link QueryService#DEFAULT_LIMIT} when null
 * @param offset        rows to skip, 0 when null
 */
public record EventQuery(Long startTime,
        Long endTime,
        String changeGroupId,
        List<String> controls,
        List<String> components,
        Integer limit,
        Integer offset) {

    public EventQuery {
        controls = controls == null ? List.of() : List.copyOf(controls);
        components = components == null ? List.of() : List.copyOf(components);
    }

    public static EventQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Long startTime;
        private Long endTime;
        private String changeGroupId;
        private List<String> controls = List.of();
        private List<String> components = List.of();
        private Integer limit;
        private Integer offset;

        public Builder startTime(Long startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Long endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder changeGroupId(String changeGroupId) {
            this.changeGroupId = changeGroupId;
            return this;
        }

        public Builder controls(List<String> controls) {
            this.controls = controls;
            return this;
        }

        public Builder components(List<String> components) {
            this.components = components;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public EventQuery build() {
            return new EventQuery(startTime, endTime, changeGroupId, controls, components, limit, offset);
        }
    }
}
