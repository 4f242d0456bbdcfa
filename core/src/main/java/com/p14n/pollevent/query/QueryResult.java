package com.p14n.pollevent.query;

import java.util.List;

import com.p14n.pollevent.data.PersistedEvent;

/**
 * One page of query results.
 *
 * @param events     the rows of the page, in storage order
 * @param totalCount number of rows matching the filters, ignoring paging
 * @param limit      effective page size
 * @param offset     effective offset
 */
public record QueryResult(List<PersistedEvent> events, long totalCount, int limit, int offset) {

    public QueryResult {
        events = List.copyOf(events);
    }

    public boolean hasMore() {
        return offset + events.size() < totalCount;
    }
}
