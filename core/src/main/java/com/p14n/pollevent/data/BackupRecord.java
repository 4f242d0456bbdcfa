package com.p14n.pollevent.data;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Metadata of a snapshot file in the backup directory.
 *
 * @param eventsCount number of events in the snapshot, or {@code null} when
 *                    only the file listing is known
 */
public record BackupRecord(String filename,
        Path path,
        Instant createdAt,
        long size,
        boolean compressed,
        Long eventsCount) {
}
