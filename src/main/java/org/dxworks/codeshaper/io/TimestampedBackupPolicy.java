package org.dxworks.codeshaper.io;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Places the backup next to the original as {@code <name>.backup.<epochMillis>}.
 */
public class TimestampedBackupPolicy implements BackupPolicy {

    @Override
    public Path backupPathFor(Path original, Instant now) {
        return original.resolveSibling(original.getFileName() + ".backup." + now.toEpochMilli());
    }
}
