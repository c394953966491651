package org.dxworks.codeshaper.io;

import java.nio.file.Path;
import java.time.Instant;

@FunctionalInterface
public interface BackupPolicy {

    Path backupPathFor(Path original, Instant now);
}
