package com.marketpipe.core.shm;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-JVM half of the segment mutex.
 * <p>
 * File locks belong to the whole JVM, so two handles on the same segment inside one
 * process cannot both request one (that throws {@code OverlappingFileLockException}).
 * Every handle for a path first takes the same {@link ReentrantLock}, then the file lock.
 */
final class SegmentLocks {

    private static final Map<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private SegmentLocks() {}

    static ReentrantLock forPath(Path path) {
        return LOCKS.computeIfAbsent(path.toAbsolutePath().normalize(), p -> new ReentrantLock());
    }
}
