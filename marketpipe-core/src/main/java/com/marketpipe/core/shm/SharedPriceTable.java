package com.marketpipe.core.shm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Fixed-capacity, symbol-indexed price table in a memory-mapped segment file,
 * readable and writable by several processes at once.
 * <p>
 * Lifecycle: one process {@link #create}s the segment, any number {@link #attach} to it,
 * and only the creator {@link #unlink}s it on shutdown. Every price access happens under
 * a cross-process mutex (an exclusive file lock plus an in-JVM lock per path) which is
 * held for one entry access or one full copy, never longer.
 * See {@link SegmentLayout} for the byte layout.
 */
public class SharedPriceTable implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(SharedPriceTable.class);

    private static final int CREATE_ATTEMPTS = 3;
    private static final AtomicLong STAGING_SEQ = new AtomicLong();

    private final String name;
    private final Path path;
    private final boolean creator;
    private final ReentrantLock jvmLock;
    private final List<String> symbols;
    private final Map<String, Integer> symbolToIndex;

    private FileChannel channel;
    private MappedByteBuffer buffer;
    private volatile boolean closed = false;

    private SharedPriceTable(String name, Path path, boolean creator, ReentrantLock jvmLock,
                             FileChannel channel, MappedByteBuffer buffer, List<String> symbols) {
        this.name = name;
        this.path = path;
        this.creator = creator;
        this.jvmLock = jvmLock;
        this.channel = channel;
        this.buffer = buffer;
        this.symbols = List.copyOf(symbols);

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < symbols.size(); i++) {
            index.put(symbols.get(i), i);
        }
        this.symbolToIndex = Collections.unmodifiableMap(index);
    }

    /**
     * Create the segment, or attach to it if a segment with this name already exists.
     * <p>
     * A new segment is fully initialized under a private staging name and then published
     * with a hard link, so no other process can ever open it half-written. An existing
     * segment is assumed to be left over from an earlier run: its contents are reused, not
     * reset. An existing but empty file (a creator that died before writing anything) is
     * initialized in place under the lock.
     *
     * @throws SharedSegmentException if the segment cannot be created, or an existing one has
     *                                a different symbol layout
     */
    public static SharedPriceTable create(Path dir, String name, List<String> symbols) throws SharedSegmentException {
        if (symbols.isEmpty()) {
            throw new IllegalArgumentException("A shared price table needs at least one symbol");
        }
        symbols.forEach(SegmentLayout::checkSymbol);

        Path path = dir.resolve(name);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new SharedSegmentException("Failed to create segment directory " + dir, e);
        }

        for (int attempt = 1; attempt <= CREATE_ATTEMPTS; attempt++) {
            SharedPriceTable published = publishNew(dir, name, path, symbols);
            if (published != null) {
                return published;
            }
            LOG.warn("Shared segment '{}' already exists. Attaching...", name);
            try {
                return openExisting(name, path, symbols);
            } catch (NoSuchFileException e) {
                // unlinked between our publish attempt and the open
                LOG.debug("Shared segment '{}' vanished before attach, retrying create", name);
            }
        }
        throw new SharedSegmentException("Could not create or attach shared segment '" + name
            + "' after " + CREATE_ATTEMPTS + " attempts");
    }

    /**
     * @return the new table, or null if a segment with this name already exists
     */
    private static SharedPriceTable publishNew(Path dir, String name, Path path, List<String> symbols)
            throws SharedSegmentException {
        Path staging = dir.resolve("." + name + "." + ProcessHandle.current().pid()
            + "." + STAGING_SEQ.incrementAndGet() + ".tmp");
        long size = SegmentLayout.segmentSize(symbols.size());
        FileChannel channel = null;
        try {
            channel = FileChannel.open(staging, StandardOpenOption.CREATE_NEW,
                StandardOpenOption.READ, StandardOpenOption.WRITE);
            MappedByteBuffer buffer = initialize(channel, symbols, size);
            Files.createLink(path, staging);

            LOG.info("Created shared segment '{}' ({} bytes, {} symbols)", name, size, symbols.size());
            return new SharedPriceTable(name, path, true, SegmentLocks.forPath(path), channel, buffer, symbols);
        } catch (FileAlreadyExistsException e) {
            closeQuietly(channel);
            return null;
        } catch (IOException | UnsupportedOperationException e) {
            closeQuietly(channel);
            throw new SharedSegmentException("Failed to create shared segment '" + name + "' at " + path, e);
        } finally {
            try {
                Files.deleteIfExists(staging);
            } catch (IOException e) {
                LOG.warn("Failed to remove staging file {}: {}", staging, e.getMessage());
            }
        }
    }

    /**
     * Open a segment that already exists under {@code path} on behalf of a creator.
     */
    private static SharedPriceTable openExisting(String name, Path path, List<String> symbols)
            throws SharedSegmentException, NoSuchFileException {
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (NoSuchFileException e) {
            throw e;
        } catch (IOException e) {
            throw new SharedSegmentException("Failed to open shared segment '" + name + "'", e);
        }

        ReentrantLock jvmLock = SegmentLocks.forPath(path);
        long expectedSize = SegmentLayout.segmentSize(symbols.size());
        MappedByteBuffer buffer;
        List<String> existing = new ArrayList<>();
        boolean initialized = false;
        jvmLock.lock();
        try (FileLock ignored = channel.lock()) {
            long size = channel.size();
            if (size == 0) {
                LOG.warn("Shared segment '{}' exists but is empty. Initializing...", name);
                buffer = initialize(channel, symbols, expectedSize);
                existing.addAll(symbols);
                initialized = true;
            } else if (size % SegmentLayout.ENTRY_BYTES != 0) {
                closeQuietly(channel);
                throw new SharedSegmentException("Existing segment '" + name + "' has invalid size " + size);
            } else {
                buffer = channel.map(FileChannel.MapMode.READ_WRITE, 0, size);
                buffer.order(SegmentLayout.BYTE_ORDER);
                int entries = (int) (size / SegmentLayout.ENTRY_BYTES);
                for (int i = 0; i < entries; i++) {
                    existing.add(SegmentLayout.readSymbol(buffer, i));
                }
            }
        } catch (IOException e) {
            closeQuietly(channel);
            throw new SharedSegmentException("Failed to attach shared segment '" + name + "'", e);
        } finally {
            jvmLock.unlock();
        }

        if (!existing.equals(symbols)) {
            closeQuietly(channel);
            throw new SharedSegmentException("Existing segment '" + name + "' tracks "
                + existing + " but " + symbols + " was requested");
        }
        LOG.info("Attached to shared segment '{}' ({} symbols)", name, existing.size());
        return new SharedPriceTable(name, path, initialized, jvmLock, channel, buffer, existing);
    }

    /**
     * Size the file, write every symbol with a zero price and flush.
     */
    private static MappedByteBuffer initialize(FileChannel channel, List<String> symbols, long size) throws IOException {
        MappedByteBuffer buffer = channel.map(FileChannel.MapMode.READ_WRITE, 0, size);
        buffer.order(SegmentLayout.BYTE_ORDER);
        for (int i = 0; i < symbols.size(); i++) {
            SegmentLayout.writeEntry(buffer, i, symbols.get(i), 0.0);
        }
        buffer.force();
        return buffer;
    }

    /**
     * Attach to an existing segment. The symbol layout is read from the segment itself.
     *
     * @throws SegmentNotFoundException if no initialized segment exists under this name
     */
    public static SharedPriceTable attach(Path dir, String name) throws SharedSegmentException {
        Path path = dir.resolve(name);
        FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (NoSuchFileException e) {
            throw new SegmentNotFoundException("Shared segment '" + name + "' not found at " + path, e);
        } catch (IOException e) {
            throw new SharedSegmentException("Failed to open shared segment '" + name + "'", e);
        }

        ReentrantLock jvmLock = SegmentLocks.forPath(path);
        long size = 0;
        MappedByteBuffer buffer = null;
        List<String> symbols = new ArrayList<>();
        jvmLock.lock();
        try (FileLock ignored = channel.lock()) {
            size = channel.size();
            if (size > 0 && size % SegmentLayout.ENTRY_BYTES == 0) {
                buffer = channel.map(FileChannel.MapMode.READ_WRITE, 0, size);
                buffer.order(SegmentLayout.BYTE_ORDER);
                int entries = (int) (size / SegmentLayout.ENTRY_BYTES);
                for (int i = 0; i < entries; i++) {
                    symbols.add(SegmentLayout.readSymbol(buffer, i));
                }
            }
        } catch (IOException e) {
            closeQuietly(channel);
            throw new SharedSegmentException("Failed to attach shared segment '" + name + "'", e);
        } finally {
            jvmLock.unlock();
        }

        if (buffer == null) {
            closeQuietly(channel);
            throw new SegmentNotFoundException("Shared segment '" + name
                + "' is not initialized (size " + size + " bytes)");
        }
        LOG.info("Attached to shared segment '{}' ({} symbols)", name, symbols.size());
        return new SharedPriceTable(name, path, false, jvmLock, channel, buffer, symbols);
    }

    /**
     * Write a price at the symbol's fixed index. Untracked symbols are ignored with a warning.
     */
    public void update(String symbol, double price) {
        Integer idx = symbolToIndex.get(symbol);
        if (idx == null) {
            LOG.warn("Symbol '{}' not tracked in shared segment '{}'", symbol, name);
            return;
        }
        withLock(buf -> buf.putDouble(SegmentLayout.priceOffset(idx), price));
    }

    /**
     * Latest price for a symbol, or empty if the symbol is not tracked.
     */
    public OptionalDouble read(String symbol) {
        Integer idx = symbolToIndex.get(symbol);
        if (idx == null) {
            LOG.debug("Symbol '{}' not tracked in shared segment '{}'", symbol, name);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(withLock(buf -> buf.getDouble(SegmentLayout.priceOffset(idx))));
    }

    /**
     * Copy of every entry taken under a single lock acquisition, in segment order.
     */
    public Map<String, Double> snapshot() {
        double[] prices = withLock(buf -> {
            double[] copy = new double[symbols.size()];
            for (int i = 0; i < copy.length; i++) {
                copy[i] = buf.getDouble(SegmentLayout.priceOffset(i));
            }
            return copy;
        });

        Map<String, Double> result = new LinkedHashMap<>();
        for (int i = 0; i < prices.length; i++) {
            result.put(symbols.get(i), prices[i]);
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Detach this handle. Idempotent; the segment itself survives until {@link #unlink()}.
     */
    @Override
    public void close() {
        if (closed) return;
        jvmLock.lock();
        try {
            if (closed) return;
            closed = true;
            buffer = null;
            closeQuietly(channel);
            channel = null;
            LOG.info("Detached from shared segment '{}'", name);
        } finally {
            jvmLock.unlock();
        }
    }

    /**
     * Destroy the segment. Only the creator should call this; a segment that is already gone
     * counts as success.
     *
     * @return true if the segment is gone afterwards
     */
    public boolean unlink() {
        try {
            if (Files.deleteIfExists(path)) {
                LOG.info("Shared segment '{}' destroyed", name);
            } else {
                LOG.debug("Shared segment '{}' was already destroyed", name);
            }
            return true;
        } catch (IOException e) {
            LOG.warn("Failed to unlink shared segment '{}': {}", name, e.getMessage());
            return false;
        }
    }

    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    public boolean isCreator() {
        return creator;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<String> getSymbols() {
        return symbols;
    }

    public boolean isTracked(String symbol) {
        return symbolToIndex.containsKey(symbol);
    }

    private <T> T withLock(Function<MappedByteBuffer, T> access) {
        jvmLock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Shared segment handle '" + name + "' is closed");
            }
            try (FileLock ignored = channel.lock()) {
                return access.apply(buffer);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to lock shared segment '" + name + "'", e);
        } finally {
            jvmLock.unlock();
        }
    }

    private static void closeQuietly(FileChannel channel) {
        if (channel == null) return;
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Failed to close segment channel: {}", e.getMessage());
        }
    }
}
