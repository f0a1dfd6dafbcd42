package com.assetdiffbot.core.queue;

import com.assetdiffbot.core.model.DurableJob;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable FIFO queue backed by a directory of JSON files.
 *
 * <p>Each entry is written to a temporary file and forced to disk, then published as
 * {@code <sequence>-<instance>.json} with a hard link that never replaces an existing entry.
 * The directory is forced after publishing, and only then does {@link #enqueue} return.
 * Entries are taken in sequence order and stay on disk until {@link #complete} deletes them,
 * so a crash between take and complete redelivers the entry on the next start. Entries that
 * cannot be parsed are moved to {@code dead/}.
 *
 * <p>Several queue instances, in one process or several, may enqueue into the same directory.
 * Each carries its own instance tag in the ids it issues. Intended for a single consumer per
 * directory.
 */
public class DirectoryJobQueue {

    private static final Logger log = LoggerFactory.getLogger(DirectoryJobQueue.class);

    static final String SUFFIX = ".json";
    static final String TEMP_PREFIX = ".tmp-";
    static final String DEAD_DIR = "dead";

    /** How often {@link #take} rescans for entries written by other processes. */
    private static final long POLL_INTERVAL_MS = 500;

    private static final int MAX_PUBLISH_ATTEMPTS = 5;

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Object signal = new Object();
    private final String instanceTag;
    private long lastSequence;

    public DirectoryJobQueue(Path directory, ObjectMapper objectMapper) {
        this.directory = directory.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.instanceTag = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        try {
            Files.createDirectories(this.directory.resolve(DEAD_DIR));
        } catch (IOException e) {
            throw new JobQueueException("Failed to create queue directory " + this.directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    /**
     * Durably writes a job. Returns only once the entry is on disk.
     *
     * @return the entry id
     */
    public String enqueue(DurableJob job) {
        String id = nextId();
        Path temp = directory.resolve(TEMP_PREFIX + id);
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(job);
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                var buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            id = publishUnderFreeId(temp, id);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new JobQueueException("Failed to enqueue job " + id, e);
        }
        syncDirectory();
        log.debug("Enqueued {} job as {}", job.type(), id);
        synchronized (signal) {
            signal.notifyAll();
        }
        return id;
    }

    private String publishUnderFreeId(Path temp, String firstId) throws IOException {
        String id = firstId;
        for (int attempt = 1; ; attempt++) {
            try {
                publish(temp, directory.resolve(id + SUFFIX));
                return id;
            } catch (FileAlreadyExistsException e) {
                if (attempt >= MAX_PUBLISH_ATTEMPTS) {
                    throw e;
                }
                log.warn("Queue entry {} already exists, retrying under a new id", id);
                id = nextId();
            }
        }
    }

    /**
     * Takes the oldest entry that is not already in flight, waiting up to {@code timeout}.
     */
    public Optional<QueuedJob> take(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            for (Path entry : entries()) {
                String id = idOf(entry);
                if (inFlight.contains(id)) {
                    continue;
                }
                Optional<DurableJob> job = read(entry);
                if (job.isEmpty()) {
                    continue;
                }
                inFlight.add(id);
                return Optional.of(new QueuedJob(id, job.get()));
            }
            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMs <= 0) {
                return Optional.empty();
            }
            synchronized (signal) {
                signal.wait(Math.min(remainingMs, POLL_INTERVAL_MS));
            }
        }
    }

    /**
     * Removes a processed entry. Called after success and after terminal failure.
     */
    public void complete(String id) {
        try {
            Files.deleteIfExists(directory.resolve(id + SUFFIX));
        } catch (IOException e) {
            throw new JobQueueException("Failed to complete job " + id, e);
        } finally {
            inFlight.remove(id);
        }
        log.debug("Completed queue entry {}", id);
    }

    /**
     * Readable entries in delivery order, including those in flight.
     */
    public List<QueuedJob> pending() {
        var jobs = new ArrayList<QueuedJob>();
        for (Path entry : entries()) {
            try {
                jobs.add(new QueuedJob(idOf(entry), objectMapper.readValue(entry.toFile(), DurableJob.class)));
            } catch (IOException e) {
                log.debug("Skipping unreadable entry {}: {}", entry.getFileName(), e.getMessage());
            }
        }
        return jobs;
    }

    public int size() {
        return entries().size();
    }

    private List<Path> entries() {
        var entries = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry)) {
                    entries.add(entry);
                }
            }
        } catch (IOException e) {
            throw new JobQueueException("Failed to list queue directory " + directory, e);
        }
        entries.sort(null);
        return entries;
    }

    private Optional<DurableJob> read(Path entry) {
        try {
            return Optional.of(objectMapper.readValue(entry.toFile(), DurableJob.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.error("Moving unreadable queue entry {} to {}/: {}", entry.getFileName(), DEAD_DIR, e.getMessage());
            try {
                Files.move(entry, directory.resolve(DEAD_DIR).resolve(entry.getFileName()),
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                e.addSuppressed(moveError);
                throw new JobQueueException("Failed to quarantine queue entry " + entry.getFileName(), e);
            }
            return Optional.empty();
        }
    }

    /**
     * Zero-padded so that lexical order is delivery order. Derived from the clock so that
     * ids keep increasing across restarts; the instance tag keeps ids issued by different
     * queue instances apart.
     */
    private synchronized String nextId() {
        long candidate = System.currentTimeMillis() * 1000;
        lastSequence = Math.max(candidate, lastSequence + 1);
        return "%020d-%s".formatted(lastSequence, instanceTag);
    }

    private static String idOf(Path entry) {
        String name = entry.getFileName().toString();
        return name.substring(0, name.length() - SUFFIX.length());
    }

    /**
     * Makes {@code temp} visible as {@code target} and removes {@code temp}. Never replaces an
     * existing target.
     *
     * @throws FileAlreadyExistsException if {@code target} already exists
     */
    static void publish(Path temp, Path target) throws IOException {
        try {
            Files.createLink(target, temp);
        } catch (UnsupportedOperationException e) {
            log.warn("Hard links not supported in {}, falling back to a plain rename", temp.getParent());
            Files.move(temp, target);
            return;
        }
        // The entry is already visible; a leftover temp file is never read as an entry.
        deleteQuietly(temp);
    }

    private void syncDirectory() {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.warn("Could not force queue directory {} to disk: {}", directory, e.getMessage());
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete temporary queue file {}: {}", path, e.getMessage());
        }
    }
}
