package com.assetdiffbot.core.queue;

import com.assetdiffbot.core.model.ChangeKind;
import com.assetdiffbot.core.model.DiffRequest;
import com.assetdiffbot.core.model.DurableJob;
import com.assetdiffbot.core.model.FileChange;
import com.assetdiffbot.core.model.JobType;
import com.assetdiffbot.core.model.RepositoryRef;
import com.assetdiffbot.core.model.Revision;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryJobQueueTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private DirectoryJobQueue queue;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        queue = new DirectoryJobQueue(tempDir.resolve("jobs"), objectMapper);
    }

    private static DiffRequest request(long pullRequest) {
        return new DiffRequest(7, new RepositoryRef(99, "owner/repo"),
                new Revision("aaa", "main"), new Revision("bbb", "feature"), pullRequest,
                List.of(new FileChange("icons/a.dmi", ChangeKind.MODIFIED)), 555L);
    }

    private List<Path> filesIn(Path dir) throws Exception {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isRegularFile).toList();
        }
    }

    @Test
    void enqueueWritesOneEntryAndNoTemporaryFiles() throws Exception {
        String id = queue.enqueue(DurableJob.diff(request(1)));

        var files = filesIn(queue.directory());
        assertEquals(1, files.size());
        assertEquals(id + ".json", files.get(0).getFileName().toString());
        String json = Files.readString(files.get(0));
        assertTrue(json.contains("\"installation_id\":7"));
        assertTrue(json.contains("\"full_name\":\"owner/repo\""));
        assertTrue(json.contains("\"status\":\"modified\""));
    }

    @Test
    void entriesAreTakenInFifoOrder() throws Exception {
        queue.enqueue(DurableJob.diff(request(1)));
        queue.enqueue(DurableJob.diff(request(2)));
        queue.enqueue(DurableJob.cleanup());

        assertEquals(1, queue.take(Duration.ZERO).orElseThrow().job().request().pullRequest());
        assertEquals(2, queue.take(Duration.ZERO).orElseThrow().job().request().pullRequest());
        assertEquals(JobType.CLEANUP, queue.take(Duration.ZERO).orElseThrow().job().type());
        assertTrue(queue.take(Duration.ZERO).isEmpty());
    }

    @Test
    void requestSurvivesRoundTrip() throws Exception {
        var original = request(3);
        queue.enqueue(DurableJob.diff(original));

        var taken = queue.take(Duration.ZERO).orElseThrow().job();

        assertEquals(original, taken.request());
        assertNotNull(taken.enqueuedAt());
    }

    @Test
    void completeDeletesEntry() throws Exception {
        queue.enqueue(DurableJob.diff(request(1)));
        var taken = queue.take(Duration.ZERO).orElseThrow();

        queue.complete(taken.id());

        assertEquals(0, queue.size());
    }

    @Test
    void uncompletedEntryIsRedeliveredAfterRestart() throws Exception {
        queue.enqueue(DurableJob.diff(request(1)));
        queue.enqueue(DurableJob.diff(request(2)));
        var first = queue.take(Duration.ZERO).orElseThrow();

        var restarted = new DirectoryJobQueue(tempDir.resolve("jobs"), objectMapper);

        var redelivered = restarted.take(Duration.ZERO).orElseThrow();
        assertEquals(first.id(), redelivered.id());
        assertEquals(2, restarted.size());
    }

    @Test
    void takeTimesOutWhenEmpty() throws Exception {
        long start = System.nanoTime();

        assertTrue(queue.take(Duration.ofMillis(100)).isEmpty());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));
    }

    @Test
    void takeWakesUpOnEnqueue() throws Exception {
        var taken = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.take(Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        queue.enqueue(DurableJob.cleanup());

        assertTrue(taken.get(5, TimeUnit.SECONDS).isPresent());
    }

    @Test
    void corruptEntryIsMovedToDeadLetters() throws Exception {
        Files.writeString(queue.directory().resolve("00000000000000000001.json"), "{not json");
        queue.enqueue(DurableJob.cleanup());

        var taken = queue.take(Duration.ZERO);

        assertTrue(taken.isPresent());
        assertEquals(JobType.CLEANUP, taken.get().job().type());
        assertTrue(Files.exists(queue.directory().resolve(DirectoryJobQueue.DEAD_DIR)
                .resolve("00000000000000000001.json")));
    }

    @Test
    void pendingListsEntriesInOrder() {
        queue.enqueue(DurableJob.diff(request(5)));
        queue.enqueue(DurableJob.cleanup());

        var pending = queue.pending();

        assertEquals(2, pending.size());
        assertEquals(JobType.DIFF, pending.get(0).job().type());
        assertEquals(JobType.CLEANUP, pending.get(1).job().type());
        assertTrue(pending.get(0).id().compareTo(pending.get(1).id()) < 0);
    }

    @Test
    void producersSharingADirectoryNeverOverwriteEachOther() throws Exception {
        var other = new DirectoryJobQueue(queue.directory(), objectMapper);
        var ids = new HashSet<String>();
        for (int i = 0; i < 200; i++) {
            ids.add(queue.enqueue(DurableJob.diff(request(i))));
            ids.add(other.enqueue(DurableJob.diff(request(1000 + i))));
        }

        assertEquals(400, ids.size());
        assertEquals(400, queue.size());
        var pullRequests = queue.pending().stream().map(job -> job.job().request().pullRequest()).collect(Collectors.toSet());
        assertEquals(400, pullRequests.size());
    }

    @Test
    void publishRefusesToReplaceAnExistingEntry() throws Exception {
        Path target = queue.directory().resolve("00000000000000000001-aaaaaaaa.json");
        Files.writeString(target, "acknowledged");
        Path temp = queue.directory().resolve(DirectoryJobQueue.TEMP_PREFIX + "late");
        Files.writeString(temp, "late");

        assertThrows(FileAlreadyExistsException.class, () -> DirectoryJobQueue.publish(temp, target));

        assertEquals("acknowledged", Files.readString(target));
    }

    @Test
    void publishMovesTheTemporaryFileIntoPlace() throws Exception {
        Path target = queue.directory().resolve("00000000000000000002-aaaaaaaa.json");
        Path temp = queue.directory().resolve(DirectoryJobQueue.TEMP_PREFIX + "fresh");
        Files.writeString(temp, "fresh");

        DirectoryJobQueue.publish(temp, target);

        assertEquals("fresh", Files.readString(target));
        assertFalse(Files.exists(temp));
    }
}
