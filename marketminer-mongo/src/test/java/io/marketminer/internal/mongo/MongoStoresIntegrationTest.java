package io.marketminer.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.marketminer.JobAdmission;
import io.marketminer.core.DispatchRequest;
import io.marketminer.core.DispatchTarget;
import io.marketminer.core.Job;
import io.marketminer.core.JobStatus;
import io.marketminer.core.RetryPolicy;
import io.marketminer.internal.BoundaryCalls;
import io.marketminer.internal.DefaultJobAdmission;
import io.marketminer.internal.DispatchSubmitter;
import io.marketminer.internal.QueueProvisioner;
import io.marketminer.spi.QueueAlreadyExistsException;
import io.marketminer.utils.QueueNames;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoStoresIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoClient mongoClient;
    private MongoTemplate mongoTemplate;
    private MongoJobRecordStore jobStore;
    private MongoDispatchQueueService queueService;

    @BeforeEach
    void setUp() {
        mongoClient = MongoClients.create(MONGO.getReplicaSetUrl());
        mongoTemplate = new MongoTemplate(mongoClient, "marketminer_test");
        dropAll();
        jobStore = new MongoJobRecordStore(mongoTemplate);
        queueService = new MongoDispatchQueueService(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
        mongoClient.close();
    }

    @Test
    void jobRecordShouldRoundTripAndDelete() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Job job = Job.queued("job-1", "shop.example", List.of("https://shop.example/a", "https://shop.example/b"), now);

        jobStore.put(job);
        assertEquals(job, jobStore.get("job-1").orElseThrow());

        jobStore.delete("job-1");
        assertTrue(jobStore.get("job-1").isEmpty());
    }

    @Test
    void staleQueuedJobsShouldBeFailedOnlyWhileQueued() {
        Instant old = Instant.now().minus(Duration.ofHours(3)).truncatedTo(ChronoUnit.MILLIS);
        jobStore.put(Job.queued("stale", "shop.example", List.of("https://shop.example/a"), old));
        jobStore.put(new Job("running", "shop.example", List.of("https://shop.example/b"), JobStatus.RUNNING, old, old));

        List<Job> candidates = jobStore.findQueuedCreatedBefore(Instant.now().minus(Duration.ofHours(2)), 10);
        assertEquals(1, candidates.size());
        assertEquals("stale", candidates.get(0).id());

        Instant now = Instant.now();
        assertTrue(jobStore.failIfStillQueued("stale", now));
        assertFalse(jobStore.failIfStillQueued("stale", now));
        assertFalse(jobStore.failIfStillQueued("running", now));

        assertEquals(JobStatus.FAILED, jobStore.get("stale").orElseThrow().status());
        assertEquals(JobStatus.RUNNING, jobStore.get("running").orElseThrow().status());
    }

    @Test
    void secondQueueCreateShouldSignalAlreadyExists() {
        queueService.createQueue("prices-shop.example", RetryPolicy.DEFAULT);

        assertThrows(QueueAlreadyExistsException.class,
                () -> queueService.createQueue("prices-shop.example", RetryPolicy.DEFAULT));
        assertEquals(RetryPolicy.DEFAULT, queueService.getQueue("prices-shop.example").retryPolicy());
    }

    @Test
    void concurrentFirstJobsForDomainShouldShareOneQueue() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            JobAdmission admission = admission();
            List<Callable<String>> creates = List.of(
                    () -> admission.createJob("shop.example", List.of("https://shop.example/a")),
                    () -> admission.createJob("shop.example", List.of("https://shop.example/b")),
                    () -> admission.createJob("shop.example", List.of("https://shop.example/c")),
                    () -> admission.createJob("shop.example", List.of("https://shop.example/d"))
            );

            for (Future<String> f : callers.invokeAll(creates)) {
                String id = f.get();
                assertEquals(JobStatus.QUEUED, jobStore.get(id).orElseThrow().status());
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(1, mongoTemplate.findAll(DispatchQueueDocument.class).size());
        List<DispatchRequest> pending = queueService.pending("prices-shop.example");
        assertEquals(4, pending.size());
        assertEquals("POST", pending.get(0).httpMethod());
    }

    private JobAdmission admission() {
        BoundaryCalls calls = BoundaryCalls.inline();
        QueueNames names = new QueueNames();
        DispatchTarget target = DispatchTarget.runJob("test-project", "us-central1", "spider", "sa@test-project.iam.gserviceaccount.com");
        return new DefaultJobAdmission(
                jobStore,
                new QueueProvisioner(queueService, names, calls),
                new DispatchSubmitter(queueService, names, target, new ObjectMapper(), calls),
                calls
        );
    }

    private void dropAll() {
        mongoTemplate.dropCollection(JobDocument.class);
        mongoTemplate.dropCollection(DispatchQueueDocument.class);
        mongoTemplate.dropCollection(DispatchTaskDocument.class);
    }
}
