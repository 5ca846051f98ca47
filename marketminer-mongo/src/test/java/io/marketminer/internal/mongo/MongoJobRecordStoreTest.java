package io.marketminer.internal.mongo;

import com.mongodb.client.result.UpdateResult;
import io.marketminer.core.Job;
import io.marketminer.core.JobStatus;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MongoJobRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);
    private final MongoJobRecordStore store = new MongoJobRecordStore(mongoTemplate);

    @Test
    void putShouldSaveFullDocument() {
        store.put(Job.queued("job-1", "shop.example", List.of("https://shop.example/a"), NOW));

        ArgumentCaptor<JobDocument> captor = ArgumentCaptor.forClass(JobDocument.class);
        verify(mongoTemplate).save(captor.capture());
        JobDocument doc = captor.getValue();
        assertThat(doc.getId()).isEqualTo("job-1");
        assertThat(doc.getDomain()).isEqualTo("shop.example");
        assertThat(doc.getUrls()).containsExactly("https://shop.example/a");
        assertThat(doc.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(doc.getCreatedAt()).isEqualTo(NOW);
        assertThat(doc.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void missingDocumentShouldReadAsEmpty() {
        when(mongoTemplate.findById("nope", JobDocument.class)).thenReturn(null);

        assertThat(store.get("nope")).isEmpty();
    }

    @Test
    void failIfStillQueuedShouldReportWhetherStatusChanged() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(JobDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.failIfStillQueued("job-1", NOW)).isTrue();
        assertThat(store.failIfStillQueued("job-1", NOW)).isFalse();
    }

    @Test
    void nonPositiveLimitShouldNotQuery() {
        assertThat(store.findQueuedCreatedBefore(NOW, 0)).isEmpty();
        verifyNoInteractions(mongoTemplate);
    }
}
