package io.marketminer.internal;

import io.marketminer.core.DispatchQueue;
import io.marketminer.core.JobDispatchException;
import io.marketminer.core.RetryPolicy;
import io.marketminer.spi.DispatchQueueService;
import io.marketminer.spi.QueueAlreadyExistsException;
import io.marketminer.spi.QueueNotFoundException;
import io.marketminer.utils.QueueNames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueueProvisionerTest {

    private static final String QUEUE = "prices-shop.example";

    @Mock
    private DispatchQueueService queueService;

    private QueueProvisioner provisioner() {
        return new QueueProvisioner(queueService, new QueueNames(), BoundaryCalls.inline());
    }

    @Test
    void existingQueueShouldBeNoop() {
        when(queueService.getQueue(QUEUE)).thenReturn(new DispatchQueue(QUEUE, RetryPolicy.DEFAULT, Instant.now()));

        provisioner().ensureQueue("shop.example");

        verify(queueService, never()).createQueue(anyString(), any());
    }

    @Test
    void missingQueueShouldBeCreatedWithFixedRetryPolicy() {
        when(queueService.getQueue(QUEUE)).thenThrow(new QueueNotFoundException(QUEUE));

        provisioner().ensureQueue("shop.example");

        verify(queueService).createQueue(QUEUE, new RetryPolicy(
                7, Duration.ofSeconds(1), Duration.ofMinutes(10), Duration.ofHours(1)));
    }

    @Test
    void alreadyExistsOnCreateShouldCountAsSuccess() {
        when(queueService.getQueue(QUEUE)).thenThrow(new QueueNotFoundException(QUEUE));
        doThrow(new QueueAlreadyExistsException(QUEUE)).when(queueService).createQueue(QUEUE, RetryPolicy.DEFAULT);

        assertDoesNotThrow(() -> provisioner().ensureQueue("shop.example"));
    }

    @Test
    void lookupFailureOtherThanNotFoundShouldNotCreate() {
        SecurityException denied = new SecurityException("permission denied");
        when(queueService.getQueue(QUEUE)).thenThrow(denied);

        JobDispatchException ex = assertThrows(JobDispatchException.class, () -> provisioner().ensureQueue("shop.example"));

        assertSame(denied, ex.getCause());
        verify(queueService, never()).createQueue(anyString(), any());
    }

    @Test
    void createFailureShouldSurfaceAsDispatchError() {
        when(queueService.getQueue(QUEUE)).thenThrow(new QueueNotFoundException(QUEUE));
        doThrow(new IllegalStateException("quota exceeded")).when(queueService).createQueue(QUEUE, RetryPolicy.DEFAULT);

        assertThrows(JobDispatchException.class, () -> provisioner().ensureQueue("shop.example"));
    }
}
