package com.github.dimitryivaniuta.gateway.smartpay.service;

import com.github.dimitryivaniuta.gateway.smartpay.domain.OrderStatus;
import com.github.dimitryivaniuta.gateway.smartpay.domain.StatusSource;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class PaymentStatusLoggerTest {

    private final StatusLogWriter writer = Mockito.mock(StatusLogWriter.class);

    @Test
    void delegatesToWriter() {
        PaymentStatusLogger logger = new PaymentStatusLogger(writer, Runnable::run);

        logger.log("Smart Pay", "INV-1", OrderStatus.COMPLETED, StatusSource.STATUS_UPDATE);

        Mockito.verify(writer).write("Smart Pay", "INV-1", OrderStatus.COMPLETED, StatusSource.STATUS_UPDATE);
    }

    @Test
    void writeFailureDoesNotReachCaller() {
        PaymentStatusLogger logger = new PaymentStatusLogger(writer, Runnable::run);
        Mockito.when(writer.write(Mockito.any(), Mockito.any(), Mockito.any(), Mockito.any()))
                .thenThrow(new IllegalStateException("db down"));

        Assertions.assertDoesNotThrow(
                () -> logger.log("Smart Pay", "INV-1", OrderStatus.EXPIRED, StatusSource.NOTIFICATION));
    }

    @Test
    void rejectedWriteDoesNotReachCaller() {
        Executor full = task -> {
            throw new TaskRejectedException("queue full");
        };
        PaymentStatusLogger logger = new PaymentStatusLogger(writer, full);

        Assertions.assertDoesNotThrow(
                () -> logger.log("Smart Pay", "INV-1", OrderStatus.CANCELLED, StatusSource.RETURN));
        Mockito.verifyNoInteractions(writer);
    }

    @Test
    void saturatedPoolRejectsInsteadOfSilentlyDropping() throws Exception {
        ThreadPoolTaskExecutor pool = new ThreadPoolTaskExecutor();
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(1);
        pool.setQueueCapacity(0);
        pool.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        pool.initialize();
        CountDownLatch release = new CountDownLatch(1);
        try {
            pool.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });

            Assertions.assertThrows(RejectedExecutionException.class, () -> pool.execute(() -> { }));
            PaymentStatusLogger logger = new PaymentStatusLogger(writer, pool);
            Assertions.assertDoesNotThrow(
                    () -> logger.log("Smart Pay", "INV-2", OrderStatus.COMPLETED, StatusSource.NOTIFICATION));
        } finally {
            release.countDown();
            pool.shutdown();
        }
        Mockito.verifyNoInteractions(writer);
    }
}
