package com.example.fulfillment.infrastructure.task;

import com.example.fulfillment.application.port.out.TaskQueuePort;
import com.example.fulfillment.application.port.out.TaskQueuePort.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Queues the periodic points expiration run.
 */
@Component
public class PointsExpirationScheduler {

    private static final Logger log = LoggerFactory.getLogger(PointsExpirationScheduler.class);

    private final TaskQueuePort taskQueue;

    public PointsExpirationScheduler(TaskQueuePort taskQueue) {
        this.taskQueue = taskQueue;
    }

    @Scheduled(cron = "${loyalty.expiration.cron:0 0 3 * * *}")
    public void scheduleExpiration() {
        String runKey = "expiration-" + LocalDate.now(ZoneOffset.UTC);
        String taskId = taskQueue.enqueue(TaskType.PROCESS_POINTS_EXPIRATION, runKey);
        log.info("Queued points expiration task {} ({})", taskId, runKey);
    }
}
