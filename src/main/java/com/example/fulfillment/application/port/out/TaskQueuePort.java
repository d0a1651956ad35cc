package com.example.fulfillment.application.port.out;

/**
 * Outbound port for enqueueing asynchronous loyalty tasks.
 * Enqueueing joins the caller's transaction: a task is visible to workers only
 * if the state change that produced it commits.
 */
public interface TaskQueuePort {

    /**
     * Task kinds understood by the loyalty task worker.
     */
    enum TaskType {
        PROCESS_ORDER_POINTS,
        REVERSE_ORDER_POINTS,
        RECALCULATE_USER_TIER,
        PROCESS_POINTS_EXPIRATION
    }

    /**
     * @param type        the task kind
     * @param aggregateId order id, user id or a fixed key for periodic tasks
     * @return the queued task id
     */
    String enqueue(TaskType type, String aggregateId);
}
