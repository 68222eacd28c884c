/**
 * Runner Layer - TaskRunner와 TaskQueue.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskqueue.runner.TaskRunner} - 활성화 게이트 + 결과 라우팅</li>
 *   <li>{@link com.ryuqq.taskqueue.runner.TaskQueue} - BoundedQueue + TaskRunner 조합</li>
 *   <li>{@link com.ryuqq.taskqueue.runner.TaskQueues} - 정적 팩토리</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * runner (TaskQueue, TaskRunner, TaskQueueConfig)
 *   ↓ depends on
 * core/executor (ConcurrencyLimiter, TaskOperation, DrainMode)
 *   ↓ depends on
 * core (BoundedSequence, BoundedQueue, Outcome, Settlement)
 * </pre>
 *
 * @author TaskQueue Team
 * @since 1.0.0
 */
package com.ryuqq.taskqueue.runner;
