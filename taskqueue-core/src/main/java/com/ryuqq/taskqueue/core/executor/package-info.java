/**
 * Concurrency-bounded execution.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskqueue.core.executor.ConcurrencyLimiter} - In-flight tracking, admission, drain, idle signal</li>
 *   <li>{@link com.ryuqq.taskqueue.core.executor.TaskOperation} - Per-item asynchronous operation</li>
 *   <li>{@link com.ryuqq.taskqueue.core.executor.ItemSource} - Pull-based item supplier for drains</li>
 *   <li>{@link com.ryuqq.taskqueue.core.executor.DrainMode} - DEFAULT (self-feeding) or RACE waiting</li>
 * </ul>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>activeCount never exceeds concurrency</li>
 *   <li>Items are admitted in source order, each exactly once</li>
 *   <li>Operation errors are captured per item and never abort sibling operations</li>
 *   <li>Completion is signalled by futures, not polling</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskQueue Team
 */
package com.ryuqq.taskqueue.core.executor;
