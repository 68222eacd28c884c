/**
 * Bounded ordered containers.
 *
 * <p>This package provides the capacity-checked storage primitive and the two
 * thin views over it.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskqueue.core.collection.BoundedSequence} - Array-backed ordered sequence with a fixed capacity</li>
 *   <li>{@link com.ryuqq.taskqueue.core.collection.BoundedQueue} - FIFO view (enqueue at tail, dequeue from head)</li>
 *   <li>{@link com.ryuqq.taskqueue.core.collection.BoundedStack} - LIFO view (push/pop/peek at tail)</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskqueue.core.collection.CapacityExceededException} - Mutation beyond capacity, state unchanged</li>
 *   <li>{@link com.ryuqq.taskqueue.core.collection.QueueFullException} / {@link com.ryuqq.taskqueue.core.collection.StackFullException} - Full enqueue/push</li>
 *   <li>{@link com.ryuqq.taskqueue.core.collection.IndexOutOfRangeException} - Invalid index for update/insert</li>
 * </ul>
 *
 * <p>None of these types are thread-safe.</p>
 *
 * @since 1.0.0
 * @author TaskQueue Team
 */
package com.ryuqq.taskqueue.core.collection;
