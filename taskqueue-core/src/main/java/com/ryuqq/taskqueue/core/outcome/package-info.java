/**
 * Task outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskqueue.core.outcome.Outcome} - Sealed interface (permits Success, Failure)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskqueue.core.outcome.Success} - Successful completion (default for unit-returning operations)</li>
 *   <li>{@link com.ryuqq.taskqueue.core.outcome.Failure} - Declared, non-exceptional failure</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.taskqueue.core.outcome.Settlement} carries either an Outcome or the
 * error thrown by the operation, never both.</p>
 *
 * @since 1.0.0
 * @author TaskQueue Team
 */
package com.ryuqq.taskqueue.core.outcome;
