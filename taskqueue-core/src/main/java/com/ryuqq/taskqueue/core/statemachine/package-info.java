/**
 * Limiter lifecycle state.
 *
 * @since 1.0.0
 * @author TaskQueue Team
 */
package com.ryuqq.taskqueue.core.statemachine;
