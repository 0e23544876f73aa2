/**
 * Runtime orchestration package.
 *
 * <p>{@link io.taskrelay.runtime.TaskRelayRuntime} wires the store, dispatcher,
 * health monitor and oversight channel together and exposes the operations used
 * by the CLI: submission, scheduling and monitoring cycles, operator queries and
 * worker management.
 */
package io.taskrelay.runtime;
