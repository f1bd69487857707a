/**
 * Attempt execution: the bounded worker pool, the per-attempt state machine, and the
 * bridge from the poller.
 *
 * @see io.postflow.dispatch.PublicationDispatcher
 */
package io.postflow.dispatch;
