/**
 * Pure retry decisions and the exponential backoff they use.
 */
package io.postflow.retry;
