/**
 * Credential vault: decrypts stored tokens, refreshes them single-flight, and persists the
 * rotated values.
 */
package io.postflow.vault;
