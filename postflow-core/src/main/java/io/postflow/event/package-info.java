/**
 * Terminal publication events and their asynchronous delivery.
 */
package io.postflow.event;
