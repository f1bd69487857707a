/**
 * Domain records: schedules, publications, platform connections and post content.
 */
package io.postflow.model;
