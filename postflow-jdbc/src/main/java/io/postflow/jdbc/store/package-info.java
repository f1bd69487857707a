/**
 * JDBC implementations of the schedule, publication and connection stores.
 *
 * <p>Publication stores differ per database only in their idempotent insert and are
 * selected by JDBC URL through {@link io.postflow.jdbc.store.JdbcPublicationStores}.
 * DDL for each database ships under {@code /schema/}.
 */
package io.postflow.jdbc.store;
