/**
 * JDBC plumbing shared by the Postflow stores: connection provider, statement helper and
 * the unchecked store exception.
 *
 * @see io.postflow.jdbc.store.JdbcPublicationStores
 */
package io.postflow.jdbc;
