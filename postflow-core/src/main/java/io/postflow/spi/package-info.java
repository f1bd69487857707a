/**
 * Service Provider Interfaces for plugging stores, collaborators and metrics into the dispatcher.
 *
 * <p>Store interfaces take an explicit {@link java.sql.Connection}; JDBC implementations live
 * in {@code postflow-jdbc}. {@link io.postflow.spi.PostStore}, {@link io.postflow.spi.MediaStore}
 * and {@link io.postflow.spi.NotificationSink} are owned by the surrounding application.
 *
 * @see io.postflow.spi.ConnectionProvider
 * @see io.postflow.spi.PublicationStore
 * @see io.postflow.spi.MetricsExporter
 */
package io.postflow.spi;
