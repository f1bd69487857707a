/**
 * Micrometer bridge for exporting dispatcher metrics to Prometheus, Grafana, and other backends.
 *
 * @see io.postflow.micrometer.MicrometerMetricsExporter
 */
package io.postflow.micrometer;
