/**
 * Spring Boot auto-configuration for the postflow dispatcher, bound to {@code postflow.*}
 * properties.
 *
 * @see io.postflow.spring.boot.PostflowAutoConfiguration
 */
package io.postflow.spring.boot;
