/**
 * Spring configuration: executors, WebSocket endpoint, backend selection and startup checks.
 *
 * <p>Typed settings live in {@code config.properties} and are bound from
 * {@code application.properties} under the {@code bridge.*} and {@code threadpool.*} prefixes.
 */
package com.phillippitts.streambridge.config;
