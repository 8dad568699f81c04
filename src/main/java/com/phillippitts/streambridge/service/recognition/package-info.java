/**
 * Client side of the remote speech-recognition stream.
 *
 * <p>{@link com.phillippitts.streambridge.service.recognition.RecognitionSessionClient} owns one
 * backend stream per session and serialises segments over it, with connect retries, exponential
 * backoff, per-segment timeouts and a degraded mode. Backends plug in through
 * {@link com.phillippitts.streambridge.service.recognition.RecognitionBackend}:
 * <ul>
 *   <li>{@code websocket} - the remote ASR service</li>
 *   <li>{@code synthetic} - local placeholder results, used for testing and as the fallback</li>
 * </ul>
 */
package com.phillippitts.streambridge.service.recognition;
