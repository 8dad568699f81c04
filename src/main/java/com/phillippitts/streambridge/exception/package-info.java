/**
 * Application-specific exception hierarchy.
 *
 * <p>Every error kind the bridge surfaces maps to one exception type:
 * <ul>
 *   <li>{@link com.phillippitts.streambridge.exception.StreamBridgeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.streambridge.exception.InvalidAudioException} - format error,
 *       fatal to the connection</li>
 *   <li>{@link com.phillippitts.streambridge.exception.BackendUnavailableException} - backend
 *       unreachable after retries; the session degrades or rejects segments</li>
 *   <li>{@link com.phillippitts.streambridge.exception.SegmentTimeoutException} - a single
 *       segment failed to produce a result in time; the session continues</li>
 *   <li>{@link com.phillippitts.streambridge.exception.BackendBusyException} - per-session
 *       backlog full; transient</li>
 *   <li>{@link com.phillippitts.streambridge.exception.ControlMessageException} - malformed or
 *       unknown control message; logged and ignored</li>
 *   <li>{@link com.phillippitts.streambridge.exception.RecognitionException} - mid-stream
 *       transport failure or backend-reported error for a segment</li>
 *   <li>{@link com.phillippitts.streambridge.exception.ConnectionNotFoundException} - status
 *       lookup for an unknown connection</li>
 * </ul>
 *
 * <p>On the WebSocket surface all of them become a {@code {"type":"error","error":...}} envelope.
 * On the REST status surface they are mapped by {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.streambridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.streambridge.exception;
