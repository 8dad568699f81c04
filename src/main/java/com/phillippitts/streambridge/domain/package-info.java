/**
 * Domain model of the transcription bridge.
 *
 * <p>Value types ({@link com.phillippitts.streambridge.domain.AudioFrame},
 * {@link com.phillippitts.streambridge.domain.RecognitionResult},
 * {@link com.phillippitts.streambridge.domain.SessionSummary}) are immutable records.
 * {@link com.phillippitts.streambridge.domain.AudioSegment} is the one mutable type: it grows
 * until sealed and never outlives the connection that produced it.
 */
package com.phillippitts.streambridge.domain;
