/**
 * Per-connection transcription sessions.
 *
 * <p>A {@link com.phillippitts.streambridge.service.session.TranscriptionSession} owns one frame
 * buffer and one recognition client and runs all of its work on a
 * {@link com.phillippitts.streambridge.service.session.SerialExecutor}, the logical task of its
 * connection. Results leave through the {@link com.phillippitts.streambridge.service.session.ClientChannel}
 * the gateway supplies.
 */
package com.phillippitts.streambridge.service.session;
