/**
 * Backend health tracking.
 *
 * <p>Session clients publish {@link com.phillippitts.streambridge.service.recognition.watchdog.BackendFailureEvent}
 * and {@link com.phillippitts.streambridge.service.recognition.watchdog.BackendRecoveredEvent} through Spring's
 * application event bus; {@link com.phillippitts.streambridge.service.recognition.watchdog.BackendHealthTracker}
 * folds them into a sliding-window state that the actuator health endpoint reports.
 */
package com.phillippitts.streambridge.service.recognition.watchdog;
