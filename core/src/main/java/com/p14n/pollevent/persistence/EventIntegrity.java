package com.p14n.pollevent.persistence;

import com.p14n.pollevent.data.ChangeEvent;
import com.p14n.pollevent.data.ControlValue;

/**
 * Checks an event against the limits of the events table before it is written.
 */
public class EventIntegrity {

    static final int MAX_ID_LENGTH = 255;
    static final int MAX_PATH_LENGTH = 512;
    static final int MAX_TEXT_LENGTH = 4096;

    private EventIntegrity() {
    }

    /**
     * @param event the event to check
     * @return a description of the problem, or {@code null} if the event can be stored
     */
    public static String check(ChangeEvent event) {
        if (event.changeGroupId().length() > MAX_ID_LENGTH) {
            return "change group id longer than " + MAX_ID_LENGTH;
        }
        if (event.control().path().length() > MAX_PATH_LENGTH) {
            return "control path longer than " + MAX_PATH_LENGTH + ": " + event.control().path().substring(0, 32)
                    + "...";
        }
        if (event.component() != null && event.component().length() > MAX_ID_LENGTH) {
            return "component name longer than " + MAX_ID_LENGTH;
        }
        if (event.control().control().length() > MAX_ID_LENGTH) {
            return "control name longer than " + MAX_ID_LENGTH;
        }
        if (event.value().kind() == ControlValue.Kind.STRING && event.value().asString().length() > MAX_TEXT_LENGTH) {
            return "value of " + event.control() + " longer than " + MAX_TEXT_LENGTH;
        }
        if (event.stringValue() != null && event.stringValue().length() > MAX_TEXT_LENGTH) {
            return "string value of " + event.control() + " longer than " + MAX_TEXT_LENGTH;
        }
        if (event.timestamp() <= 0) {
            return "non-positive timestamp " + event.timestamp() + " for " + event.control();
        }
        if (event.sequence() < 0) {
            return "negative sequence " + event.sequence() + " for " + event.control();
        }
        return null;
    }
}
