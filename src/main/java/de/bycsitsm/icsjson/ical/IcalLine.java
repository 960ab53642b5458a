package de.bycsitsm.icsjson.ical;

/**
 * One unfolded {@code KEY:VALUE} line of iCalendar data.
 *
 * @param key   the text before the first colon
 * @param value the text after the first colon, which may itself contain colons
 */
record IcalLine(String key, String value) {

    boolean is(String expectedKey, String expectedValue) {
        return key.equals(expectedKey) && value.equals(expectedValue);
    }
}
