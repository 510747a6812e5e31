package com.osman.badges.core.pipeline;

/**
 * A record that could not be turned into a badge.
 *
 * @param rowIndex     1-based data row
 * @param rawName      name cell as read, for locating the row
 * @param reachedState last state the record completed before failing
 * @param reason       message of the underlying exception
 */
public record RecordFailure(int rowIndex, String rawName, RecordState reachedState, String reason) {
}
