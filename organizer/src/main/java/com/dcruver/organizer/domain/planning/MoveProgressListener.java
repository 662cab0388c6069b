package com.dcruver.organizer.domain.planning;

/**
 * Notified after each move is attempted.
 */
@FunctionalInterface
public interface MoveProgressListener {

    MoveProgressListener NONE = (index, total, fileName) -> { };

    void onMove(int index, int total, String fileName);
}
