package com.divelog.proximity.service.location;

import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;

/**
 * Subscriber to position updates from {@link PositionProvider}.
 */
public interface PositionListener {

    void onPosition(Position position);

    default void onPositionFailure(PositionFailure failure) {
    }
}
