package com.divelog.proximity.service.location;

import com.divelog.proximity.model.AuthorizationStatus;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.model.PositionFailure;
import com.divelog.proximity.model.SamplingProfile;

/**
 * Port to the platform location service.
 *
 * Callbacks may arrive on any thread; the engine funnels them into the
 * proximity mailbox before any state is touched.
 */
public interface LocationPlatform {

    /**
     * Last authorization status known to the platform. Side-effect free: it must
     * never cause a consent prompt to appear.
     */
    AuthorizationStatus authorizationStatus();

    /**
     * Shows the platform consent prompt. The answer arrives later through
     * {@link Listener#onAuthorizationChanged(AuthorizationStatus)}.
     */
    void requestAuthorization();

    /**
     * Starts (or reconfigures) continuous sampling with the given profile,
     * replacing significant-change sampling if it was active.
     */
    void startStandardUpdates(SamplingProfile profile);

    /**
     * Switches to coarse significant-change sampling, replacing continuous sampling.
     */
    void startSignificantChangeUpdates();

    void stopUpdates();

    void setListener(Listener listener);

    interface Listener {

        void onPosition(Position position);

        void onPositionFailure(PositionFailure failure);

        void onAuthorizationChanged(AuthorizationStatus status);
    }
}
