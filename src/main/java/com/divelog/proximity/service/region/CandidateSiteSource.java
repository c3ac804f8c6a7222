package com.divelog.proximity.service.region;

import com.divelog.proximity.model.CandidateSite;
import com.divelog.proximity.model.Position;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Supplies dive sites near a position.
 *
 * Queries may hit the database, so results arrive asynchronously; the
 * scheduler never blocks its mailbox waiting for them.
 */
public interface CandidateSiteSource {

    /**
     * @param position  query center
     * @param radiusKm  search radius
     * @param limit     maximum number of sites returned
     * @return sites within the radius, ascending by distance from {@code position},
     *         ties broken deterministically
     */
    CompletableFuture<List<CandidateSite>> nearby(Position position, double radiusKm, int limit);
}
