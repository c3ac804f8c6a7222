package com.divelog.proximity.service.region;

import com.divelog.proximity.entity.DiveSite;
import com.divelog.proximity.model.CandidateSite;
import com.divelog.proximity.model.Coordinate;
import com.divelog.proximity.model.Position;
import com.divelog.proximity.repository.DiveSiteRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link CandidateSiteSource} backed by the PostGIS dive site table.
 *
 * Queries run on the candidate query pool; a hung query is bounded by the
 * datasource's own statement timeout, not here.
 */
@Slf4j
@Component
public class DiveSiteCandidateSource implements CandidateSiteSource {

    private final DiveSiteRepository siteRepository;
    private final Executor queryExecutor;

    public DiveSiteCandidateSource(
        DiveSiteRepository siteRepository,
        @Qualifier("candidateQueryExecutor") Executor queryExecutor
    ) {
        this.siteRepository = siteRepository;
        this.queryExecutor = queryExecutor;
    }

    @Override
    public CompletableFuture<List<CandidateSite>> nearby(Position position, double radiusKm, int limit) {
        return CompletableFuture.supplyAsync(() -> query(position, radiusKm, limit), queryExecutor);
    }

    private List<CandidateSite> query(Position position, double radiusKm, int limit) {
        long startTime = System.currentTimeMillis();

        List<CandidateSite> sites = siteRepository.findNearby(
                position.longitude(),
                position.latitude(),
                radiusKm * 1000.0,
                limit
            ).stream()
            .map(DiveSiteCandidateSource::toCandidate)
            .toList();

        log.debug("Found {} candidate sites within {}km of {} in {}ms",
            sites.size(), radiusKm, position.toLogString(), System.currentTimeMillis() - startTime);
        return sites;
    }

    static CandidateSite toCandidate(DiveSite site) {
        return new CandidateSite(site.getId(), new Coordinate(site.getLatitude(), site.getLongitude()));
    }
}
