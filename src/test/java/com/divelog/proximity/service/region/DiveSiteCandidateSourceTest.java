package com.divelog.proximity.service.region;

import com.divelog.proximity.entity.DiveSite;
import com.divelog.proximity.model.CandidateSite;
import com.divelog.proximity.repository.DiveSiteRepository;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;

import java.util.List;

import static com.divelog.proximity.support.TestSites.positionAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiveSiteCandidateSourceTest {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), 4326);

    private final DiveSiteRepository repository = mock(DiveSiteRepository.class);
    private final DiveSiteCandidateSource source = new DiveSiteCandidateSource(repository, Runnable::run);

    private static DiveSite site(String id, double latitude, double longitude) {
        return DiveSite.builder()
            .id(id)
            .name("Site " + id)
            .location(GEOMETRY_FACTORY.createPoint(new Coordinate(longitude, latitude)))
            .build();
    }

    @Test
    void shouldQueryInMetersAndMapToCandidates() {
        when(repository.findNearby(0.0, 0.0, 50_000.0, 20))
            .thenReturn(List.of(site("a", 0.01, 0.0), site("b", 0.02, 0.0)));

        List<CandidateSite> candidates = source.nearby(positionAt(0), 50, 20).join();

        assertThat(candidates).extracting(CandidateSite::siteId).containsExactly("a", "b");
        assertThat(candidates.get(0).location().latitude()).isEqualTo(0.01);
        verify(repository).findNearby(0.0, 0.0, 50_000.0, 20);
    }

    @Test
    void shouldCompleteExceptionallyWhenQueryFails() {
        when(repository.findNearby(0.0, 0.0, 50_000.0, 20)).thenThrow(new IllegalStateException("timeout"));

        assertThatThrownBy(() -> source.nearby(positionAt(0), 50, 20).join())
            .hasCauseInstanceOf(IllegalStateException.class);
    }
}
