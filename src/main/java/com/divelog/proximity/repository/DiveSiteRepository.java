package com.divelog.proximity.repository;

import com.divelog.proximity.entity.DiveSite;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spatial queries over dive sites.
 *
 * PostGIS Functions Used:
 * - ST_DWithin on geography: meter-based radius filter, uses the GiST index
 * - ST_Distance on geography: ordering by true distance
 * - ST_MakePoint takes (longitude, latitude), in that order
 */
@Repository
public interface DiveSiteRepository extends JpaRepository<DiveSite, String> {

    /**
     * Active sites within {@code meters} of a point, nearest first.
     *
     * Equal distances are ordered by id so repeated queries return the same list.
     */
    @Query(value = """
        SELECT * FROM dive_sites
        WHERE active = true
        AND ST_DWithin(
            location::geography,
            ST_SetSRID(ST_MakePoint(:longitude, :latitude), 4326)::geography,
            :meters
        )
        ORDER BY ST_Distance(
            location::geography,
            ST_SetSRID(ST_MakePoint(:longitude, :latitude), 4326)::geography
        ), id
        LIMIT :limit
        """, nativeQuery = true)
    List<DiveSite> findNearby(
        @Param("longitude") double longitude,
        @Param("latitude") double latitude,
        @Param("meters") double meters,
        @Param("limit") int limit
    );

    long countByActiveTrue();
}
