package com.cratedownloads.shared.repository;

import com.cratedownloads.shared.model.Version;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Version entities.
 */
@Repository
public interface VersionRepository extends JpaRepository<Version, Long> {

    /**
     * Find a version by the canonical name of its crate and its version number.
     * The canonical name is lower case with '-' replaced by '_'.
     * @param canonicalCrateName canonical crate name
     * @param num version number as published
     * @return Optional containing the Version with its crate fetched
     */
    @Query("""
        SELECT v FROM Version v JOIN FETCH v.crate c
        WHERE lower(replace(c.name, '-', '_')) = :canonicalCrateName
        AND v.num = :num
        """)
    Optional<Version> findByCanonicalCrateNameAndNum(
            @Param("canonicalCrateName") String canonicalCrateName,
            @Param("num") String num
    );
}
