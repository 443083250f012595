package com.cratedownloads.shared.repository;

import com.cratedownloads.shared.model.Crate;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Crate entities.
 */
@Repository
public interface CrateRepository extends JpaRepository<Crate, Long> {

    Optional<Crate> findByName(String name);
}
