package com.ayende.backend.repository;

import com.ayende.backend.domain.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TenantRepository extends JpaRepository<Tenant, UUID> {

    // Used by the resolver on every request
    Optional<Tenant> findBySlugAndActiveTrue(String slug);

    Optional<Tenant> findBySlug(String slug);

    boolean existsBySlug(String slug);

    long countByActiveTrue();

    List<Tenant> findByActiveTrueOrderByNameAsc();
}
