package com.ayende.backend.repository;

import com.ayende.backend.domain.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, UUID> {

    Optional<Customer> findByEmail(String email);

    boolean existsByEmail(String email);

    @Modifying
    @Query("UPDATE Customer c SET c.lastLogin = :now WHERE c.id = :id")
    void updateLastLogin(@Param("id") UUID id, @Param("now") LocalDateTime now);
}
