package com.ayende.backend.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Platform-wide identity. The same customer may belong to several businesses through
 * {@link Membership}; removing a membership never removes the customer.
 */
@Getter
@Setter
@Entity
@Table(name = "customers")
public class Customer extends BaseEntity {

    @Column(nullable = false, unique = true)
    private String email;

    @Column(nullable = false)
    private String password;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(length = 20)
    private String phone;

    @Column(name = "date_of_birth")
    private LocalDate dateOfBirth;

    @Column(columnDefinition = "TEXT")
    private String address;

    private String city;

    @Column(name = "postal_code", length = 20)
    private String postalCode;

    private String country = "Canada";

    @Column(name = "preferred_language", length = 10)
    private String preferredLanguage = "en";

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    // Platform operator; the only identity allowed in without a tenant
    @Column(name = "is_superuser", nullable = false)
    private boolean superuser = false;

    @Column(name = "email_verified", nullable = false)
    private boolean emailVerified = false;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;

    public String getFullName() {
        return (firstName + " " + lastName).trim();
    }
}
