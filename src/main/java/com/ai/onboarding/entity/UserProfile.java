package com.ai.onboarding.entity;

import com.ai.onboarding.conversation.LicenseStatus;
import com.ai.onboarding.conversation.LicenseType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_session_key", columnList = "session_key", unique = true)
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Opaque client session identifier (query param / header / remote host). */
    @Column(name = "session_key", nullable = false, unique = true, length = 200)
    private String sessionKey;

    @Column(name = "zip_code", length = 5)
    private String zipCode;

    @Column(name = "full_name", columnDefinition = "TEXT")
    private String fullName;

    @Column(columnDefinition = "TEXT")
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "license_type", length = 20)
    private LicenseType licenseType;

    @Enumerated(EnumType.STRING)
    @Column(name = "license_status", length = 20)
    private LicenseStatus licenseStatus;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
