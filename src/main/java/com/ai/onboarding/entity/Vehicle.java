package com.ai.onboarding.entity;

import com.ai.onboarding.conversation.VehicleUse;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "vehicles", indexes = {
    @Index(name = "idx_vehicles_user_id", columnList = "user_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "user")
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private UserProfile user;

    @Column(length = 17)
    private String vin;

    @Column(name = "model_year")
    private Integer year;

    @Column(columnDefinition = "TEXT")
    private String make;

    @Column(name = "body_type", columnDefinition = "TEXT")
    private String bodyType;

    @Enumerated(EnumType.STRING)
    @Column(name = "vehicle_use", length = 20)
    private VehicleUse vehicleUse;

    @Column(name = "blind_spot_warning")
    private Boolean blindSpotWarning;

    @Column(name = "days_per_week")
    private Integer daysPerWeek;

    @Column(name = "one_way_miles")
    private Integer oneWayMiles;

    @Column(name = "annual_mileage")
    private Integer annualMileage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
