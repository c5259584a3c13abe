package com.ai.onboarding.repository;

import com.ai.onboarding.entity.Vehicle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    List<Vehicle> findByUser_IdOrderByIdAsc(Long userId);
}
