package com.ai.onboarding.repository;

import com.ai.onboarding.entity.OnboardingSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Optional;

@Repository
public interface OnboardingSessionRepository extends JpaRepository<OnboardingSession, Long> {

    Optional<OnboardingSession> findByUserId(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM OnboardingSession s WHERE s.userId = :userId")
    Optional<OnboardingSession> findByUserIdForUpdate(@Param("userId") Long userId);
}
