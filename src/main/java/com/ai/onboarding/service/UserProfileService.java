package com.ai.onboarding.service;

import com.ai.onboarding.conversation.ConversationState;
import com.ai.onboarding.conversation.CurrentVehicle;
import com.ai.onboarding.conversation.LicenseStatus;
import com.ai.onboarding.conversation.LicenseType;
import com.ai.onboarding.conversation.VehicleUse;
import com.ai.onboarding.entity.OnboardingSession;
import com.ai.onboarding.entity.UserProfile;
import com.ai.onboarding.entity.Vehicle;
import com.ai.onboarding.repository.OnboardingSessionRepository;
import com.ai.onboarding.repository.UserProfileRepository;
import com.ai.onboarding.repository.VehicleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
public class UserProfileService {

    private static final Logger log = LoggerFactory.getLogger(UserProfileService.class);

    private final UserProfileRepository userRepository;
    private final VehicleRepository vehicleRepository;
    private final OnboardingSessionRepository sessionRepository;

    public UserProfileService(UserProfileRepository userRepository,
                              VehicleRepository vehicleRepository,
                              OnboardingSessionRepository sessionRepository) {
        this.userRepository = userRepository;
        this.vehicleRepository = vehicleRepository;
        this.sessionRepository = sessionRepository;
    }

    /**
     * Finds the profile for a client session key, creating it together with its
     * onboarding session (at {@code start}) on first contact.
     */
    @Transactional
    public UserProfile getOrCreate(String sessionKey) {
        return userRepository.findBySessionKey(sessionKey)
                .orElseGet(() -> createNew(sessionKey));
    }

    private UserProfile createNew(String sessionKey) {
        UserProfile user = userRepository.save(UserProfile.builder().sessionKey(sessionKey).build());
        sessionRepository.save(OnboardingSession.builder()
                .userId(user.getId())
                .currentState(ConversationState.START.getValue())
                .stateData("{}")
                .build());
        log.info("New onboarding user | id={} sessionKey={}", user.getId(), sessionKey);
        return user;
    }

    @Transactional(readOnly = true)
    public Optional<UserProfile> findById(Long userId) {
        return userRepository.findById(userId);
    }

    @Transactional
    public UserProfile updateZipCode(Long userId, String zipCode) {
        UserProfile user = require(userId);
        user.setZipCode(zipCode);
        return userRepository.save(user);
    }

    @Transactional
    public UserProfile updateFullName(Long userId, String fullName) {
        UserProfile user = require(userId);
        user.setFullName(fullName);
        return userRepository.save(user);
    }

    @Transactional
    public UserProfile updateEmail(Long userId, String email) {
        UserProfile user = require(userId);
        user.setEmail(email);
        return userRepository.save(user);
    }

    @Transactional
    public UserProfile updateLicenseType(Long userId, LicenseType licenseType) {
        UserProfile user = require(userId);
        user.setLicenseType(licenseType);
        return userRepository.save(user);
    }

    @Transactional
    public UserProfile updateLicenseStatus(Long userId, LicenseStatus licenseStatus) {
        UserProfile user = require(userId);
        user.setLicenseStatus(licenseStatus);
        return userRepository.save(user);
    }

    @Transactional
    public Vehicle saveVehicle(Long userId, CurrentVehicle data) {
        Vehicle vehicle = Vehicle.builder()
                .user(require(userId))
                .vin(data.getVin())
                .year(data.getYear())
                .make(data.getMake())
                .bodyType(data.getBodyType())
                .vehicleUse(VehicleUse.fromCode(data.getVehicleUse()))
                .blindSpotWarning(data.getBlindSpotWarning())
                .daysPerWeek(data.getDaysPerWeek())
                .oneWayMiles(data.getOneWayMiles())
                .annualMileage(data.getAnnualMileage())
                .build();
        Vehicle saved = vehicleRepository.save(vehicle);
        log.info("Vehicle saved | userId={} vehicleId={}", userId, saved.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Vehicle> getVehicles(Long userId) {
        return vehicleRepository.findByUser_IdOrderByIdAsc(userId);
    }

    private UserProfile require(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new IllegalStateException("No user with id " + userId));
    }
}
