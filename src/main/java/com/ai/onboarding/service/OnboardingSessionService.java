package com.ai.onboarding.service;

import com.ai.onboarding.conversation.ConversationEngine;
import com.ai.onboarding.conversation.ConversationState;
import com.ai.onboarding.conversation.CurrentVehicle;
import com.ai.onboarding.conversation.LicenseStatus;
import com.ai.onboarding.conversation.LicenseType;
import com.ai.onboarding.conversation.SessionData;
import com.ai.onboarding.conversation.ValidatedValue;
import com.ai.onboarding.entity.OnboardingSession;
import com.ai.onboarding.repository.OnboardingSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and advances the persisted onboarding session. A turn (storing the validated answer,
 * choosing the next state, saving state and scratch data) is committed in one transaction.
 */
@Service
public class OnboardingSessionService {

    private static final Logger log = LoggerFactory.getLogger(OnboardingSessionService.class);

    private final OnboardingSessionRepository repository;
    private final UserProfileService userProfileService;
    private final ConversationEngine engine;
    private final SessionDataCodec codec;

    public OnboardingSessionService(OnboardingSessionRepository repository,
                                    UserProfileService userProfileService,
                                    ConversationEngine engine,
                                    SessionDataCodec codec) {
        this.repository = repository;
        this.userProfileService = userProfileService;
        this.engine = engine;
        this.codec = codec;
    }

    @Transactional(readOnly = true)
    public SessionSnapshot load(Long userId) {
        OnboardingSession session = repository.findByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("No onboarding session for user " + userId));
        return toSnapshot(session);
    }

    /**
     * Applies an answer already accepted by {@link ConversationEngine#validate} for {@code current}
     * and moves the session to the next state.
     *
     * @return the new state
     */
    @Transactional
    public ConversationState commitTurn(Long userId, ConversationState current, ValidatedValue value) {
        OnboardingSession session = repository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("No onboarding session for user " + userId));
        SessionSnapshot snapshot = toSnapshot(session);
        if (snapshot.getState() != current) {
            throw new IllegalStateException("Session for user " + userId + " is at " + snapshot.getState()
                    + ", answer was for " + current);
        }

        SessionData data = snapshot.getData();
        applyValidInput(userId, current, value, data);
        ConversationState next = engine.nextState(current, value, data);

        session.setCurrentState(next.getValue());
        session.setStateData(codec.encode(data));
        repository.save(session);
        log.info("Transition | userId={} {} -> {}", userId, current.getValue(), next.getValue());
        return next;
    }

    private void applyValidInput(Long userId, ConversationState state, ValidatedValue value, SessionData data) {
        CurrentVehicle vehicle = data.getCurrentVehicle();
        switch (state) {
            case COLLECTING_ZIP:
                userProfileService.updateZipCode(userId, value.asText());
                break;
            case COLLECTING_NAME:
                userProfileService.updateFullName(userId, value.asText());
                break;
            case COLLECTING_EMAIL:
                userProfileService.updateEmail(userId, value.asText());
                break;
            case COLLECTING_VEHICLE_INFO:
                data.setCurrentVehicle(CurrentVehicle.from(value.asVehicle()));
                break;
            case COLLECTING_VEHICLE_USE:
                vehicle.setVehicleUse(value.asText());
                break;
            case COLLECTING_BLIND_SPOT:
                vehicle.setBlindSpotWarning(value.asFlag());
                break;
            case COLLECTING_COMMUTE_DAYS:
                vehicle.setDaysPerWeek(value.asNumber());
                break;
            case COLLECTING_COMMUTE_MILES:
                vehicle.setOneWayMiles(value.asNumber());
                finishVehicle(userId, data);
                break;
            case COLLECTING_ANNUAL_MILEAGE:
                vehicle.setAnnualMileage(value.asNumber());
                finishVehicle(userId, data);
                break;
            case COLLECTING_LICENSE_TYPE:
                userProfileService.updateLicenseType(userId, LicenseType.fromCode(value.asText()));
                break;
            case COLLECTING_LICENSE_STATUS:
                userProfileService.updateLicenseStatus(userId, LicenseStatus.fromCode(value.asText()));
                break;
            default:
                // start, vehicle_intro, ask_more_vehicles, completed carry nothing to store
                break;
        }
    }

    private void finishVehicle(Long userId, SessionData data) {
        CurrentVehicle vehicle = data.getCurrentVehicle();
        if (vehicle.isEmpty()) {
            log.warn("No vehicle details to save | userId={}", userId);
        } else {
            userProfileService.saveVehicle(userId, vehicle);
        }
        data.resetCurrentVehicle();
    }

    private SessionSnapshot toSnapshot(OnboardingSession session) {
        ConversationState state;
        try {
            state = ConversationState.fromValue(session.getCurrentState());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Corrupt session " + session.getId(), e);
        }
        return new SessionSnapshot(state, codec.decode(session.getStateData()));
    }
}
