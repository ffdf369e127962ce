package com.gembridge.model;

/**
 * Progress of the Code Assist onboarding handshake for one project.
 */
public enum OnboardingState {
    NOT_STARTED,
    TIER_RESOLVED,
    ONBOARDING_IN_PROGRESS,
    COMPLETE
}
