package com.gembridge.exception;

/**
 * The onboard operation did not report completion within the configured number of polls.
 */
public class OnboardingTimeoutException extends OnboardingException {

    public OnboardingTimeoutException(String projectId, int attempts) {
        super("Onboarding for project " + projectId + " did not complete after " + attempts + " polls", null);
    }
}
