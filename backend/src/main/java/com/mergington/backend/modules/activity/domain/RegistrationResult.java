package com.mergington.backend.modules.activity.domain;

public record RegistrationResult(String activityName, String participant, int participantCount) {
}
