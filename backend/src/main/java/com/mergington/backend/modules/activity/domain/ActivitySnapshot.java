package com.mergington.backend.modules.activity.domain;

import java.util.List;

/**
 * Immutable copy of an activity taken under its lock.
 */
public record ActivitySnapshot(
        String name,
        String description,
        String schedule,
        int maxParticipants,
        List<String> participants
) {
}
