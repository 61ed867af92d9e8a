package com.mergington.backend.modules.activity.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mergington.backend.modules.activity.domain.ActivitySnapshot;

public record ActivityResponse(
        String description,
        String schedule,
        @JsonProperty("max_participants") int maxParticipants,
        List<String> participants
) {

    public static ActivityResponse from(ActivitySnapshot snapshot) {
        return new ActivityResponse(
                snapshot.description(),
                snapshot.schedule(),
                snapshot.maxParticipants(),
                snapshot.participants()
        );
    }
}
