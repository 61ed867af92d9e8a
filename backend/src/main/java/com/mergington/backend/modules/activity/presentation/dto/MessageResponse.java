package com.mergington.backend.modules.activity.presentation.dto;

public record MessageResponse(String message) {
}
