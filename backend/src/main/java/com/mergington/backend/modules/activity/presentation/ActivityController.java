package com.mergington.backend.modules.activity.presentation;

import java.util.LinkedHashMap;
import java.util.Map;

import com.mergington.backend.modules.activity.application.ActivityRegistry;
import com.mergington.backend.modules.activity.domain.RegistrationResult;
import com.mergington.backend.modules.activity.presentation.dto.ActivityResponse;
import com.mergington.backend.modules.activity.presentation.dto.MessageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/activities")
public class ActivityController {

    private final ActivityRegistry activityRegistry;

    public ActivityController(ActivityRegistry activityRegistry) {
        this.activityRegistry = activityRegistry;
    }

    @Operation(summary = "List activities", description = "Returns every activity keyed by name with its current roster.")
    @GetMapping
    public ResponseEntity<Map<String, ActivityResponse>> getActivities() {
        Map<String, ActivityResponse> response = new LinkedHashMap<>();
        activityRegistry.listActivities()
                .forEach((name, snapshot) -> response.put(name, ActivityResponse.from(snapshot)));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Sign up for an activity")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Student added to the roster"),
            @ApiResponse(responseCode = "400", description = "Already signed up or activity full"),
            @ApiResponse(responseCode = "404", description = "Activity not found")
    })
    @PostMapping("/{activityName}/signup")
    public ResponseEntity<MessageResponse> signUp(
            @PathVariable("activityName") String activityName,
            @RequestParam("email") String email
    ) {
        RegistrationResult result = activityRegistry.signUp(activityName, email);
        return ResponseEntity.ok(new MessageResponse(
                "Signed up " + result.participant() + " for " + result.activityName()));
    }

    @Operation(summary = "Unregister from an activity")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Student removed from the roster"),
            @ApiResponse(responseCode = "400", description = "Student not registered"),
            @ApiResponse(responseCode = "404", description = "Activity not found")
    })
    @DeleteMapping("/{activityName}/unregister")
    public ResponseEntity<MessageResponse> unregister(
            @PathVariable("activityName") String activityName,
            @RequestParam("email") String email
    ) {
        RegistrationResult result = activityRegistry.unregister(activityName, email);
        return ResponseEntity.ok(new MessageResponse(
                "Unregistered " + result.participant() + " from " + result.activityName()));
    }
}
