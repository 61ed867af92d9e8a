package com.mergington.backend.modules.activity.application;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergington.backend.modules.activity.domain.Activity;

/**
 * Reads the startup catalog from a JSON object keyed by activity name.
 */
@Component
public class ActivityCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(ActivityCatalogLoader.class);

    private static final TypeReference<LinkedHashMap<String, SeedActivity>> SEED_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final String seedLocation;

    public ActivityCatalogLoader(
            ObjectMapper objectMapper,
            @Value("${app.activities.seed-location:seed/activities.json}") String seedLocation
    ) {
        this.objectMapper = objectMapper;
        this.seedLocation = seedLocation;
    }

    public List<Activity> load() {
        Resource resource = new ClassPathResource(seedLocation);
        Map<String, SeedActivity> seed;
        try (InputStream in = resource.getInputStream()) {
            seed = objectMapper.readValue(in, SEED_TYPE);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read activity seed from classpath:" + seedLocation, ex);
        }
        if (seed == null || seed.isEmpty()) {
            throw new IllegalStateException("Activity seed at classpath:" + seedLocation + " is empty");
        }

        List<Activity> activities = new ArrayList<>(seed.size());
        seed.forEach((name, entry) -> activities.add(toActivity(name, entry)));
        log.info("Loaded {} activities from classpath:{}", activities.size(), seedLocation);
        return activities;
    }

    private Activity toActivity(String name, SeedActivity entry) {
        if (entry == null) {
            throw new IllegalStateException("Activity seed entry for '" + name + "' is empty");
        }
        try {
            return new Activity(name, entry.description(), entry.schedule(),
                    entry.maxParticipants(), entry.participants());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid activity seed entry '" + name + "': " + ex.getMessage(), ex);
        }
    }

    record SeedActivity(
            String description,
            String schedule,
            @JsonProperty("max_participants") int maxParticipants,
            List<String> participants
    ) {
    }
}
