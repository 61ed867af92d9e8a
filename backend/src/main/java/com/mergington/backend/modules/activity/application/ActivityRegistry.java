package com.mergington.backend.modules.activity.application;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.mergington.backend.global.error.ProblemException;
import com.mergington.backend.modules.activity.domain.Activity;
import com.mergington.backend.modules.activity.domain.ActivitySnapshot;
import com.mergington.backend.modules.activity.domain.RegistrationResult;

/**
 * In-memory catalog of activities keyed by name.
 *
 * <p>The name to activity map is fixed after construction. Each roster change runs under the
 * lock of the activity it touches, and every check happens before the roster is modified, so a
 * rejected call leaves the roster as it was.
 */
@Service
public class ActivityRegistry {

    static final String ACTIVITY_NOT_FOUND = "Activity not found";
    static final String ALREADY_SIGNED_UP = "Student is already signed up for this activity";
    static final String NOT_REGISTERED = "Student is not registered for this activity";
    static final String ACTIVITY_FULL = "Activity is full";

    private static final Logger log = LoggerFactory.getLogger(ActivityRegistry.class);

    private final Map<String, Activity> activities;
    private final boolean enforceCapacity;

    @Autowired
    public ActivityRegistry(
            ActivityCatalogLoader catalogLoader,
            @Value("${app.activities.enforce-capacity:true}") boolean enforceCapacity
    ) {
        this(catalogLoader.load(), enforceCapacity);
    }

    public ActivityRegistry(List<Activity> seed, boolean enforceCapacity) {
        Map<String, Activity> byName = new LinkedHashMap<>();
        for (Activity activity : seed) {
            if (byName.putIfAbsent(activity.getName(), activity) != null) {
                throw new IllegalArgumentException("duplicate activity name: " + activity.getName());
            }
        }
        this.activities = Collections.unmodifiableMap(byName);
        this.enforceCapacity = enforceCapacity;
        log.info("Activity registry initialised with {} activities (capacity enforced: {})",
                activities.size(), enforceCapacity);
    }

    public Map<String, ActivitySnapshot> listActivities() {
        Map<String, ActivitySnapshot> result = new LinkedHashMap<>();
        for (Activity activity : activities.values()) {
            activity.lock().lock();
            try {
                result.put(activity.getName(), activity.snapshot());
            } finally {
                activity.lock().unlock();
            }
        }
        return result;
    }

    public int size() {
        return activities.size();
    }

    public RegistrationResult signUp(String activityName, String participant) {
        Activity activity = findActivity(activityName);
        activity.lock().lock();
        try {
            if (activity.hasParticipant(participant)) {
                log.debug("Rejected signup of {} for {}: already on roster", participant, activityName);
                throw ProblemException.conflict("activity.already_signed_up", ALREADY_SIGNED_UP);
            }
            if (enforceCapacity && activity.isFull()) {
                log.debug("Rejected signup of {} for {}: capacity {} reached",
                        participant, activityName, activity.getMaxParticipants());
                throw ProblemException.conflict("activity.full", ACTIVITY_FULL);
            }
            activity.addParticipant(participant);
            log.info("Signed up {} for {} ({}/{})", participant, activityName,
                    activity.participantCount(), activity.getMaxParticipants());
            return new RegistrationResult(activityName, participant, activity.participantCount());
        } finally {
            activity.lock().unlock();
        }
    }

    public RegistrationResult unregister(String activityName, String participant) {
        Activity activity = findActivity(activityName);
        activity.lock().lock();
        try {
            if (!activity.removeParticipant(participant)) {
                log.debug("Rejected unregister of {} from {}: not on roster", participant, activityName);
                throw ProblemException.conflict("activity.not_registered", NOT_REGISTERED);
            }
            log.info("Unregistered {} from {} ({}/{})", participant, activityName,
                    activity.participantCount(), activity.getMaxParticipants());
            return new RegistrationResult(activityName, participant, activity.participantCount());
        } finally {
            activity.lock().unlock();
        }
    }

    private Activity findActivity(String activityName) {
        Activity activity = activityName == null ? null : activities.get(activityName);
        if (activity == null) {
            log.debug("Unknown activity requested: {}", activityName);
            throw ProblemException.notFound("activity.not_found", ACTIVITY_NOT_FOUND);
        }
        return activity;
    }
}
