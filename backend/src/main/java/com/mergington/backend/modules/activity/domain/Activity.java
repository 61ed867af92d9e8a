package com.mergington.backend.modules.activity.domain;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * An extracurricular activity and its roster.
 *
 * <p>Name, description, schedule and capacity are fixed at construction; only the roster
 * changes. Roster mutations are not synchronized here: callers hold {@link #lock()} for the
 * whole check-then-act sequence.
 */
public class Activity {

    private final String name;
    private final String description;
    private final String schedule;
    private final int maxParticipants;
    private final List<String> participants;
    private final ReentrantLock lock = new ReentrantLock();

    public Activity(String name, String description, String schedule, int maxParticipants,
                    List<String> participants) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("activity name must not be blank");
        }
        if (maxParticipants <= 0) {
            throw new IllegalArgumentException("max participants must be positive for " + name);
        }
        List<String> initial = participants == null ? List.of() : participants;
        if (new LinkedHashSet<>(initial).size() != initial.size()) {
            throw new IllegalArgumentException("duplicate participants in roster of " + name);
        }
        if (initial.size() > maxParticipants) {
            throw new IllegalArgumentException("roster of " + name + " exceeds its capacity of " + maxParticipants);
        }
        this.name = name;
        this.description = Objects.requireNonNullElse(description, "");
        this.schedule = Objects.requireNonNullElse(schedule, "");
        this.maxParticipants = maxParticipants;
        this.participants = new ArrayList<>(initial);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getSchedule() {
        return schedule;
    }

    public int getMaxParticipants() {
        return maxParticipants;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public boolean hasParticipant(String participant) {
        return participants.contains(participant);
    }

    public boolean isFull() {
        return participants.size() >= maxParticipants;
    }

    public int participantCount() {
        return participants.size();
    }

    public void addParticipant(String participant) {
        participants.add(participant);
    }

    public boolean removeParticipant(String participant) {
        return participants.remove(participant);
    }

    public ActivitySnapshot snapshot() {
        return new ActivitySnapshot(name, description, schedule, maxParticipants, List.copyOf(participants));
    }
}
