package com.mergington.backend.support;

import java.util.List;

import com.mergington.backend.modules.activity.domain.Activity;

/**
 * Fresh copies of the first seed activities for tests that build their own registry.
 */
public final class TestActivities {

    public static final String CHESS_CLUB = "Chess Club";
    public static final String PROGRAMMING_CLASS = "Programming Class";
    public static final String GYM_CLASS = "Gym Class";

    public static final String MICHAEL = "michael@mergington.edu";
    public static final String DANIEL = "daniel@mergington.edu";
    public static final String EMMA = "emma@mergington.edu";

    private TestActivities() {
    }

    public static List<Activity> seed() {
        return List.of(
                new Activity(CHESS_CLUB, "Learn strategies and compete in chess tournaments",
                        "Fridays, 3:30 PM - 5:00 PM", 12, List.of(MICHAEL, DANIEL)),
                new Activity(PROGRAMMING_CLASS, "Learn programming fundamentals and build software projects",
                        "Tuesdays and Thursdays, 3:30 PM - 4:30 PM", 20, List.of(EMMA, "sophia@mergington.edu")),
                new Activity(GYM_CLASS, "Physical education and sports activities",
                        "Mondays, Wednesdays, Fridays, 2:00 PM - 3:00 PM", 30,
                        List.of("john@mergington.edu", "olivia@mergington.edu"))
        );
    }
}
