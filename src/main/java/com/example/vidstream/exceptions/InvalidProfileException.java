package com.example.vidstream.exceptions;

import java.util.Collection;

/**
 * A profile or resolution name outside the configured ladder.
 */
public class InvalidProfileException extends RuntimeException {

    private final String profileName;

    public InvalidProfileException(String profileName, Collection<String> knownProfiles) {
        super("Unknown transcode profile '" + profileName + "'. Configured profiles: " + String.join(", ", knownProfiles));
        this.profileName = profileName;
    }

    public String getProfileName() {
        return profileName;
    }
}
