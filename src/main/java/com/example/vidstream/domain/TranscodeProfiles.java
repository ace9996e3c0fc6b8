package com.example.vidstream.domain;

import com.example.vidstream.config.TranscodeProperties.ProfileDefinition;
import com.example.vidstream.exceptions.InvalidProfileException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The closed, ordered set of transcode profiles known to this process.
 * Built once at startup; lookups of names outside the set fail loudly with {@link InvalidProfileException}.
 */
public final class TranscodeProfiles {

    private final List<TranscodeProfile> ordered;
    private final Map<String, TranscodeProfile> byName;

    private TranscodeProfiles(List<TranscodeProfile> ordered) {
        this.ordered = Collections.unmodifiableList(ordered);
        Map<String, TranscodeProfile> index = new LinkedHashMap<>();
        ordered.forEach(profile -> index.put(profile.name(), profile));
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * Validates the configured ladder and freezes it.
     * Names must be unique and heights strictly increasing in configuration order.
     *
     * @throws IllegalArgumentException if the ladder is empty or inconsistent
     */
    public static TranscodeProfiles fromDefinitions(List<ProfileDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("At least one transcode profile must be configured (transcode.profiles)");
        }
        List<TranscodeProfile> profiles = new ArrayList<>(definitions.size());
        int previousHeight = 0;
        for (int i = 0; i < definitions.size(); i++) {
            ProfileDefinition definition = definitions.get(i);
            String name = definition.name();
            if (profiles.stream().anyMatch(p -> p.name().equals(name))) {
                throw new IllegalArgumentException("Duplicate transcode profile name: " + name);
            }
            if (definition.height() <= previousHeight) {
                throw new IllegalArgumentException("Transcode profiles must be ordered by strictly increasing height, "
                        + name + " (" + definition.height() + ") follows a profile of height " + previousHeight);
            }
            previousHeight = definition.height();
            profiles.add(new TranscodeProfile(name, definition.height(),
                    definition.videoBitrateKbps(), definition.audioBitrateKbps(), i));
        }
        return new TranscodeProfiles(profiles);
    }

    /**
     * @throws InvalidProfileException if {@code name} is not one of the configured profiles
     */
    public TranscodeProfile resolve(String name) {
        TranscodeProfile profile = name == null ? null : byName.get(name);
        if (profile == null) {
            throw new InvalidProfileException(name, byName.keySet());
        }
        return profile;
    }

    public Optional<TranscodeProfile> find(String name) {
        return Optional.ofNullable(name == null ? null : byName.get(name));
    }

    public List<TranscodeProfile> all() {
        return ordered;
    }
}
