package com.example.vidstream.exceptions;

/**
 * The profile asks for more vertical resolution than the source has. Renditions are never upscaled,
 * so the profile is skipped for this video and the job fails without output.
 */
public class ProfileExceedsSourceException extends TranscodeException {

    private final String profileName;
    private final int profileHeight;
    private final int sourceHeight;

    public ProfileExceedsSourceException(String profileName, int profileHeight, int sourceHeight) {
        super(String.format("Profile %s (%d px) exceeds source height %d px; upscaling is disabled",
                profileName, profileHeight, sourceHeight), false);
        this.profileName = profileName;
        this.profileHeight = profileHeight;
        this.sourceHeight = sourceHeight;
    }

    public String getProfileName() {
        return profileName;
    }

    public int getProfileHeight() {
        return profileHeight;
    }

    public int getSourceHeight() {
        return sourceHeight;
    }
}
