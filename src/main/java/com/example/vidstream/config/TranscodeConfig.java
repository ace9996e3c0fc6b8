package com.example.vidstream.config;

import com.example.vidstream.domain.TranscodeProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TranscodeConfig {

    private static final Logger log = LoggerFactory.getLogger(TranscodeConfig.class);

    @Bean
    public TranscodeProfiles transcodeProfiles(TranscodeProperties properties) {
        TranscodeProfiles profiles = TranscodeProfiles.fromDefinitions(properties.profiles());
        log.info("Transcode ladder: {}", profiles.all());
        return profiles;
    }
}
