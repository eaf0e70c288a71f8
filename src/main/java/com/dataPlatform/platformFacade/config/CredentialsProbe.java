package com.dataPlatform.platformFacade.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks whether platform credentials are available.
 * Credentials are present when ~/.kaggle/kaggle.json exists or both username and key
 * are configured. Missing credentials are only reported; the facade still starts and
 * upstream calls fail with an authentication error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CredentialsProbe {

    private final FacadeSettings settings;

    public boolean hasCredentials() {
        return hasCredentials(Path.of(System.getProperty("user.home")));
    }

    boolean hasCredentials(Path homeDirectory) {
        if (Files.exists(homeDirectory.resolve(".kaggle").resolve("kaggle.json"))) {
            return true;
        }
        return isSet(settings.getUsername()) && isSet(settings.getApiKey());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void reportOnStartup() {
        if (hasCredentials()) {
            log.info("Platform credentials found - username configured: {}", isSet(settings.getUsername()));
        } else {
            log.warn("Platform credentials not found. Set KAGGLE_USERNAME and KAGGLE_KEY or provide ~/.kaggle/kaggle.json");
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
