package com.dataPlatform.platformFacade.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CredentialsProbeTest {

    @TempDir
    Path home;

    @Test
    void hasCredentials_UsernameAndKeyConfigured_IsTrue() {
        CredentialsProbe probe = new CredentialsProbe(FacadeSettings.builder().username("alice").apiKey("k").build());

        assertThat(probe.hasCredentials(home)).isTrue();
    }

    @Test
    void hasCredentials_OnlyUsername_IsFalse() {
        CredentialsProbe probe = new CredentialsProbe(FacadeSettings.builder().username("alice").apiKey(" ").build());

        assertThat(probe.hasCredentials(home)).isFalse();
    }

    @Test
    void hasCredentials_CredentialsFile_IsTrue() throws Exception {
        // given
        Path dir = Files.createDirectories(home.resolve(".kaggle"));
        Files.writeString(dir.resolve("kaggle.json"), "{\"username\":\"alice\",\"key\":\"k\"}");
        CredentialsProbe probe = new CredentialsProbe(FacadeSettings.builder().build());

        // when / then
        assertThat(probe.hasCredentials(home)).isTrue();
    }
}
