package com.ryuqq.registration.adapter.runner;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 설정 record (RegistrationSettings, ProcessRunnerConfig, EngineLocatorConfig) 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RegistrationSettingsTest {

    @Test
    void 기본값_확인() {
        // when
        RegistrationSettings settings = new RegistrationSettings();

        // then
        assertThat(settings.pollingIntervalMs()).isEqualTo(100);
        assertThat(settings.workRoot()).isNull();
        assertThat(settings.resultMarker()).isEqualTo("registration_transform");
        assertThat(settings.initialTransformFileName()).isEqualTo("initial_transform.h5");
        assertThat(settings.artifactExtensions()).containsExactly(".h5", ".tfm");
        assertThat(new ProcessRunnerConfig().gracePeriodMs()).isEqualTo(5000);
        assertThat(new EngineLocatorConfig().executableName()).isEqualTo("MIRegistration");
    }

    @Test
    void with_메서드는_해당_값만_변경() {
        // when
        RegistrationSettings settings = new RegistrationSettings()
            .withPollingIntervalMs(20)
            .withWorkRoot(Path.of("/tmp/work"))
            .withInitialTransformFileName("start.tfm");

        // then
        assertThat(settings.pollingIntervalMs()).isEqualTo(20);
        assertThat(settings.workRoot()).isEqualTo(Path.of("/tmp/work"));
        assertThat(settings.workDirPrefix()).isEqualTo("registration_");
        assertThat(settings.initialTransformFileName()).isEqualTo("start.tfm");
        assertThat(settings.resultMarker()).isEqualTo("registration_transform");
    }

    @Test
    void 잘못된_값은_예외() {
        // when & then
        assertThatThrownBy(() -> new RegistrationSettings().withPollingIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("pollingIntervalMs must be positive (current: 0)");
        assertThatThrownBy(() -> new RegistrationSettings().withArtifactExtensions(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RegistrationSettings().withWorkDirPrefix("bad/prefix"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("workDirPrefix cannot contain a path separator: bad/prefix");
        assertThatThrownBy(() -> new RegistrationSettings().withInitialTransformFileName(" "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ProcessRunnerConfig().withGracePeriodMs(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gracePeriodMs must be positive");
        assertThatThrownBy(() -> new EngineLocatorConfig().withExecutableName(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
