package com.ryuqq.registration.adapter.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EngineLocator 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class EngineLocatorTest {

    @TempDir
    Path tempDir;

    @Test
    void locate_명시적_경로_우선() throws IOException {
        // given
        Path explicit = executable(tempDir.resolve("custom/MIRegistration"));
        Path candidate = executable(tempDir.resolve("bin/MIRegistration"));
        EngineLocatorConfig config = new EngineLocatorConfig()
            .withExplicitExecutable(explicit)
            .withCandidateDirectories(List.of(candidate.getParent()));

        // when & then
        assertThat(new EngineLocator(config, name -> null, false).locate()).contains(explicit);
    }

    @Test
    void locate_명시적_경로가_없으면_후보_디렉터리() throws IOException {
        // given
        Path candidate = executable(tempDir.resolve("second/MIRegistration"));
        EngineLocatorConfig config = new EngineLocatorConfig()
            .withExplicitExecutable(tempDir.resolve("missing/MIRegistration"))
            .withCandidateDirectories(List.of(tempDir.resolve("first"), candidate.getParent()));

        // when & then
        assertThat(new EngineLocator(config, name -> null, false).locate()).contains(candidate);
    }

    @Test
    void locate_마지막으로_PATH_탐색() throws IOException {
        // given
        Path onPath = executable(tempDir.resolve("path-bin/MIRegistration"));
        Map<String, String> env = Map.of("PATH", tempDir.resolve("empty") + File.pathSeparator + onPath.getParent());

        // when & then
        assertThat(new EngineLocator(new EngineLocatorConfig(), env::get, false).locate()).contains(onPath);
    }

    @Test
    void locate_실행_권한이_없으면_제외() throws IOException {
        // given
        Path notExecutable = tempDir.resolve("bin/MIRegistration");
        Files.createDirectories(notExecutable.getParent());
        Files.writeString(notExecutable, "#!/bin/sh\n");
        EngineLocatorConfig config = new EngineLocatorConfig().withCandidateDirectories(List.of(notExecutable.getParent()));

        // when & then
        assertThat(new EngineLocator(config, name -> null, false).locate()).isEmpty();
    }

    @Test
    void locate_Windows는_exe_확장자_탐색() throws IOException {
        // given
        Path exe = executable(tempDir.resolve("win/MIRegistration.exe"));
        EngineLocatorConfig config = new EngineLocatorConfig().withCandidateDirectories(List.of(exe.getParent()));

        // when & then
        assertThat(new EngineLocator(config, name -> null, true).locate()).contains(exe);
        assertThat(new EngineLocator(config, name -> null, false).locate()).isEmpty();
    }

    @Test
    void fixed_해당_경로만_사용() throws IOException {
        // given
        Path exe = executable(tempDir.resolve("MIRegistration"));

        // when & then
        assertThat(EngineLocator.fixed(exe).locate()).contains(exe);
        assertThat(EngineLocator.fixed(tempDir.resolve("nothing")).locate()).isEmpty();
    }

    private static Path executable(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, "#!/bin/sh\nexit 0\n");
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
        return file;
    }
}
