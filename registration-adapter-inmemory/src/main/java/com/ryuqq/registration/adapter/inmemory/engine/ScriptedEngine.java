package com.ryuqq.registration.adapter.inmemory.engine;

import com.ryuqq.registration.adapter.inmemory.scene.MatrixTextFormat;
import com.ryuqq.registration.core.model.AffineTransform3D;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 스크립트 기반 가짜 정합 엔진 (테스트용).
 *
 * <p>실제 정합 실행 파일 대신 {@code /bin/sh} 스크립트를 생성합니다.
 * 엔진과 같은 인자 규약을 따르며, 마지막 인자를 출력 디렉터리로 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Path exe = ScriptedEngine.builder()
 *     .stdout("Iteration 1")
 *     .writeArtifact("registration_transform.h5", AffineTransform3D.translation(5, 0, 0))
 *     .exitCode(0)
 *     .writeTo(tempDir.resolve("MIRegistration"));
 * }</pre>
 *
 * <p><strong>주의:</strong> POSIX 셸이 필요합니다 (Linux/macOS).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedEngine {

    private final List<String> stdoutLines;
    private final List<String> stderrLines;
    private final Map<String, AffineTransform3D> artifacts;
    private final Path argsFile;
    private final Path pidFile;
    private final long sleepSeconds;
    private final int exitCode;

    private ScriptedEngine(Builder builder) {
        this.stdoutLines = List.copyOf(builder.stdoutLines);
        this.stderrLines = List.copyOf(builder.stderrLines);
        this.artifacts = new LinkedHashMap<>(builder.artifacts);
        this.argsFile = builder.argsFile;
        this.pidFile = builder.pidFile;
        this.sleepSeconds = builder.sleepSeconds;
        this.exitCode = builder.exitCode;
    }

    /**
     * 빌더 생성.
     *
     * @return 빌더
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 스크립트 본문 생성.
     *
     * @return {@code /bin/sh} 스크립트
     */
    public String script() {
        StringBuilder sb = new StringBuilder();
        sb.append("#!/bin/sh\n");
        sb.append("for last; do :; done\n");
        if (pidFile != null) {
            sb.append("echo $$ > ").append(quote(pidFile.toString())).append('\n');
        }
        if (argsFile != null) {
            sb.append("for arg in \"$@\"; do echo \"$arg\"; done > ").append(quote(argsFile.toString())).append('\n');
        }
        for (String line : stdoutLines) {
            sb.append("echo ").append(quote(line)).append('\n');
        }
        for (String line : stderrLines) {
            sb.append("echo ").append(quote(line)).append(" 1>&2\n");
        }
        if (sleepSeconds > 0) {
            // exec keeps the pid stable for cancellation tests
            if (artifacts.isEmpty() && exitCode == 0) {
                sb.append("exec sleep ").append(sleepSeconds).append('\n');
                return sb.toString();
            }
            sb.append("sleep ").append(sleepSeconds).append('\n');
        }
        for (Map.Entry<String, AffineTransform3D> artifact : artifacts.entrySet()) {
            sb.append("cat > \"$last/").append(artifact.getKey()).append("\" <<'MATRIX'\n");
            sb.append(MatrixTextFormat.format(artifact.getValue()));
            sb.append("MATRIX\n");
        }
        sb.append("exit ").append(exitCode).append('\n');
        return sb.toString();
    }

    /**
     * 스크립트를 실행 파일로 기록.
     *
     * @param executable 생성할 파일 경로
     * @return 생성된 실행 파일 경로
     * @throws IOException 파일을 쓸 수 없는 경우
     */
    public Path writeTo(Path executable) throws IOException {
        Files.writeString(executable, script(), StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(executable, PosixFilePermissions.fromString("rwxr-xr-x"));
        return executable;
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    /**
     * ScriptedEngine 빌더.
     */
    public static final class Builder {

        private final List<String> stdoutLines = new ArrayList<>();
        private final List<String> stderrLines = new ArrayList<>();
        private final Map<String, AffineTransform3D> artifacts = new LinkedHashMap<>();
        private Path argsFile;
        private Path pidFile;
        private long sleepSeconds;
        private int exitCode;

        private Builder() {
        }

        public Builder stdout(String line) {
            stdoutLines.add(line);
            return this;
        }

        public Builder stderr(String line) {
            stderrLines.add(line);
            return this;
        }

        /**
         * 출력 디렉터리에 변환 파일 생성.
         *
         * @param fileName 파일 이름 (경로 구분자 불가)
         * @param transform 기록할 변환
         * @return 빌더
         */
        public Builder writeArtifact(String fileName, AffineTransform3D transform) {
            if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\"")) {
                throw new IllegalArgumentException("Invalid artifact file name: " + fileName);
            }
            if (transform == null) {
                throw new IllegalArgumentException("transform cannot be null");
            }
            artifacts.put(fileName, transform);
            return this;
        }

        public Builder recordArgsTo(Path file) {
            this.argsFile = file;
            return this;
        }

        public Builder writePidTo(Path file) {
            this.pidFile = file;
            return this;
        }

        public Builder sleepSeconds(long seconds) {
            if (seconds < 0) {
                throw new IllegalArgumentException("sleepSeconds must be non-negative (current: " + seconds + ")");
            }
            this.sleepSeconds = seconds;
            return this;
        }

        public Builder exitCode(int exitCode) {
            if (exitCode < 0 || exitCode > 255) {
                throw new IllegalArgumentException("exitCode must be between 0 and 255 (current: " + exitCode + ")");
            }
            this.exitCode = exitCode;
            return this;
        }

        public ScriptedEngine build() {
            return new ScriptedEngine(this);
        }

        /**
         * 빌드 후 바로 실행 파일로 기록.
         *
         * @param executable 생성할 파일 경로
         * @return 생성된 실행 파일 경로
         * @throws IOException 파일을 쓸 수 없는 경우
         */
        public Path writeTo(Path executable) throws IOException {
            return build().writeTo(executable);
        }
    }
}
