package com.ryuqq.registration.core.command;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 외부 프로세스 실행 명령 (실행 파일 + 순서 있는 인자 명세).
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CommandDescriptor command = CommandDescriptor.builder(executable)
 *     .option("--config", configPath)
 *     .option("--sampling-percentage", "0.1")
 *     .optionIfPresent("--fixed-mask", maskPathOrNull)
 *     .positional(fixedPath)
 *     .positional(movingPath)
 *     .positional(outputDir)
 *     .build();
 *
 * List&lt;String&gt; argv = command.toArgv();
 * </pre>
 *
 * <p><strong>불변성:</strong> 생성 후 변경 불가</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CommandDescriptor {

    private final Path executable;
    private final List<ArgumentSpec> arguments;

    private CommandDescriptor(Path executable, List<ArgumentSpec> arguments) {
        this.executable = executable;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
    }

    /**
     * Builder 생성.
     *
     * @param executable 실행 파일 경로
     * @return Builder
     * @throws IllegalArgumentException executable이 null인 경우
     */
    public static Builder builder(Path executable) {
        if (executable == null) {
            throw new IllegalArgumentException("executable cannot be null");
        }
        return new Builder(executable);
    }

    /**
     * 실행 파일 경로 조회.
     *
     * @return 실행 파일 경로
     */
    public Path executable() {
        return executable;
    }

    /**
     * 인자 명세 조회.
     *
     * @return 순서 있는 인자 명세 (수정 불가)
     */
    public List<ArgumentSpec> arguments() {
        return arguments;
    }

    /**
     * ProcessBuilder에 전달할 argv 생성.
     *
     * @return 실행 파일 + 인자 토큰
     */
    public List<String> toArgv() {
        List<String> argv = new ArrayList<>();
        argv.add(executable.toString());
        for (ArgumentSpec argument : arguments) {
            argv.addAll(argument.tokens());
        }
        return argv;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String token : toArgv()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            // 로그 표시용 인용
            sb.append(token.indexOf(' ') >= 0 ? '"' + token + '"' : token);
        }
        return sb.toString();
    }

    /**
     * CommandDescriptor Builder.
     */
    public static final class Builder {

        private final Path executable;
        private final List<ArgumentSpec> arguments = new ArrayList<>();

        private Builder(Path executable) {
            this.executable = executable;
        }

        public Builder option(String name, String value) {
            arguments.add(new ArgumentSpec.Option(name, value));
            return this;
        }

        public Builder option(String name, Path value) {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null for option " + name);
            }
            return option(name, value.toString());
        }

        /**
         * 값이 있을 때만 옵션 추가.
         */
        public Builder optionIfPresent(String name, Path valueOrNull) {
            return valueOrNull == null ? this : option(name, valueOrNull);
        }

        public Builder positional(String value) {
            arguments.add(new ArgumentSpec.Positional(value));
            return this;
        }

        public Builder positional(Path value) {
            if (value == null) {
                throw new IllegalArgumentException("positional path cannot be null");
            }
            return positional(value.toString());
        }

        public CommandDescriptor build() {
            return new CommandDescriptor(executable, arguments);
        }
    }
}
