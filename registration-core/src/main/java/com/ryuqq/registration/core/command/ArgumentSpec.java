package com.ryuqq.registration.core.command;

import java.util.List;

/**
 * 명령행 인자 명세.
 *
 * <p>문자열 이어 붙이기 대신 인자를 구조적으로 표현하여 인용/이스케이프 문제를 피합니다.
 * 각 명세는 순서대로 argv 토큰으로 펼쳐집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ArgumentSpec permits ArgumentSpec.Option, ArgumentSpec.Positional {

    /**
     * argv 토큰으로 변환.
     *
     * @return 토큰 목록
     */
    List<String> tokens();

    /**
     * 이름 있는 옵션 ({@code --name value}).
     *
     * @param name 옵션 이름 ({@code --}로 시작)
     * @param value 옵션 값
     */
    record Option(String name, String value) implements ArgumentSpec {

        public Option {
            if (name == null || !name.startsWith("--") || name.length() < 3) {
                throw new IllegalArgumentException("Option name must start with '--' (current: " + name + ")");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null for option " + name);
            }
        }

        @Override
        public List<String> tokens() {
            return List.of(name, value);
        }
    }

    /**
     * 위치 인자.
     *
     * @param value 인자 값
     */
    record Positional(String value) implements ArgumentSpec {

        public Positional {
            if (value == null || value.isEmpty()) {
                throw new IllegalArgumentException("Positional value cannot be null or empty");
            }
        }

        @Override
        public List<String> tokens() {
            return List.of(value);
        }
    }
}
