package com.ryuqq.registration.adapter.runner;

import com.ryuqq.registration.core.model.ConfigSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 정합 설정 파일 결정기.
 *
 * <p>사용자 지정 설정 파일이 존재하면 우선 사용하고,
 * 없으면 설정 디렉터리에서 전략별 파일({@code Rigid.json} 등)을 찾습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ConfigurationResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationResolver.class);

    private final Path configDirectory;

    /**
     * 생성자.
     *
     * @param configDirectory 전략별 설정 파일 디렉터리 (null이면 사용자 지정 파일만 사용)
     */
    public ConfigurationResolver(Path configDirectory) {
        this.configDirectory = configDirectory;
    }

    /**
     * 설정 파일 결정.
     *
     * @param selection 설정 선택
     * @return 설정 파일 경로 (찾지 못하면 empty)
     */
    public Optional<Path> resolve(ConfigSelection selection) {
        if (selection == null) {
            throw new IllegalArgumentException("selection cannot be null");
        }
        Optional<Path> custom = selection.customConfig();
        if (custom.isPresent()) {
            if (Files.isRegularFile(custom.get())) {
                return custom;
            }
            log.warn("Custom configuration {} does not exist, falling back to {}",
                custom.get(), selection.strategy());
        }
        if (configDirectory == null) {
            return Optional.empty();
        }
        Path strategyFile = configDirectory.resolve(selection.strategy().configFileName());
        if (Files.isRegularFile(strategyFile)) {
            return Optional.of(strategyFile);
        }
        log.debug("No configuration for {} in {}", selection.strategy(), configDirectory);
        return Optional.empty();
    }
}
