package com.ryuqq.registration.core.outcome;

import com.ryuqq.registration.core.model.AffineTransform3D;

import java.nio.file.Path;

/**
 * 성공 결과.
 *
 * <p>엔진이 생성한 결과 변환 파일 경로와 읽어 들인 변환을 담습니다.
 * 작업 디렉터리는 콜백 전에 삭제되므로 {@code artifactPath}는 기록용이며 더 이상 존재하지 않습니다.</p>
 *
 * @param artifactPath 발견된 결과 파일 경로
 * @param transform 읽어 들인 변환
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Ok(
    Path artifactPath,
    AffineTransform3D transform
) implements RegistrationResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException artifactPath 또는 transform이 null인 경우
     */
    public Ok {
        if (artifactPath == null) {
            throw new IllegalArgumentException("artifactPath cannot be null");
        }
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
    }

    /**
     * 성공 결과 생성.
     *
     * @param artifactPath 결과 파일 경로
     * @param transform 변환
     * @return Ok 인스턴스
     */
    public static Ok of(Path artifactPath, AffineTransform3D transform) {
        return new Ok(artifactPath, transform);
    }
}
