package com.ryuqq.registration.core.model;

/**
 * 정합 알고리즘 전략.
 *
 * <p>각 전략은 엔진 설정 디렉터리 안의 설정 파일 이름과 연결됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum RegistrationStrategy {

    /**
     * 강체 정합 (회전 + 이동).
     */
    RIGID("Rigid.json"),

    /**
     * 아핀 정합.
     */
    AFFINE("Affine.json"),

    /**
     * 강체 정합 후 아핀 정합.
     */
    RIGID_AFFINE("Rigid+Affine.json");

    private final String configFileName;

    RegistrationStrategy(String configFileName) {
        this.configFileName = configFileName;
    }

    /**
     * 전략에 대응하는 설정 파일 이름.
     *
     * @return 설정 파일 이름 (예: Rigid.json)
     */
    public String configFileName() {
        return configFileName;
    }
}
