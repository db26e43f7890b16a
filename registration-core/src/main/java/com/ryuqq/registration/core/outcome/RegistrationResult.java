package com.ryuqq.registration.core.outcome;

/**
 * 정합 실행 결과.
 *
 * <p>RegistrationResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 결과 변환 파일을 찾아 읽었고 출력 슬롯에 복사함</li>
 *   <li>{@link Fail}: 검증/설정/프로세스/결과/취소 실패</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface RegistrationResult permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
