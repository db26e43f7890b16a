package com.ryuqq.registration.core.model;

import java.util.Optional;

/**
 * 정합 실행 요청 (불변 record).
 *
 * <p>제출된 이후에는 변경되지 않습니다. fixed/moving 누락은 record 생성 시점이 아니라
 * 오케스트레이터의 준비 단계에서 VALIDATION 실패로 보고됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RegistrationRequest request = RegistrationRequest.of(fixed, moving, outputSlot)
 *     .withFixedMask(mask)
 *     .withSelection(new ConfigSelection().withStrategy(RegistrationStrategy.AFFINE));
 * </pre>
 *
 * @param fixed 고정 볼륨 (검증은 오케스트레이터가 수행)
 * @param moving 이동 볼륨 (검증은 오케스트레이터가 수행)
 * @param fixedMask 고정 볼륨 마스크 (선택, null 가능)
 * @param initialTransform 초기 변환 (선택, null 가능)
 * @param selection 설정 선택
 * @param outputSlot 결과를 복사받을 호출자 소유 슬롯
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RegistrationRequest(
    NodeRef fixed,
    NodeRef moving,
    NodeRef fixedMask,
    NodeRef initialTransform,
    ConfigSelection selection,
    TransformSlot outputSlot
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException selection 또는 outputSlot이 null인 경우
     */
    public RegistrationRequest {
        if (selection == null) {
            throw new IllegalArgumentException("selection cannot be null");
        }
        if (outputSlot == null) {
            throw new IllegalArgumentException("outputSlot cannot be null");
        }
    }

    /**
     * 기본 설정으로 요청 생성.
     *
     * @param fixed 고정 볼륨
     * @param moving 이동 볼륨
     * @param outputSlot 출력 슬롯
     * @return RegistrationRequest 인스턴스
     */
    public static RegistrationRequest of(NodeRef fixed, NodeRef moving, TransformSlot outputSlot) {
        return new RegistrationRequest(fixed, moving, null, null, new ConfigSelection(), outputSlot);
    }

    /**
     * 마스크 조회.
     *
     * @return 마스크 (없으면 empty)
     */
    public Optional<NodeRef> mask() {
        return Optional.ofNullable(fixedMask);
    }

    /**
     * 초기 변환 조회.
     *
     * @return 초기 변환 (없으면 empty)
     */
    public Optional<NodeRef> initial() {
        return Optional.ofNullable(initialTransform);
    }

    /**
     * 실제 적용될 초기 정렬 모드.
     *
     * @return 초기 변환이 있으면 NONE, 아니면 선택된 모드 (NONE은 GEOMETRY로 대체)
     */
    public InitMode effectiveInitMode() {
        return selection.initMode().effective(initialTransform != null);
    }

    /**
     * fixedMask만 변경한 새 인스턴스 생성.
     */
    public RegistrationRequest withFixedMask(NodeRef fixedMask) {
        return new RegistrationRequest(fixed, moving, fixedMask, initialTransform, selection, outputSlot);
    }

    /**
     * initialTransform만 변경한 새 인스턴스 생성.
     */
    public RegistrationRequest withInitialTransform(NodeRef initialTransform) {
        return new RegistrationRequest(fixed, moving, fixedMask, initialTransform, selection, outputSlot);
    }

    /**
     * selection만 변경한 새 인스턴스 생성.
     */
    public RegistrationRequest withSelection(ConfigSelection selection) {
        return new RegistrationRequest(fixed, moving, fixedMask, initialTransform, selection, outputSlot);
    }
}
