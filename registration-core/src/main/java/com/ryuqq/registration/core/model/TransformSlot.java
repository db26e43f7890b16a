package com.ryuqq.registration.core.model;

import java.util.Optional;

/**
 * 호출자가 소유한 출력 변환 슬롯.
 *
 * <p>정합 결과는 슬롯 자체를 교체하지 않고 {@link #copyFrom(AffineTransform3D)}로 내용만 복사합니다.
 * 호출자가 이미 보관 중인 슬롯 참조는 정합 후에도 그대로 유효합니다.</p>
 *
 * <p><strong>스레드 모델:</strong> 슬롯은 호출자의 단일 스레드 루프에서만 변경됩니다.
 * 백그라운드 스레드나 외부 프로세스가 직접 접근하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TransformSlot {

    private final NodeRef id;
    private AffineTransform3D content;
    private int revision;

    private TransformSlot(NodeRef id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        this.id = id;
    }

    /**
     * 빈 슬롯 생성.
     *
     * @param id 슬롯 노드 식별자
     * @return 내용이 없는 TransformSlot
     * @throws IllegalArgumentException id가 null인 경우
     */
    public static TransformSlot empty(NodeRef id) {
        return new TransformSlot(id);
    }

    /**
     * 변환 내용 복사.
     *
     * <p>슬롯의 정체성(identity)은 유지되고 내용만 교체됩니다.</p>
     *
     * @param transform 복사할 변환
     * @throws IllegalArgumentException transform이 null인 경우
     */
    public void copyFrom(AffineTransform3D transform) {
        if (transform == null) {
            throw new IllegalArgumentException("transform cannot be null");
        }
        this.content = transform;
        this.revision++;
    }

    /**
     * 슬롯 노드 식별자 조회.
     *
     * @return 슬롯 식별자
     */
    public NodeRef getId() {
        return id;
    }

    /**
     * 현재 변환 내용 조회.
     *
     * @return 변환 내용 (아직 복사된 적 없으면 empty)
     */
    public Optional<AffineTransform3D> content() {
        return Optional.ofNullable(content);
    }

    /**
     * 내용이 복사된 횟수.
     *
     * @return 복사 횟수 (0 이상)
     */
    public int revision() {
        return revision;
    }

    @Override
    public String toString() {
        return "TransformSlot{id=" + id + ", revision=" + revision + "}";
    }
}
