package com.ryuqq.registration.core.model;

/**
 * 호출자가 소유한 장면(scene) 노드에 대한 불투명 참조.
 *
 * <p>볼륨, 마스크, 변환 노드를 가리키며, 실제 데이터는 호출자 측에 남아 있습니다.
 * 오케스트레이터는 참조만 보관하고 {@code VolumeExporter}를 통해 파일로 내보냅니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class NodeRef {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private NodeRef(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("NodeRef cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("NodeRef length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * NodeRef 생성.
     *
     * @param value 노드 식별자
     * @return NodeRef 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static NodeRef of(String value) {
        return new NodeRef(value);
    }

    /**
     * 노드 식별자 조회.
     *
     * @return 노드 식별자
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeRef nodeRef = (NodeRef) o;
        return value.equals(nodeRef.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "NodeRef{" + value + '}';
    }
}
