package com.ryuqq.registration.core.spi;

import com.ryuqq.registration.core.model.NodeRef;

import java.nio.file.Path;

/**
 * 볼륨/변환 내보내기 SPI.
 *
 * <p>호출자 장면의 볼륨, 마스크, 변환 노드를 엔진이 읽을 수 있는 파일로 저장합니다.
 * 엔진 프로세스 시작 전에 호출자 루프에서 동기적으로 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface VolumeExporter {

    /**
     * 노드를 파일로 내보내기.
     *
     * <p>실패는 예외가 아니라 {@code false}로 보고해야 합니다.</p>
     *
     * @param node 내보낼 노드
     * @param file 대상 파일 경로
     * @return 성공 여부
     */
    boolean export(NodeRef node, Path file);
}
