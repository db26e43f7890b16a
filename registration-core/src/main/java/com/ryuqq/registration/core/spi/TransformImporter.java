package com.ryuqq.registration.core.spi;

import com.ryuqq.registration.core.model.AffineTransform3D;

import java.nio.file.Path;

/**
 * 변환 파일 읽기 SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface TransformImporter {

    /**
     * 변환 파일 읽기.
     *
     * @param file 변환 파일 경로
     * @return 읽어 들인 변환, 읽을 수 없으면 null
     */
    AffineTransform3D importTransform(Path file);
}
