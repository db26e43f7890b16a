package com.ryuqq.registration.adapter.inmemory.scene;

import com.ryuqq.registration.core.model.AffineTransform3D;
import com.ryuqq.registration.core.model.NodeRef;
import com.ryuqq.registration.core.spi.TransformImporter;
import com.ryuqq.registration.core.spi.VolumeExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-Memory 장면 구현체 (개발 및 테스트용).
 *
 * <p>볼륨 노드는 원본 파일 경로로, 변환 노드는 행렬로 보관합니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>볼륨 내보내기: 원본 파일을 대상 경로로 복사</li>
 *   <li>변환 내보내기: {@link MatrixTextFormat}으로 기록</li>
 *   <li>변환 읽기: {@link MatrixTextFormat}으로 해석, 실패 시 null</li>
 * </ul>
 *
 * <p><strong>주의:</strong> 볼륨 파일 형식은 해석하지 않습니다 (복사만 수행).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryScene implements VolumeExporter, TransformImporter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScene.class);

    private final Map<NodeRef, Path> volumes = new ConcurrentHashMap<>();
    private final Map<NodeRef, AffineTransform3D> transforms = new ConcurrentHashMap<>();
    private final AtomicInteger exportCount = new AtomicInteger();

    /**
     * 볼륨 노드 등록.
     *
     * @param node 노드 참조
     * @param sourceFile 볼륨 원본 파일
     */
    public void putVolume(NodeRef node, Path sourceFile) {
        if (node == null || sourceFile == null) {
            throw new IllegalArgumentException("node and sourceFile cannot be null");
        }
        transforms.remove(node);
        volumes.put(node, sourceFile);
    }

    /**
     * 변환 노드 등록.
     *
     * @param node 노드 참조
     * @param transform 변환
     */
    public void putTransform(NodeRef node, AffineTransform3D transform) {
        if (node == null || transform == null) {
            throw new IllegalArgumentException("node and transform cannot be null");
        }
        volumes.remove(node);
        transforms.put(node, transform);
    }

    /**
     * 변환 노드 조회.
     *
     * @param node 노드 참조
     * @return 변환 (없으면 empty)
     */
    public Optional<AffineTransform3D> transform(NodeRef node) {
        return Optional.ofNullable(transforms.get(node));
    }

    /**
     * 성공한 내보내기 횟수.
     *
     * @return 내보내기 횟수
     */
    public int exportCount() {
        return exportCount.get();
    }

    @Override
    public boolean export(NodeRef node, Path file) {
        if (node == null || file == null) {
            log.warn("Export rejected: node={}, file={}", node, file);
            return false;
        }
        try {
            Path volume = volumes.get(node);
            if (volume != null) {
                Files.copy(volume, file, StandardCopyOption.REPLACE_EXISTING);
                exportCount.incrementAndGet();
                log.debug("Exported volume {} to {}", node, file);
                return true;
            }
            AffineTransform3D transform = transforms.get(node);
            if (transform != null) {
                MatrixTextFormat.write(file, transform);
                exportCount.incrementAndGet();
                log.debug("Exported transform {} to {}", node, file);
                return true;
            }
            log.warn("Cannot export unknown node {}", node);
            return false;
        } catch (IOException e) {
            log.error("Failed to export {} to {}", node, file, e);
            return false;
        }
    }

    @Override
    public AffineTransform3D importTransform(Path file) {
        try {
            return MatrixTextFormat.read(file);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Cannot read transform from {}: {}", file, e.getMessage());
            return null;
        }
    }
}
