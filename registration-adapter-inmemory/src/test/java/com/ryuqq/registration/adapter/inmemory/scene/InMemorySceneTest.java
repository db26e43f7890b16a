package com.ryuqq.registration.adapter.inmemory.scene;

import com.ryuqq.registration.core.model.AffineTransform3D;
import com.ryuqq.registration.core.model.NodeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryScene 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemorySceneTest {

    @TempDir
    Path tempDir;

    private InMemoryScene scene;

    @BeforeEach
    void setUp() {
        scene = new InMemoryScene();
    }

    @Test
    void export_볼륨은_원본_파일을_복사() throws IOException {
        // given
        Path source = Files.writeString(tempDir.resolve("ct.raw"), "voxels", StandardCharsets.UTF_8);
        scene.putVolume(NodeRef.of("ct"), source);
        Path target = tempDir.resolve("fixed.nrrd");

        // when
        boolean exported = scene.export(NodeRef.of("ct"), target);

        // then
        assertThat(exported).isTrue();
        assertThat(target).hasContent("voxels");
        assertThat(scene.exportCount()).isEqualTo(1);
    }

    @Test
    void export_변환은_행렬_텍스트로_기록() throws IOException {
        // given
        scene.putTransform(NodeRef.of("initial"), AffineTransform3D.translation(1, 2, 3));
        Path target = tempDir.resolve("initial_transform.h5");

        // when
        boolean exported = scene.export(NodeRef.of("initial"), target);

        // then
        assertThat(exported).isTrue();
        assertThat(MatrixTextFormat.read(target)).isEqualTo(AffineTransform3D.translation(1, 2, 3));
    }

    @Test
    void export_알_수_없는_노드는_false() {
        // when & then
        assertThat(scene.export(NodeRef.of("missing"), tempDir.resolve("x.nrrd"))).isFalse();
        assertThat(scene.exportCount()).isZero();
    }

    @Test
    void export_원본_파일이_사라지면_false() {
        // given
        scene.putVolume(NodeRef.of("ct"), tempDir.resolve("deleted.raw"));

        // when & then
        assertThat(scene.export(NodeRef.of("ct"), tempDir.resolve("fixed.nrrd"))).isFalse();
    }

    @Test
    void importTransform_정상_파일은_변환_반환() throws IOException {
        // given
        Path file = tempDir.resolve("registration_transform.h5");
        MatrixTextFormat.write(file, AffineTransform3D.translation(0, 0, 7));

        // when & then
        assertThat(scene.importTransform(file)).isEqualTo(AffineTransform3D.translation(0, 0, 7));
    }

    @Test
    void importTransform_읽을_수_없으면_null() throws IOException {
        // given
        Path garbage = Files.writeString(tempDir.resolve("garbage.h5"), "HDF\u0089", StandardCharsets.UTF_8);

        // when & then
        assertThat(scene.importTransform(garbage)).isNull();
        assertThat(scene.importTransform(tempDir.resolve("absent.h5"))).isNull();
    }

    @Test
    void putVolume_같은_노드를_변환으로_교체() {
        // given
        scene.putVolume(NodeRef.of("node"), tempDir.resolve("a.raw"));

        // when
        scene.putTransform(NodeRef.of("node"), AffineTransform3D.identity());

        // then
        assertThat(scene.transform(NodeRef.of("node"))).contains(AffineTransform3D.identity());
    }
}
