package com.ryuqq.registration.adapter.runner;

import com.ryuqq.registration.adapter.inmemory.engine.ScriptedEngine;
import com.ryuqq.registration.adapter.inmemory.loop.ManualCallerLoop;
import com.ryuqq.registration.application.orchestrator.RegistrationCallback;
import com.ryuqq.registration.core.model.AffineTransform3D;
import com.ryuqq.registration.core.model.ConfigSelection;
import com.ryuqq.registration.core.model.NodeRef;
import com.ryuqq.registration.core.model.RegistrationRequest;
import com.ryuqq.registration.core.model.TransformSlot;
import com.ryuqq.registration.core.outcome.ErrorCode;
import com.ryuqq.registration.core.outcome.Fail;
import com.ryuqq.registration.core.outcome.Ok;
import com.ryuqq.registration.core.outcome.RegistrationResult;
import com.ryuqq.registration.core.spi.TransformImporter;
import com.ryuqq.registration.core.spi.VolumeExporter;
import com.ryuqq.registration.core.statemachine.RunState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * DefaultRegistrationOrchestrator 유닛 테스트.
 *
 * <p>장면 연동(VolumeExporter, TransformImporter)은 모킹하고, 엔진은 스크립트로 실제 실행합니다.</p>
 * <ul>
 *   <li>정상 실행: 인자 구성, 결과 파일 읽기, 출력 슬롯 갱신</li>
 *   <li>준비 실패: VALIDATION, CONFIGURATION, EXPORT</li>
 *   <li>실행 실패: PROCESS_FAILURE, TRANSFORM_LOAD</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@EnabledOnOs({OS.LINUX, OS.MAC})
class DefaultRegistrationOrchestratorTest {

    private static final NodeRef FIXED = NodeRef.of("fixed");
    private static final NodeRef MOVING = NodeRef.of("moving");
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    @Mock
    private VolumeExporter exporter;

    @Mock
    private TransformImporter importer;

    private ManualCallerLoop loop;
    private Path configDir;
    private Path workRoot;
    private TransformSlot slot;
    private final List<Boolean> callbacks = new ArrayList<>();
    private final RegistrationCallback callback = (success, outputSlot) -> callbacks.add(success);

    @BeforeEach
    void setUp() throws IOException {
        loop = new ManualCallerLoop();
        configDir = Files.createDirectories(tempDir.resolve("config"));
        Files.writeString(configDir.resolve("Rigid.json"), "{\"rigid\": true}");
        workRoot = Files.createDirectories(tempDir.resolve("work"));
        slot = TransformSlot.empty(NodeRef.of("output"));
    }

    // ============================================================
    // 1. 정상 실행
    // ============================================================

    @Test
    void submit_정상_실행_시_슬롯_갱신과_성공_콜백() throws IOException {
        // given
        Path argsFile = tempDir.resolve("args.txt");
        Path exe = engine(ScriptedEngine.builder()
            .recordArgsTo(argsFile)
            .stdout("Registration finished")
            .writeArtifact("registration_transform.h5", AffineTransform3D.identity()));
        exportWritesFiles();
        when(importer.importTransform(any())).thenReturn(AffineTransform3D.translation(4, 5, 6));
        DefaultRegistrationOrchestrator orchestrator = orchestrator(exe);

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        assertThat(orchestrator.state()).isEqualTo(RunState.RUNNING);
        assertThat(callbacks).isEmpty();
        awaitCallback();

        // then
        assertThat(callbacks).containsExactly(true);
        assertThat(slot.content()).contains(AffineTransform3D.translation(4, 5, 6));
        assertThat(orchestrator.state()).isEqualTo(RunState.IDLE);
        RegistrationResult result = orchestrator.lastResult().orElseThrow();
        assertThat(result).isInstanceOf(Ok.class);
        assertThat(((Ok) result).artifactPath().getFileName().toString()).isEqualTo("registration_transform.h5");

        List<String> args = Files.readAllLines(argsFile);
        assertThat(args).hasSize(7);
        assertThat(args.get(0)).isEqualTo("--config");
        assertThat(args.get(1)).endsWith("config.json");
        assertThat(args.subList(2, 4)).containsExactly("--sampling-percentage", "0.1");
        assertThat(args.get(4)).endsWith("fixed.nrrd");
        assertThat(args.get(5)).endsWith("moving.nrrd");
        assertThat(Path.of(args.get(6)).getParent()).isEqualTo(workRoot);
        assertThat(workRoot).isEmptyDirectory();
    }

    @Test
    void submit_마스크와_초기_변환이_있으면_옵션_추가() throws IOException {
        // given
        Path argsFile = tempDir.resolve("args.txt");
        Path exe = engine(ScriptedEngine.builder()
            .recordArgsTo(argsFile)
            .writeArtifact("registration_transform.h5", AffineTransform3D.identity()));
        exportWritesFiles();
        when(importer.importTransform(any())).thenReturn(AffineTransform3D.identity());
        DefaultRegistrationOrchestrator orchestrator = orchestrator(exe);
        RegistrationRequest request = RegistrationRequest.of(FIXED, MOVING, slot)
            .withFixedMask(NodeRef.of("mask"))
            .withInitialTransform(NodeRef.of("initial"))
            .withSelection(new ConfigSelection().withSamplingPercentage(0.25));

        // when
        orchestrator.submitRegistration(request, callback);
        awaitCallback();

        // then
        List<String> args = Files.readAllLines(argsFile);
        assertThat(args.subList(2, 4)).containsExactly("--sampling-percentage", "0.25");
        assertThat(args.get(4)).isEqualTo("--fixed-mask");
        assertThat(args.get(5)).endsWith("mask.nrrd");
        assertThat(args.get(6)).isEqualTo("--initial");
        assertThat(args.get(7)).endsWith("initial_transform.h5");
        verify(exporter).export(eq(NodeRef.of("initial")), any());
        assertThat(callbacks).containsExactly(true);
    }

    @Test
    void submit_결과_파일_경로를_importer에_전달() throws IOException {
        // given
        Path exe = engine(ScriptedEngine.builder()
            .writeArtifact("other.tfm", AffineTransform3D.identity())
            .writeArtifact("registration_transform.h5", AffineTransform3D.identity()));
        exportWritesFiles();
        when(importer.importTransform(any())).thenReturn(AffineTransform3D.identity());
        DefaultRegistrationOrchestrator orchestrator = orchestrator(exe);
        ArgumentCaptor<Path> captor = ArgumentCaptor.forClass(Path.class);

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        awaitCallback();

        // then
        verify(importer).importTransform(captor.capture());
        assertThat(captor.getValue().getFileName().toString()).isEqualTo("registration_transform.h5");
    }

    // ============================================================
    // 2. 준비 단계 실패
    // ============================================================

    @Test
    void submit_고정_볼륨이_없으면_VALIDATION_실패() throws IOException {
        // given
        DefaultRegistrationOrchestrator orchestrator = orchestrator(engine(ScriptedEngine.builder()));

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(null, MOVING, slot), callback);

        // then
        assertThat(callbacks).isEmpty();
        loop.runPending();
        assertThat(callbacks).containsExactly(false);
        assertFailure(orchestrator, ErrorCode.VALIDATION);
        verifyNoInteractions(exporter, importer);
    }

    @Test
    void submit_실행_파일이_없으면_CONFIGURATION_실패() {
        // given
        DefaultRegistrationOrchestrator orchestrator = orchestrator(tempDir.resolve("missing-engine"));

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        loop.runPending();

        // then
        assertThat(callbacks).containsExactly(false);
        assertFailure(orchestrator, ErrorCode.CONFIGURATION);
        verifyNoInteractions(exporter);
        assertThat(workRoot).isEmptyDirectory();
    }

    @Test
    void submit_내보내기_false면_EXPORT_실패와_정리() throws IOException {
        // given
        DefaultRegistrationOrchestrator orchestrator = orchestrator(engine(ScriptedEngine.builder()));
        when(exporter.export(any(), any())).thenReturn(false);

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        assertThat(orchestrator.state()).isEqualTo(RunState.FAILED);
        loop.runPending();

        // then
        assertThat(callbacks).containsExactly(false);
        assertFailure(orchestrator, ErrorCode.EXPORT);
        assertThat(workRoot).isEmptyDirectory();
        assertThat(orchestrator.state()).isEqualTo(RunState.IDLE);
    }

    @Test
    void submit_내보내기_예외도_EXPORT_실패() throws IOException {
        // given
        DefaultRegistrationOrchestrator orchestrator = orchestrator(engine(ScriptedEngine.builder()));
        when(exporter.export(any(), any())).thenThrow(new IllegalStateException("scene closed"));

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        loop.runPending();

        // then
        Fail fail = assertFailure(orchestrator, ErrorCode.EXPORT);
        assertThat(fail.cause()).isEqualTo("scene closed");
    }

    @Test
    void submit_준비_중_예상치_못한_예외도_정리_후_실패_콜백_한_번() throws IOException {
        // given: 경로로 쓸 수 없는 초기 변환 파일 이름
        exportWritesFiles();
        DefaultRegistrationOrchestrator orchestrator = new DefaultRegistrationOrchestrator(
            loop, exporter, importer,
            EngineLocator.fixed(engine(ScriptedEngine.builder())),
            new ConfigurationResolver(configDir),
            new RegistrationSettings().withPollingIntervalMs(10).withWorkRoot(workRoot)
                .withInitialTransformFileName("bad\0name.h5"),
            new ProcessRunnerConfig().withGracePeriodMs(500),
            line -> { });
        List<TransformSlot> delivered = new ArrayList<>();
        RegistrationRequest request = RegistrationRequest.of(FIXED, MOVING, slot)
            .withInitialTransform(NodeRef.of("initial"));

        // when
        orchestrator.submitRegistration(request, (success, outputSlot) -> {
            callbacks.add(success);
            delivered.add(outputSlot);
        });
        assertThat(orchestrator.state()).isEqualTo(RunState.FAILED);
        assertThat(callbacks).isEmpty();
        loop.runPending();

        // then
        assertThat(callbacks).containsExactly(false);
        assertThat(delivered).containsExactly((TransformSlot) null);
        assertThat(orchestrator.state()).isEqualTo(RunState.IDLE);
        assertFailure(orchestrator, ErrorCode.EXPORT);
        assertThat(workRoot).isEmptyDirectory();

        // 다음 요청은 busy로 거부되지 않음
        orchestrator.submitRegistration(RegistrationRequest.of(null, MOVING, slot), callback);
        loop.runPending();
        assertThat(callbacks).containsExactly(false, false);
        assertFailure(orchestrator, ErrorCode.VALIDATION);
    }

    // ============================================================
    // 3. 실행 후 실패
    // ============================================================

    @Test
    void submit_엔진이_비정상_종료하면_PROCESS_FAILURE_결과_읽지_않음() throws IOException {
        // given
        Path exe = engine(ScriptedEngine.builder()
            .writeArtifact("registration_transform.h5", AffineTransform3D.identity())
            .exitCode(2));
        exportWritesFiles();
        DefaultRegistrationOrchestrator orchestrator = orchestrator(exe);

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        awaitCallback();

        // then
        assertThat(callbacks).containsExactly(false);
        Fail fail = assertFailure(orchestrator, ErrorCode.PROCESS_FAILURE);
        assertThat(fail.message()).contains("code 2");
        verify(importer, never()).importTransform(any());
        assertThat(slot.content()).isEmpty();
    }

    @Test
    void submit_변환을_읽지_못하면_TRANSFORM_LOAD_실패() throws IOException {
        // given
        Path exe = engine(ScriptedEngine.builder()
            .writeArtifact("registration_transform.h5", AffineTransform3D.identity()));
        exportWritesFiles();
        when(importer.importTransform(any())).thenReturn(null);
        DefaultRegistrationOrchestrator orchestrator = orchestrator(exe);

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        awaitCallback();

        // then
        assertThat(callbacks).containsExactly(false);
        assertFailure(orchestrator, ErrorCode.TRANSFORM_LOAD);
        assertThat(slot.revision()).isZero();
    }

    @Test
    void submit_importer_예외도_TRANSFORM_LOAD_실패() throws IOException {
        // given
        Path exe = engine(ScriptedEngine.builder()
            .writeArtifact("registration_transform.h5", AffineTransform3D.identity()));
        exportWritesFiles();
        when(importer.importTransform(any())).thenThrow(new IllegalArgumentException("corrupt"));
        DefaultRegistrationOrchestrator orchestrator = orchestrator(exe);

        // when
        orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), callback);
        awaitCallback();

        // then
        assertFailure(orchestrator, ErrorCode.TRANSFORM_LOAD);
    }

    // ============================================================
    // 4. 입력 검증
    // ============================================================

    @Test
    void submit_null_인자는_예외() {
        // given
        DefaultRegistrationOrchestrator orchestrator = orchestrator(tempDir.resolve("engine"));

        // when & then
        assertThatThrownBy(() -> orchestrator.submitRegistration(null, callback))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("request cannot be null");
        assertThatThrownBy(() -> orchestrator.submitRegistration(RegistrationRequest.of(FIXED, MOVING, slot), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("callback cannot be null");
        assertThat(orchestrator.state()).isEqualTo(RunState.IDLE);
    }

    @Test
    void 생성자_null_의존성은_예외() {
        // when & then
        assertThatThrownBy(() -> new DefaultRegistrationOrchestrator(
            null, exporter, importer, EngineLocator.fixed(tempDir), new ConfigurationResolver(configDir)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("loop cannot be null");
    }

    private DefaultRegistrationOrchestrator orchestrator(Path exe) {
        return new DefaultRegistrationOrchestrator(
            loop, exporter, importer,
            EngineLocator.fixed(exe),
            new ConfigurationResolver(configDir),
            new RegistrationSettings().withPollingIntervalMs(10).withWorkRoot(workRoot),
            new ProcessRunnerConfig().withGracePeriodMs(500),
            line -> { });
    }

    private Path engine(ScriptedEngine.Builder builder) throws IOException {
        return builder.writeTo(tempDir.resolve("MIRegistration"));
    }

    private void exportWritesFiles() {
        doAnswer(invocation -> {
            Path file = invocation.getArgument(1);
            Files.writeString(file, "exported");
            return true;
        }).when(exporter).export(any(), any());
    }

    private void awaitCallback() {
        assertThat(loop.runUntil(() -> !callbacks.isEmpty(), TIMEOUT)).isTrue();
    }

    private static Fail assertFailure(DefaultRegistrationOrchestrator orchestrator, ErrorCode expected) {
        RegistrationResult result = orchestrator.lastResult().orElseThrow();
        assertThat(result).isInstanceOf(Fail.class);
        Fail fail = (Fail) result;
        assertThat(fail.errorCode()).isEqualTo(expected);
        return fail;
    }
}
