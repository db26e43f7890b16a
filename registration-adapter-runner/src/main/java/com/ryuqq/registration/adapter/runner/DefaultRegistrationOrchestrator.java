package com.ryuqq.registration.adapter.runner;

import com.ryuqq.registration.application.orchestrator.RegistrationCallback;
import com.ryuqq.registration.application.orchestrator.RegistrationOrchestrator;
import com.ryuqq.registration.core.command.CommandDescriptor;
import com.ryuqq.registration.core.model.AffineTransform3D;
import com.ryuqq.registration.core.model.NodeRef;
import com.ryuqq.registration.core.model.RegistrationRequest;
import com.ryuqq.registration.core.outcome.ErrorCode;
import com.ryuqq.registration.core.outcome.Fail;
import com.ryuqq.registration.core.outcome.Ok;
import com.ryuqq.registration.core.outcome.RegistrationResult;
import com.ryuqq.registration.core.spi.CallerLoop;
import com.ryuqq.registration.core.spi.TransformImporter;
import com.ryuqq.registration.core.spi.VolumeExporter;
import com.ryuqq.registration.core.statemachine.RunState;
import com.ryuqq.registration.core.statemachine.RunStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * 외부 엔진 기반 {@link RegistrationOrchestrator} 구현체.
 *
 * <p>정합 한 건을 준비, 실행, 결과 수집, 정리까지 관리합니다.
 * 엔진 프로세스는 별도로 실행되고, 종료 여부는 호출자 루프에서 고정 간격으로 확인합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>입력 검증, 엔진 실행 파일과 설정 파일 결정 (프로세스 시작 전)</li>
 *   <li>실행 전용 작업 디렉터리 생성 후 입력 볼륨/마스크/초기 변환 내보내기</li>
 *   <li>설정 파일을 config.json으로 복사하고 인자 목록 구성</li>
 *   <li>엔진 시작 (비차단), {@link CompletionWatch}로 종료 감시</li>
 *   <li>종료 시: 취소/종료 코드 확인 → 결과 파일 탐색 → 변환 읽기 → 출력 슬롯에 복사</li>
 *   <li>작업 디렉터리 삭제 후 콜백 정확히 한 번 호출</li>
 * </ol>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * IDLE → PREPARING → RUNNING → COMPLETED | FAILED | CANCELLED → IDLE
 *             └──────────────→ FAILED
 * </pre>
 *
 * <p><strong>스레드 규칙:</strong> 모든 공개 메서드는 호출자 루프 스레드에서 호출해야 합니다.
 * 상태, 출력 슬롯 변경, 콜백은 모두 그 스레드에서만 일어납니다.
 * submitRegistration 안에서는 콜백을 호출하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DefaultRegistrationOrchestrator implements RegistrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultRegistrationOrchestrator.class);

    static final String FIXED_FILE = "fixed.nrrd";
    static final String MOVING_FILE = "moving.nrrd";
    static final String MASK_FILE = "mask.nrrd";
    static final String CONFIG_FILE = "config.json";

    private final CallerLoop loop;
    private final VolumeExporter exporter;
    private final TransformImporter importer;
    private final EngineLocator engineLocator;
    private final ConfigurationResolver configurationResolver;
    private final RegistrationSettings settings;
    private final ProcessRunnerConfig runnerConfig;
    private final LineSink lineSink;
    private final OutputArtifactLocator artifactLocator;

    private RunState state = RunState.IDLE;
    private Run current;
    private RegistrationResult lastResult;

    /**
     * 생성자 (기본 설정, 엔진 출력은 로그로 기록).
     *
     * @param loop 호출자 루프
     * @param exporter 볼륨/변환 내보내기
     * @param importer 변환 읽기
     * @param engineLocator 엔진 실행 파일 탐색기
     * @param configurationResolver 설정 파일 결정기
     */
    public DefaultRegistrationOrchestrator(
        CallerLoop loop,
        VolumeExporter exporter,
        TransformImporter importer,
        EngineLocator engineLocator,
        ConfigurationResolver configurationResolver
    ) {
        this(loop, exporter, importer, engineLocator, configurationResolver,
            new RegistrationSettings(), new ProcessRunnerConfig(), LineSink.logging());
    }

    /**
     * 생성자.
     *
     * @param loop 호출자 루프
     * @param exporter 볼륨/변환 내보내기
     * @param importer 변환 읽기
     * @param engineLocator 엔진 실행 파일 탐색기
     * @param configurationResolver 설정 파일 결정기
     * @param settings 정합 설정
     * @param runnerConfig 프로세스 실행기 설정
     * @param lineSink 엔진 출력 수신자
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public DefaultRegistrationOrchestrator(
        CallerLoop loop,
        VolumeExporter exporter,
        TransformImporter importer,
        EngineLocator engineLocator,
        ConfigurationResolver configurationResolver,
        RegistrationSettings settings,
        ProcessRunnerConfig runnerConfig,
        LineSink lineSink
    ) {
        if (loop == null) {
            throw new IllegalArgumentException("loop cannot be null");
        }
        if (exporter == null) {
            throw new IllegalArgumentException("exporter cannot be null");
        }
        if (importer == null) {
            throw new IllegalArgumentException("importer cannot be null");
        }
        if (engineLocator == null) {
            throw new IllegalArgumentException("engineLocator cannot be null");
        }
        if (configurationResolver == null) {
            throw new IllegalArgumentException("configurationResolver cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (runnerConfig == null) {
            throw new IllegalArgumentException("runnerConfig cannot be null");
        }
        if (lineSink == null) {
            throw new IllegalArgumentException("lineSink cannot be null");
        }
        this.loop = loop;
        this.exporter = exporter;
        this.importer = importer;
        this.engineLocator = engineLocator;
        this.configurationResolver = configurationResolver;
        this.settings = settings;
        this.runnerConfig = runnerConfig;
        this.lineSink = lineSink;
        this.artifactLocator = OutputArtifactLocator.from(settings);
    }

    @Override
    public void submitRegistration(RegistrationRequest request, RegistrationCallback callback) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (state != RunState.IDLE) {
            throw new IllegalStateException("Registration already in progress");
        }

        Run run = new Run(request, callback);
        current = run;
        state = RunStateTransition.transition(state, RunState.PREPARING);

        try {
            prepareAndStart(run);
        } catch (PreparationException e) {
            log.warn("Registration preparation failed: [{}] {}", e.fail.errorCode().code(), e.fail.message());
            terminate(run, e.fail);
            // callback must not run inside submit
            loop.execute(() -> deliver(run, e.fail));
        } catch (RuntimeException e) {
            Fail fail = Fail.of(run.workDir == null ? ErrorCode.CONFIGURATION : ErrorCode.EXPORT,
                "Registration preparation failed", String.valueOf(e.getMessage()));
            log.error("Unexpected registration preparation failure", e);
            if (run.runner != null) {
                run.runner.stop();
            }
            terminate(run, fail);
            loop.execute(() -> deliver(run, fail));
        }
    }

    @Override
    public void cancel() {
        Run run = current;
        if (run == null || state != RunState.RUNNING) {
            log.debug("Cancel ignored (state={})", state);
            return;
        }
        log.info("Cancelling registration");
        run.runner.stop();
    }

    @Override
    public RunState state() {
        return state;
    }

    @Override
    public Optional<RegistrationResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    private void prepareAndStart(Run run) throws PreparationException {
        RegistrationRequest request = run.request;
        if (request.fixed() == null || request.moving() == null) {
            throw new PreparationException(Fail.of(ErrorCode.VALIDATION, "Fixed and moving volumes are required"));
        }

        Path executable = engineLocator.locate()
            .orElseThrow(() -> new PreparationException(
                Fail.of(ErrorCode.CONFIGURATION, "Registration engine executable not found")));
        Path configuration = configurationResolver.resolve(request.selection())
            .orElseThrow(() -> new PreparationException(
                Fail.of(ErrorCode.CONFIGURATION,
                    "No configuration available for strategy " + request.selection().strategy())));

        try {
            run.workDir = WorkingDirectory.create(settings.workRoot(), settings.workDirPrefix());
        } catch (IOException e) {
            throw new PreparationException(
                Fail.of(ErrorCode.EXPORT, "Cannot create working directory", e.getMessage()));
        }

        Path fixedFile = export(run, request.fixed(), FIXED_FILE);
        Path movingFile = export(run, request.moving(), MOVING_FILE);
        Path maskFile = request.fixedMask() == null ? null : export(run, request.fixedMask(), MASK_FILE);
        Path initialFile = request.initialTransform() == null
            ? null
            : export(run, request.initialTransform(), settings.initialTransformFileName());

        Path configCopy = run.workDir.resolve(CONFIG_FILE);
        try {
            Files.copy(configuration, configCopy, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new PreparationException(
                Fail.of(ErrorCode.CONFIGURATION, "Cannot copy configuration " + configuration, e.getMessage()));
        }

        CommandDescriptor command = CommandDescriptor.builder(executable)
            .option("--config", configCopy)
            .option("--sampling-percentage", Double.toString(request.selection().samplingPercentage()))
            .optionIfPresent("--fixed-mask", maskFile)
            .optionIfPresent("--initial", initialFile)
            .positional(fixedFile)
            .positional(movingFile)
            .positional(run.workDir.path())
            .build();

        run.runner = new ExternalProcessRunner(command, run.workDir.path(), lineSink, runnerConfig);
        try {
            run.runner.start();
        } catch (IOException e) {
            throw new PreparationException(
                Fail.of(ErrorCode.PROCESS_FAILURE, "Cannot start registration engine " + executable, e.getMessage()));
        }

        state = RunStateTransition.transition(state, RunState.RUNNING);
        log.info("Registration running: strategy={}, initMode={}, sampling={}, pid={}",
            request.selection().strategy(), request.effectiveInitMode(),
            request.selection().samplingPercentage(), run.runner.pid());

        run.watch = new CompletionWatch(loop, settings.pollingIntervalMs(),
            () -> !run.runner.isAlive(), () -> onEngineFinished(run));
        run.watch.start();
    }

    private Path export(Run run, NodeRef node, String fileName) throws PreparationException {
        Path target = run.workDir.resolve(fileName);
        boolean exported;
        try {
            exported = exporter.export(node, target);
        } catch (RuntimeException e) {
            throw new PreparationException(Fail.of(ErrorCode.EXPORT, "Export failed for " + node, e.getMessage()));
        }
        if (!exported) {
            throw new PreparationException(Fail.of(ErrorCode.EXPORT, "Export failed for " + node));
        }
        return target;
    }

    private void onEngineFinished(Run run) {
        RegistrationResult result = collect(run);
        terminate(run, result);
        deliver(run, result);
    }

    private RegistrationResult collect(Run run) {
        ProcessOutcome outcome = run.runner.outcome();
        if (outcome.cancelled()) {
            return Fail.of(ErrorCode.CANCELLED, "Registration cancelled");
        }
        if (outcome.exitCode() != 0) {
            return Fail.of(ErrorCode.PROCESS_FAILURE, "Registration engine exited with code " + outcome.exitCode());
        }

        Optional<Path> artifact;
        try {
            artifact = artifactLocator.locate(run.workDir.path());
        } catch (IOException e) {
            return Fail.of(ErrorCode.MISSING_OUTPUT, "Cannot list engine output", e.getMessage());
        }
        if (artifact.isEmpty()) {
            return Fail.of(ErrorCode.MISSING_OUTPUT,
                "Registration engine reported success but produced missing output (no transform file)");
        }

        AffineTransform3D transform;
        try {
            transform = importer.importTransform(artifact.get());
        } catch (RuntimeException e) {
            return Fail.of(ErrorCode.TRANSFORM_LOAD, "Cannot load transform " + artifact.get().getFileName(), e.getMessage());
        }
        if (transform == null) {
            return Fail.of(ErrorCode.TRANSFORM_LOAD, "Cannot load transform " + artifact.get().getFileName());
        }

        run.request.outputSlot().copyFrom(transform);
        return Ok.of(artifact.get(), transform);
    }

    /**
     * 종료 상태 전이와 작업 디렉터리 정리.
     */
    private void terminate(Run run, RegistrationResult result) {
        RunState terminal;
        if (result.isOk()) {
            terminal = RunState.COMPLETED;
        } else if (((Fail) result).isCancelled()) {
            terminal = RunState.CANCELLED;
        } else {
            terminal = RunState.FAILED;
        }
        state = RunStateTransition.transition(state, terminal);
        if (run.workDir != null) {
            run.workDir.close();
        }
        lastResult = result;
        if (result instanceof Fail fail) {
            log.warn("Registration {}: [{}] {}", terminal, fail.errorCode().code(), fail.message());
        } else {
            log.info("Registration completed: {}", ((Ok) result).artifactPath().getFileName());
        }
    }

    /**
     * IDLE 복귀 후 콜백 호출.
     */
    private void deliver(Run run, RegistrationResult result) {
        current = null;
        state = RunStateTransition.transition(state, RunState.IDLE);
        boolean success = result.isOk();
        try {
            run.callback.onComplete(success, success ? run.request.outputSlot() : null);
        } catch (RuntimeException e) {
            log.error("Registration callback failed", e);
        }
    }

    private static final class Run {

        private final RegistrationRequest request;
        private final RegistrationCallback callback;
        private WorkingDirectory workDir;
        private ExternalProcessRunner runner;
        private CompletionWatch watch;

        private Run(RegistrationRequest request, RegistrationCallback callback) {
            this.request = request;
            this.callback = callback;
        }
    }

    private static final class PreparationException extends Exception {

        private static final long serialVersionUID = 1L;

        private final transient Fail fail;

        private PreparationException(Fail fail) {
            super(fail.message());
            this.fail = fail;
        }
    }
}
