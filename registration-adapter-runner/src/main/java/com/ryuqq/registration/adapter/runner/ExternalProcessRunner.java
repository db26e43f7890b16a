package com.ryuqq.registration.adapter.runner;

import com.ryuqq.registration.core.command.CommandDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * 외부 정합 엔진 프로세스 실행기.
 *
 * <p>프로세스 하나와 출력 수집 스레드 하나를 소유합니다.
 * 표준 출력과 표준 에러는 합쳐서 한 줄씩 {@link LineSink}로 전달합니다.</p>
 *
 * <p><strong>종료 판정:</strong></p>
 * <ul>
 *   <li>{@link #isAlive()}: 프로세스 또는 출력 수집 스레드가 살아 있으면 true (비차단)</li>
 *   <li>호출자는 isAlive()가 false가 된 뒤에만 {@link #outcome()}을 읽습니다</li>
 * </ul>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>{@link #stop()}은 하위 프로세스까지 정상 종료를 요청하고 즉시 반환합니다</li>
 *   <li>유예 시간 안에 종료되지 않으면 별도 데몬 스레드가 강제 종료합니다</li>
 *   <li>stop() 이후의 결과는 종료 코드와 무관하게 cancelled=true</li>
 * </ul>
 *
 * <p><strong>스레드 안전성:</strong> start/stop/isAlive/outcome은 호출자 루프 한 스레드에서 호출하는 것을 전제로 합니다.
 * 출력 수집 스레드와 공유하는 상태는 원자 참조로 관리하며, KILLED 이후에는 다른 상태로 바뀌지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExternalProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ExternalProcessRunner.class);

    private final CommandDescriptor command;
    private final Path workingDirectory;
    private final LineSink sink;
    private final ProcessRunnerConfig config;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private final AtomicReference<ProcessState> state = new AtomicReference<>(ProcessState.NOT_STARTED);
    private Process process;
    private Thread drainThread;

    /**
     * 생성자.
     *
     * @param command 실행 명령
     * @param workingDirectory 프로세스 작업 디렉터리 (null이면 현재 디렉터리)
     * @param sink 출력 라인 수신자
     * @param config 실행기 설정
     */
    public ExternalProcessRunner(CommandDescriptor command, Path workingDirectory, LineSink sink, ProcessRunnerConfig config) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.command = command;
        this.workingDirectory = workingDirectory;
        this.sink = sink;
        this.config = config;
    }

    /**
     * 프로세스 시작 (비차단).
     *
     * @throws IOException 프로세스를 생성할 수 없는 경우
     * @throws IllegalStateException 이미 시작한 경우
     */
    public void start() throws IOException {
        if (process != null) {
            throw new IllegalStateException("Process already started: " + command.executable());
        }
        ProcessBuilder builder = new ProcessBuilder(command.toArgv()).redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        log.info("Starting engine: {}", command);
        process = builder.start();
        state.set(ProcessState.SPAWNED);

        drainThread = new Thread(this::drain, config.threadNamePrefix() + "-output");
        drainThread.setDaemon(true);
        drainThread.start();
    }

    /**
     * 프로세스 또는 출력 수집이 진행 중인지 확인 (비차단).
     *
     * @return 진행 중이면 true, 시작 전이면 false
     */
    public boolean isAlive() {
        if (process == null) {
            return false;
        }
        return process.isAlive() || drainThread.isAlive();
    }

    /**
     * 프로세스 종료 요청 (비차단).
     *
     * <p>여러 번 호출해도 안전합니다. 이미 종료된 프로세스도 취소로 기록됩니다.</p>
     */
    public void stop() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        state.set(ProcessState.KILLED);
        if (process == null || !process.isAlive()) {
            return;
        }
        log.info("Stopping engine process {}", process.pid());
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        descendants.forEach(ProcessHandle::destroy);
        process.destroy();

        Process target = process;
        Thread escalation = new Thread(() -> escalate(target, descendants), config.threadNamePrefix() + "-kill");
        escalation.setDaemon(true);
        escalation.start();
    }

    /**
     * 종료 결과 조회.
     *
     * @return 종료 결과
     * @throws IllegalStateException 시작 전이거나 아직 진행 중인 경우
     */
    public ProcessOutcome outcome() {
        if (process == null) {
            throw new IllegalStateException("Process not started");
        }
        if (isAlive()) {
            throw new IllegalStateException("Process still running");
        }
        return new ProcessOutcome(process.exitValue(), cancelled.get());
    }

    public ProcessState state() {
        return state.get();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 프로세스 ID 조회.
     *
     * @return pid (시작 전이면 -1)
     */
    public long pid() {
        return process == null ? -1 : process.pid();
    }

    private void drain() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                state.compareAndSet(ProcessState.SPAWNED, ProcessState.STREAMING);
                deliver(line);
            }
        } catch (IOException e) {
            // stream closes under us when the process is destroyed
            log.debug("Engine output stream closed: {}", e.getMessage());
        }
        try {
            process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        state.updateAndGet(current -> current == ProcessState.KILLED || cancelled.get()
            ? ProcessState.KILLED
            : ProcessState.EXITED);
        log.debug("Engine process {} exited with {}", process.pid(), process.exitValue());
    }

    private void deliver(String line) {
        try {
            sink.accept(line);
        } catch (RuntimeException e) {
            log.debug("Line sink failed for '{}'", line, e);
        }
    }

    private void escalate(Process target, List<ProcessHandle> descendants) {
        try {
            if (target.waitFor(config.gracePeriodMs(), TimeUnit.MILLISECONDS)) {
                descendants.stream().filter(ProcessHandle::isAlive).forEach(ProcessHandle::destroyForcibly);
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.warn("Engine process {} did not stop within {}ms, killing", target.pid(), config.gracePeriodMs());
        descendants.forEach(ProcessHandle::destroyForcibly);
        target.destroyForcibly();
    }
}
