package com.ryuqq.registration.testkit.contract;

import com.ryuqq.registration.adapter.inmemory.engine.ScriptedEngine;
import com.ryuqq.registration.adapter.inmemory.loop.ManualCallerLoop;
import com.ryuqq.registration.adapter.inmemory.scene.InMemoryScene;
import com.ryuqq.registration.adapter.runner.ConfigurationResolver;
import com.ryuqq.registration.adapter.runner.DefaultRegistrationOrchestrator;
import com.ryuqq.registration.adapter.runner.EngineLocator;
import com.ryuqq.registration.adapter.runner.LineSink;
import com.ryuqq.registration.adapter.runner.ProcessRunnerConfig;
import com.ryuqq.registration.adapter.runner.RegistrationSettings;
import com.ryuqq.registration.core.model.NodeRef;
import com.ryuqq.registration.core.model.RegistrationRequest;
import com.ryuqq.registration.core.model.TransformSlot;
import com.ryuqq.registration.core.outcome.ErrorCode;
import com.ryuqq.registration.core.outcome.Fail;
import com.ryuqq.registration.core.outcome.RegistrationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Abstract base class for registration contract tests.
 *
 * <p>Provides a scene with fixed and moving volumes, a strategy configuration directory,
 * a dedicated work root, a {@link ManualCallerLoop} driven by the test thread and a factory
 * for orchestrators wired to a scripted engine.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractRegistrationContractTest {
 *     {@literal @}Test
 *     void scenario() throws IOException {
 *         Path engine = engine(ScriptedEngine.builder().exitCode(1));
 *         DefaultRegistrationOrchestrator orchestrator = orchestrator(engine);
 *         RecordingCallback callback = new RecordingCallback();
 *
 *         orchestrator.submitRegistration(request(), callback);
 *         awaitCallback(callback);
 *
 *         assertThat(callback.single().success()).isFalse();
 *     }
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractRegistrationContractTest {

    protected static final NodeRef FIXED = NodeRef.of("fixed-volume");
    protected static final NodeRef MOVING = NodeRef.of("moving-volume");
    protected static final NodeRef OUTPUT = NodeRef.of("output-transform");
    protected static final Duration CALLBACK_TIMEOUT = Duration.ofSeconds(15);

    @TempDir
    protected Path tempDir;

    protected Path configDir;
    protected Path workRoot;
    protected InMemoryScene scene;
    protected ManualCallerLoop loop;
    protected TransformSlot outputSlot;

    /**
     * Creates fresh fixtures before each test.
     */
    @BeforeEach
    void setUpFixtures() throws IOException {
        configDir = Files.createDirectories(tempDir.resolve("config"));
        Files.writeString(configDir.resolve("Rigid.json"), "{\"transform\": \"rigid\"}", StandardCharsets.UTF_8);
        workRoot = Files.createDirectories(tempDir.resolve("work"));

        Path volumes = Files.createDirectories(tempDir.resolve("volumes"));
        scene = new InMemoryScene();
        scene.putVolume(FIXED, Files.writeString(volumes.resolve("fixed.raw"), "fixed", StandardCharsets.UTF_8));
        scene.putVolume(MOVING, Files.writeString(volumes.resolve("moving.raw"), "moving", StandardCharsets.UTF_8));

        loop = new ManualCallerLoop();
        outputSlot = TransformSlot.empty(OUTPUT);
    }

    /**
     * Writes a scripted engine executable into the temp directory.
     *
     * @param builder engine script builder
     * @return executable path
     */
    protected Path engine(ScriptedEngine.Builder builder) throws IOException {
        return engine(builder, "MIRegistration");
    }

    /**
     * Writes a scripted engine executable under the given name.
     *
     * @param builder engine script builder
     * @param name executable file name
     * @return executable path
     */
    protected Path engine(ScriptedEngine.Builder builder, String name) throws IOException {
        Path bin = Files.createDirectories(tempDir.resolve("bin"));
        return builder.writeTo(bin.resolve(name));
    }

    /**
     * Creates an orchestrator with a short polling interval and grace period.
     *
     * @param executable engine executable
     * @return orchestrator bound to {@link #loop}
     */
    protected DefaultRegistrationOrchestrator orchestrator(Path executable) {
        return new DefaultRegistrationOrchestrator(
            loop,
            scene,
            scene,
            EngineLocator.fixed(executable),
            new ConfigurationResolver(configDir),
            new RegistrationSettings().withPollingIntervalMs(20).withWorkRoot(workRoot),
            new ProcessRunnerConfig().withGracePeriodMs(1000),
            LineSink.logging()
        );
    }

    /**
     * Creates a default request (rigid strategy, no mask, no initial transform).
     */
    protected RegistrationRequest request() {
        return RegistrationRequest.of(FIXED, MOVING, outputSlot);
    }

    /**
     * Drives the loop until the callback fires.
     *
     * @param callback recording callback
     */
    protected void awaitCallback(RecordingCallback callback) {
        boolean called = loop.runUntil(callback::isCalled, CALLBACK_TIMEOUT);
        assertThat(called).as("callback within %s", CALLBACK_TIMEOUT).isTrue();
    }

    /**
     * Asserts that no working directory is left under the work root.
     */
    protected void assertWorkRootEmpty() throws IOException {
        try (Stream<Path> entries = Files.list(workRoot)) {
            List<Path> leftovers = entries.collect(Collectors.toList());
            assertThat(leftovers).as("leftover working directories").isEmpty();
        }
    }

    /**
     * Asserts that the last result failed with the expected error code.
     *
     * @param orchestrator orchestrator under test
     * @param expected expected error code
     * @return the failure
     */
    protected Fail assertFailedWith(DefaultRegistrationOrchestrator orchestrator, ErrorCode expected) {
        RegistrationResult result = orchestrator.lastResult().orElseThrow();
        assertThat(result).isInstanceOf(Fail.class);
        Fail fail = (Fail) result;
        assertThat(fail.errorCode()).isEqualTo(expected);
        return fail;
    }
}
