package io.xrdflow.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.xrdflow.core.ProcessingConfig;
import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.exception.ShapeMismatchException;
import io.xrdflow.core.plugin.TestPlugins;
import io.xrdflow.core.plugin.TestPlugins.FailingPlugin;
import io.xrdflow.core.plugin.TestPlugins.WrongShapePlugin;
import io.xrdflow.core.plugin.builtin.SumPlugin;
import io.xrdflow.core.results.ResultsState;
import io.xrdflow.core.results.WorkflowResults;
import io.xrdflow.core.scan.ScanGeometry;
import io.xrdflow.core.workflow.WorkflowTree;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScanRunnerTest {

    @Mock private ScanListener listener;

    private WorkflowTree tree;
    private WorkflowResults results;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        tree = new WorkflowTree();
        tree.createAndAddNode(TestPlugins.loader(3));
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    private ScanRunner runner(ScanGeometry scan, int workers, FailurePolicy policy) {
        executor = Executors.newFixedThreadPool(workers);
        ProcessingConfig config =
                ProcessingConfig.builder().workerCount(workers).failurePolicy(policy).build();
        results = new WorkflowResults(tree, scan);
        return new ScanRunner(tree, results, executor, config);
    }

    @Test
    void shouldProcessEveryFrameWithSeveralWorkers() throws Exception {
        // Given
        int sumId = tree.createAndAddNode(new SumPlugin());
        ScanRunner runner = runner(ScanGeometry.linear(20), 4, FailurePolicy.ABORT);

        // When
        ScanSummary summary = runner.run(listener);

        // Then
        assertThat(summary.isComplete()).isTrue();
        assertThat(summary.processedFrames()).isEqualTo(20);
        assertThat(summary.failedFrames()).isEmpty();
        Dataset sums = results.getResults(sumId);
        for (int frame = 0; frame < 20; frame++) {
            assertThat(sums.get(frame, 0)).isEqualTo(300.0 * frame + 3);
        }
        assertThat(results.getState()).isEqualTo(ResultsState.ALLOCATED_METADATA_COMPLETE);
        verify(listener).onScanStart(any(ScanGeometry.class), eq(4));
        verify(listener, times(20)).onFrameComplete(anyInt(), anyMap());
        verify(listener).onScanComplete(summary);
    }

    @Test
    void shouldFillMultiDimensionalScan() throws Exception {
        ScanGeometry scan =
                ScanGeometry.builder()
                        .dimension("y", "mm", 3, 1.0, 0.0)
                        .dimension("x", "mm", 4, 1.0, 0.0)
                        .build();
        ScanRunner runner = runner(scan, 3, FailurePolicy.ABORT);

        runner.run();

        Dataset raw = results.getResults(0);
        assertThat(raw.getShape()).containsExactly(3, 4, 3);
        assertThat(raw.get(2, 1, 2)).isEqualTo(902.0);
    }

    @Test
    void shouldUseNoMoreWorkersThanFrames() throws Exception {
        ScanRunner runner = runner(ScanGeometry.linear(2), 4, FailurePolicy.ABORT);

        runner.run(listener);

        verify(listener).onScanStart(any(ScanGeometry.class), eq(2));
    }

    @Test
    void shouldSkipFailedFramesWhenConfigured() throws Exception {
        // Given
        int failingId = tree.createAndAddNode(new FailingPlugin(3));
        ScanRunner runner = runner(ScanGeometry.linear(10), 2, FailurePolicy.SKIP);

        // When
        ScanSummary summary = runner.run(listener);

        // Then
        assertThat(summary.failedFrames()).containsExactly(3);
        assertThat(summary.processedFrames()).isEqualTo(9);
        assertThat(summary.isComplete()).isFalse();
        Dataset failing = results.getResults(failingId);
        assertThat(failing.getSlice(3).sum()).isZero();
        assertThat(failing.getSlice(4).getData()).containsExactly(400.0, 401.0, 402.0);
        verify(listener).onFrameFailed(eq(3), any(PluginExecutionException.class));
        verify(listener).onScanComplete(summary);
    }

    @Test
    void shouldAbortOnFirstFailureByDefault() {
        tree.createAndAddNode(new FailingPlugin(5));
        ScanRunner runner = runner(ScanGeometry.linear(10), 2, FailurePolicy.ABORT);

        assertThatThrownBy(() -> runner.run(listener))
                .isInstanceOf(PluginExecutionException.class)
                .hasMessage("Detector glitch in frame 5");
        verify(listener).onFrameFailed(eq(5), any(PluginExecutionException.class));
        verify(listener, never()).onScanComplete(any());
    }

    @Test
    void shouldAbortWhenResultDoesNotMatchPropagatedShape() {
        tree.createAndAddNode(new WrongShapePlugin());
        ScanRunner runner = runner(ScanGeometry.linear(4), 1, FailurePolicy.SKIP);

        assertThatThrownBy(runner::run)
                .isInstanceOf(ShapeMismatchException.class)
                .hasMessageContaining("(3,)");
    }

    @Test
    void shouldDiscardFramesInFlightAfterStop() throws Exception {
        // Given
        ScanRunner runner = runner(ScanGeometry.linear(50), 1, FailurePolicy.ABORT);
        ScanListener stopAfterFirstFrame =
                new ScanListener() {
                    @Override
                    public void onFrameComplete(int frameIndex, Map<Integer, Dataset> frameResults) {
                        runner.stop();
                    }
                };

        // When
        ScanSummary summary = runner.run(stopAfterFirstFrame);

        // Then
        assertThat(summary.stopped()).isTrue();
        assertThat(summary.processedFrames()).isEqualTo(1);
        assertThat(runner.isStopRequested()).isTrue();
        assertThat(results.getResults(0).getSlice(1).sum()).isZero();
    }
}
