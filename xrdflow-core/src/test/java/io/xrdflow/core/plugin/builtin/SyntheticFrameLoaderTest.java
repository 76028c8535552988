package io.xrdflow.core.plugin.builtin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.ConfigException;
import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.plugin.PluginResult;
import java.util.HashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SyntheticFrameLoaderTest {

    private SyntheticFrameLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SyntheticFrameLoader();
        loader.getParameters().set(SyntheticFrameLoader.ROWS, 2);
        loader.getParameters().set(SyntheticFrameLoader.COLUMNS, 3);
        loader.getParameters().set(SyntheticFrameLoader.FRAME_STEP, 10.0);
        loader.getParameters().set(SyntheticFrameLoader.BACKGROUND, 1.0);
    }

    @Test
    void shouldGeneratePredictableFrame() throws Exception {
        loader.calculateResultShape();

        PluginResult result = loader.execute(2, new HashMap<>());

        Dataset frame = result.data();
        assertThat(frame.getShape()).containsExactly(2, 3);
        assertThat(frame.getData()).containsExactly(21.0, 22.0, 23.0, 24.0, 25.0, 26.0);
        assertThat(frame.getAxis(0).label()).isEqualTo("detector row");
        assertThat(frame.getAxis(1).unit()).isEqualTo("pixel");
        assertThat(frame.getDataUnit()).isEqualTo("counts");
        assertThat(result.kwargs()).containsEntry("frame_index", 2);
    }

    @Test
    void shouldProduce1dFrameWithoutRows() throws Exception {
        loader.getParameters().set(SyntheticFrameLoader.ROWS, 0);
        loader.calculateResultShape();

        Dataset frame = loader.execute(0, new HashMap<>()).data();

        assertThat(loader.getResultShape()).containsExactly(3);
        assertThat(frame.getAxis(0).label()).isEqualTo("detector column");
        assertThat(frame.getAxis(0).range()).containsExactly(0.0, 1.0, 2.0);
    }

    @Test
    void shouldRejectInvalidFrameSize() {
        loader.getParameters().set(SyntheticFrameLoader.COLUMNS, 0);

        assertThatThrownBy(loader::calculateResultShape)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("columns=0");
    }

    @Test
    void shouldRejectNonIntegerInput() {
        assertThatThrownBy(() -> loader.execute("frame.tif", new HashMap<>()))
                .isInstanceOf(PluginExecutionException.class)
                .hasMessageContaining("frame.tif");
    }
}
