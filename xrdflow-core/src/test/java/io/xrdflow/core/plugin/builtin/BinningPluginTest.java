package io.xrdflow.core.plugin.builtin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xrdflow.core.data.AxisMetadata;
import io.xrdflow.core.data.Dataset;
import io.xrdflow.core.exception.ConfigException;
import java.util.HashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BinningPluginTest {

    private BinningPlugin binning;

    @BeforeEach
    void setUp() {
        binning = new BinningPlugin();
    }

    @Test
    void shouldAverageBlocksOf2dData() throws Exception {
        Dataset image = Dataset.zeros(4, 6);
        for (int i = 0; i < image.size(); i++) {
            image.getData()[i] = i;
        }

        Dataset binned = binning.execute(image, new HashMap<>()).data();

        assertThat(binned.getShape()).containsExactly(2, 3);
        assertThat(binned.get(0, 0)).isEqualTo(3.5);
        assertThat(binned.get(1, 2)).isEqualTo(19.5);
    }

    @Test
    void shouldDropIncompleteTrailingBinAndAverageAxisRange() throws Exception {
        Dataset profile = Dataset.of(new double[] {0, 1, 2, 3, 4}, 5);
        profile.setAxis(0, new AxisMetadata("q", "1/nm", new double[] {1, 2, 3, 4, 5}));

        Dataset binned = binning.execute(profile, new HashMap<>()).data();

        assertThat(binned.getData()).containsExactly(0.5, 2.5);
        assertThat(binned.getAxis(0).range()).containsExactly(1.5, 3.5);
        assertThat(binned.getAxis(0).unit()).isEqualTo("1/nm");
    }

    @Test
    void shouldPropagateBinnedShape() {
        binning.getParameters().set(BinningPlugin.BINNING, 3);
        binning.setInputShape(new int[] {10, 7});

        binning.calculateResultShape();

        assertThat(binning.getResultShape()).containsExactly(3, 2);
    }

    @Test
    void shouldRejectNonPositiveBinningBeforeExecution() {
        binning.getParameters().set(BinningPlugin.BINNING, -1);

        assertThatThrownBy(binning::preExecute)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("-1");
    }

    @Test
    void shouldRejectBinningLargerThanAxis() {
        binning.getParameters().set(BinningPlugin.BINNING, 4);
        binning.setInputShape(new int[] {3});

        assertThatThrownBy(binning::calculateResultShape)
                .isInstanceOf(ConfigException.class)
                .hasMessage("Binning factor 4 exceeds axis extent 3");
    }
}
