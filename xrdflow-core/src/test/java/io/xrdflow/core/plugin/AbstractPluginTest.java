package io.xrdflow.core.plugin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xrdflow.core.exception.PluginExecutionException;
import io.xrdflow.core.plugin.builtin.BinningPlugin;
import io.xrdflow.core.plugin.builtin.SumPlugin;
import java.util.HashMap;
import org.junit.jupiter.api.Test;

class AbstractPluginTest {

    @Test
    void shouldCopyParametersAndShapesIndependently() {
        BinningPlugin original = new BinningPlugin();
        original.getParameters().set(BinningPlugin.BINNING, 4);
        original.setInputShape(new int[] {8, 8});
        original.calculateResultShape();

        Plugin copy = original.copy();
        copy.getParameters().set(BinningPlugin.BINNING, 2);

        assertThat(copy).isInstanceOf(BinningPlugin.class).isNotSameAs(original);
        assertThat(copy.getInputShape()).containsExactly(8, 8);
        assertThat(copy.getResultShape()).containsExactly(2, 2);
        assertThat(original.getParameters().getInt(BinningPlugin.BINNING)).isEqualTo(4);
    }

    @Test
    void shouldNotExposeShapeArrays() {
        SumPlugin sum = new SumPlugin();
        int[] shape = {3, 4};
        sum.setInputShape(shape);

        shape[0] = 99;
        sum.getInputShape()[1] = 99;

        assertThat(sum.getInputShape()).containsExactly(3, 4);
    }

    @Test
    void shouldTitleResultsByLabelOrName() {
        SumPlugin sum = new SumPlugin();

        assertThat(sum.getResultTitle(3)).isEqualTo("[Sum] (node #003)");

        sum.getParameters().set(PluginParameters.LABEL, "Peak area");
        assertThat(sum.getResultTitle(12)).isEqualTo("Peak area (node #012)");
    }

    @Test
    void shouldDefaultClassNameToSimpleName() {
        assertThat(new SumPlugin().getPluginClass()).isEqualTo("SumPlugin");
        assertThat(new SumPlugin().isKeepResults()).isFalse();
    }

    @Test
    void shouldRejectNonDatasetInput() {
        assertThatThrownBy(() -> new SumPlugin().execute("raw", new HashMap<>()))
                .isInstanceOf(PluginExecutionException.class)
                .hasMessage("Plugin 'Sum' expects a Dataset as input, got String");
    }
}
