package io.xrdflow.core.plugin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xrdflow.core.exception.ConfigException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PluginParametersTest {

    private PluginParameters parameters;

    @BeforeEach
    void setUp() {
        parameters = new PluginParameters();
        parameters.add(PluginParameter.ofInt("binning", 2, "bin size"));
        parameters.add(PluginParameter.ofDouble("threshold", 0.5, null));
        parameters.add(PluginParameter.ofInt("x_stop", null, "optional stop"));
    }

    @Test
    void shouldCarryGenericParametersFirst() {
        assertThat(parameters.names())
                .containsExactly("label", "keep_results", "binning", "threshold", "x_stop");
        assertThat(parameters.getString(PluginParameters.LABEL)).isEmpty();
        assertThat(parameters.getBoolean(PluginParameters.KEEP_RESULTS)).isFalse();
    }

    @Test
    void shouldInitialiseWithDefaults() {
        assertThat(parameters.getInt("binning")).isEqualTo(2);
        assertThat(parameters.getDouble("threshold")).isEqualTo(0.5);
        assertThat(parameters.getInt("x_stop")).isNull();
        assertThat(parameters.getDefinition("threshold").description()).isEmpty();
    }

    @Test
    void shouldCoerceNumbersAndStrings() {
        parameters.set("binning", 4.0);
        parameters.set("threshold", 3);
        parameters.set("x_stop", " -2 ");
        parameters.set(PluginParameters.KEEP_RESULTS, "TRUE");

        assertThat(parameters.getInt("binning")).isEqualTo(4);
        assertThat(parameters.getDouble("threshold")).isEqualTo(3.0);
        assertThat(parameters.getInt("x_stop")).isEqualTo(-2);
        assertThat(parameters.getBoolean(PluginParameters.KEEP_RESULTS)).isTrue();
    }

    @Test
    void shouldAcceptNullForOptionalValues() {
        parameters.set("x_stop", 5);

        parameters.set("x_stop", null);

        assertThat(parameters.get("x_stop")).isNull();
    }

    @Test
    void shouldRejectNonIntegralValueForIntegerParameter() {
        assertThatThrownBy(() -> parameters.set("binning", 2.5))
                .isInstanceOf(ConfigException.class)
                .hasMessage("Invalid value '2.5' for parameter 'binning' of type Integer");
    }

    @Test
    void shouldRejectUnparsableValues() {
        assertThatThrownBy(() -> parameters.set("threshold", "high"))
                .isInstanceOf(ConfigException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> parameters.set(PluginParameters.KEEP_RESULTS, "yes"))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldRejectUnknownParameter() {
        assertThatThrownBy(() -> parameters.set("gain", 1))
                .isInstanceOf(ConfigException.class)
                .hasMessage("Unknown plugin parameter: gain");
        assertThatThrownBy(() -> parameters.get("gain")).isInstanceOf(ConfigException.class);
    }

    @Test
    void shouldRejectDuplicateDefinition() {
        assertThatThrownBy(() -> parameters.add(PluginParameter.ofInt("binning", 1, "")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldRejectUnsupportedParameterType() {
        assertThatThrownBy(() -> new PluginParameter("shape", int[].class, null, ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldExportValuesAsOrderedPairs() {
        parameters.set(PluginParameters.LABEL, "roi");

        assertThat(parameters.entries())
                .extracting(Map.Entry::getKey)
                .containsExactly("label", "keep_results", "binning", "threshold", "x_stop");
        assertThat(parameters.entries())
                .extracting(Map.Entry::getValue)
                .containsExactly("roi", false, 2, 0.5, null);
    }

    @Test
    void shouldCopyAllValues() {
        PluginParameters other = new PluginParameters();
        other.add(PluginParameter.ofInt("binning", 2, ""));
        other.add(PluginParameter.ofDouble("threshold", 0.5, ""));
        other.add(PluginParameter.ofInt("x_stop", null, ""));
        other.set("binning", 8);
        other.set("x_stop", 10);

        parameters.setAll(other);

        assertThat(parameters.getInt("binning")).isEqualTo(8);
        assertThat(parameters.getInt("x_stop")).isEqualTo(10);
    }
}
