package io.xrdflow.core.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.xrdflow.core.exception.ConfigException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DatasetTest {

    private static Dataset ramp(int... shape) {
        Dataset dataset = Dataset.zeros(shape);
        double[] values = dataset.getData();
        for (int i = 0; i < values.length; i++) {
            values[i] = i;
        }
        return dataset;
    }

    @Nested
    class ConstructionTest {

        @Test
        void shouldCreateZeroFilledDataset() {
            Dataset dataset = Dataset.zeros(2, 3);

            assertThat(dataset.getShape()).containsExactly(2, 3);
            assertThat(dataset.size()).isEqualTo(6);
            assertThat(dataset.ndim()).isEqualTo(2);
            assertThat(dataset.sum()).isZero();
            assertThat(dataset.getAxes()).containsOnly(AxisMetadata.empty());
        }

        @Test
        void shouldWrapArrayWithoutCopying() {
            double[] values = {1, 2, 3, 4};

            Dataset dataset = Dataset.of(values, 2, 2);
            values[3] = 40;

            assertThat(dataset.get(1, 1)).isEqualTo(40.0);
        }

        @Test
        void shouldRejectMismatchedLength() {
            assertThatThrownBy(() -> Dataset.of(new double[5], 2, 2))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("(2, 2)");
        }

        @Test
        void shouldRejectNegativeExtent() {
            assertThatThrownBy(() -> Dataset.zeros(3, -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectShapeWithTooManyElements() {
            assertThatThrownBy(() -> Dataset.zeros(50_000, 50_000))
                    .isInstanceOf(ConfigException.class)
                    .hasMessageContaining("(50000, 50000)")
                    .hasCauseInstanceOf(ArithmeticException.class);
        }

        @Test
        void shouldNotExposeShapeArray() {
            Dataset dataset = Dataset.zeros(4);

            dataset.getShape()[0] = 9;

            assertThat(dataset.getShape()).containsExactly(4);
        }
    }

    @Nested
    class IndexingTest {

        @Test
        void shouldAddressValuesRowMajor() {
            Dataset dataset = ramp(2, 3, 4);

            assertThat(dataset.get(1, 2, 3)).isEqualTo(23.0);
            assertThat(dataset.get(0, 1, 0)).isEqualTo(4.0);
        }

        @Test
        void shouldSetSingleValue() {
            Dataset dataset = Dataset.zeros(2, 2);

            dataset.set(7.5, 1, 0);

            assertThat(dataset.getData()).containsExactly(0.0, 0.0, 7.5, 0.0);
        }

        @Test
        void shouldRejectWrongNumberOfIndices() {
            assertThatThrownBy(() -> ramp(2, 3).get(1))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Expected 2 indices");
        }

        @Test
        void shouldRejectIndexOutOfRange() {
            assertThatThrownBy(() -> ramp(2, 3).get(2, 0))
                    .isInstanceOf(IndexOutOfBoundsException.class)
                    .hasMessageContaining("axis 0");
        }
    }

    @Nested
    class SlicingTest {

        @Test
        void shouldWriteTrailingBlock() {
            Dataset composite = Dataset.zeros(4, 6, 3);

            composite.setSlice(new int[] {2, 1}, Dataset.of(new double[] {7, 8, 9}, 3));

            assertThat(composite.get(2, 1, 0)).isEqualTo(7.0);
            assertThat(composite.get(2, 1, 2)).isEqualTo(9.0);
            assertThat(composite.sum()).isEqualTo(24.0);
        }

        @Test
        void shouldRejectBlockOfWrongShape() {
            Dataset composite = Dataset.zeros(4, 3);

            assertThatThrownBy(() -> composite.setSlice(new int[] {0}, Dataset.zeros(4)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Slice has shape (3,) but value has shape (4,)");
        }

        @Test
        void shouldReadCopyOfTrailingBlockWithMetadata() {
            Dataset composite = ramp(2, 3);
            composite.setAxis(1, new AxisMetadata("2theta", "deg", new double[] {10, 20, 30}));
            composite.setDataLabel("intensity");

            Dataset row = composite.getSlice(1);
            row.getData()[0] = -1;

            assertThat(row.getShape()).containsExactly(3);
            assertThat(row.getData()).containsExactly(-1.0, 4.0, 5.0);
            assertThat(composite.get(1, 0)).isEqualTo(3.0);
            assertThat(row.getAxis(0).label()).isEqualTo("2theta");
            assertThat(row.getDataLabel()).isEqualTo("intensity");
        }

        @Test
        void shouldReshapeIntoIndependentCopy() {
            Dataset dataset = ramp(2, 3);
            dataset.setAxis(0, new AxisMetadata("row", "", null));
            dataset.setDataUnit("counts");

            Dataset flat = dataset.reshape(6);
            flat.getData()[0] = 100;

            assertThat(flat.getShape()).containsExactly(6);
            assertThat(flat.getAxis(0)).isEqualTo(AxisMetadata.empty());
            assertThat(flat.getDataUnit()).isEqualTo("counts");
            assertThat(dataset.get(0, 0)).isZero();
        }

        @Test
        void shouldCopyValuesAndMetadata() {
            Dataset dataset = ramp(3);
            dataset.setAxis(0, new AxisMetadata("q", "1/nm", new double[] {1, 2, 3}));

            Dataset copy = dataset.copy();
            copy.getData()[1] = 50;
            copy.setAxis(0, null);

            assertThat(dataset.get(1)).isEqualTo(1.0);
            assertThat(dataset.getAxis(0).unit()).isEqualTo("1/nm");
            assertThat(copy.getAxis(0)).isEqualTo(AxisMetadata.empty());
        }
    }

    @Nested
    class MetadataTest {

        @Test
        void shouldNormalizeNullLabelsToEmpty() {
            AxisMetadata axis = new AxisMetadata(null, null, null);

            assertThat(axis.label()).isEmpty();
            assertThat(axis.unit()).isEmpty();
            assertThat(axis.rangeOrIndices(3)).containsExactly(0.0, 1.0, 2.0);
        }

        @Test
        void shouldCompareRangesByValue() {
            assertThat(new AxisMetadata("x", "mm", new double[] {1, 2}))
                    .isEqualTo(new AxisMetadata("x", "mm", new double[] {1, 2}))
                    .hasSameHashCodeAs(new AxisMetadata("x", "mm", new double[] {1, 2}));
        }

        @Test
        void shouldSliceRange() {
            AxisMetadata axis = new AxisMetadata("x", "mm", new double[] {0, 0.5, 1, 1.5});

            assertThat(axis.slice(1, 3).range()).containsExactly(0.5, 1.0);
            assertThat(AxisMetadata.empty().slice(0, 2).range()).isNull();
        }

        @Test
        void shouldFormatShapes() {
            assertThat(Shapes.format(new int[] {5})).isEqualTo("(5,)");
            assertThat(Shapes.format(new int[] {4, 6})).isEqualTo("(4, 6)");
            assertThat(Shapes.format(null)).isEqualTo("(unknown)");
            assertThat(Shapes.concat(new int[] {4, 6}, new int[] {3})).containsExactly(4, 6, 3);
            assertThat(Shapes.isResolved(new int[] {2, -1})).isFalse();
        }
    }
}
