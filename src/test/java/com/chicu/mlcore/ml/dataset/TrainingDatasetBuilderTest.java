package com.chicu.mlcore.ml.dataset;

import com.chicu.mlcore.ml.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrainingDatasetBuilderTest {

    private final TrainingDatasetBuilder builder = new TrainingDatasetBuilder();

    @Test
    void build_shouldProduceLabeledDataset() {
        TrainingDatasetBuilder.Rows rows = TrainingDatasetBuilder.Rows.empty()
                .add(new double[]{1.0, 2.0}, 0)
                .add(new double[]{3.0, 4.0}, 1);

        TrainingDatasetBuilder.Dataset ds = builder.build(rows);

        assertTrue(ds.labeled());
        assertEquals(2, ds.samples());
        assertEquals(2, ds.features());
        assertArrayEquals(new int[]{0, 1}, ds.y());
        assertNotNull(ds.datasetId());
    }

    @Test
    void build_withoutLabels_shouldBeUnlabeled() {
        List<double[]> x = new ArrayList<>(List.of(new double[]{1.0}, new double[]{2.0}));

        TrainingDatasetBuilder.Dataset ds = builder.build(new TrainingDatasetBuilder.Rows(" ds-1 ", x, null));

        assertFalse(ds.labeled());
        assertEquals("ds-1", ds.datasetId());
    }

    @Test
    void build_shouldCopyRows() {
        double[] row = {1.0, 2.0};
        TrainingDatasetBuilder.Dataset ds = builder.build(TrainingDatasetBuilder.Rows.empty().add(row, 1));

        row[0] = 99.0;

        assertEquals(1.0, ds.x()[0][0]);
    }

    @Test
    void build_shouldRejectBadInput() {
        assertThrows(ValidationException.class, () -> builder.build(null));
        assertThrows(ValidationException.class, () -> builder.build(TrainingDatasetBuilder.Rows.empty()));
        assertThrows(ValidationException.class, () -> builder.build(TrainingDatasetBuilder.Rows.empty()
                .add(new double[]{1.0}, 2)));
        assertThrows(ValidationException.class, () -> builder.build(TrainingDatasetBuilder.Rows.empty()
                .add(new double[]{1.0, 2.0}, 0)
                .add(new double[]{1.0}, 1)));
        assertThrows(ValidationException.class, () -> builder.build(TrainingDatasetBuilder.Rows.empty()
                .add(new double[]{Double.NaN}, 0)));
    }

    @Test
    void checkMatrix_shouldRejectEmptyColumns() {
        assertThrows(ValidationException.class, () -> TrainingDatasetBuilder.checkMatrix(new double[][]{{}, {}}));
    }
}
