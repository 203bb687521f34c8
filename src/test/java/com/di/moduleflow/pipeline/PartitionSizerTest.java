package com.di.moduleflow.pipeline;

import com.di.moduleflow.config.SessionConf;
import com.di.moduleflow.model.PipelineTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartitionSizer Tests")
class PartitionSizerTest {

    private static PipelineTable target(double factor) {
        return PipelineTable.builder().name("t").shuffleFactor(factor).build();
    }

    @ParameterizedTest
    @CsvSource({
            "200, 1.0, 200",
            "200, 0.5, 100",
            "3, 0.5, 2",
            "1, 0.01, 1",
            "800, 2.0, 1000"
    })
    @DisplayName("Should scale by shuffle factor and cap at the session maximum")
    void testWritePartitions(int source, double factor, int expected) {
        SessionConf conf = new SessionConf(Map.of(PartitionSizer.MAX_SHUFFLE_PARTITIONS, "1000"));
        assertEquals(expected, new PartitionSizer(conf).writePartitions(source, target(factor)));
        assertEquals(String.valueOf(expected), conf.get(PartitionSizer.SHUFFLE_PARTITIONS));
    }

    @Test
    @DisplayName("Should be uncapped when no maximum is configured")
    void testWritePartitions_NoMax() {
        SessionConf conf = new SessionConf(Map.of());
        assertEquals(5000, new PartitionSizer(conf).writePartitions(2500, target(2.0)));
    }

    @Test
    @DisplayName("Should reject a non-positive source partition count")
    void testWritePartitions_InvalidSource() {
        PartitionSizer sizer = new PartitionSizer(new SessionConf(Map.of()));
        assertThrows(IllegalArgumentException.class, () -> sizer.writePartitions(0, target(1.0)));
    }
}
