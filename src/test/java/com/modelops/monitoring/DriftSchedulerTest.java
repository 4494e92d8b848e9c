package com.modelops.monitoring;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DriftSchedulerTest {

    @Mock DriftMonitor driftMonitor;
    @InjectMocks DriftScheduler scheduler;

    @Test
    void refresh_recomputesDrift() {
        when(driftMonitor.assess()).thenReturn(DriftAssessment.builder()
            .computedAt(Instant.now()).sampleSize(10).bufferCapacity(1000).threshold(0.1)
            .referenceLoaded(true)
            .features(List.of(DriftAssessment.FeatureDrift.builder()
                .feature("age").currentMean(60).referenceMean(40).referenceStd(10)
                .driftScore(1.0).highDrift(true).build()))
            .build());

        scheduler.refresh();
        scheduler.refresh();

        verify(driftMonitor, times(2)).assess();
    }
}
