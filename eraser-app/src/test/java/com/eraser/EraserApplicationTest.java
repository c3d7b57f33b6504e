package com.eraser;

import com.eraser.batch.service.BatchService;
import com.eraser.config.BatchDirectoryRunner;
import com.eraser.image.config.DetectionProperties;
import com.eraser.image.inpaint.InpainterFactory;
import com.eraser.image.service.WatermarkRemovalService;
import com.eraser.web.controller.WatermarkController;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "eraser.detection.outlier-std-factor=2.0")
class EraserApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private DetectionProperties detectionProperties;

    @Test
    void should_WireAllModules_When_ContextStarts() {
        assertThat(context.getBean(WatermarkRemovalService.class)).isNotNull();
        assertThat(context.getBean(InpainterFactory.class)).isNotNull();
        assertThat(context.getBean(BatchService.class)).isNotNull();
        assertThat(context.getBean(WatermarkController.class)).isNotNull();
        assertThat(context.getBean(BatchDirectoryRunner.class)).isNotNull();
    }

    @Test
    void should_BindDetectionThresholds_When_PropertiesOverridden() {
        assertThat(detectionProperties.getOutlierStdFactor()).isEqualTo(2.0);
        assertThat(detectionProperties.getCannyLowThreshold()).isEqualTo(30.0);
    }
}
