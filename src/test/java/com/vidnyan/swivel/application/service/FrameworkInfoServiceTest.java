package com.vidnyan.swivel.application.service;

import com.vidnyan.swivel.TestDoubles;
import com.vidnyan.swivel.adapter.out.framework.SwingFrameworkRuntime;
import com.vidnyan.swivel.application.port.in.DescribeFrameworkUseCase.FrameworkInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrameworkInfoServiceTest {

    @Test
    void describe_ShouldListCatalogueResolvedAgainstRuntime() {
        FrameworkInfo info = new FrameworkInfoService(new SwingFrameworkRuntime()).describe();

        assertTrue(info.available());
        assertNotNull(info.frameworkVersion());
        assertTrue(info.components().contains("JButton"));
        assertTrue(info.components().contains("JLabel"));
        assertFalse(info.components().contains("JPanel"));
        assertTrue(info.containers().contains("JPanel"));
        assertTrue(info.layouts().contains("BorderLayout"));
        assertTrue(info.unresolved().isEmpty(), () -> "unresolved " + info.unresolved());
    }

    @Test
    void describe_ShouldReportMissingRuntime() {
        FrameworkInfo info = new FrameworkInfoService(TestDoubles.unavailableRuntime()).describe();

        assertFalse(info.available());
        assertNull(info.frameworkVersion());
        assertTrue(info.unresolved().isEmpty());
        assertFalse(info.containers().isEmpty());
    }
}
