package org.example.modelgen.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class TaskStatusReportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void fromData_readsResultUrlsAndProgress() throws Exception {
        JsonNode data = objectMapper.readTree("""
                {
                  "task_id": "t-1",
                  "status": "success",
                  "progress": 100,
                  "output": {"generated_image": "https://cdn.example/gen.png"},
                  "result": {
                    "pbr_model": {"url": "https://cdn.example/model.glb"},
                    "rendered_image": {"url": "https://cdn.example/preview.webp"}
                  }
                }
                """);

        TaskStatusReport report = TaskStatusReport.fromData(data);

        assertEquals("success", report.rawStatus());
        assertEquals(TaskStatus.SUCCESS, report.status());
        assertEquals(100, report.progress());
        assertEquals("https://cdn.example/model.glb", report.modelUrl());
        assertEquals("https://cdn.example/preview.webp", report.renderedImageUrl());
        assertEquals("https://cdn.example/gen.png", report.generatedImageUrl());
        assertNull(report.error());
        assertSame(data, report.payload());
    }

    @Test
    void fromData_keepsRawStatusWhenUnknown() throws Exception {
        JsonNode data = objectMapper.readTree("{\"status\": \"rendering\", \"progress\": \"n/a\"}");

        TaskStatusReport report = TaskStatusReport.fromData(data);

        assertEquals("rendering", report.rawStatus());
        assertEquals(TaskStatus.PROCESSING, report.status());
        assertNull(report.progress());
        assertNull(report.modelUrl());
    }

    @Test
    void fromData_readsErrorText() throws Exception {
        JsonNode data = objectMapper.readTree("{\"status\": \"failed\", \"error\": \"bad mesh\"}");

        TaskStatusReport report = TaskStatusReport.fromData(data);

        assertEquals(TaskStatus.FAILED, report.status());
        assertEquals("bad mesh", report.error());
    }
}
