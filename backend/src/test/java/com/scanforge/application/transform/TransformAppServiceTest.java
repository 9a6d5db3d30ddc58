package com.scanforge.application.transform;

import com.scanforge.application.transform.exception.InvalidTransformRequestException;
import com.scanforge.domain.transform.model.OutputWindow;
import com.scanforge.domain.transform.model.TransformationResult;
import com.scanforge.infrastructure.pipeline.TransformProperties;
import com.scanforge.infrastructure.pipeline.TransformationPipeline;
import com.scanforge.infrastructure.preprocessing.SourceNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransformAppServiceTest {

    @Mock
    private TransformationPipeline pipeline;

    private TransformProperties properties;
    private TransformAppService service;

    @BeforeEach
    void setUp() {
        properties = new TransformProperties();
        service = new TransformAppService(new SourceNormalizer(), pipeline, properties);
    }

    // ── Request validation ──

    @Nested
    @DisplayName("Rejected requests")
    class Rejected {

        @Test
        @DisplayName("Blank source → failure, pipeline untouched")
        void blank_source() {
            TransformationResult result = service.transform("  \n", null, "2024-01-01", "2024-01-31", false);

            assertThat(result.success()).isFalse();
            assertThat(result.errors()).containsExactly("Source code is required");
            assertThat(result.metadata()).containsEntry("output_window", "2024-01-01..2024-01-31");
            verifyNoInteractions(pipeline);
        }

        @Test
        @DisplayName("Source over the configured length → failure")
        void too_long() {
            properties.setMaxSourceLength(10);

            TransformationResult result = service.transform("x = 12345678901", null, "2024-01-01", "2024-01-31",
                    false);

            assertThat(result.errors())
                    .containsExactly("Source code exceeds the maximum length of 10 characters");
            verifyNoInteractions(pipeline);
        }

        @Test
        @DisplayName("Non-ISO dates → failure naming both bounds")
        void bad_dates() {
            TransformationResult result = service.transform("x = 1", null, "2024-13-01", "2024-01-31", false);

            assertThat(result.errors())
                    .containsExactly("Output window dates must be ISO-8601 (YYYY-MM-DD): 2024-13-01, 2024-01-31");
        }

        @Test
        @DisplayName("Start after end → failure")
        void start_after_end() {
            TransformationResult result = service.transform("x = 1", null, "2024-02-01", "2024-01-31", false);

            assertThat(result.errors()).containsExactly("Output window start 2024-02-01 is after end 2024-01-31");
            verifyNoInteractions(pipeline);
        }

        @Test
        @DisplayName("validateTransformRequest throws the request exception directly")
        void validate_throws() {
            assertThatThrownBy(() -> service.validateTransformRequest(null, "2024-01-01", "2024-01-31"))
                    .isInstanceOf(InvalidTransformRequestException.class)
                    .hasMessage("Source code is required");
            assertThatThrownBy(() -> service.validateTransformRequest("x = 1", null, "2024-01-31"))
                    .isInstanceOf(InvalidTransformRequestException.class)
                    .hasMessageStartingWith("Output window dates must be ISO-8601");
        }
    }

    // ── Accepted requests ──

    @Test
    @DisplayName("Valid request → normalized source and parsed window reach the pipeline")
    void normalized_source_reaches_pipeline() {
        TransformationResult expected = new TransformationResult(true, "class X:\n    pass\n", List.of(),
                Map.of(), List.of(), 0);
        when(pipeline.transform(anyString(), any(), any(OutputWindow.class), anyBoolean())).thenReturn(expected);

        TransformationResult result = service.transform("\uFEFFx = 1\r\n", "gap", "2024-01-02", "2024-03-28", true);

        assertThat(result).isSameAs(expected);
        verify(pipeline).transform("x = 1\n", "gap",
                new OutputWindow(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 3, 28)), true);
    }
}
