package com.example.tubefetch.exceptions;

import com.example.tubefetch.domain.JobState;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler Tests")
@MockitoSettings(strictness = Strictness.LENIENT)
class GlobalExceptionHandlerTest {

    @InjectMocks
    private GlobalExceptionHandler globalExceptionHandler;

    @Mock
    private WebRequest webRequest;

    private final String requestUri = "/progress/abc";

    @BeforeEach
    void setUp() {
        when(webRequest.getDescription(false)).thenReturn(requestUri);
    }

    private static void assertDecorated(ProblemDetail problemDetail, String expectedError) {
        assertThat(problemDetail.getProperties())
                .containsEntry("error", expectedError)
                .containsKey("timestamp")
                .extracting("timestamp").isInstanceOf(Instant.class);
    }

    @Nested
    @DisplayName("Job Exceptions")
    class JobExceptionTests {

        @Test
        @DisplayName("JobNotFoundException gives 404 without echoing the id")
        void handleJobNotFound() {
            ProblemDetail problemDetail = globalExceptionHandler.handleJobNotFound(
                    new JobNotFoundException("abc"), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
            assertThat(problemDetail.getTitle()).isEqualTo("Not Found");
            assertThat(problemDetail.getDetail()).isEqualTo("Download not found");
            assertThat(problemDetail.getInstance()).isEqualTo(URI.create(requestUri));
            assertDecorated(problemDetail, "Download not found");
        }

        @Test
        @DisplayName("JobNotReadyException gives 409 with the current status")
        void handleJobNotReady() {
            ProblemDetail problemDetail = globalExceptionHandler.handleJobNotReady(
                    new JobNotReadyException("abc", JobState.PROCESSING), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.CONFLICT.value());
            assertDecorated(problemDetail, "Download is not ready (status: processing)");
        }
    }

    @Nested
    @DisplayName("Pipeline and Storage Exceptions")
    class PipelineExceptionTests {

        @Test
        @DisplayName("PipelineException hides tool output behind a generic message")
        void handlePipelineException() {
            PipelineException ex = new PipelineException("ffmpeg exited with 1", 1, "Invalid data found at /tmp/x");

            ProblemDetail problemDetail = globalExceptionHandler.handlePipelineException(ex, webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
            assertThat(problemDetail.getDetail()).doesNotContain("/tmp/x");
            assertDecorated(problemDetail, "Video processing failed. Please try a different format.");
        }

        @Test
        @DisplayName("WorkspaceStorageException gives 500")
        void handleWorkspaceStorageException() {
            ProblemDetail problemDetail = globalExceptionHandler.handleWorkspaceStorageException(
                    new WorkspaceStorageException("Could not read /srv/downloads/abc/out.mp4"), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
            assertThat(problemDetail.getDetail()).doesNotContain("/srv/downloads");
        }
    }

    @Nested
    @DisplayName("Metadata Exceptions")
    class MetadataExceptionTests {

        @Test
        @DisplayName("ExtractionException gives 502 with its summarized message")
        void handleExtractionException() {
            ProblemDetail problemDetail = globalExceptionHandler.handleExtractionException(
                    new ExtractionException("This video is unavailable."), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.BAD_GATEWAY.value());
            assertDecorated(problemDetail, "This video is unavailable.");
        }

        @Test
        @DisplayName("MetadataTimeoutException gives 504")
        void handleMetadataTimeout() {
            ProblemDetail problemDetail = globalExceptionHandler.handleMetadataTimeout(
                    new MetadataTimeoutException("Metadata lookup timed out"), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT.value());
        }

        @Test
        @DisplayName("InvalidVideoUrlException keeps its 400 status and reason")
        void handleInvalidUrl() {
            ProblemDetail problemDetail = globalExceptionHandler.handleResponseStatusException(
                    new InvalidVideoUrlException(), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
            assertThat(problemDetail.getTitle()).isEqualTo("Bad Request");
            assertDecorated(problemDetail, InvalidVideoUrlException.MESSAGE);
        }

        @Test
        @DisplayName("Any ResponseStatusException keeps its status")
        void handleResponseStatusException() {
            ProblemDetail problemDetail = globalExceptionHandler.handleResponseStatusException(
                    new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Try later"), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE.value());
            assertDecorated(problemDetail, "Try later");
        }
    }

    private record TestDto(
            @NotBlank(message = "name is required") String name,
            @Size(min = 5, message = "value is too short") String value) {
    }

    @Nested
    @DisplayName("ConstraintViolationException Handling")
    class ConstraintViolationExceptionTests {

        @Test
        @DisplayName("Should return 400 with the first violation as the error")
        void handleConstraintViolationException() {
            try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
                Validator validator = factory.getValidator();
                Set<ConstraintViolation<TestDto>> violations = validator.validate(new TestDto("Test", "123"));
                ConstraintViolationException ex = new ConstraintViolationException("Validation failed", violations);

                ProblemDetail problemDetail = globalExceptionHandler.handleConstraintViolationException(ex, webRequest);

                assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST.value());
                assertDecorated(problemDetail, "value is too short");

                @SuppressWarnings("unchecked")
                Map<String, String> errors = (Map<String, String>) Objects.requireNonNull(problemDetail.getProperties()).get("errors");
                assertThat(errors).containsExactly(Map.entry("value", "value is too short"));
            }
        }
    }

    @Nested
    @DisplayName("Fallbacks")
    class FallbackTests {

        @Test
        @DisplayName("Unhandled exceptions give a generic 500")
        void handleGenericException() {
            ProblemDetail problemDetail = globalExceptionHandler.handleGenericException(
                    new IllegalStateException("boom at /etc/secret"), webRequest);

            assertThat(problemDetail.getStatus()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR.value());
            assertDecorated(problemDetail, "An unexpected internal error occurred. Please try again later.");
        }

        @Test
        @DisplayName("handleExceptionInternal builds a ProblemDetail when the body is missing")
        void handleExceptionInternal_NoBody() {
            ResponseEntity<Object> response = globalExceptionHandler.handleExceptionInternal(
                    new IllegalArgumentException("bad"), null, new HttpHeaders(), HttpStatus.BAD_REQUEST, webRequest);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
            assertThat(response.getBody()).isInstanceOf(ProblemDetail.class);
            ProblemDetail problemDetail = (ProblemDetail) response.getBody();
            assert problemDetail != null;
            assertThat(problemDetail.getDetail()).isEqualTo("The request could not be processed.");
            assertThat(problemDetail.getInstance()).isEqualTo(URI.create(requestUri));
            assertDecorated(problemDetail, "The request could not be processed.");
        }

        @Test
        @DisplayName("handleExceptionInternal keeps an existing error property")
        void handleExceptionInternal_KeepsError() {
            ProblemDetail body = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, "No static resource x");
            body.setProperty("error", "custom");

            ResponseEntity<Object> response = globalExceptionHandler.handleExceptionInternal(
                    new IllegalArgumentException("x"), body, new HttpHeaders(), HttpStatus.NOT_FOUND, webRequest);

            ProblemDetail problemDetail = (ProblemDetail) response.getBody();
            assert problemDetail != null;
            assertThat(problemDetail.getTitle()).isEqualTo("Not Found");
            assertDecorated(problemDetail, "custom");
        }
    }
}
