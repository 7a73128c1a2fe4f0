/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.autoheal.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tarik.autoheal.AgentConfig.BrowserType;
import org.tarik.autoheal.dto.ExecutionTrace.TraceStatus;
import org.tarik.autoheal.exceptions.SandboxTimeoutException;
import org.tarik.autoheal.exceptions.ServiceException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RemoteExecutionSandboxTest {
    private static final URI ENDPOINT = URI.create("http://sandbox.local/execute");
    private static final SandboxRequest REQUEST = new SandboxRequest("await page.goto('https://example.com')", true,
            BrowserType.FIREFOX, 30_000);

    @Mock
    private HttpClient httpClient;
    @Mock
    private HttpResponse<String> httpResponse;

    private RemoteExecutionSandbox sandbox;

    @BeforeEach
    void setUp() {
        sandbox = new RemoteExecutionSandbox(httpClient, ENDPOINT, 5_000);
    }

    private void respondWith(int statusCode, String body) throws Exception {
        when(httpResponse.statusCode()).thenReturn(statusCode);
        when(httpResponse.body()).thenReturn(body);
        when(httpClient.<String>send(any(), any())).thenReturn(httpResponse);
    }

    @Test
    @DisplayName("A failed execution is parsed into a failure response with its error signal")
    void shouldParseFailureResponse() throws Exception {
        // Given
        respondWith(200, """
                {
                  "status": "failure",
                  "logs": ["navigated", "clicking submit"],
                  "artifact_handles": ["step1_login.png"],
                  "duration_ms": 1250,
                  "error_signal": {
                    "message": "waiting for locator('#submit')",
                    "stack_trace": "at run_automation (line 12)",
                    "failing_step_index": 3
                  },
                  "cost": 0.002,
                  "sandbox_version": "1.4"
                }
                """);

        // When
        var response = sandbox.execute(REQUEST);

        // Then
        assertThat(response.status()).isEqualTo(SandboxResponse.Status.FAILURE);
        assertThat(response.cost()).isEqualByComparingTo("0.002");
        var trace = response.toTrace();
        assertThat(trace.status()).isEqualTo(TraceStatus.FAILURE);
        assertThat(trace.logs()).containsExactly("navigated", "clicking submit");
        assertThat(trace.artifactHandles()).containsExactly("step1_login.png");
        assertThat(trace.durationMillis()).isEqualTo(1250);
        assertThat(trace.errorSignal().message()).isEqualTo("waiting for locator('#submit')");
        assertThat(trace.errorSignal().failingStepIndex()).isEqualTo(3);
    }

    @Test
    @DisplayName("The request goes to the endpoint with the timeout extended by the grace period")
    void shouldPostToEndpointWithGraceTimeout() throws Exception {
        // Given
        respondWith(200, "{\"status\": \"success\", \"duration_ms\": 10}");
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);

        // When
        var response = sandbox.execute(REQUEST);

        // Then
        verify(httpClient).send(captor.capture(), any());
        var request = captor.getValue();
        assertThat(request.uri()).isEqualTo(ENDPOINT);
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.timeout()).contains(Duration.ofMillis(35_000));
        assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
        assertThat(response.status()).isEqualTo(SandboxResponse.Status.SUCCESS);
        assertThat(response.cost()).isEqualByComparingTo("0");
        assertThat(response.logs()).isEmpty();
    }

    @Test
    @DisplayName("A timed-out status in the body is reported as a sandbox timeout")
    void shouldReportTimedOutStatusAsTimeout() throws Exception {
        // Given
        respondWith(200, "{\"status\": \"timed_out\", \"duration_ms\": 30000}");

        // When / Then
        assertThatThrownBy(() -> sandbox.execute(REQUEST))
                .isInstanceOf(SandboxTimeoutException.class)
                .satisfies(e -> assertThat(((SandboxTimeoutException) e).getElapsedMillis()).isEqualTo(30_000));
    }

    @Test
    @DisplayName("A gateway timeout is reported as a sandbox timeout")
    void shouldReportGatewayTimeoutAsTimeout() throws Exception {
        // Given
        when(httpResponse.statusCode()).thenReturn(504);
        when(httpClient.<String>send(any(), any())).thenReturn(httpResponse);

        // When / Then
        assertThatThrownBy(() -> sandbox.execute(REQUEST)).isInstanceOf(SandboxTimeoutException.class);
    }

    @Test
    @DisplayName("An HTTP client timeout is reported as a sandbox timeout")
    void shouldReportClientTimeoutAsTimeout() throws Exception {
        // Given
        when(httpClient.<String>send(any(), any())).thenThrow(new HttpTimeoutException("request timed out"));

        // When / Then
        assertThatThrownBy(() -> sandbox.execute(REQUEST)).isInstanceOf(SandboxTimeoutException.class);
    }

    @Test
    @DisplayName("A server error is an execution service fault")
    void shouldReportServerErrorAsServiceFault() throws Exception {
        // Given
        respondWith(500, "Internal Server Error");

        // When / Then
        assertThatThrownBy(() -> sandbox.execute(REQUEST))
                .isInstanceOf(ServiceException.class)
                .isNotInstanceOf(SandboxTimeoutException.class)
                .hasMessageContaining("500")
                .satisfies(e -> assertThat(((ServiceException) e).getServiceKind())
                        .isEqualTo(ServiceException.ServiceKind.EXECUTION));
    }

    @Test
    @DisplayName("A body which isn't a sandbox response is an execution service fault")
    void shouldReportMalformedBodyAsServiceFault() throws Exception {
        // Given
        respondWith(200, "<html>gateway</html>");

        // When / Then
        assertThatThrownBy(() -> sandbox.execute(REQUEST))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("malformed");
    }

    @Test
    @DisplayName("An unreachable sandbox is an execution service fault")
    void shouldReportConnectionFailureAsServiceFault() throws Exception {
        // Given
        when(httpClient.<String>send(any(), any())).thenThrow(new IOException("Connection refused"));

        // When / Then
        assertThatThrownBy(() -> sandbox.execute(REQUEST))
                .isInstanceOf(ServiceException.class)
                .hasRootCauseInstanceOf(IOException.class);
    }
}
