package com.example.gateway_bff.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.SocketTimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class ResourceServiceClientTest {

  @Test
  void getRelaysBearerTokenAndReturnsBody() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resource.test/resources/user"))
        .andExpect(method(GET))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer session-token"))
        .andRespond(
            withSuccess(
                """
                {"status":"success","message":"Retrieved 3 user resources","data":[]}
                """,
                MediaType.APPLICATION_JSON));

    final ResponseEntity<JsonNode> response =
        fixture.client.get("/resources/user", "session-token");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody().get("message").asText())
        .isEqualTo("Retrieved 3 user resources");
    fixture.server.verify();
  }

  @Test
  void getPassesThroughForbidden() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resource.test/resources/admin"))
        .andRespond(
            withStatus(HttpStatus.FORBIDDEN)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"Admin access required\"}"));

    final ResponseEntity<JsonNode> response =
        fixture.client.get("/resources/admin", "session-token");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    assertThat(response.getBody().get("error").asText()).isEqualTo("Admin access required");
  }

  @Test
  void getPassesThroughUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resource.test/user/profile"))
        .andRespond(
            withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"Invalid or expired token\"}"));

    final ResponseEntity<JsonNode> response = fixture.client.get("/user/profile", "expired");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    assertThat(response.getBody().get("error").asText()).isEqualTo("Invalid or expired token");
  }

  @Test
  void getMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resource.test/admin/stats"))
        .andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.get("/admin/stats", "session-token"))
        .isInstanceOf(ResourceIntegrationException.class)
        .extracting(ex -> ((ResourceIntegrationException) ex).reason())
        .isEqualTo(ResourceIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void getMapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo("http://resource.test/admin/users"))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.get("/admin/users", "session-token"))
        .isInstanceOf(ResourceIntegrationException.class)
        .extracting(ex -> ((ResourceIntegrationException) ex).reason())
        .isEqualTo(ResourceIntegrationException.Reason.TIMEOUT);
  }

  private static ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder().baseUrl("http://resource.test");
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    return new ClientFixture(new ResourceServiceClient(builder.build()), server);
  }

  private record ClientFixture(ResourceServiceClient client, MockRestServiceServer server) {}
}
