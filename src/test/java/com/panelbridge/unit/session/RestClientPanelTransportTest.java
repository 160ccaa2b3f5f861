package com.panelbridge.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.panelbridge.domain.model.PanelCredentials;
import com.panelbridge.exception.AuthException;
import com.panelbridge.exception.AuthFailureCause;
import com.panelbridge.mapper.JsonHelper;
import com.panelbridge.session.PanelRequest;
import com.panelbridge.session.PanelResponse;
import com.panelbridge.session.RestClientPanelTransport;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

/**
 * Unit tests for {@link RestClientPanelTransport} against {@link MockRestServiceServer}.
 */
class RestClientPanelTransportTest {

    private static final String BASE = "https://panel.local:11001";

    private MockRestServiceServer server;
    private RestClientPanelTransport transport;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new RestClientPanelTransport(builder.build());
    }

    @Test
    @DisplayName("login posts the credentials and returns the ss-id cookie value")
    void loginReturnsSessionCookie() {
        server.expect(requestTo(BASE + "/auth"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"Username\":\"admin\",\"Password\":\"secret\"}"))
                .andRespond(withSuccess()
                        .header(HttpHeaders.SET_COOKIE, "ss-opt=temp; path=/")
                        .header(HttpHeaders.SET_COOKIE, "ss-id=abc123; path=/"));

        String token = transport.login(credentials());

        assertThat(token).isEqualTo("abc123");
        server.verify();
    }

    @Test
    @DisplayName("login maps 401 to AuthException CREDENTIALS")
    void loginRefused() {
        server.expect(requestTo(BASE + "/auth")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> transport.login(credentials()))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getFailureCause())
                .isEqualTo(AuthFailureCause.CREDENTIALS);
    }

    @Test
    @DisplayName("login without an ss-id cookie is treated as refused")
    void loginWithoutCookie() {
        server.expect(requestTo(BASE + "/auth")).andRespond(withSuccess());

        assertThatThrownBy(() -> transport.login(credentials()))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("ss-id");
    }

    @Test
    @DisplayName("send attaches the session cookie, query parameters and JSON body")
    void sendAttachesCookie() {
        server.expect(requestTo(BASE + "/api/ActionPlans/12/Exec?PartitionId=3"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.COOKIE, "ss-id=tok"))
                .andExpect(content().json("{\"SessionVars\":{}}"))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        PanelRequest request = PanelRequest.post("/api/ActionPlans/12/Exec", Map.of("SessionVars", Map.of()))
                .queryParam("PartitionId", 3)
                .build();
        PanelResponse response = transport.send(BASE, request, "tok");

        assertThat(response.isSuccess()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("send returns error statuses as responses instead of throwing")
    void sendReturnsErrorStatus() {
        server.expect(requestTo(BASE + "/api/Doors/5/Status"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body("{\"Message\":\"Not found\"}"));

        PanelResponse response = transport.send(BASE, PanelRequest.get("/api/Doors/5/Status").build(), "tok");

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(JsonHelper.text(response.json(), "Message")).isEqualTo("Not found");
    }

    private static PanelCredentials credentials() {
        return PanelCredentials.builder().baseUrl(BASE + "/").username("admin").password("secret").build();
    }
}
