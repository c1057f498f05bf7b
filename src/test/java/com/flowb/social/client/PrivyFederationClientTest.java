package com.flowb.social.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowb.social.config.PrivyProperties;
import com.flowb.social.dto.LinkedHandles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PrivyFederationClientTest {

    private static final String USER_JSON = "{\"id\":\"did:privy:abc\",\"linked_accounts\":["
            + "{\"type\":\"telegram\",\"telegram_user_id\":\"12345\"},"
            + "{\"type\":\"farcaster\",\"fid\":4242},"
            + "{\"type\":\"email\",\"address\":\"a@b.c\"}]}";

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private PrivyFederationClient client;

    @BeforeEach
    void setUp() {
        PrivyProperties properties = new PrivyProperties();
        properties.setAppId("app-1");
        properties.setAppSecret("secret");
        client = new PrivyFederationClient(httpClient, new ObjectMapper(), properties);
    }

    @Test
    void lookup_TelegramUser_SearchesAndReturnsOtherHandles() throws Exception {
        // Given
        doReturn(httpResponse).when(httpClient).send(any(), any());
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("{\"data\":[" + USER_JSON + "]}");

        // When
        Optional<LinkedHandles> handles = client.lookupLinkedHandles("telegram_12345");

        // Then
        assertThat(handles).isPresent();
        assertThat(handles.get().getFederationId()).isEqualTo("did:privy:abc");
        assertThat(handles.get().getLinkedHandles()).containsExactly("farcaster_4242", "web_did:privy:abc");
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertThat(captor.getValue().uri().toString()).isEqualTo("https://auth.privy.io/api/v1/users/search");
        assertThat(captor.getValue().headers().firstValue("privy-app-id")).contains("app-1");
    }

    @Test
    void lookup_WebUser_FetchesUserDirectly() throws Exception {
        // Given
        doReturn(httpResponse).when(httpClient).send(any(), any());
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn(USER_JSON);

        // When
        Optional<LinkedHandles> handles = client.lookupLinkedHandles("web_did:privy:abc");

        // Then
        assertThat(handles.get().getLinkedHandles()).containsExactly("telegram_12345", "farcaster_4242");
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        assertThat(captor.getValue().method()).isEqualTo("GET");
    }

    @Test
    void lookup_NoMatch_ReturnsEmpty() throws Exception {
        // Given
        doReturn(httpResponse).when(httpClient).send(any(), any());
        when(httpResponse.statusCode()).thenReturn(200);
        when(httpResponse.body()).thenReturn("{\"data\":[]}");

        // When / Then
        assertThat(client.lookupLinkedHandles("farcaster_4242")).isEmpty();
    }

    @Test
    void lookup_ServiceDown_ReturnsEmptyWithoutThrowing() throws Exception {
        // Given
        doThrow(new IOException("timeout")).when(httpClient).send(any(), any());

        // When / Then
        assertThat(client.lookupLinkedHandles("telegram_12345")).isEmpty();
    }

    @Test
    void lookup_UnsupportedPlatform_SkipsCall() {
        assertThat(client.lookupLinkedHandles("discord_99")).isEmpty();
        verifyNoInteractions(httpClient);
    }
}
