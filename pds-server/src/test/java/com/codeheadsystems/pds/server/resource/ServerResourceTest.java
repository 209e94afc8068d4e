package com.codeheadsystems.pds.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.pds.model.server.CreateAccountRequest;
import com.codeheadsystems.pds.model.server.CreateAccountResponse;
import com.codeheadsystems.pds.model.server.GetSessionResponse;
import com.codeheadsystems.pds.server.exception.RegistrationError;
import com.codeheadsystems.pds.server.exception.RegistrationException;
import com.codeheadsystems.pds.server.manager.AccountRegistrationManager;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ServerResourceTest {

  private static final String DID = "did:plc:ewvi7nxzyoun6zhxrhs64oiz";
  private static final String HANDLE = "alice.example";

  @Mock private AccountRegistrationManager accountRegistrationManager;
  private ServerResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
    // WebApplicationException needs a JAX-RS RuntimeDelegate; only the API jar is on the test classpath.
    RuntimeDelegate mockRd = mock(RuntimeDelegate.class);
    Response.ResponseBuilder mockBuilder = mock(Response.ResponseBuilder.class, Mockito.RETURNS_SELF);
    Response mockResponse = mock(Response.class);

    when(mockRd.createResponseBuilder()).thenReturn(mockBuilder);
    when(mockBuilder.status(anyInt(), anyString())).thenReturn(mockBuilder);
    when(mockBuilder.build()).thenReturn(mockResponse);
    when(mockResponse.getStatus()).thenReturn(Response.Status.BAD_REQUEST.getStatusCode());

    RuntimeDelegate.setInstance(mockRd);
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    RuntimeDelegate.setInstance(null);
  }

  @BeforeEach
  void setUp() {
    resource = new ServerResource(accountRegistrationManager);
  }

  @Test
  void createAccount_validRequest_returnsManagerResponse() {
    CreateAccountRequest request = new CreateAccountRequest("a@x.com", "p", HANDLE, "CODE-1");
    CreateAccountResponse expected = new CreateAccountResponse(HANDLE, DID, "access", "refresh");
    when(accountRegistrationManager.register(request)).thenReturn(expected);

    assertThat(resource.createAccount(request)).isEqualTo(expected);
  }

  @Test
  void createAccount_nullBody_throwsBadRequest() {
    assertThatThrownBy(() -> resource.createAccount(null))
        .isInstanceOf(WebApplicationException.class)
        .hasMessage("Missing request body")
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
    verifyNoInteractions(accountRegistrationManager);
  }

  @Test
  void createAccount_refused_propagatesRegistrationException() {
    CreateAccountRequest request = new CreateAccountRequest("a@x.com", "p", HANDLE, "CODE-1");
    when(accountRegistrationManager.register(request))
        .thenThrow(new RegistrationException(RegistrationError.INVALID_INVITE_CODE, "Provided invite code not available"));

    assertThatThrownBy(() -> resource.createAccount(request))
        .isInstanceOf(RegistrationException.class)
        .hasMessage("Provided invite code not available");
  }

  @Test
  void getSession_bearerToken_returnsSession() {
    GetSessionResponse expected = new GetSessionResponse(HANDLE, DID, "a@x.com");
    when(accountRegistrationManager.getSession("token-123")).thenReturn(expected);

    assertThat(resource.getSession("Bearer token-123")).isEqualTo(expected);
    verify(accountRegistrationManager).getSession("token-123");
  }

  @Test
  void getSession_missingHeader_throwsUnauthorized() {
    assertThatThrownBy(() -> resource.getSession(null))
        .isInstanceOf(WebApplicationException.class)
        .hasMessage("Authentication required");
    verifyNoInteractions(accountRegistrationManager);
  }

  @Test
  void getSession_nonBearerScheme_throwsUnauthorized() {
    assertThatThrownBy(() -> resource.getSession("Basic dXNlcjpwYXNz"))
        .isInstanceOf(WebApplicationException.class)
        .hasMessage("Authentication required");
  }

  @Test
  void getSession_rejectedToken_throwsUnauthorized() {
    when(accountRegistrationManager.getSession("expired")).thenThrow(new SecurityException("Authentication failed"));

    assertThatThrownBy(() -> resource.getSession("Bearer expired"))
        .isInstanceOf(WebApplicationException.class)
        .hasMessage("Authentication failed");
  }
}
