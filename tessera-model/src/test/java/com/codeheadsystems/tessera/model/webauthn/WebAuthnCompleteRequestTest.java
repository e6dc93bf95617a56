package com.codeheadsystems.tessera.model.webauthn;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class WebAuthnCompleteRequestTest {

  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  @Test
  void deserializesClientDataJsonName() throws Exception {
    String clientData = B64URL.encodeToString("{\"type\":\"webauthn.get\"}".getBytes(UTF_8));
    String json = "{\"identifier\":\"alice\",\"credentialId\":\"Y3JlZA\",\"clientDataJSON\":\"" + clientData
        + "\",\"authenticatorData\":\"AAEC\",\"signature\":\"c2ln\"}";
    WebAuthnCompleteRequest request = new ObjectMapper().readValue(json, WebAuthnCompleteRequest.class);

    assertThat(request.requireCredentialId()).isEqualTo("Y3JlZA");
    assertThat(new String(request.clientDataJsonBytes(), UTF_8)).isEqualTo("{\"type\":\"webauthn.get\"}");
    assertThat(request.authenticatorDataBytes()).containsExactly(0, 1, 2);
    assertThat(request.signatureBytes()).isEqualTo("sig".getBytes(UTF_8));
    assertThat(request.userHandleBytes()).isEmpty();
  }

  @Test
  void missingOrInvalidFields_throwWithFieldName() {
    WebAuthnCompleteRequest missing = new WebAuthnCompleteRequest("alice", "Y3JlZA", null, "AAEC", "c2ln", null);
    assertThatThrownBy(missing::clientDataJsonBytes)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Missing required field: clientDataJSON");

    WebAuthnCompleteRequest invalid = new WebAuthnCompleteRequest("alice", "Y3JlZA", "e30", "AAEC", "not*base64", null);
    assertThatThrownBy(invalid::signatureBytes)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Invalid base64 in field: signature");
  }

  @Test
  void startResponse_copiesAllowList() {
    WebAuthnStartResponse response = new WebAuthnStartResponse("chal", null, "example.com", 60_000);
    assertThat(response.allowCredentials()).isEmpty();
  }
}
