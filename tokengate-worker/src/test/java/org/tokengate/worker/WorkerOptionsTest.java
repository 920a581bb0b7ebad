package org.tokengate.worker;

import static org.assertj.core.api.Assertions.assertThat;

import io.vertx.core.json.JsonObject;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.tokengate.worker.idp.IdpClientOptions;

class WorkerOptionsTest {

  @AfterEach
  void clear() {
    System.clearProperty(WorkerOptions.IDP_URL);
  }

  @Test
  void defaults() {
    WorkerOptions options = WorkerOptions.fromConfig(new JsonObject());
    assertThat(options.getTokenSubject()).isEqualTo("token.request");
    assertThat(options.getScope()).isEqualTo("openid profile");
    assertThat(options.getWorkerName()).isNotEmpty();
    IdpClientOptions idp = options.getIdpClientOptions();
    assertThat(idp.getTimeout()).isEqualTo(10000L);
    assertThat(idp.isSimulate()).isFalse();
    if (System.getenv("IDP_URL") == null) {
      assertThat(idp.getUrl()).isEqualTo("https://idp.example.com");
    }
    if (System.getenv("IDP_TOKEN_PATH") == null) {
      assertThat(idp.getTokenPath())
          .isEqualTo("/realms/phoenix/protocol/openid-connect/token");
    }
  }

  @Test
  void fromJsonAndProperty() {
    JsonObject conf = new JsonObject()
        .put("token_subject", "tokens.v2")
        .put("worker_name", "w7")
        .put("idp_url", "http://json")
        .put("idp_token_path", "/t")
        .put("idp_timeout_ms", 250)
        .put("idp_scope", "openid")
        .put("idp_simulate", true);
    System.setProperty(WorkerOptions.IDP_URL, "http://prop");
    WorkerOptions options = WorkerOptions.fromConfig(conf);
    assertThat(options.getTokenSubject()).isEqualTo("tokens.v2");
    assertThat(options.getWorkerName()).isEqualTo("w7");
    assertThat(options.getScope()).isEqualTo("openid");
    assertThat(options.getIdpClientOptions().getUrl()).isEqualTo("http://prop");
    assertThat(options.getIdpClientOptions().getTokenPath()).isEqualTo("/t");
    assertThat(options.getIdpClientOptions().getTimeout()).isEqualTo(250L);
    assertThat(options.getIdpClientOptions().isSimulate()).isTrue();
  }

  @Test
  void hostNameOnlyAsLastResort() {
    AtomicInteger lookups = new AtomicInteger();
    Supplier<String> hostName = () -> {
      lookups.incrementAndGet();
      return "host-1";
    };
    WorkerOptions named = WorkerOptions.fromConfig(
        new JsonObject().put("worker_name", "w1"), hostName);
    assertThat(named.getWorkerName()).isEqualTo("w1");
    assertThat(lookups.get()).isZero();

    if (System.getenv("POD_NAME") == null) {
      WorkerOptions unnamed = WorkerOptions.fromConfig(new JsonObject(), hostName);
      assertThat(unnamed.getWorkerName()).isEqualTo("host-1");
      assertThat(lookups.get()).isEqualTo(1);
    }
  }
}
