package org.econdata.fredproxy.base;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;

import org.econdata.fredproxy.config.WireMockConfig;

@Import(WireMockConfig.class)
public abstract class AbstractWireMockTest extends AbstractIntegrationTest {

  /** WireMock server for FRED API responses, provided by {@link WireMockConfig}. */
  @Autowired protected WireMockServer wireMockServer;

  /**
   * Points the FRED client at the local WireMock server instead of the real FRED API.
   *
   * @param registry Spring dynamic property registry
   */
  @DynamicPropertySource
  static void configureWireMockProperties(DynamicPropertyRegistry registry) {
    var wireMock = WireMockConfig.getWireMockServer();
    registry.add("fred-proxy.fred.base-url", () -> "http://localhost:" + wireMock.port());
  }

  /** Resets stubs and binds the static {@link WireMock} DSL used by the fixtures to this server. */
  @BeforeEach
  protected void resetWireMock() {
    wireMockServer.resetAll();
    WireMock.configureFor("localhost", wireMockServer.port());
  }
}
