package org.econdata.fredproxy.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import org.econdata.fredproxy.service.store.CacheStore;

@Component
public class FredProxyStartupConfig {

  private static final Logger log = LoggerFactory.getLogger(FredProxyStartupConfig.class);

  private final FredProxyProperties fredProxyProperties;
  private final CacheStore cacheStore;

  public FredProxyStartupConfig(FredProxyProperties properties, CacheStore cacheStore) {
    this.fredProxyProperties = properties;
    this.cacheStore = cacheStore;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void onStartup() {
    logConfiguration();
    initializeCache();
  }

  private void initializeCache() {
    try {
      cacheStore.initialize();
    } catch (Exception e) {
      log.error("CRITICAL: failed to initialize the observation cache, exiting...", e);
      throw new IllegalStateException(
          "Application cannot start without a usable cache. "
              + "Initialization failed: "
              + e.getMessage(),
          e);
    }
  }

  private void logConfiguration() {
    var fred = fredProxyProperties.getFred();
    log.info(
        "FRED Proxy Configuration:\n  baseUrl: {}\n  apiKey: {}\n  timeoutSeconds: {}\n"
            + "  connectTimeoutMillis: {}\n  pageSize: {}\n  corsAllowedOrigins: {}",
        fred.getBaseUrl(),
        fred.getMaskedApiKey(),
        fred.getTimeoutSeconds(),
        fred.getConnectTimeoutMillis(),
        fred.getPageSize(),
        fredProxyProperties.getCors().getAllowedOrigins());
  }
}
