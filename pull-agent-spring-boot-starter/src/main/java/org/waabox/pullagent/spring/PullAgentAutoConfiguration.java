package org.waabox.pullagent.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.waabox.pullagent.PullAgent;
import org.waabox.pullagent.cluster.MembershipTransport;
import org.waabox.pullagent.metrics.PullAgentMetrics;
import org.waabox.pullagent.proxy.ProxyConfig;
import org.waabox.pullagent.transport.http.HttpMembershipTransport;
import org.waabox.pullagent.transport.http.HttpTransportConfig;

/**
 * Spring Boot auto-configuration for the pull-agent.
 *
 * <p>This configuration creates and manages a singleton {@link PullAgent},
 * wiring an optional {@link MembershipTransport} and an optional
 * {@link PullAgentMetrics} bean. When no transport bean is present the
 * HTTP membership transport is used.
 *
 * <p>The agent lifecycle (start/stop) is managed through Spring's
 * {@link SmartLifecycle}; a failed join or bind fails the application
 * start.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(PullAgentProperties.class)
public class PullAgentAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PullAgentAutoConfiguration.class);

  /**
   * Creates the default HTTP membership transport, bound to
   * {@code pull-agent.transport.port}.
   *
   * <p>The agent closes the transport when it stops; closing it again on
   * context shutdown is a no-op.
   *
   * @param properties the configuration properties, never null
   *
   * @return the bound transport, never null
   */
  @Bean
  @ConditionalOnMissingBean(MembershipTransport.class)
  public HttpMembershipTransport membershipTransport(
      final PullAgentProperties properties) {
    final String advertiseAddress = properties.getAdvertiseAddress();
    return HttpMembershipTransport.open(HttpTransportConfig.create(
        properties.getBindAddress(), properties.getTransport().getPort(),
        advertiseAddress.isBlank() ? null : advertiseAddress));
  }

  /**
   * Creates the singleton {@link PullAgent} bean.
   *
   * @param properties       the configuration properties, never null
   * @param transport        the membership transport, never null
   * @param metricsProvider  provider for an optional PullAgentMetrics bean
   *
   * @return the configured, not yet started agent, never null
   */
  @Bean
  public PullAgent pullAgent(final PullAgentProperties properties,
      final MembershipTransport transport,
      final ObjectProvider<PullAgentMetrics> metricsProvider) {

    final ProxyConfig proxyConfig = ProxyConfig.builder()
        .bindAddress(properties.getBindAddress())
        .port(properties.getPort())
        .localDir(properties.getLocalDir())
        .chunkSize(properties.getChunkSize())
        .pollInterval(properties.getPollInterval())
        .stallTimeout(properties.getStallTimeout())
        .connectTimeout(properties.getConnectTimeout())
        .build();

    final PullAgent.Builder builder = PullAgent.builder()
        .transport(transport)
        .seed(properties.getPeer())
        .proxyConfig(proxyConfig);

    if (!properties.getAdvertiseAddress().isBlank()) {
      builder.advertiseAddress(properties.getAdvertiseAddress());
    }

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("PullAgent using custom PullAgentMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    log.info("PullAgent configured with {} transport, port {}, cache {}",
        transport.getClass().getSimpleName(), properties.getPort(),
        properties.getLocalDir());
    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that manages the agent
   * start/stop lifecycle.
   *
   * <p>The lifecycle starts late (phase {@code Integer.MAX_VALUE - 1})
   * to ensure all other beans are initialized first, and stops early
   * for the same reason.
   *
   * @param pullAgent the agent to manage, never null
   *
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle pullAgentLifecycle(final PullAgent pullAgent) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting PullAgent lifecycle...");
        pullAgent.start();
        running = true;
        log.info("PullAgent lifecycle started successfully.");
      }

      @Override
      public void stop() {
        log.info("Stopping PullAgent lifecycle...");
        pullAgent.stop();
        running = false;
        log.info("PullAgent lifecycle stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return Integer.MAX_VALUE - 1;
      }
    };
  }
}
