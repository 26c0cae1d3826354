package org.waabox.pullagent.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.pullagent.PullAgent;
import org.waabox.pullagent.cluster.ClusterEvent;
import org.waabox.pullagent.cluster.MembershipTransport;
import org.waabox.pullagent.transport.http.HttpMembershipTransport;

/**
 * Tests for {@link PullAgentAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PullAgentAutoConfigurationTest {

  @TempDir
  Path cacheDir;

  /** The runner, bound to loopback and ephemeral ports. */
  private ApplicationContextRunner runner() {
    return new ApplicationContextRunner()
        .withConfiguration(
            AutoConfigurations.of(PullAgentAutoConfiguration.class))
        .withPropertyValues(
            "pull-agent.bind-address=127.0.0.1",
            "pull-agent.port=0",
            "pull-agent.transport.port=0",
            "pull-agent.advertise-address=127.0.0.1",
            "pull-agent.local-dir=" + cacheDir);
  }

  /**
   * Verifies that with no transport bean the HTTP transport is used and
   * the agent is started by the lifecycle.
   */
  @Test
  void whenContextLoads_givenNoTransportBean_shouldStartWithHttpTransport() {
    runner().run(context -> {
      final PullAgent agent = context.getBean(PullAgent.class);

      assertInstanceOf(HttpMembershipTransport.class,
          context.getBean(MembershipTransport.class));
      assertEquals("127.0.0.1", agent.nodeAddress());
      assertTrue(agent.port() > 0);
    });
  }

  /**
   * Verifies that the properties are bound with their defaults.
   */
  @Test
  void whenContextLoads_givenNoTuning_shouldBindDefaults() {
    runner().run(context -> {
      final PullAgentProperties properties =
          context.getBean(PullAgentProperties.class);

      assertEquals("", properties.getPeer());
      assertEquals(1024 * 1024, properties.getChunkSize());
      assertEquals("http", properties.getTransport().getType());
      assertEquals("pull-agent-layers",
          properties.getTransport().getKafka().getTopic());
    });
  }

  /**
   * Verifies that a custom MembershipTransport bean replaces the default
   * one and is closed when the context stops.
   */
  @Test
  void whenContextLoads_givenCustomTransport_shouldUseIt() {
    runner().withUserConfiguration(TestTransportConfig.class)
        .run(context -> {
          assertEquals(1, context.getBeansOfType(MembershipTransport.class)
              .size());
          final TestMembershipTransport transport =
              context.getBean(TestMembershipTransport.class);
          assertNotNull(context.getBean(PullAgent.class).nodeAddress());

          context.close();
          assertTrue(transport.closed);
        });
  }

  /**
   * Verifies that an unreachable peer fails the application start.
   */
  @Test
  void whenContextLoads_givenUnreachablePeer_shouldFailToStart() {
    runner().withPropertyValues("pull-agent.peer=127.0.0.1:1")
        .run(context -> assertNotNull(context.getStartupFailure()));
  }

  /** Test configuration that provides an in-process transport. */
  @Configuration(proxyBeanMethods = false)
  static class TestTransportConfig {

    @Bean
    TestMembershipTransport testMembershipTransport() {
      return new TestMembershipTransport();
    }
  }

  /** A transport with no peers, that only hears itself. */
  static class TestMembershipTransport implements MembershipTransport {

    private final BlockingQueue<ClusterEvent> inbound =
        new LinkedBlockingQueue<>();

    private volatile boolean closed;

    @Override
    public int join(final String seedAddress) {
      return 1;
    }

    @Override
    public String advertiseAddress() {
      return "127.0.0.1";
    }

    @Override
    public void broadcast(final String eventName, final byte[] payload) {
      inbound.add(ClusterEvent.user(eventName, payload));
    }

    @Override
    public ClusterEvent nextEvent() throws InterruptedException {
      return inbound.take();
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
