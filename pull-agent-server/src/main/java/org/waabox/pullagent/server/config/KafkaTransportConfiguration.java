package org.waabox.pullagent.server.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import org.waabox.pullagent.spring.PullAgentProperties;
import org.waabox.pullagent.transport.kafka.KafkaMembershipTransport;
import org.waabox.pullagent.transport.kafka.KafkaTransportConfig;

/** Switches the node to the Kafka membership transport when
 * {@code pull-agent.transport.type=kafka}.
 *
 * <p>The transport bean defined here makes the starter's default HTTP
 * transport back off. {@code pull-agent.peer}, when set, is used as the
 * bootstrap servers to join through.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
@ConditionalOnProperty(prefix = "pull-agent.transport", name = "type",
    havingValue = "kafka")
public class KafkaTransportConfiguration {

  /** Creates the Kafka membership transport.
   *
   * <p>The agent closes the transport when it stops; closing it again on
   * context shutdown is a no-op.
   *
   * @param properties the pull-agent properties, never null
   *
   * @return the transport, never null
   */
  @Bean
  public KafkaMembershipTransport kafkaMembershipTransport(
      final PullAgentProperties properties) {
    final PullAgentProperties.Kafka kafka =
        properties.getTransport().getKafka();
    final String advertiseAddress = properties.getAdvertiseAddress();
    return new KafkaMembershipTransport(KafkaTransportConfig.create(
        kafka.getBootstrapServers(), kafka.getTopic(),
        advertiseAddress.isBlank() ? null : advertiseAddress));
  }
}
