package org.waabox.pullagent.transport.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pullagent.PullAgentException;
import org.waabox.pullagent.cluster.AdvertiseAddresses;
import org.waabox.pullagent.cluster.ClusterEvent;
import org.waabox.pullagent.cluster.MembershipTransport;

/**
 * HTTP-based implementation of {@link MembershipTransport}.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer} to
 * receive membership and user events, and {@code java.net.http.HttpClient}
 * to send them to the other members in a fire-and-forget manner. Every node
 * keeps the full member list:
 * <ul>
 *   <li>{@code POST /pull-agent/join}: the receiver adds the joiner, tells
 *       the other members about it, and answers with the member list.</li>
 *   <li>{@code POST /pull-agent/member}: a member joined elsewhere.</li>
 *   <li>{@code POST /pull-agent/leave}: a member is shutting down.</li>
 *   <li>{@code POST /pull-agent/event}: a user event broadcast.</li>
 * </ul>
 *
 * <p>A member is identified by {@code advertiseAddress:port}. Broadcasts
 * are delivered to this node too, through the same inbound queue.
 *
 * <p>Typical usage:
 * <pre>{@code
 * HttpMembershipTransport transport = HttpMembershipTransport.open(
 *     HttpTransportConfig.create(7946));
 * transport.join("10.0.0.2:7946");
 * transport.broadcast("START_LAYER", payload);
 * ClusterEvent event = transport.nextEvent();
 * // ... on shutdown
 * transport.close();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpMembershipTransport implements MembershipTransport {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HttpMembershipTransport.class);

  /** The base path of every transport endpoint. */
  static final String BASE_PATH = "/pull-agent";

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** The delay in seconds before stopping the HTTP server. */
  private static final int SERVER_STOP_DELAY_SECONDS = 1;

  /** The configuration, never null. */
  private final HttpTransportConfig config;

  /** The HTTP server receiving events, never null. */
  private final HttpServer server;

  /** The HTTP client sending events, never null. */
  private final HttpClient client;

  /** The address advertised to peers, never null, may be empty. */
  private final String advertiseAddress;

  /** This member's id, {@code advertiseAddress:port}. */
  private final String self;

  /** Every known member, this one included. */
  private final Set<String> members = ConcurrentHashMap.newKeySet();

  /** Whether {@link #close()} already ran. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** The inbound events, consumed by {@link #nextEvent()}. */
  private final BlockingQueue<ClusterEvent> inbound =
      new LinkedBlockingQueue<>();

  /** Creates a transport around an already bound server. */
  private HttpMembershipTransport(final HttpTransportConfig theConfig,
      final HttpServer theServer, final String theAdvertiseAddress) {
    config = theConfig;
    server = theServer;
    advertiseAddress = theAdvertiseAddress;
    self = theAdvertiseAddress + ":" + theServer.getAddress().getPort();
    members.add(self);
    client = HttpClient.newBuilder()
        .connectTimeout(theConfig.requestTimeout())
        .build();
  }

  /**
   * Binds the transport and starts receiving events.
   *
   * @param config the transport configuration, never null
   * @return the started transport, never null
   * @throws PullAgentException if the port cannot be bound
   */
  public static HttpMembershipTransport open(
      final HttpTransportConfig config) {
    Objects.requireNonNull(config, "config cannot be null");

    final HttpServer server;
    try {
      server = HttpServer.create(new InetSocketAddress(
          config.bindAddress(), config.port()), 0);
    } catch (final IOException e) {
      throw new PullAgentException("Failed to start membership transport"
          + " on port " + config.port(), e);
    }

    final String address = config.advertiseAddress() != null
        ? config.advertiseAddress()
        : AdvertiseAddresses.resolve();

    final HttpMembershipTransport transport = new HttpMembershipTransport(
        config, server, address);
    server.createContext(BASE_PATH + "/join",
        post(transport::handleJoin));
    server.createContext(BASE_PATH + "/member",
        post(transport::handleMember));
    server.createContext(BASE_PATH + "/leave",
        post(transport::handleLeave));
    server.createContext(BASE_PATH + "/event",
        post(transport::handleEvent));
    server.start();

    log.info("Membership transport listening on port {} as '{}'",
        server.getAddress().getPort(), transport.self);
    return transport;
  }

  /** {@inheritDoc} */
  @Override
  public int join(final String seedAddress) throws IOException {
    Objects.requireNonNull(seedAddress, "seedAddress cannot be null");

    final HttpRequest request = HttpRequest.newBuilder()
        .uri(endpoint(seedAddress, "join"))
        .timeout(config.requestTimeout())
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(
            MembershipCodec.member(self)))
        .build();

    final HttpResponse<byte[]> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while joining " + seedAddress, e);
    }
    if (response.statusCode() != HTTP_OK) {
      throw new IOException("Seed " + seedAddress + " responded with status "
          + response.statusCode());
    }

    for (final String member : MembershipCodec.readMembers(response.body())) {
      addMember(member);
    }
    log.info("Joined through {}, {} members known", seedAddress,
        members.size());
    return 1;
  }

  /** {@inheritDoc} */
  @Override
  public String advertiseAddress() {
    return advertiseAddress;
  }

  /** {@inheritDoc} */
  @Override
  public void broadcast(final String eventName, final byte[] payload) {
    Objects.requireNonNull(eventName, "eventName cannot be null");
    Objects.requireNonNull(payload, "payload cannot be null");

    inbound.add(ClusterEvent.user(eventName, payload));
    final byte[] body = MembershipCodec.event(eventName, payload);
    for (final String member : others()) {
      send(member, "event", body);
    }
  }

  /** {@inheritDoc} */
  @Override
  public ClusterEvent nextEvent() throws InterruptedException {
    return inbound.take();
  }

  /**
   * Tells the other members this node is leaving, then stops the server.
   */
  @Override
  public void close() {
    if (closed.getAndSet(true)) {
      return;
    }
    final byte[] body = MembershipCodec.member(self);
    final List<CompletableFuture<?>> pending = new ArrayList<>();
    for (final String member : others()) {
      pending.add(send(member, "leave", body));
    }
    try {
      CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
          .get(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (final ExecutionException | TimeoutException e) {
      log.warn("Not every member acknowledged the leave: {}",
          e.getMessage());
    }
    server.stop(SERVER_STOP_DELAY_SECONDS);
    log.info("Membership transport '{}' closed", self);
  }

  /**
   * Returns every known member, this one included.
   *
   * @return a snapshot of the member ids, never null
   */
  public List<String> members() {
    return List.copyOf(members);
  }

  /**
   * Returns the port the transport is bound to.
   *
   * @return the bound port
   */
  public int port() {
    return server.getAddress().getPort();
  }

  private void handleJoin(final HttpExchange exchange, final byte[] body)
      throws IOException {
    final String joiner = MembershipCodec.readMember(body);
    final byte[] notice = MembershipCodec.member(joiner);
    for (final String member : others()) {
      if (!member.equals(joiner)) {
        send(member, "member", notice);
      }
    }
    addMember(joiner);
    respond(exchange, HTTP_OK, MembershipCodec.members(members));
  }

  private void handleMember(final HttpExchange exchange, final byte[] body)
      throws IOException {
    addMember(MembershipCodec.readMember(body));
    respond(exchange, HTTP_OK, new byte[0]);
  }

  private void handleLeave(final HttpExchange exchange, final byte[] body)
      throws IOException {
    final String member = MembershipCodec.readMember(body);
    if (members.remove(member)) {
      log.info("Member {} left", member);
      inbound.add(ClusterEvent.member("member-leave",
          member.getBytes(StandardCharsets.UTF_8)));
    }
    respond(exchange, HTTP_OK, new byte[0]);
  }

  private void handleEvent(final HttpExchange exchange, final byte[] body)
      throws IOException {
    inbound.add(MembershipCodec.readEvent(body));
    respond(exchange, HTTP_OK, new byte[0]);
  }

  /** Records a member, announcing it on the inbound stream when new. */
  private void addMember(final String member) {
    if (members.add(member)) {
      log.info("Member {} joined", member);
      inbound.add(ClusterEvent.member("member-join",
          member.getBytes(StandardCharsets.UTF_8)));
    }
  }

  /** Every member but this one. */
  private List<String> others() {
    final List<String> others = new ArrayList<>(members);
    others.remove(self);
    return others;
  }

  /** Posts a body to a member, logging failures. */
  private CompletableFuture<?> send(final String member, final String action,
      final byte[] body) {
    final URI uri = endpoint(member, action);
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(config.requestTimeout())
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(body))
        .build();

    return client.sendAsync(request, HttpResponse.BodyHandlers.discarding())
        .thenAccept(response -> {
          if (response.statusCode() != HTTP_OK) {
            log.warn("Member {} responded with status {} to {}", member,
                response.statusCode(), action);
          }
        })
        .exceptionally(ex -> {
          log.warn("Failed to send {} to {}: {}", action, member,
              ex.getMessage());
          return null;
        });
  }

  private static URI endpoint(final String member, final String action) {
    return URI.create("http://" + member + BASE_PATH + "/" + action);
  }

  /**
   * Wraps a body handler so it only accepts POST and turns undecodable
   * bodies into a 400.
   */
  private static HttpHandler post(final BodyHandler handler) {
    return exchange -> {
      try {
        if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
          respond(exchange, HTTP_METHOD_NOT_ALLOWED, new byte[0]);
          return;
        }
        final byte[] body;
        try (InputStream is = exchange.getRequestBody()) {
          body = is.readAllBytes();
        }
        try {
          handler.handle(exchange, body);
        } catch (final IOException e) {
          log.warn("Rejecting {} request: {}", exchange.getRequestURI(),
              e.getMessage());
          respond(exchange, HTTP_BAD_REQUEST, new byte[0]);
        }
      } finally {
        exchange.close();
      }
    };
  }

  private static void respond(final HttpExchange exchange, final int status,
      final byte[] body) throws IOException {
    exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
    if (body.length > 0) {
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(body);
      }
    }
  }

  /** Handles a decoded POST body. */
  @FunctionalInterface
  private interface BodyHandler {

    /**
     * Handles the request.
     *
     * @param exchange the exchange, never null
     * @param body     the request body, never null
     * @throws IOException if the body cannot be decoded
     */
    void handle(HttpExchange exchange, byte[] body) throws IOException;
  }
}
