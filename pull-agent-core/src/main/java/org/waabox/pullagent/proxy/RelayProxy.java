package org.waabox.pullagent.proxy;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pullagent.PullAgentException;
import org.waabox.pullagent.cluster.LayerCluster;
import org.waabox.pullagent.metrics.PullAgentMetrics;

/**
 * The HTTP front of a node: decides where each layer request is served from
 * and streams the bytes back.
 *
 * <p>Every {@code GET} is resolved in order:
 * <ol>
 *   <li>a non-empty {@code relay}: a peer wants our copy, stream the local file
 *       with the {@link PartialFileReader} even if it is still growing.</li>
 *   <li>The cluster knows nodes holding the layer: pick one at random and
 *       relay its bytes, or serve locally if the pick is this node.</li>
 *   <li>A {@code source} was given: become the authoritative fetcher,
 *       announce the layer, and tee the origin response into the cache and
 *       the caller.</li>
 *   <li>Otherwise answer 200 with an empty body.</li>
 * </ol>
 *
 * <p>Requests run concurrently on a cached thread pool. Only one origin
 * fetch per layer runs on this node at a time: a second request for a
 * layer already being fetched is served from the in-progress file.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class RelayProxy {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(RelayProxy.class);

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** HTTP 500 Internal Server Error status code. */
  private static final int HTTP_INTERNAL_ERROR = 500;

  /** HTTP 502 Bad Gateway status code. */
  private static final int HTTP_BAD_GATEWAY = 502;

  /** HTTP 503 Service Unavailable status code. */
  private static final int HTTP_UNAVAILABLE = 503;

  /** The delay in seconds before stopping the HTTP server. */
  private static final int SERVER_STOP_DELAY_SECONDS = 1;

  /** The proxy configuration, never null. */
  private final ProxyConfig config;

  /** The cluster view used to find and announce layers, never null. */
  private final LayerCluster cluster;

  /** The metrics sink, never null. */
  private final PullAgentMetrics metrics;

  /** The random source used to pick a peer, never null. */
  private final Random random;

  /** The on-disk cache, never null. */
  private final LayerCache cache;

  /** The reader for local, possibly growing, files. */
  private final PartialFileReader reader;

  /** The layers this node is currently fetching from their origin. */
  private final ConcurrentHashMap<String, Boolean> inFlight =
      new ConcurrentHashMap<>();

  /** The HTTP server, null until started. */
  private HttpServer server;

  /** The request executor, null until started. */
  private ExecutorService executor;

  /** The HTTP client for peers and origins, null until started. */
  private HttpClient client;

  /**
   * Creates a new proxy.
   *
   * @param theConfig  the proxy configuration, never null
   * @param theCluster the cluster view, never null
   * @param theMetrics the metrics sink, never null
   */
  public RelayProxy(final ProxyConfig theConfig, final LayerCluster theCluster,
      final PullAgentMetrics theMetrics) {
    this(theConfig, theCluster, theMetrics, new Random());
  }

  /**
   * Creates a new proxy with the given random source.
   *
   * @param theConfig  the proxy configuration, never null
   * @param theCluster the cluster view, never null
   * @param theMetrics the metrics sink, never null
   * @param theRandom  the random source used to pick a peer, never null
   */
  RelayProxy(final ProxyConfig theConfig, final LayerCluster theCluster,
      final PullAgentMetrics theMetrics, final Random theRandom) {
    config = Objects.requireNonNull(theConfig, "config cannot be null");
    cluster = Objects.requireNonNull(theCluster, "cluster cannot be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics cannot be null");
    random = Objects.requireNonNull(theRandom, "random cannot be null");
    cache = new LayerCache(config.localDir());
    reader = new PartialFileReader(config.chunkSize(), config.pollInterval(),
        config.stallTimeout());
  }

  /**
   * Binds the HTTP server and starts accepting requests.
   *
   * @throws PullAgentException if the server cannot be bound
   */
  public void start() {
    try {
      server = HttpServer.create(new InetSocketAddress(
          config.bindAddress(), config.port()), 0);
    } catch (final IOException e) {
      throw new PullAgentException("Failed to start proxy on "
          + config.bindAddress() + ":" + config.port(), e);
    }
    executor = Executors.newCachedThreadPool(new ProxyThreadFactory());
    client = HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    server.createContext("/", this::handle);
    server.setExecutor(executor);
    server.start();
    log.info("Proxy listening on {}:{}, caching into {}",
        config.bindAddress(), port(), config.localDir());
  }

  /** Stops the HTTP server and the request threads. */
  public void stop() {
    if (server != null) {
      server.stop(SERVER_STOP_DELAY_SECONDS);
      server = null;
      log.info("Proxy stopped");
    }
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
    client = null;
  }

  /**
   * Returns the port the proxy is bound to.
   *
   * @return the bound port
   * @throws IllegalStateException if the proxy was not started
   */
  public int port() {
    if (server == null) {
      throw new IllegalStateException("Proxy not started");
    }
    return server.getAddress().getPort();
  }

  /**
   * Picks the node to relay from, uniformly at random.
   *
   * @param endpoints the candidate nodes, never empty
   * @return the chosen node, never null
   */
  String selectEndpoint(final List<String> endpoints) {
    return endpoints.get(random.nextInt(endpoints.size()));
  }

  /**
   * Builds the URL used to relay a layer from a peer.
   *
   * @param peer    the peer address, with or without a port
   * @param request the request being served, never null
   * @return the relay URL, never null
   */
  URI relayUri(final String peer, final RelayRequest request) {
    final String hostAndPort = peer.indexOf(':') >= 0
        ? peer
        : peer + ":" + relayPort();
    return URI.create("http://" + hostAndPort + request.rawPath()
        + "?relay=true&len=" + request.length());
  }

  /** The port peers without an explicit port are assumed to listen on. */
  private int relayPort() {
    return config.port() != 0 ? config.port() : port();
  }

  /**
   * Handles one request, making sure the exchange is always closed.
   *
   * @param exchange the HTTP exchange, never null
   */
  private void handle(final HttpExchange exchange) {
    try {
      dispatch(exchange);
    } catch (final IOException e) {
      log.warn("Failed to serve {}: {}", exchange.getRequestURI(),
          e.getMessage());
    } catch (final RuntimeException e) {
      log.error("Unexpected failure serving {}", exchange.getRequestURI(), e);
    } finally {
      exchange.close();
    }
  }

  private void dispatch(final HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      sendStatus(exchange, HTTP_METHOD_NOT_ALLOWED);
      return;
    }

    final RelayRequest request;
    try {
      request = RelayRequest.parse(exchange.getRequestURI());
    } catch (final IllegalArgumentException e) {
      log.warn("Rejecting {}: {}", exchange.getRequestURI(), e.getMessage());
      sendStatus(exchange, HTTP_BAD_REQUEST);
      return;
    }

    if (request.relay()) {
      serveLocal(exchange, request);
      return;
    }

    final List<String> endpoints = cluster.endpoints(request.digest());
    if (!endpoints.isEmpty()) {
      final String peer = selectEndpoint(endpoints);
      if (peer.equals(cluster.localAddress())) {
        log.debug("Serving {} from the local copy", request.digest());
        serveLocal(exchange, request);
      } else {
        relayFromPeer(exchange, request, peer);
      }
      return;
    }

    if (request.origin().isPresent()) {
      fetchFromOrigin(exchange, request, request.origin().get());
      return;
    }

    log.debug("No holder and no source for {}", request.digest());
    sendStatus(exchange, HTTP_OK);
  }

  /** Streams the local copy of the layer, which may still be growing. */
  private void serveLocal(final HttpExchange exchange,
      final RelayRequest request) throws IOException {
    final String digest = request.digest();
    final FileChannel channel;
    try {
      channel = openLocal(digest);
    } catch (final IOException e) {
      log.warn("Cannot open local copy of {}: {}", digest, e.getMessage());
      sendStatus(exchange, HTTP_INTERNAL_ERROR);
      return;
    }
    try (channel) {
      sendHeaders(exchange, request.length());
      final long sent = reader.transfer(channel, cache.pathFor(digest),
          request.length(), exchange.getResponseBody());
      if (sent < request.length()) {
        log.warn("Served {} of {} bytes of {}", sent, request.length(),
            digest);
      }
      metrics.localServed(digest, sent);
    }
  }

  /**
   * Opens the local file, waiting for it to be created while this node is
   * fetching it.
   */
  private FileChannel openLocal(final String digest) throws IOException {
    while (true) {
      try {
        return cache.open(digest);
      } catch (final NoSuchFileException e) {
        if (!inFlight.containsKey(digest)) {
          throw e;
        }
        try {
          Thread.sleep(config.pollInterval().toMillis());
        } catch (final InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }

  /** Relays the layer from the given peer without caching it. */
  private void relayFromPeer(final HttpExchange exchange,
      final RelayRequest request, final String peer) throws IOException {
    final String digest = request.digest();
    final URI uri;
    try {
      uri = relayUri(peer, request);
    } catch (final IllegalArgumentException e) {
      log.warn("Cannot relay {} from malformed holder '{}': {}", digest, peer,
          e.getMessage());
      metrics.fetchFailed(digest, e);
      sendStatus(exchange, HTTP_BAD_GATEWAY);
      return;
    }
    log.debug("Relaying {} from {}", digest, uri);

    final HttpResponse<InputStream> response = get(exchange, uri, digest);
    if (response == null) {
      return;
    }
    try (InputStream in = response.body()) {
      if (!isSuccess(response.statusCode())) {
        log.warn("Peer {} answered {} for {}", peer, response.statusCode(),
            digest);
        metrics.fetchFailed(digest, new IOException(
            "Peer answered " + response.statusCode()));
        sendStatus(exchange, HTTP_BAD_GATEWAY);
        return;
      }
      sendHeaders(exchange, request.length());
      final long copied = copy(in, exchange.getResponseBody(),
          request.length());
      if (copied < request.length()) {
        log.warn("Peer {} sent {} of {} bytes of {}", peer, copied,
            request.length(), digest);
      }
      metrics.peerRelayed(digest, peer);
    }
  }

  /**
   * Fetches the layer from its origin, unless this node is already doing
   * so, in which case the in-progress file is served.
   */
  private void fetchFromOrigin(final HttpExchange exchange,
      final RelayRequest request, final URI source) throws IOException {
    final String digest = request.digest();
    if (inFlight.putIfAbsent(digest, Boolean.TRUE) != null) {
      log.info("{} is already being fetched, serving the partial copy",
          digest);
      serveLocal(exchange, request);
      return;
    }
    try {
      fetchAsAuthority(exchange, request, source);
    } finally {
      inFlight.remove(digest);
    }
  }

  /**
   * Creates the cache file, announces the layer, and tees the origin
   * response into the file and the caller. The layer is always announced
   * as ended afterwards, and the file removed unless it holds every byte.
   */
  private void fetchAsAuthority(final HttpExchange exchange,
      final RelayRequest request, final URI source) throws IOException {
    final String digest = request.digest();

    final OutputStream file;
    try {
      file = cache.create(digest);
    } catch (final IOException e) {
      log.error("Cannot create cache file for {}: {}", digest,
          e.getMessage(), e);
      metrics.fetchFailed(digest, e);
      sendStatus(exchange, HTTP_INTERNAL_ERROR);
      return;
    }

    log.info("Fetching {} from {}", digest, source);
    cluster.startLayer(digest);
    boolean complete = false;
    try {
      complete = copyFromOrigin(exchange, request, source, file);
    } finally {
      complete = closeCacheFile(file, digest) && complete;
      if (!complete) {
        cache.delete(digest);
      }
      cluster.endLayer(digest);
    }
  }

  /**
   * Streams the origin response into the cache file and the caller.
   *
   * @return true if the cache file received all {@code len} bytes
   */
  private boolean copyFromOrigin(final HttpExchange exchange,
      final RelayRequest request, final URI source, final OutputStream file)
      throws IOException {
    final String digest = request.digest();
    final HttpResponse<InputStream> response = get(exchange, source, digest);
    if (response == null) {
      return false;
    }
    try (InputStream in = response.body()) {
      if (!isSuccess(response.statusCode())) {
        log.warn("Origin {} answered {}", source, response.statusCode());
        metrics.fetchFailed(digest, new IOException(
            "Origin answered " + response.statusCode()));
        sendStatus(exchange, HTTP_BAD_GATEWAY);
        return false;
      }
      sendHeaders(exchange, request.length());

      final TeeOutputStream tee = new TeeOutputStream(file,
          exchange.getResponseBody());
      final long copied;
      try {
        copied = copy(in, tee, request.length());
        tee.flush();
      } catch (final IOException e) {
        log.warn("Failed to copy {} from {}: {}", digest, source,
            e.getMessage());
        metrics.fetchFailed(digest, e);
        return false;
      }

      if (copied < request.length()) {
        log.warn("Origin {} closed after {} of {} bytes", source, copied,
            request.length());
        metrics.fetchFailed(digest, new EOFException("Expected "
            + request.length() + " bytes, got " + copied));
        return false;
      }
      if (tee.cacheFailed()) {
        metrics.fetchFailed(digest, new IOException("Cache write failed"));
        return false;
      }
      metrics.originFetched(digest, copied);
      log.info("Cached {} ({} bytes)", digest, copied);
      return true;
    }
  }

  /**
   * Sends a GET, answering the caller with a gateway error when the
   * target cannot be reached.
   *
   * @return the response, or null if the caller was already answered
   */
  private HttpResponse<InputStream> get(final HttpExchange exchange,
      final URI uri, final String digest) throws IOException {
    try {
      final HttpRequest httpRequest = HttpRequest.newBuilder(uri).GET()
          .build();
      return client.send(httpRequest,
          HttpResponse.BodyHandlers.ofInputStream());
    } catch (final IOException | IllegalArgumentException e) {
      log.warn("Failed to reach {}: {}", uri, e.getMessage());
      metrics.fetchFailed(digest, e);
      sendStatus(exchange, HTTP_BAD_GATEWAY);
      return null;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      sendStatus(exchange, HTTP_UNAVAILABLE);
      return null;
    }
  }

  /** Copies at most {@code length} bytes.
   *
   * @return the number of bytes copied
   */
  private long copy(final InputStream in, final OutputStream out,
      final long length) throws IOException {
    final byte[] buffer = new byte[config.chunkSize()];
    long copied = 0;
    while (copied < length) {
      final int read = in.read(buffer, 0,
          (int) Math.min(buffer.length, length - copied));
      if (read < 0) {
        break;
      }
      out.write(buffer, 0, read);
      copied += read;
    }
    return copied;
  }

  /** Closes the cache file.
   *
   * @return false if closing failed
   */
  private boolean closeCacheFile(final OutputStream file,
      final String digest) {
    try {
      file.close();
      return true;
    } catch (final IOException e) {
      log.warn("Failed to close cache file of {}: {}", digest,
          e.getMessage());
      return false;
    }
  }

  private static boolean isSuccess(final int status) {
    return status >= 200 && status < 300;
  }

  /** Sends the 200 headers for a body of the given length. */
  private static void sendHeaders(final HttpExchange exchange,
      final long length) throws IOException {
    exchange.getResponseHeaders().set("Content-Type",
        "application/octet-stream");
    exchange.sendResponseHeaders(HTTP_OK, length == 0 ? -1 : length);
  }

  /** Sends a status with an empty body. */
  private static void sendStatus(final HttpExchange exchange,
      final int status) throws IOException {
    exchange.sendResponseHeaders(status, -1);
  }

  /** Names the request threads and keeps them from blocking shutdown. */
  private static final class ProxyThreadFactory implements ThreadFactory {

    /** The thread counter. */
    private final AtomicInteger count = new AtomicInteger();

    /** {@inheritDoc} */
    @Override
    public Thread newThread(final Runnable runnable) {
      final Thread thread = new Thread(runnable,
          "pull-agent-proxy-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
