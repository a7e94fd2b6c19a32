package spotlane.router.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.router.api.RouterConfigController;
import spotlane.router.api.RouterHealthController;
import spotlane.router.config.RouterConfig;
import spotlane.router.probe.ReadinessProber;
import spotlane.router.probe.SpotPoker;
import spotlane.router.proxy.ProxyForwarder;
import spotlane.router.state.RoutingPatch;
import spotlane.router.state.RoutingState;

import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * The routing proxy: one Netty server, its routing state and the prober that
 * keeps that state current.
 */
public final class RouterNettyServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RouterNettyServer.class);

    private final RouterConfig config;
    private final RoutingState state;
    private final HttpClient client;
    private final ReadinessProber prober;
    private final SpotPoker poker;
    private final ProxyForwarder forwarder;

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;

    public RouterNettyServer(RouterConfig config) {
        this(config, new RoutingState(config.routeWindowSize(), Clock.systemUTC()));
    }

    public RouterNettyServer(RouterConfig config, RoutingState state) {
        this.config = config;
        this.state = state;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.connectTimeout())
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.prober = new ReadinessProber(state, config, client);
        this.poker = new SpotPoker(config, client);
        this.forwarder = new ProxyForwarder(state, prober, poker, config, client);
    }

    private ChannelInitializer<SocketChannel> pipelineInitializer(RouterHandler handler) {
        long idleSeconds = Math.max(60, config.upstreamTimeout().toSeconds() + 30);
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new IdleStateHandler(0, 0, idleSeconds, TimeUnit.SECONDS));
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(config.maxRequestBytes()));
                p.addLast(handler);
            }
        };
    }

    /**
     * Bind and start serving. Backends present in the config are applied
     * first; a configured spot URL starts the prober.
     */
    public synchronized void start() throws InterruptedException {
        if (running) {
            return;
        }
        RoutingPatch initial = new RoutingPatch(config.serverlessUrl(), config.serverlessAuthToken(),
                config.spotUrl());
        if (!initial.isEmpty()) {
            state.apply(initial);
        }

        RouterHandler handler = new RouterHandler(config, forwarder)
                .registerController(new RouterHealthController(state))
                .registerController(new RouterConfigController(state, prober));

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childHandler(pipelineInitializer(handler));
            serverChannel = b.bind(config.host(), config.port()).sync().channel();
        } catch (InterruptedException e) {
            shutdownGroups();
            throw e;
        } catch (Exception e) {
            shutdownGroups();
            throw new IllegalStateException("Cannot bind router on " + config.host() + ":" + config.port(), e);
        }
        running = true;

        if (initial.setsSpot()) {
            prober.start();
        }
        log.info("Router listening on {}:{} ({})", config.host(), port(), state.snapshot().phase());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        state.shutdown();
        prober.close();
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
        } finally {
            shutdownGroups();
            running = false;
            log.info("Router stopped");
        }
    }

    private void shutdownGroups() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            workerGroup = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
            bossGroup = null;
        }
    }

    /** Bound port; differs from the configured one when that was 0. */
    public synchronized int port() {
        if (serverChannel == null) {
            return config.port();
        }
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    /** Blocks until the server channel closes. */
    public void awaitClose() throws InterruptedException {
        Channel channel;
        synchronized (this) {
            channel = serverChannel;
        }
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public RoutingState routingState() {
        return state;
    }

    public ReadinessProber prober() {
        return prober;
    }

    public SpotPoker poker() {
        return poker;
    }

    @Override
    public void close() {
        stop();
    }
}
