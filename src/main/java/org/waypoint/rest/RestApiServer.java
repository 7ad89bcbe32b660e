package org.waypoint.rest;

import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waypoint.config.XmlConfiguration;
import org.waypoint.rest.base.RouteUtils;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * Hosts a built handler on an Undertow listener.
 */
public class RestApiServer {
    private static final Logger logger = LoggerFactory.getLogger(RestApiServer.class);

    private RestApiServer() {
    }

    /**
     * Starts Undertow with {@code handler} as the root, mounted under the configured base path.
     * The handler runs on worker threads in blocking mode.
     *
     * @return the running server; the caller stops it
     */
    public static Undertow start(XmlConfiguration cfg, HttpHandler handler) {
        if (cfg == null || cfg.server == null) {
            logger.error("Invalid configuration: missing server configuration.");
            throw new IllegalArgumentException("Invalid configuration: missing server section.");
        }
        XmlConfiguration.Server server = cfg.server;

        HttpHandler root = handler;
        String basePath = server.basePath == null ? "" : server.basePath.trim();
        if (!basePath.isEmpty() && !"/".equals(basePath)) {
            root = new Router().addMount(basePath, handler).build();
        }

        Undertow.Builder builder = Undertow.builder()
                .setServerOption(UndertowOptions.DECODE_URL, true)
                .setServerOption(UndertowOptions.URL_CHARSET, StandardCharsets.UTF_8.name())
                .addHttpListener(server.port, server.host)
                .setHandler(RouteUtils.blockingRoute(root));
        if (server.ioThreads > 0) {
            builder.setIoThreads(server.ioThreads);
        }
        if (server.workerThreads > 0) {
            builder.setWorkerThreads(server.workerThreads);
        }

        Undertow undertow = builder.build();
        undertow.start();

        logger.info("Undertow server started on http://{}:{}{}", server.host, port(undertow), basePath);
        return undertow;
    }

    /** The bound port of the first listener, useful when the configured port is 0. */
    public static int port(Undertow undertow) {
        return ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
    }
}
