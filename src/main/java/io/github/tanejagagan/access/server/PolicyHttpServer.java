package io.github.tanejagagan.access.server;

import com.sun.net.httpserver.HttpServer;
import com.typesafe.config.Config;
import io.github.tanejagagan.access.common.schema.CsvSchemaDiscovery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class PolicyHttpServer implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(PolicyHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final PolicyStore store;

    public PolicyHttpServer(Config config, PolicyStore store) throws IOException {
        this.store = store;
        var host = config.getString("host");
        var port = config.getInt("port");
        var delimiter = config.getString("schema.delimiter");
        if (delimiter.length() != 1) {
            throw new IllegalArgumentException("schema.delimiter must be a single character: " + delimiter);
        }
        var defaultPrincipals = config.getStringList("default-principals");
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.executor = Executors.newFixedThreadPool(config.getInt("threads"));
        server.setExecutor(executor);
        server.createContext(PolicyHandler.CONTEXT,
                new PolicyHandler(store, new CsvSchemaDiscovery(delimiter.charAt(0)), defaultPrincipals));
        server.createContext(FilterTypeHandler.CONTEXT, new FilterTypeHandler());
    }

    public PolicyHttpServer start() {
        server.start();
        logger.info("Access policy server is up! http://{}:{}", server.getAddress().getHostString(), port());
        return this;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public PolicyStore store() {
        return store;
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdown();
    }
}
