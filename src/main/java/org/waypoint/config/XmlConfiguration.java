package org.waypoint.config;

import jakarta.xml.bind.annotation.XmlRootElement;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public Middleware middleware;

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host = "localhost";
        public int port = 8080;
        /** 0 keeps Undertow's default. */
        public int ioThreads;
        /** 0 keeps Undertow's default. */
        public int workerThreads;
        /** Prefix the root handler is mounted under; empty or "/" serves it at the root. */
        public String basePath = "";
    }

    // --- Standard middleware ---
    @XmlRootElement(name = "middleware")
    public static class Middleware {
        public boolean accessLog = true;
        public boolean recovery = true;
        public String accessLogger;
    }
}
