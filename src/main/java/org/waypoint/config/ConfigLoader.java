package org.waypoint.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.waypoint.config.utils.XmlUtil;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Loads an XML configuration file into a typed {@link XmlConfiguration}.
     */
    public static XmlConfiguration loadConfig(String xmlPath) {
        try (InputStream in = Files.newInputStream(Path.of(xmlPath))) {
            XmlConfiguration cfg = read(in);
            logger.debug("Configuration loaded from {}", xmlPath);
            return cfg;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config file " + xmlPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration from the classpath.
     */
    public static XmlConfiguration loadResource(String resourceName) {
        InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            throw new IllegalStateException("Config resource not found on classpath: " + resourceName);
        }
        try (in) {
            XmlConfiguration cfg = read(in);
            logger.debug("Configuration loaded from classpath:{}", resourceName);
            return cfg;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load config resource " + resourceName + ": " + e.getMessage(), e);
        }
    }

    private static XmlConfiguration read(InputStream in) throws Exception {
        Document doc = XmlUtil.parse(in);
        XmlConfiguration cfg = XmlUtil.unmarshal(doc, XmlConfiguration.class);
        if (cfg.server == null) {
            cfg.server = new XmlConfiguration.Server();
        }
        if (cfg.middleware == null) {
            cfg.middleware = new XmlConfiguration.Middleware();
        }
        return cfg;
    }
}
