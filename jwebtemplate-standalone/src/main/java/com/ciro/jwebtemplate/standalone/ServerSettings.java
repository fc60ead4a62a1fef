package com.ciro.jwebtemplate.standalone;

import com.ciro.jwebtemplate.exception.WebTemplateException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Settings of the template directory server.
 * <p>
 * {@link #load()} reads {@code jwebtemplate.properties} from the classpath, then lets
 * {@code -Djwebtemplate.*} system properties override single keys.
 */
public class ServerSettings {
    public static final String RESOURCE = "jwebtemplate.properties";
    public static final String PREFIX = "jwebtemplate.";

    private int port = 8080;
    private String host = "0.0.0.0";
    /** URL prefix served; must start and end with '/' */
    private String urlPrefix = "/";
    /** Root the loader reads from; partials and the skeleton resolve against it */
    private String templateDirectory = "templates/";
    /** Sub-directory of templateDirectory holding the pages; defaults to the URL prefix */
    private String directory;
    private String skeleton = "skeleton.html";
    private String extension = ".html";
    /** Seconds template source stays cached; 0 reads the file on every request */
    private long cacheTtlSeconds = 60;
    private boolean gzip = true;

    public static ServerSettings load() {
        Properties props = new Properties();
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try (InputStream in = cl == null ? null : cl.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new WebTemplateException("Could not read " + RESOURCE, e);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                props.setProperty(name, System.getProperty(name));
            }
        }
        return from(props);
    }

    public static ServerSettings from(Properties props) {
        ServerSettings s = new ServerSettings();
        String v;
        if ((v = get(props, "port")) != null) s.setPort(Integer.parseInt(v));
        if ((v = get(props, "host")) != null) s.setHost(v);
        if ((v = get(props, "urlPrefix")) != null) s.setUrlPrefix(v);
        if ((v = get(props, "templateDirectory")) != null) s.setTemplateDirectory(v);
        if ((v = get(props, "directory")) != null) s.setDirectory(v);
        if ((v = get(props, "skeleton")) != null) s.setSkeleton(v);
        if ((v = get(props, "extension")) != null) s.setExtension(v);
        if ((v = get(props, "cacheTtlSeconds")) != null) s.setCacheTtlSeconds(Long.parseLong(v));
        if ((v = get(props, "gzip")) != null) s.setGzip(Boolean.parseBoolean(v));
        return s;
    }

    private static String get(Properties props, String key) {
        String v = props.getProperty(PREFIX + key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    /** Page directory below the template root, always ending in '/'. */
    public String effectiveDirectory() {
        String d = directory != null ? directory : urlPrefix.substring(1);
        if (d.isEmpty()) return "./";
        return d.endsWith("/") ? d : d + "/";
    }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public String getUrlPrefix() { return urlPrefix; }
    public void setUrlPrefix(String urlPrefix) {
        if (!urlPrefix.startsWith("/") || !urlPrefix.endsWith("/")) {
            throw new IllegalArgumentException("urlPrefix must start and end with '/': " + urlPrefix);
        }
        this.urlPrefix = urlPrefix;
    }

    public String getTemplateDirectory() { return templateDirectory; }
    public void setTemplateDirectory(String templateDirectory) { this.templateDirectory = templateDirectory; }

    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }

    public String getSkeleton() { return skeleton; }
    public void setSkeleton(String skeleton) { this.skeleton = skeleton; }

    public String getExtension() { return extension; }
    public void setExtension(String extension) { this.extension = extension; }

    public long getCacheTtlSeconds() { return cacheTtlSeconds; }
    public void setCacheTtlSeconds(long cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }

    public boolean isGzip() { return gzip; }
    public void setGzip(boolean gzip) { this.gzip = gzip; }
}
