package com.ciro.jwebtemplate.standalone;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerSettings settings = ServerSettings.load();
        if (args.length > 0) {
            settings.setTemplateDirectory(args[0]);
        }

        TemplateServer server = new TemplateServer(settings);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "jwebtemplate-shutdown"));

        log.info("Starting template server...");
        server.start();
    }
}
