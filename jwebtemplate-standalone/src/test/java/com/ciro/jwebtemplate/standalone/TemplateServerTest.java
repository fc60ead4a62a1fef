package com.ciro.jwebtemplate.standalone;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateServerTest {

    @TempDir
    Path templates;

    private TemplateServer server;
    private final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(templates.resolve("skeleton.html"),
                "<!DOCTYPE html><html><head><title>Site</title></head><body><main/></body></html>");
        Files.createDirectories(templates.resolve("pages"));
        Files.writeString(templates.resolve("pages/hello.html"),
                "<main body-class=\"hello\"><h1>Hello <%= meta.query.name || 'world' %></h1>"
                        + "<p><%= meta.currentPath %></p></main><title>Greeting</title>");
        Files.writeString(templates.resolve("pages/broken.html"), "<div>no main here</div>");

        ServerSettings settings = new ServerSettings();
        settings.setPort(0);
        settings.setHost("127.0.0.1");
        settings.setUrlPrefix("/pages/");
        settings.setTemplateDirectory(templates.toString());
        server = new TemplateServer(settings);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> get(String path, String... headers) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path));
        if (headers.length > 0) request.headers(headers);
        return client.send(request.GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void rendersTemplateIntoSkeleton() throws Exception {
        HttpResponse<String> response = get("/pages/hello?name=ann");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).hasValue("text/html; charset=UTF-8");
        assertThat(response.headers().firstValue("Cache-Control")).hasValue("max-age=600");
        assertThat(response.body())
                .contains("<title>Greeting</title>")
                .contains("<body class=\"hello\">")
                .contains("<h1>Hello ann</h1>")
                .contains("<p>/pages/hello</p>");
    }

    @Test
    void unknownAndNestedNamesAreNotFound() throws Exception {
        assertThat(get("/pages/absent").statusCode()).isEqualTo(404);
        assertThat(get("/pages/sub/hello").statusCode()).isEqualTo(404);
        assertThat(get("/elsewhere/hello").statusCode()).isEqualTo(404);
        assertThat(get("/pages/").statusCode()).isEqualTo(404);
    }

    @Test
    void renderFailuresAnswer500() throws Exception {
        HttpResponse<String> response = get("/pages/broken");

        assertThat(response.statusCode()).isEqualTo(500);
        assertThat(response.body()).contains("pages/broken.html");
    }

    @Test
    void gzipsWhenAccepted() throws Exception {
        HttpResponse<String> response = get("/pages/hello", "Accept-Encoding", "gzip");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Encoding")).hasValue("gzip");
    }
}
