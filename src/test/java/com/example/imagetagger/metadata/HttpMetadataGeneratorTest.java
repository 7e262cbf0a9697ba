package com.example.imagetagger.metadata;

import com.example.imagetagger.WorkItem;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpMetadataGeneratorTest {
    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void postsImageAndParsesDescription() throws Exception {
        AtomicReference<byte[]> received = new AtomicReference<>();
        AtomicReference<String> contentType = new AtomicReference<>();
        AtomicReference<String> authorization = new AtomicReference<>();
        URI endpoint = serve(200, "{\"title\":\"Cat\",\"description\":\"A cat\",\"keywords\":[\"cat\"],\"confidence\":0.9}",
                received, contentType, authorization);
        Path image = image(new byte[]{1, 2, 3});

        HttpMetadataGenerator generator = new HttpMetadataGenerator(endpoint, "secret", Duration.ofSeconds(5));
        Optional<ImageMetadata> metadata = generator.generate(new WorkItem(image, "image/png"));

        assertEquals(Optional.of(new ImageMetadata("Cat", "A cat", List.of("cat"))), metadata);
        assertArrayEquals(new byte[]{1, 2, 3}, received.get());
        assertEquals("image/png", contentType.get());
        assertEquals("Bearer secret", authorization.get());
    }

    @Test
    void noContentMeansNoMetadata() throws Exception {
        URI endpoint = serve(204, "", new AtomicReference<>(), new AtomicReference<>(), new AtomicReference<>());

        HttpMetadataGenerator generator = new HttpMetadataGenerator(endpoint, null, Duration.ofSeconds(5));

        assertTrue(generator.generate(new WorkItem(image(new byte[]{9}), "image/jpeg")).isEmpty());
    }

    @Test
    void errorStatusRaisesIOException() throws Exception {
        URI endpoint = serve(500, "overloaded", new AtomicReference<>(), new AtomicReference<>(), new AtomicReference<>());

        HttpMetadataGenerator generator = new HttpMetadataGenerator(endpoint, null, Duration.ofSeconds(5));

        IOException ex = assertThrows(IOException.class,
                () -> generator.generate(new WorkItem(image(new byte[]{9}), "image/jpeg")));
        assertTrue(ex.getMessage().contains("500"));
    }

    private URI serve(int status,
                      String body,
                      AtomicReference<byte[]> received,
                      AtomicReference<String> contentType,
                      AtomicReference<String> authorization) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/describe", exchange -> {
            received.set(exchange.getRequestBody().readAllBytes());
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            if (status == 204) {
                exchange.sendResponseHeaders(204, -1);
            } else {
                exchange.sendResponseHeaders(status, bytes.length);
                try (OutputStream out = exchange.getResponseBody()) {
                    out.write(bytes);
                }
            }
            exchange.close();
        });
        server.start();
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/describe");
    }

    private static Path image(byte[] content) throws IOException {
        Path dir = Files.createTempDirectory("http-generator");
        Path file = dir.resolve("upload.png");
        Files.write(file, content);
        return file;
    }
}
