package com.example.imagetagger;

import com.example.imagetagger.events.ProgressSink;
import com.example.imagetagger.events.QueuedProgressSink;
import com.example.imagetagger.metadata.HttpMetadataGenerator;
import com.example.imagetagger.metadata.SidecarMetadataWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    static int run(String[] args) throws IOException, InterruptedException {
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar image-tagger.jar <config.json> [rootDirectory]");
            return 1;
        }
        BatchConfig config;
        try {
            config = new ConfigLoader().load(Path.of(args[0]));
        } catch (IllegalArgumentException ex) {
            LOGGER.error("Invalid configuration: {}", ex.getMessage());
            return 1;
        }
        Path root = args.length > 1 ? Path.of(args[1]) : config.rootDirectory().orElse(null);
        if (root == null) {
            LOGGER.error("No root directory given on the command line or in the configuration.");
            return 1;
        }
        if (config.generatorEndpoint().isEmpty()) {
            LOGGER.error("generatorEndpoint is required.");
            return 1;
        }
        URI endpoint = config.generatorEndpoint().get();

        HttpMetadataGenerator generator = new HttpMetadataGenerator(
                endpoint,
                System.getenv(config.apiKeyEnvironmentVariable()),
                config.requestTimeout()
        );
        SidecarMetadataWriter writer = new SidecarMetadataWriter(config.sidecarSuffix());

        // Workers publish into the queue; the main thread is the only consumer.
        QueuedProgressSink events = new QueuedProgressSink();
        List<ProgressSink> listeners = new ArrayList<>();
        listeners.add(new LoggingProgressListener());
        BatchReportWriter report = config.reportFile().map(BatchReportWriter::new).orElse(null);
        if (report != null) {
            listeners.add(report);
        }
        ProgressSink consumer = ProgressSink.compose(listeners.toArray(new ProgressSink[0]));

        try (MetadataBatchRunner runner = MetadataBatchRunner.create(config, generator, writer, events)) {
            try {
                runner.runBatch(root);
            } catch (EnumerationException ex) {
                LOGGER.error("Cannot process {}: {}", root, ex.getMessage());
                return 2;
            }
            BatchSummary summary = events.dispatchUntilComplete(consumer);
            if (report != null) {
                report.write(summary);
                LOGGER.info("Wrote report to {}", report.path());
            }
        }
        return 0;
    }
}
