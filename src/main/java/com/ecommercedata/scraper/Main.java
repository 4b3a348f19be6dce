package com.ecommercedata.scraper;

import com.ecommercedata.storage.CsvDirectoryLoader;
import com.ecommercedata.storage.DatabaseConnector;
import com.ecommercedata.storage.DatasetWriter;
import com.ecommercedata.storage.LoadResult;
import com.ecommercedata.storage.TabularLoader;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for the e-commerce data pipeline.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code scrape} (default): crawl competitor pages, call the JSON APIs and load every dataset.</li>
 *   <li>{@code load-csv [dir]}: load every CSV file under a directory (default {@code data/raw}).</li>
 *   <li>{@code db}: start the embedded PostgreSQL only and keep it running until Enter is pressed.</li>
 * </ul>
 * The configured database is used when {@code db.url} is set, otherwise an embedded PostgreSQL is started.
 *
 * @author E-commerce Data Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = run(args);
        // exit() would block while shutdown hooks are running
        if (!shuttingDown.get()) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase() : "scrape";
        PipelineConfig config;
        try {
            config = ConfigLoader.fromEnvironment().load();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return 2;
        }

        EmbeddedPostgres postgres = null;
        try {
            DatabaseConnector connector;
            if (config.database().isConfigured()) {
                connector = new DatabaseConnector(config.database().jdbcUrl(), config.database().user(), config.database().password());
            } else {
                postgres = DatabaseConnector.startEmbedded(config.embeddedDataDir(), config.embeddedPort());
                connector = DatabaseConnector.forEmbedded(postgres);
            }
            if (!connector.ping()) {
                logger.error("Database {} is not reachable", connector.url());
                return 1;
            }

            switch (mode) {
                case "db":
                    return waitForEnter(connector, postgres != null);
                case "load-csv":
                    Path dir = args.length > 1 ? Path.of(args[1]) : config.outputDir().resolve("raw");
                    return loadCsv(connector, dir);
                case "scrape":
                    return scrape(config, connector);
                default:
                    logger.error("Unknown mode '{}'; expected scrape, load-csv or db", mode);
                    return 2;
            }
        } catch (IllegalStateException e) {
            logger.error("Failed to start embedded PostgreSQL: {}", e.getMessage());
            return 1;
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (IOException e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
    }

    private static int scrape(PipelineConfig config, DatabaseConnector connector) {
        CancellationToken cancellation = new CancellationToken();
        Thread main = Thread.currentThread();
        Thread hook = new Thread(() -> {
            logger.warn("Shutdown requested; cancelling the run");
            shuttingDown.set(true);
            cancellation.cancel();
            try {
                main.join(config.requestTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "pipeline-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        PipelineRunner runner = new PipelineRunner(
            config,
            SiteProfile.defaults(),
            new JdkHttpTransport(config.userAgents(), config.requestTimeout()),
            DynamicSession::open,
            new TabularLoader(connector),
            new DatasetWriter(),
            Clock.systemUTC(),
            DelayPolicy.Sleeper.system(),
            cancellation);
        PipelineSummary summary = runner.run();
        System.out.println(PipelineReport.format(summary));
        printTables(connector);
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM already shutting down");
        }
        return summary.hasFailures() ? 1 : 0;
    }

    private static int loadCsv(DatabaseConnector connector, Path dir) {
        try {
            List<LoadResult> results = new CsvDirectoryLoader(new TabularLoader(connector)).loadAll(dir);
            logger.info("Loaded {} CSV files from {}", results.size(), dir);
            printTables(connector);
            return 0;
        } catch (IOException e) {
            logger.error("Could not read CSV directory {}: {}", dir, e.getMessage());
            return 1;
        }
    }

    private static int waitForEnter(DatabaseConnector connector, boolean embedded) {
        if (!embedded) {
            logger.warn("db.url is set; nothing to start");
        }
        System.out.println("Database running.");
        System.out.println("JDBC URL: " + connector.url());
        System.out.println("Press Enter to stop the database and exit.");
        try {
            System.in.read();
        } catch (IOException e) {
            logger.warn("Could not read from stdin: {}", e.getMessage());
        }
        return 0;
    }

    private static void printTables(DatabaseConnector connector) {
        try {
            System.out.println(PipelineReport.formatTables(connector.tableRowCounts()));
        } catch (SQLException e) {
            logger.warn("Could not list tables: {}", e.getMessage());
        }
    }
}
