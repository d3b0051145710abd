package edu.harvard.hms.dbmi.avillach.varload.loader;

import edu.harvard.hms.dbmi.avillach.varload.etl.load.JdbcVariantStore;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.VariantStore;
import edu.harvard.hms.dbmi.avillach.varload.etl.pipeline.PipelineOrchestrator;
import edu.harvard.hms.dbmi.avillach.varload.etl.pipeline.PipelineSettings;
import edu.harvard.hms.dbmi.avillach.varload.etl.pipeline.RunReport;
import edu.harvard.hms.dbmi.avillach.varload.loader.config.LoaderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import javax.sql.DataSource;

/**
 * Streams a VCF file into the variant store.
 *
 * Run with:
 * java -jar loader-service.jar \
 *   --varload.input-file=/path/to/clinvar.vcf.gz \
 *   --varload.work-dir=/path/to/processed \
 *   --varload.mode=FULL \
 *   --varload.datasource.url=jdbc:postgresql://localhost:5432/genomics \
 *   --varload.datasource.dialect=POSTGRES
 *
 * The process exit code is 0 when the run completed (also when it stopped at varload.max-rows),
 * 1 when it failed, 2 when the store was lost after some batches committed (rerun without
 * varload.start-fresh to resume) and 3 when it was cancelled.
 */
@SpringBootApplication(exclude = {
    org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration.class
})
@ConfigurationPropertiesScan("edu.harvard.hms.dbmi.avillach.varload.loader.config")
public class VariantLoaderApplication implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(VariantLoaderApplication.class);

    private final LoaderConfig config;
    private final DataSource dataSource;
    private RunReport report;

    public VariantLoaderApplication(LoaderConfig config, DataSource dataSource) {
        this.config = config;
        this.dataSource = dataSource;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(VariantLoaderApplication.class);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public void run(String... args) {
        PipelineSettings settings = config.toSettings();
        log.info("Starting variant load, run ID: {}", settings.getRunId());

        VariantStore store = settings.getMode().loads()
            ? new JdbcVariantStore(dataSource, config.getDatasource().getDialect(), settings.getMaxAlleleLength())
            : null;
        report = new PipelineOrchestrator(settings, store).run();

        log.info("Run ID: {}", report.runId());
        log.info("Status: {} (exit code {})", report.status(), report.exitCode());
        if (report.transformSkipped()) {
            log.info("Transform skipped: reused {}", settings.getIntermediateFile());
        }
        if (report.maxRowsReached()) {
            log.info("Stopped at the row limit of {}", settings.getMaxRows());
        }
        report.tableCounts().forEach((table, count) -> log.info("  {}: {}", table, count));
        log.info("Failures logged: {} ({})", report.failuresLogged(), settings.getFailureLog());
        log.info("Duration: {} seconds", report.elapsed().toSeconds());
        if (report.error() != null) {
            log.error("Error: {}", report.error());
        }
    }

    public RunReport getReport() {
        return report;
    }

    @Override
    public int getExitCode() {
        return report == null ? 1 : report.exitCode();
    }
}
