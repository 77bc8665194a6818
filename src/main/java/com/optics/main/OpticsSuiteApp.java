package com.optics.main;

import com.optics.model.AppConfig;
import com.optics.model.RayTracingConfig;
import com.optics.model.ResultColumn;
import com.optics.model.TelescopeOptics;
import com.optics.service.PhotonListParser;
import com.optics.service.PsfImageCache;
import com.optics.service.RayTracingOrchestrator;
import com.optics.service.ResultsTableStore;
import com.optics.service.RxToolService;
import com.optics.service.SimtelRayTracingRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Simulates and analyses the default ray-tracing matrix of the configured telescope.
 */
public class OpticsSuiteApp {

    private static final Logger log = LoggerFactory.getLogger(OpticsSuiteApp.class);

    public static void main(String[] args) {
        try {
            run();
        } catch (Exception e) {
            log.error("Ray tracing failed", e);
            System.exit(1);
        }
    }

    static void run() throws Exception {
        TelescopeOptics optics = AppConfig.getTelescopeOptics();
        RayTracingConfig config = RayTracingConfig.builder(optics, false)
                .workerThreads(AppConfig.getWorkerThreads())
                .build();
        Path simtelPath = AppConfig.getSimtelPath();
        Duration timeout = Duration.ofMinutes(AppConfig.getToolTimeoutMinutes());
        log.info("Ray tracing {} {} with {}", optics.site, optics.telescopeName, config);

        SimtelRayTracingRunner runner = new SimtelRayTracingRunner(simtelPath,
                Paths.get(AppConfig.getSimtelConfigFile()), optics, AppConfig.getSiteAltitude(),
                config.getLabel(), timeout);
        RayTracingOrchestrator rayTracing = new RayTracingOrchestrator(config, optics,
                AppConfig.getOutputDirectory(), runner, new PhotonListParser(),
                new RxToolService(simtelPath, timeout), new ResultsTableStore(), new PsfImageCache());

        rayTracing.simulate(false, false);
        rayTracing.analyze(true, false, AppConfig.isUseRx());

        String d80 = ResultColumn.D80_DEG.columnName();
        log.info("D80 mean = {} deg, std dev = {} deg", rayTracing.getMean(d80), rayTracing.getStdDev(d80));
        log.info("Results written to {}", rayTracing.getResultsFile());
    }
}
