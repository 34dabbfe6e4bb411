package uk.ac.ntu.loopserve.demo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uk.ac.ntu.loopserve.common.Version;
import uk.ac.ntu.loopserve.server.RouteApplication;
import uk.ac.ntu.loopserve.server.RunningService;
import uk.ac.ntu.loopserve.server.ServiceConfig;
import uk.ac.ntu.loopserve.server.StartupException;

public final class DemoMain {

    private static final Logger log = LoggerFactory.getLogger(DemoMain.class);

    public static void main(String[] args) {
        ServiceConfig cfg = ServiceConfig.builder(DemoRoutes.routes())
                .port(DemoConfig.port())
                .workers(DemoConfig.workers())
                .queueCapacity(DemoConfig.queueCapacity())
                .db(DemoConfig.database())
                .build();

        log.info("Starting {} {} (db={}, migrations={})",
                Version.NAME, Version.VERSION, DemoConfig.dbUrl(), DemoConfig.migrations());

        RunningService service;
        try {
            service = RouteApplication.apply(cfg);
        } catch (StartupException e) {
            log.error("Startup failed: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(service::close, "loopserve-shutdown"));
    }
}
