package com.hashfleet.monitor;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application for the Hashrate Fleet Monitor.
 *
 * Ingests periodic throughput reports from distributed hash generators,
 * keeps a live view of the active ones, persists their history and watches
 * the health of the ingestion pipeline.
 */
@Slf4j
@SpringBootApplication
public class HashrateMonitorApplication {

    public static void main(String[] args) {
        log.info("Starting Hashrate Monitor Application...");
        SpringApplication.run(HashrateMonitorApplication.class, args);
        log.info("Hashrate Monitor Application started successfully");
    }
}
