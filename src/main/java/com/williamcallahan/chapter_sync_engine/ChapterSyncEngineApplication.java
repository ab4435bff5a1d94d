/**
 * Main application class for the chapter sync engine
 *
 * Features:
 * - Storage is chosen by DatabaseConfig or NoDatabaseConfig depending on the datasource URL
 * - Schedulers produce sync, maintenance and healing work; the worker pool consumes it
 * - Entry point for Spring Boot application
 */

package com.williamcallahan.chapter_sync_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableRetry
public class ChapterSyncEngineApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(ChapterSyncEngineApplication.class, args);
    }
}
