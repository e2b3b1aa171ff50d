package com.musicbox.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Beans compartidos del subsistema NFC.
 */
@Configuration
public class NfcConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Worker único: las detecciones se procesan en el orden en que llegan del
     * lector.
     */
    @Bean(name = "nfcDetectionExecutor", destroyMethod = "shutdown")
    public ExecutorService nfcDetectionExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("nfc-detection-"));
    }

    @Bean(name = "nfcSweepScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService nfcSweepScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("nfc-sweep-"));
    }
}
