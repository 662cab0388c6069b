package com.dcruver.organizer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Vault Organizer.
 *
 * Reconciles the physical location of Markdown notes with the type declared in
 * their frontmatter. Every destructive operation is backed up, validated and
 * rolled back on failure.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class VaultOrganizerApplication {

    public static void main(String[] args) {
        log.info("Starting Vault Organizer...");
        SpringApplication.run(VaultOrganizerApplication.class, args);
    }
}
