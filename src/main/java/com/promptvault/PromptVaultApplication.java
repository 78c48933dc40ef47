package com.promptvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for PromptVault - local prompt library with versioning,
 * usage scoring and snapshot export/import.
 */
@SpringBootApplication
public class PromptVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(PromptVaultApplication.class, args);
    }
}
