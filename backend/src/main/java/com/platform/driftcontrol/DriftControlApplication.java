package com.platform.driftcontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Drift Control Application
 * 
 * Turns detected infrastructure drift into remediation plans and executes them:
 * - Classification of each drifted property into a strategy and severity
 * - Ordered plans with include/exclude and destructive-change filters
 * - Approval gating, dry-run previews, state backup and rollback
 * - Day-partitioned audit trail with execution statistics
 */
@SpringBootApplication
public class DriftControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftControlApplication.class, args);
    }
}
