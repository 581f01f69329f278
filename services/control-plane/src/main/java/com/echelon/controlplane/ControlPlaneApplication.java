package com.echelon.controlplane;

import com.echelon.controlplane.config.ControlPlaneProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Echelon control plane: the action kernel behind a single HTTP endpoint.
 *
 * <p>Configured by default with:
 *
 * <ul>
 *   <li>Graceful shutdown, so in-flight handlers finish and the audit queue drains
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation through the HTTP filter into the kernel
 *   <li>RFC 7807 ProblemDetail for requests that never reach the kernel
 * </ul>
 *
 * <p>Storage is in memory; a deployment replaces the repository and {@code KernelStore} beans.
 */
@SpringBootApplication
@EnableConfigurationProperties(ControlPlaneProperties.class)
public class ControlPlaneApplication {

    private static final Logger log = LoggerFactory.getLogger(ControlPlaneApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ControlPlaneApplication.class, args);
        log.info("Echelon control plane started");
    }
}
