package com.cloudcost.attribution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * OpenShift-on-AWS Cost Attribution Engine
 *
 * Attributes AWS Cost and Usage Report line items to OpenShift clusters, nodes,
 * namespaces and labels, and resolves network direction and savings plan costs.
 */
@SpringBootApplication
public class CostAttributionApplication {

    public static void main(String[] args) {
        SpringApplication.run(CostAttributionApplication.class, args);
    }
}
