package com.cloudcost.attribution.domain.model;

/**
 * Direction of an EC2 data transfer line item.
 */
public enum DataTransferDirection {
    IN,
    OUT
}
