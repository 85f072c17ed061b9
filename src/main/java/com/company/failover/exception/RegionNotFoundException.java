package com.company.failover.exception;

public class RegionNotFoundException extends RuntimeException {
    public RegionNotFoundException(String regionId) {
        super("Region not found: " + regionId);
    }
}
