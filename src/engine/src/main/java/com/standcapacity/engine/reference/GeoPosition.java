package com.standcapacity.engine.reference;

/** Optional WGS84 position of a stand. */
public record GeoPosition(double latitude, double longitude) {}
