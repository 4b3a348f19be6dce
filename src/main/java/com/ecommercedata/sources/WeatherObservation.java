package com.ecommercedata.sources;

import java.time.Instant;

/**
 * Current weather for one city, metric units.
 */
public record WeatherObservation(String city, double temperature, int humidity, String weather, Instant timestamp) {
}
