package com.z254.butterfly.sentinel.forecast;

import com.z254.butterfly.sentinel.telemetry.MetricKey;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Latest capacity forecast per series. Each cycle replaces the previous entry.
 */
@Component
public class ForecastStore {

    private final Map<MetricKey, CapacityForecast> forecasts = new ConcurrentHashMap<>();

    public void put(CapacityForecast forecast) {
        forecasts.put(new MetricKey(forecast.getServiceName(), forecast.getMetricName()), forecast);
    }

    public void remove(MetricKey key) {
        forecasts.remove(key);
    }

    public Optional<CapacityForecast> get(String service, String metric) {
        return Optional.ofNullable(forecasts.get(new MetricKey(service, metric)));
    }

    public List<CapacityForecast> forService(String service) {
        return forecasts.values().stream()
                .filter(f -> f.getServiceName().equals(service))
                .collect(Collectors.toList());
    }

    public int size() {
        return forecasts.size();
    }
}
