package com.demoAuto.salesAgent.catalog.store;

import com.demoAuto.salesAgent.catalog.model.CatalogStats;
import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.catalog.scoring.TextMatchScorer;
import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.util.ClasspathResourceLoader;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Catalog store backed by a JSON array on the classpath.
 *
 * The file is read once at startup. Rows that fail validation are skipped with a warning,
 * the rest become an immutable snapshot that {@link #reload()} replaces in one step.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JsonCatalogStore implements CatalogStore {

    private final SalesAgentProperties properties;

    private volatile Snapshot snapshot = Snapshot.EMPTY;

    @PostConstruct
    public void load() {
        reload();
    }

    @Override
    public void reload() {
        String resource = properties.getCatalog().getResource();
        JsonNode root;
        try {
            root = ClasspathResourceLoader.loadAsJsonNode(resource);
        } catch (IOException e) {
            log.error("Failed to load catalog - resource: {}", resource, e);
            throw new UncheckedIOException("Catalog could not be loaded: " + resource, e);
        }
        if (!root.isArray()) {
            throw new IllegalStateException("Catalog resource must be a JSON array: " + resource);
        }

        List<VehicleRecord> vehicles = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int index = 0;
        for (JsonNode row : root) {
            try {
                VehicleRecord vehicle = VehicleRecordMapper.fromJson(row);
                if (!seenIds.add(vehicle.getStockId())) {
                    log.warn("Skipping catalog row - index: {}, reason: duplicate stock_id {}", index, vehicle.getStockId());
                } else {
                    vehicles.add(vehicle);
                }
            } catch (IllegalArgumentException e) {
                log.warn("Skipping catalog row - index: {}, reason: {}", index, e.getMessage());
            }
            index++;
        }

        snapshot = new Snapshot(vehicles);
        log.info("Catalog loaded - resource: {}, rows: {}, vehicles: {}", resource, index, vehicles.size());
    }

    @Override
    public List<VehicleRecord> all() {
        return snapshot.vehicles();
    }

    @Override
    public Optional<VehicleRecord> byStockId(String stockId) {
        return Optional.ofNullable(snapshot.byId().get(stockId));
    }

    @Override
    public Optional<VehicleRecord> byName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        List<VehicleRecord> vehicles = snapshot.vehicles();
        String wanted = name.toLowerCase(Locale.ROOT).trim();

        for (VehicleRecord vehicle : vehicles) {
            String makeModel = (vehicle.getMake() + " " + vehicle.getModel()).toLowerCase(Locale.ROOT);
            if (wanted.contains(makeModel)) {
                return Optional.of(vehicle);
            }
        }

        // partial keyword hits ("2020", "se") are not enough to name a car
        Optional<VehicleRecord> model = best(vehicles, v -> TextMatchScorer.namesModel(v, name) ? 1.0 : 0.0, 0.0);
        if (model.isPresent()) {
            return model;
        }
        return best(vehicles, v -> TextMatchScorer.fuzzyScore(v, name), TextMatchScorer.FUZZY_THRESHOLD);
    }

    @Override
    public List<VehicleRecord> byMake(String make) {
        return snapshot.vehicles().stream()
                .filter(v -> v.getMake().equalsIgnoreCase(make))
                .toList();
    }

    @Override
    public List<VehicleRecord> inPriceRange(BigDecimal minPrice, BigDecimal maxPrice) {
        return snapshot.vehicles().stream()
                .filter(v -> v.getPrice().compareTo(minPrice) >= 0 && v.getPrice().compareTo(maxPrice) <= 0)
                .toList();
    }

    @Override
    public List<String> uniqueMakes() {
        return snapshot.vehicles().stream()
                .map(VehicleRecord::getMake)
                .distinct()
                .sorted()
                .toList();
    }

    @Override
    public CatalogStats stats() {
        List<VehicleRecord> vehicles = snapshot.vehicles();
        if (vehicles.isEmpty()) {
            return CatalogStats.builder().totalVehicles(0).makes(List.of()).build();
        }
        return CatalogStats.builder()
                .totalVehicles(vehicles.size())
                .makes(uniqueMakes())
                .minPrice(vehicles.stream().map(VehicleRecord::getPrice).min(Comparator.naturalOrder()).orElseThrow())
                .maxPrice(vehicles.stream().map(VehicleRecord::getPrice).max(Comparator.naturalOrder()).orElseThrow())
                .minYear(vehicles.stream().mapToInt(VehicleRecord::getYear).min().orElseThrow())
                .maxYear(vehicles.stream().mapToInt(VehicleRecord::getYear).max().orElseThrow())
                .build();
    }

    /**
     * Highest-scoring record strictly above {@code threshold}; ties go to the lowest stock id.
     */
    private static Optional<VehicleRecord> best(List<VehicleRecord> vehicles, ToDoubleFunction<VehicleRecord> scorer, double threshold) {
        VehicleRecord best = null;
        double bestScore = threshold;
        for (VehicleRecord vehicle : vehicles) {
            double score = scorer.applyAsDouble(vehicle);
            if (score > bestScore || (best != null && score == bestScore
                    && vehicle.getStockId().compareTo(best.getStockId()) < 0)) {
                best = vehicle;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    private record Snapshot(List<VehicleRecord> vehicles, Map<String, VehicleRecord> byId) {

        static final Snapshot EMPTY = new Snapshot(List.of());

        Snapshot(List<VehicleRecord> vehicles) {
            this(List.copyOf(vehicles), index(vehicles));
        }

        private static Map<String, VehicleRecord> index(List<VehicleRecord> vehicles) {
            Map<String, VehicleRecord> byId = new LinkedHashMap<>();
            vehicles.forEach(v -> byId.put(v.getStockId(), v));
            return Map.copyOf(byId);
        }
    }
}
