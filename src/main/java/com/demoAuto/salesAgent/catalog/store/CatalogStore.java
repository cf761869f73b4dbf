package com.demoAuto.salesAgent.catalog.store;

import com.demoAuto.salesAgent.catalog.model.CatalogStats;
import com.demoAuto.salesAgent.catalog.model.VehicleRecord;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Read access to the vehicle catalog. Implementations hold an immutable snapshot,
 * so lookups are safe to call from any request thread.
 */
public interface CatalogStore {

    /**
     * The current snapshot. The same list instance is returned until the next {@link #reload()}.
     */
    List<VehicleRecord> all();

    Optional<VehicleRecord> byStockId(String stockId);

    /**
     * Resolves a free-text vehicle name ("Toyota Corolla", "vw jetta") to a single record.
     * Exact make+model containment wins, then a model named as whole words, then best fuzzy match.
     * Names matching none of these are not found.
     */
    Optional<VehicleRecord> byName(String name);

    List<VehicleRecord> byMake(String make);

    List<VehicleRecord> inPriceRange(BigDecimal minPrice, BigDecimal maxPrice);

    List<String> uniqueMakes();

    CatalogStats stats();

    /**
     * Re-reads the data source and atomically replaces the snapshot.
     */
    void reload();
}
