package com.demoAuto.salesAgent.catalog.service;

import com.demoAuto.salesAgent.catalog.model.VehicleRecord;
import com.demoAuto.salesAgent.catalog.store.CatalogStore;
import com.demoAuto.salesAgent.config.SalesAgentProperties;
import com.demoAuto.salesAgent.llm.service.EmbeddingClient;
import com.demoAuto.salesAgent.retrieval.EmbeddingRetrieval;
import com.demoAuto.salesAgent.retrieval.Retrieval;
import com.demoAuto.salesAgent.retrieval.RetrievalUnavailableException;
import com.demoAuto.salesAgent.retrieval.ScoredItem;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Embedding index over the catalog, built at startup and rebuilt on first use after a
 * {@link CatalogStore#reload()} hands out a new snapshot.
 * When embeddings are unavailable the index stays empty and {@link #topK} throws,
 * which sends the catalog handler to the keyword/fuzzy search.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogSemanticIndex implements Retrieval<VehicleRecord> {

    private final CatalogStore catalogStore;
    private final EmbeddingClient embeddingClient;
    private final SalesAgentProperties properties;

    private volatile EmbeddingRetrieval<VehicleRecord> index;

    // snapshot the current index was built from, set even when embedding failed
    private volatile List<VehicleRecord> indexedVehicles;

    @PostConstruct
    public void build() {
        if (!properties.getCatalog().isSemanticSearch()) {
            log.info("Semantic catalog search disabled");
            return;
        }
        rebuild(catalogStore.all());
    }

    @Override
    public List<ScoredItem<VehicleRecord>> topK(String query, int k) {
        if (properties.getCatalog().isSemanticSearch()) {
            List<VehicleRecord> vehicles = catalogStore.all();
            if (vehicles != indexedVehicles) {
                rebuild(vehicles);
            }
        }
        EmbeddingRetrieval<VehicleRecord> current = index;
        if (current == null) {
            throw new RetrievalUnavailableException("Catalog index is not available");
        }
        return current.topK(query, k);
    }

    private synchronized void rebuild(List<VehicleRecord> vehicles) {
        if (vehicles == indexedVehicles) {
            return;
        }
        try {
            index = EmbeddingRetrieval.build(vehicles, CatalogSemanticIndex::embeddingText, embeddingClient);
            log.info("Catalog embedding index built - vehicles: {}", vehicles.size());
        } catch (RuntimeException e) {
            log.warn("Catalog embeddings unavailable, keyword search will be used - error: {}", e.getMessage());
            index = null;
        }
        indexedVehicles = vehicles;
    }

    static String embeddingText(VehicleRecord vehicle) {
        return vehicle.getMake() + " " + vehicle.getModel()
                + " year " + vehicle.getYear()
                + " version " + (vehicle.getVersion() == null ? "" : vehicle.getVersion())
                + " price " + vehicle.getPrice().toPlainString()
                + " km " + vehicle.getMileageKm()
                + " bluetooth " + (vehicle.getBluetooth() == null ? "" : vehicle.getBluetooth())
                + " carplay " + (vehicle.getCarPlay() == null ? "" : vehicle.getCarPlay());
    }
}
