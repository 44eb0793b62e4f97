package io.agentloom.worker;

import io.agentloom.config.LoomConfig;
import io.agentloom.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads configured script workers from {@code workers/scripts.json}. Invalid entries are
 * skipped and logged.
 */
public final class ScriptWorkers {
    private static final Logger log = LoggerFactory.getLogger(ScriptWorkers.class);

    private ScriptWorkers() {
    }

    public static List<ScriptWorker> load(LoomConfig config, WorkerContext context) {
        Path cfg = config.scriptWorkersFile();
        if (!Files.exists(cfg)) {
            return List.of();
        }
        ScriptWorkerFile file;
        try {
            file = Jsons.mapper().readValue(cfg.toFile(), ScriptWorkerFile.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load script worker config: " + cfg, e);
        }
        if (file == null || file.workers() == null || file.workers().isEmpty()) {
            return List.of();
        }
        List<ScriptWorker> out = new ArrayList<>();
        int skipped = 0;
        for (ScriptWorkerSpec spec : file.workers()) {
            try {
                out.add(ScriptWorker.fromSpec(spec, config.workspaceDir(), context));
            } catch (IllegalArgumentException e) {
                skipped++;
                log.warn("Skipping script worker {}: {}", spec == null ? "<null>" : spec.role(), e.getMessage());
            }
        }
        log.info("Loaded {} script worker(s) from {} ({} skipped)", out.size(), cfg, skipped);
        return out;
    }

    record ScriptWorkerFile(List<ScriptWorkerSpec> workers) {
    }
}
