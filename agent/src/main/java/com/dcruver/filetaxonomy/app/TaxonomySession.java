package com.dcruver.filetaxonomy.app;

import com.dcruver.filetaxonomy.analysis.DeepAnalysisTaskManager;
import com.dcruver.filetaxonomy.domain.ScannedFile;
import com.dcruver.filetaxonomy.domain.SharedTaxonomy;
import com.dcruver.filetaxonomy.gate.MergeSplitGatekeeper;
import lombok.Value;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Everything that belongs to the taxonomy currently being worked on.
 */
@Value
public class TaxonomySession {
    String name;
    SharedTaxonomy taxonomy;
    MergeSplitGatekeeper gatekeeper;
    DeepAnalysisTaskManager taskManager;
    Map<UUID, ScannedFile> filesById;

    public Optional<ScannedFile> file(UUID fileId) {
        return Optional.ofNullable(filesById.get(fileId));
    }
}
