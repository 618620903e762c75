package com.mirrorwatch.watch.analysis;

import com.mirrorwatch.watch.model.Analysis;
import com.mirrorwatch.watch.model.Item;

public interface AnalysisClient {
    /**
     * @throws AnalysisUnavailableException when the service fails or answers without the expected sections
     */
    Analysis analyze(Item item);
}
