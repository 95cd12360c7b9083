package com.docindex.main.embedding;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
final class OrtInitializer {

    private OrtInitializer() {
    }

    /**
     * Session options for CPU inference. A non-positive thread count means
     * all cores but one.
     */
    static OrtSession.SessionOptions initializeOrt(int intraOpThreads) throws OrtException {
        OrtSession.SessionOptions options = new OrtSession.SessionOptions();

        int intraThreads = intraOpThreads > 0
                ? intraOpThreads
                : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

        options.setIntraOpNumThreads(intraThreads);
        options.setInterOpNumThreads(1);

        log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
        return options;
    }
}
