package com.libragraph.filestore.core.staging;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

public final class StagingAreas {

    private StagingAreas() {}

    public static StagingArea at(Path dir, ExecutorService executor) {
        StagingArea area = new StagingArea();
        area.stagingDir = dir.toString();
        area.executor = executor;
        return area;
    }
}
