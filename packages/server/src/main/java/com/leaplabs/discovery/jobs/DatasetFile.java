package com.leaplabs.discovery.jobs;

import com.leaplabs.discovery.client.DatasetFormat;
import java.nio.file.Path;

/** A dataset file that passed local checks: resolved path, size and recognised format. */
public record DatasetFile(Path path, long sizeBytes, DatasetFormat format) {}
