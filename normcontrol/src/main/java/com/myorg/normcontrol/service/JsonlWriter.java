package com.myorg.normcontrol.service;

import java.io.File;
import java.io.IOException;
import java.util.List;

public interface JsonlWriter<T> {

    /**
     * Appends one JSON document per line to {@code outputFile}, creating it when missing.
     */
    void append(File outputFile, List<T> data) throws IOException;
}
