package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.PageText;

import java.io.File;
import java.util.List;

/**
 * Produces ordered per-page text for a source document.
 */
public interface TextExtractionService {

    /**
     * @throws com.myorg.normcontrol.exception.CollaboratorUnavailableException when the file cannot be read
     */
    List<PageText> extract(File file);
}
