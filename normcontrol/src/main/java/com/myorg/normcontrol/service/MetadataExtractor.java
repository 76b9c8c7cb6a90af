package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.ProjectInfo;
import com.myorg.normcontrol.model.StampInfo;
import com.myorg.normcontrol.patterns.PatternLibrary;

/**
 * Best-effort structured extraction. Implementations never throw on any text input:
 * what cannot be read is left unset and lowers the confidence.
 */
public interface MetadataExtractor {

    StampInfo extractStamp(String text, PatternLibrary library);

    ProjectInfo extractProjectInfo(String text, PatternLibrary library);

    /**
     * First-page analysis: project info and stamp of the first page plus the norms of the
     * resolved document mark.
     */
    DocumentMetadata extractDocumentMetadata(String firstPageText, PatternLibrary library);
}
