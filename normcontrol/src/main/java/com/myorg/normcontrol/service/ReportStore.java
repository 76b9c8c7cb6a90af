package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.ComplianceReport;

import java.util.Optional;

/**
 * Persists analysis results. I/O failures surface as
 * {@link com.myorg.normcontrol.exception.CollaboratorUnavailableException}.
 */
public interface ReportStore {

    void save(ComplianceReport report);

    Optional<ComplianceReport> find(String documentId);
}
