package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.ComplianceReport;

import java.io.IOException;
import java.io.OutputStream;

public interface ReportExporter {

    void export(ComplianceReport report, OutputStream out) throws IOException;
}
