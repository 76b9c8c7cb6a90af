package com.myorg.normcontrol.exception;

public class ReportNotFoundException extends NormControlException {

    public ReportNotFoundException(String documentId) {
        super("No stored compliance report for document " + documentId);
    }

    @Override
    public String getErrorKind() {
        return "not_found";
    }
}
