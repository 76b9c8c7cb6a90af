package com.myorg.normcontrol.model;

/**
 * Where the "general data" sheet was found. {@code explicit} is false when the page comes
 * from the configured fallback rather than from an indicator in the text.
 */
public record GeneralDataLocation(int pageNumber, boolean explicit) {

    public static GeneralDataLocation detected(int pageNumber) {
        return new GeneralDataLocation(pageNumber, true);
    }

    public static GeneralDataLocation fallback(int pageNumber) {
        return new GeneralDataLocation(pageNumber, false);
    }
}
