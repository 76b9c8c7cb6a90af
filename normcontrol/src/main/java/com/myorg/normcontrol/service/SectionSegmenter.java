package com.myorg.normcontrol.service;

import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.Section;

import java.util.List;

public interface SectionSegmenter {

    /**
     * Groups classified pages into contiguous sections covering every page exactly once.
     *
     * @param pages classified pages sorted by page number, numbered {@code 1..n}
     */
    List<Section> segment(List<Page> pages);
}
